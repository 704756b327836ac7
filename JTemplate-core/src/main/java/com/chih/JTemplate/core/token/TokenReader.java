package com.chih.JTemplate.core.token;

import com.chih.JTemplate.core.exception.InvalidTokenException;
import com.chih.JTemplate.core.text.SourcePosition;
import com.chih.JTemplate.core.text.TextStream;

/**
 * 从文本流中读取一个完整的 Token
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public final class TokenReader {

    private TokenReader() {
    }

    /**
     * 读取 Token，调用时流必须正好位于 <code>{{</code> 处
     *
     * @param in 文本流
     * @return 解析后的 Token，读取完成后流位于 <code>}}</code> 之后
     * @throws InvalidTokenException Token 未闭合，或结束符不是 <code>}}</code>
     */
    public static Token read(TextStream in) {
        int start = in.getOffset();
        SourcePosition startPosition = in.getPosition();
        StringBuilder content = new StringBuilder();

        in.skip(2);
        while (true) {
            int c = in.get();
            if (c == TextStream.EOF) {
                throw new InvalidTokenException("End-of-file reached while reading token", startPosition);
            } else if (c != '}') {
                content.append((char) c);
            } else if (in.peek() == '}') {
                in.get();
                return Token.parse(content.toString(), start, in.getOffset(), startPosition);
            } else {
                throw new InvalidTokenException(
                        String.format("Token '%s' incorrectly delimited", content), in.getPosition());
            }
        }
    }

    /**
     * 判断刚读出的字符是否为 Token 起始
     */
    public static boolean isTokenStart(int current, TextStream in) {
        return current == '{' && in.peek() == '{';
    }
}
