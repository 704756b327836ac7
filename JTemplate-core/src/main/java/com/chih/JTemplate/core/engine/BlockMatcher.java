package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.exception.BlockNestingException;
import com.chih.JTemplate.core.exception.InvalidBlockException;
import com.chih.JTemplate.core.text.TextStream;
import com.chih.JTemplate.core.token.Token;
import com.chih.JTemplate.core.token.TokenKind;
import com.chih.JTemplate.core.token.TokenReader;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 查找块的结束 Token
 * <p>
 * 从块开始 Token 之后逐字符扫描，遇到 <code>{{</code> 时完整读取嵌套 Token（跳过格式化器语法）。
 * 维护一个以当前块名为栈底的名称栈：嵌套的块开始入栈，块结束出栈且必须与栈顶同名，
 * 栈空时即为匹配的结束 Token。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public final class BlockMatcher {

    private BlockMatcher() {
    }

    /**
     * @param in 位于块开始 Token 之后的输入流，返回时位于结束 Token 之后
     * @param open 块开始 Token
     * @return 匹配的块结束 Token
     * @throws BlockNestingException 嵌套的块结束名称与栈顶不一致
     * @throws InvalidBlockException 输入结束仍未找到块结束
     */
    public static Token findEnd(TextStream in, Token open) {
        Deque<String> names = new ArrayDeque<>();
        names.push(open.getName());
        while (!in.isAtEnd()) {
            int current = in.get();
            if (!TokenReader.isTokenStart(current, in)) {
                continue;
            }
            in.unget();
            Token token = TokenReader.read(in);
            TokenKind kind = token.getKind();
            if (kind.isBlockOpen()) {
                names.push(token.getName());
            } else if (kind == TokenKind.BLOCK_CLOSE) {
                String expected = names.pop();
                if (!expected.equals(token.getName())) {
                    throw new BlockNestingException(expected, token.getName(), token.getPosition());
                }
                if (names.isEmpty()) {
                    return token;
                }
            }
        }
        throw new InvalidBlockException(
                String.format("Could not find block end for '%s'", open.getName()), open.getPosition());
    }
}
