package com.chih.JTemplate.core.token;

import com.chih.JTemplate.core.exception.InvalidFormatterException;
import com.chih.JTemplate.core.exception.InvalidNamedCharacterException;
import com.chih.JTemplate.core.exception.InvalidTokenException;
import com.chih.JTemplate.core.format.BlockFormatter;
import com.chih.JTemplate.core.format.Formatter;
import com.chih.JTemplate.core.format.FormatterRegistry;
import com.chih.JTemplate.core.format.ValueFormatter;
import com.chih.JTemplate.core.text.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 单个 Token
 * <p>
 * Token 内容（<code>{{</code> 与 <code>}}</code> 之间的文本）的语法为：
 * </p>
 * <pre>
 * [prefix]?name(:formatter[=value])*
 *
 * {{#Foo}}          -> kind = BLOCK_OPEN, name = Foo
 * {{Bar:width=8}}   -> kind = VALUE, name = Bar, formatters = [width(8)]
 * {{.field:uc}}     -> kind = SELF_REFERENCE, name = .field, formatters = [upper-case]
 * </pre>
 * <p>
 * 构造时即检查格式化器与 Token 类型是否匹配：块格式化器只能用于块起始 Token，
 * 值格式化器只能用于值 Token（含自引用），其他类型的 Token 不允许携带格式化器。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public final class Token {

    private static final Map<String, String> NAMED_CHARACTERS = Map.of(
            "NEWLINE", "\n",
            "SPACE", " ",
            "LEFT_BRACE", "{",
            "RIGHT_BRACE", "}");

    private final TokenKind kind;
    private final String name;
    private final List<Formatter> formatters;
    private final int start;
    private final int end;
    private final SourcePosition position;

    private Token(TokenKind kind, String name, List<Formatter> formatters,
                  int start, int end, SourcePosition position) {
        this.kind = kind;
        this.name = name;
        this.formatters = formatters;
        this.start = start;
        this.end = end;
        this.position = position;
    }

    /**
     * 解析 Token 内容
     *
     * @param content 大括号之间的原始文本
     * @param start Token 起始偏移（指向 <code>{{</code>）
     * @param end Token 结束偏移（<code>}}</code> 之后）
     * @param position Token 起始位置
     * @return 解析后的 Token
     * @throws InvalidTokenException Token 名称为空
     * @throws InvalidFormatterException 格式化器未知、参数非法或类型不匹配
     */
    public static Token parse(String content, int start, int end, SourcePosition position) {
        String body = content;
        TokenKind prefixKind = body.isEmpty() ? null : TokenKind.fromPrefix(body.charAt(0));
        if (prefixKind != null) {
            body = body.substring(1);
        }

        String name = body;
        List<String> specs = Collections.emptyList();
        int separator = body.indexOf(':');
        // 名称以 ':' 开头时不拆分
        if (separator > 0) {
            name = body.substring(0, separator);
            specs = splitSpecs(body.substring(separator + 1));
        }

        if (name.isEmpty()) {
            throw new InvalidTokenException("Token '" + content + "' has an empty name", position);
        }

        TokenKind kind = prefixKind;
        if (kind == null) {
            kind = name.charAt(0) == '.' ? TokenKind.SELF_REFERENCE : TokenKind.VALUE;
        }

        List<Formatter> formatters = new ArrayList<>(specs.size());
        for (String spec : specs) {
            int eq = spec.indexOf('=');
            String key = eq >= 0 ? spec.substring(0, eq) : spec;
            String value = eq >= 0 ? spec.substring(eq + 1) : null;

            Formatter formatter = FormatterRegistry.create(key, value, position);
            if (formatter.isBlockFormatter() && kind != TokenKind.BLOCK_OPEN) {
                throw new InvalidFormatterException(String.format(
                        "Requested block formatter '%s' on non-block. "
                                + "Only block formatters can be used on blocks.", key), position);
            }
            if (formatter.isValueFormatter() && !kind.isValue()) {
                throw new InvalidFormatterException(String.format(
                        "Requested value formatter '%s' for non-value. "
                                + "Only value formatters can be used with values.", key), position);
            }
            formatters.add(formatter);
        }

        return new Token(kind, name, Collections.unmodifiableList(formatters), start, end, position);
    }

    private static List<String> splitSpecs(String text) {
        List<String> specs = new ArrayList<>();
        int from = 0;
        int idx;
        while ((idx = text.indexOf(':', from)) >= 0) {
            specs.add(text.substring(from, idx));
            from = idx + 1;
        }
        specs.add(text.substring(from));
        return specs;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public List<Formatter> getFormatters() {
        return formatters;
    }

    /**
     * 值格式化器，按声明顺序
     */
    public List<ValueFormatter> getValueFormatters() {
        List<ValueFormatter> result = new ArrayList<>(formatters.size());
        for (Formatter f : formatters) {
            if (f instanceof ValueFormatter) {
                result.add((ValueFormatter) f);
            }
        }
        return result;
    }

    /**
     * 块格式化器，按声明顺序
     */
    public List<BlockFormatter> getBlockFormatters() {
        List<BlockFormatter> result = new ArrayList<>(formatters.size());
        for (Formatter f : formatters) {
            if (f instanceof BlockFormatter) {
                result.add((BlockFormatter) f);
            }
        }
        return result;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public boolean isSelfReference() {
        return kind == TokenKind.SELF_REFERENCE;
    }

    /**
     * 求值具名字符 Token
     *
     * @return 对应的字符
     * @throws InvalidNamedCharacterException 名称不在词表中
     */
    public String evaluateNamedCharacter() {
        String result = NAMED_CHARACTERS.get(name);
        if (result == null) {
            throw new InvalidNamedCharacterException(
                    String.format("Unrecognized named character token '%s'", name), position);
        }
        return result;
    }

    @Override
    public String toString() {
        return "Token{" + kind + " '" + name + "' at " + position + "}";
    }
}
