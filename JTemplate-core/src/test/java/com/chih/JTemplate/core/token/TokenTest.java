package com.chih.JTemplate.core.token;

import com.chih.JTemplate.core.exception.InvalidFormatterException;
import com.chih.JTemplate.core.exception.InvalidNamedCharacterException;
import com.chih.JTemplate.core.exception.InvalidTokenException;
import com.chih.JTemplate.core.format.IndentFormatter;
import com.chih.JTemplate.core.format.WidthFormatter;
import com.chih.JTemplate.core.text.SourcePosition;
import com.chih.JTemplate.core.text.TextStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Token 解析测试")
class TokenTest {

    private static final SourcePosition POS = new SourcePosition(1, 1, null);

    private static Token parse(String content) {
        return Token.parse(content, 0, content.length() + 4, POS);
    }

    @Test
    @DisplayName("前缀决定 Token 类型")
    void testKindFromPrefix() {
        assertThat(parse("name").getKind()).isEqualTo(TokenKind.VALUE);
        assertThat(parse(".").getKind()).isEqualTo(TokenKind.SELF_REFERENCE);
        assertThat(parse(".field.x").getKind()).isEqualTo(TokenKind.SELF_REFERENCE);
        assertThat(parse("#block").getKind()).isEqualTo(TokenKind.BLOCK_OPEN);
        assertThat(parse("!block").getKind()).isEqualTo(TokenKind.NEGATED_BLOCK_OPEN);
        assertThat(parse("/block").getKind()).isEqualTo(TokenKind.BLOCK_CLOSE);
        assertThat(parse("_NEWLINE").getKind()).isEqualTo(TokenKind.NAMED_CHARACTER);
        assertThat(parse(">header").getKind()).isEqualTo(TokenKind.INCLUDE);
    }

    @Test
    @DisplayName("名称和格式化器按第一个冒号拆分")
    void testFormatterSplit() {
        Token token = parse("a.b:width=4:uc");

        assertThat(token.getName()).isEqualTo("a.b");
        assertThat(token.getFormatters()).hasSize(2);
        assertThat(token.getValueFormatters().get(0)).isInstanceOf(WidthFormatter.class);
    }

    @Test
    @DisplayName("块标记名称中的 # 保留在名称里")
    void testMarkerName() {
        Token token = parse("#items#Separator");

        assertThat(token.getKind()).isEqualTo(TokenKind.BLOCK_OPEN);
        assertThat(token.getName()).isEqualTo("items#Separator");
    }

    @Test
    @DisplayName("块格式化器只能用于块开始")
    void testBlockFormatterOnBlock() {
        Token token = parse("#b:indent=1:l-s=SPACE");
        assertThat(token.getBlockFormatters()).hasSize(2);
        assertThat(token.getBlockFormatters().get(0)).isInstanceOf(IndentFormatter.class);

        assertThatThrownBy(() -> parse("v:indent=1"))
                .isInstanceOf(InvalidFormatterException.class)
                .hasMessageContaining("block formatter 'indent' on non-block");
        assertThatThrownBy(() -> parse("#b:uc"))
                .isInstanceOf(InvalidFormatterException.class)
                .hasMessageContaining("value formatter 'uc' for non-value");
    }

    @Test
    @DisplayName("未知格式化器或缺少参数")
    void testInvalidFormatters() {
        assertThatThrownBy(() -> parse("test:foo"))
                .isInstanceOf(InvalidFormatterException.class)
                .hasMessageContaining("Invalid formatter 'foo'");
        assertThatThrownBy(() -> parse("test:width"))
                .isInstanceOf(InvalidFormatterException.class);
        assertThatThrownBy(() -> parse("test:width=abc"))
                .isInstanceOf(InvalidFormatterException.class)
                .hasMessageContaining("integer");
    }

    @Test
    @DisplayName("空名称是非法 Token")
    void testEmptyName() {
        assertThatThrownBy(() -> parse("")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> parse("#")).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("命名字符")
    void testNamedCharacters() {
        assertThat(parse("_NEWLINE").evaluateNamedCharacter()).isEqualTo("\n");
        assertThat(parse("_SPACE").evaluateNamedCharacter()).isEqualTo(" ");
        assertThat(parse("_LEFT_BRACE").evaluateNamedCharacter()).isEqualTo("{");
        assertThat(parse("_RIGHT_BRACE").evaluateNamedCharacter()).isEqualTo("}");
        assertThatThrownBy(() -> parse("_NEWLINES").evaluateNamedCharacter())
                .isInstanceOf(InvalidNamedCharacterException.class);
    }

    @Test
    @DisplayName("TokenReader 读取完整 Token 并记录偏移")
    void testTokenReader() {
        TextStream in = new TextStream("{{name:uc}}rest");
        Token token = TokenReader.read(in);

        assertThat(token.getName()).isEqualTo("name");
        assertThat(token.getStart()).isZero();
        assertThat(token.getEnd()).isEqualTo(11);
        assertThat(in.getOffset()).isEqualTo(11);
    }

    @Test
    @DisplayName("TokenReader 未闭合或单个右括号")
    void testTokenReaderErrors() {
        assertThatThrownBy(() -> TokenReader.read(new TextStream("{{test")))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessageContaining("End-of-file");
        assertThatThrownBy(() -> TokenReader.read(new TextStream("{{test}")))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessageContaining("incorrectly delimited");
    }
}
