package com.chih.JTemplate.core.token;

/**
 * Token 类型，由 <code>{{</code> 之后的第一个字符决定
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public enum TokenKind {
    /** {@code {{name}}} */
    VALUE,
    /** {@code {{.}}} 或 {@code {{.field}}} */
    SELF_REFERENCE,
    /** {@code {{#name}}} */
    BLOCK_OPEN,
    /** {@code {{!name}}} */
    NEGATED_BLOCK_OPEN,
    /** {@code {{/name}}} */
    BLOCK_CLOSE,
    /** {@code {{_NAME}}} */
    NAMED_CHARACTER,
    /** {@code {{>name}}} */
    INCLUDE;

    /**
     * 根据前缀字符获取 Token 类型
     *
     * @return 对应类型，非前缀字符返回 null
     */
    static TokenKind fromPrefix(char prefix) {
        switch (prefix) {
            case '#':
                return BLOCK_OPEN;
            case '!':
                return NEGATED_BLOCK_OPEN;
            case '/':
                return BLOCK_CLOSE;
            case '_':
                return NAMED_CHARACTER;
            case '>':
                return INCLUDE;
            default:
                return null;
        }
    }

    public boolean isBlockOpen() {
        return this == BLOCK_OPEN || this == NEGATED_BLOCK_OPEN;
    }

    public boolean isValue() {
        return this == VALUE || this == SELF_REFERENCE;
    }
}
