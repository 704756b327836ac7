package com.chih.JTemplate.core.exception;

import com.chih.JTemplate.core.text.SourcePosition;

/**
 * 块嵌套错误：遇到的块结束标记与最近一个打开的块名称不一致
 */
public class BlockNestingException extends InvalidBlockException {

    private final String expected;

    private final String actual;

    public BlockNestingException(String expected, String actual, SourcePosition position) {
        super(String.format("Cannot close block '%s' here. Last open block is '%s'", actual, expected), position);
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
