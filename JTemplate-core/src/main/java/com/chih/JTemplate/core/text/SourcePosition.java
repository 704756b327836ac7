package com.chih.JTemplate.core.text;

/**
 * 模板中的位置（行、列均从 1 开始），文件名可为 null
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public record SourcePosition(int line, int column, String filename) {

    public SourcePosition {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Line and column must be >= 1: " + line + ":" + column);
        }
    }

    @Override
    public String toString() {
        return (filename != null ? filename + ":" : "") + line + ":" + column;
    }
}
