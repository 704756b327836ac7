package com.chih.JTemplate.core.format;

/**
 * 按固定宽度对齐
 * <p>
 * 负数宽度右对齐（左侧补空格，{@code "  42"}），
 * 正数宽度左对齐（右侧补空格，{@code "42  "}）。超出宽度的值不会被截断。
 * </p>
 */
public class WidthFormatter extends ValueFormatter {

    private final String pattern;

    public WidthFormatter(int width) {
        if (width == 0) {
            this.pattern = "%s";
        } else if (width > 0) {
            this.pattern = "%-" + width + "s";
        } else {
            this.pattern = "%" + (-width) + "s";
        }
    }

    @Override
    public Object format(Object value) {
        if (value == null) {
            return null;
        }
        return String.format(pattern, value);
    }
}
