package com.chih.JTemplate.core.format;

/**
 * 布尔值输出为 {@code true}/{@code false}，其他值原样返回
 */
public class CBooleanFormatter extends ValueFormatter {

    @Override
    public Object format(Object value) {
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "true" : "false";
        }
        return value;
    }
}
