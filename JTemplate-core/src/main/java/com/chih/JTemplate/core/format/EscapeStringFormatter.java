package com.chih.JTemplate.core.format;

/**
 * 转义换行、制表符和双引号，输出可直接放进 C/Java 字符串字面量
 */
public class EscapeStringFormatter extends ValueFormatter {

    @Override
    public Object format(Object value) {
        if (value == null) {
            return null;
        }
        return String.valueOf(value)
                .replace("\n", "\\n")
                .replace("\t", "\\t")
                .replace("\"", "\\\"");
    }
}
