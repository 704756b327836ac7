package com.chih.JTemplate.core.format;

/**
 * 把换行符转义为字面量 {@code \n}
 */
public class EscapeNewlinesFormatter extends ValueFormatter {

    @Override
    public Object format(Object value) {
        if (value == null) {
            return null;
        }
        return String.valueOf(value).replace("\n", "\\n");
    }
}
