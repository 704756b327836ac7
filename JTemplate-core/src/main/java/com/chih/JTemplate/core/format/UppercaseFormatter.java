package com.chih.JTemplate.core.format;

import java.util.Locale;

public class UppercaseFormatter extends ValueFormatter {

    @Override
    public Object format(Object value) {
        if (value == null) {
            return null;
        }
        return String.valueOf(value).toUpperCase(Locale.ROOT);
    }
}
