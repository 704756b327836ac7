package com.chih.JTemplate.core.format;

public class PrefixFormatter extends ValueFormatter {

    private final String prefix;

    public PrefixFormatter(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Object format(Object value) {
        if (value == null) {
            return null;
        }
        return prefix + value;
    }
}
