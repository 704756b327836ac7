package com.chih.JTemplate.core.format;

public class SuffixFormatter extends ValueFormatter {

    private final String suffix;

    public SuffixFormatter(String suffix) {
        this.suffix = suffix;
    }

    @Override
    public Object format(Object value) {
        if (value == null) {
            return null;
        }
        return value + suffix;
    }
}
