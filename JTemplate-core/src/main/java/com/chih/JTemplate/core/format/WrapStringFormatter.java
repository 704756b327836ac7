package com.chih.JTemplate.core.format;

/**
 * 字符串两侧加双引号，非字符串原样返回
 */
public class WrapStringFormatter extends ValueFormatter {

    @Override
    public Object format(Object value) {
        if (value instanceof CharSequence) {
            return "\"" + value + "\"";
        }
        return value;
    }
}
