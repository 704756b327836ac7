package com.chih.JTemplate.core.format;

import java.math.BigInteger;
import java.util.Locale;

/**
 * 整数输出为十六进制字面量，例如 127 → {@code 0x7F}
 * <p>
 * 负数输出为 {@code -0x..}。非整数值会抛出 {@link IllegalArgumentException}。
 * </p>
 */
public class HexFormatter extends ValueFormatter {

    @Override
    public Object format(Object value) {
        if (value == null) {
            return null;
        }
        BigInteger number;
        if (value instanceof BigInteger) {
            number = (BigInteger) value;
        } else if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            number = BigInteger.valueOf(((Number) value).longValue());
        } else {
            throw new IllegalArgumentException("hex requires an integer value, got: "
                    + value.getClass().getSimpleName());
        }
        String digits = number.abs().toString(16).toUpperCase(Locale.ROOT);
        return (number.signum() < 0 ? "-0x" : "0x") + digits;
    }
}
