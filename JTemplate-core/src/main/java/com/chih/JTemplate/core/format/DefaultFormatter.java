package com.chih.JTemplate.core.format;

/**
 * 值为 null 时输出默认值，否则原样返回
 * <p>
 * 注意：变量在上下文中完全不存在时，Token 直接输出空串，格式化器不会被调用。
 * </p>
 */
public class DefaultFormatter extends ValueFormatter {

    private final String defaultValue;

    public DefaultFormatter(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    @Override
    public Object format(Object value) {
        return value == null ? defaultValue : value;
    }
}
