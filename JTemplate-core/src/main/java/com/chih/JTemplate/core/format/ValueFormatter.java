package com.chih.JTemplate.core.format;

/**
 * 值格式化器
 * <p>
 * 把一个值映射为另一个值。多个值格式化器按声明顺序串联执行，
 * 后一个接收前一个的输出。输入可能为 null（变量存在但值为 null）。
 * </p>
 */
public abstract class ValueFormatter extends Formatter {

    protected ValueFormatter() {
        super(FormatterType.VALUE);
    }

    /**
     * 格式化一个值
     *
     * @param value 当前值，可能为 null
     * @return 格式化后的值，可以为 null
     * @throws IllegalArgumentException 值的类型不被支持时
     */
    public abstract Object format(Object value);
}
