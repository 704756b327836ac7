package com.chih.JTemplate.core.format;

/**
 * 格式化器基类
 * <p>
 * 格式化器用于在展开过程中变换值或块的输出。构造完成后不可变，
 * 同一个实例可以在多次渲染、多个线程之间共享。
 * </p>
 * <ul>
 *   <li>{@link ValueFormatter}：作用于单个值，只能挂在值 Token 上</li>
 *   <li>{@link BlockFormatter}：作用于块的每次展开，只能挂在块起始 Token 上</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public abstract class Formatter {

    private final FormatterType type;

    protected Formatter(FormatterType type) {
        if (type == null) {
            throw new IllegalArgumentException("Type must be set for Formatter");
        }
        this.type = type;
    }

    public FormatterType getType() {
        return type;
    }

    public boolean isValueFormatter() {
        return type == FormatterType.VALUE;
    }

    public boolean isBlockFormatter() {
        return type == FormatterType.BLOCK;
    }
}
