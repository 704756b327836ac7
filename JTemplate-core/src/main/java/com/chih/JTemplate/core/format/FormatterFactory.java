package com.chih.JTemplate.core.format;

/**
 * 格式化器构造函数
 * <p>
 * 参数来自 Token 中 {@code name=value} 的 value 部分，没有给出时为 null。
 * 参数非法时应抛出 {@link IllegalArgumentException}，由注册表转换为模板异常。
 * </p>
 */
@FunctionalInterface
public interface FormatterFactory {

    Formatter create(String parameter);
}
