package com.chih.JTemplate.core.format;

/**
 * 格式化器类型：作用于单个值，或作用于整个块
 */
public enum FormatterType {
    BLOCK,
    VALUE
}
