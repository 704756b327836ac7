package com.chih.JTemplate.core.exception;

import com.chih.JTemplate.core.text.SourcePosition;

/**
 * 非法的格式化器：名称未注册、参数缺失或与 Token 类型不匹配
 */
public class InvalidFormatterException extends TemplateException {
    public InvalidFormatterException(String message, SourcePosition position) {
        super(message, position);
    }
}
