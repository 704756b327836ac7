package com.chih.JTemplate.core.exception;

import com.chih.JTemplate.core.text.SourcePosition;

/**
 * 非法的 Token：未闭合、分隔符错误或出现在不允许的位置
 */
public class InvalidTokenException extends TemplateException {
    public InvalidTokenException(String message, SourcePosition position) {
        super(message, position);
    }
}
