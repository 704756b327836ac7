package com.chih.JTemplate.core.exception;

/**
 * JTemplate 框架根异常
 */
public class JTemplateException extends RuntimeException {
    public JTemplateException(String message) {
        super(message);
    }

    public JTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
