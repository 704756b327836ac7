package com.chih.JTemplate.core.exception;

public class TemplateLoadException extends JTemplateException {
    public TemplateLoadException(String name, Throwable cause) {
        super("Failed to load template: " + name, cause);
    }
}
