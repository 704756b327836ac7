package com.chih.JTemplate.core.exception;

public class TemplateNotFoundException extends JTemplateException {
    public TemplateNotFoundException(String name) {
        super("Template not found for name: " + name);
    }
}
