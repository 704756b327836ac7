package com.chih.JTemplate.core.exception;

public class ContextParseException extends JTemplateException {
    public ContextParseException(String fileName, Throwable cause) {
        super("Failed to parse context file: " + fileName, cause);
    }

    public ContextParseException(String message) {
        super(message);
    }
}
