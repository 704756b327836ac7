package com.chih.JTemplate.core.exception;

import com.chih.JTemplate.core.text.SourcePosition;

/**
 * 无法识别的具名字符 Token，例如 {{_NEWLINES}}
 */
public class InvalidNamedCharacterException extends TemplateException {
    public InvalidNamedCharacterException(String message, SourcePosition position) {
        super(message, position);
    }
}
