package com.chih.JTemplate.core.exception;

import com.chih.JTemplate.core.text.SourcePosition;

/**
 * 非法的块结构：找不到块结束标记，或块结束标记与打开的块不匹配
 */
public class InvalidBlockException extends TemplateException {
    public InvalidBlockException(String message, SourcePosition position) {
        super(message, position);
    }
}
