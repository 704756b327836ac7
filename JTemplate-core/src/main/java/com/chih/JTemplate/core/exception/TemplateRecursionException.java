package com.chih.JTemplate.core.exception;

import com.chih.JTemplate.core.text.SourcePosition;

/**
 * include 嵌套层数超过上限，通常意味着模板无条件地包含了自身
 */
public class TemplateRecursionException extends TemplateException {
    public TemplateRecursionException(String message, SourcePosition position) {
        super(message, position);
    }
}
