package com.chih.JTemplate.core.exception;

import com.chih.JTemplate.core.text.SourcePosition;

/**
 * 复合路径解析失败：根变量已找到，但后续某一段路径无法解析
 */
public class PathResolutionException extends TemplateException {
    public PathResolutionException(String message, SourcePosition position) {
        super(message, position);
    }
}
