package com.chih.JTemplate.core.exception;

import com.chih.JTemplate.core.text.SourcePosition;

/**
 * 模板处理异常基类
 * <p>
 * 所有与模板结构、Token 解析、路径解析相关的异常都继承自该类，
 * 并携带出错位置（行、列以及可选的文件名），便于定位模板中的问题。
 * </p>
 * <p>
 * {@link #getMessage()} 的格式为 {@code filename:line:column:message}，
 * 没有文件名时省略第一段。原始描述可通过 {@link #getDetail()} 获取。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public class TemplateException extends JTemplateException {

    private final transient SourcePosition position;

    private final String detail;

    public TemplateException(String message, SourcePosition position) {
        super(format(message, position));
        this.position = position;
        this.detail = message;
    }

    public TemplateException(String message, SourcePosition position, Throwable cause) {
        super(format(message, position), cause);
        this.position = position;
        this.detail = message;
    }

    /**
     * 获取异常发生的位置
     *
     * @return 出错位置，未知时为 null
     */
    public SourcePosition getPosition() {
        return position;
    }

    /**
     * 获取不带位置前缀的原始描述
     */
    public String getDetail() {
        return detail;
    }

    private static String format(String message, SourcePosition position) {
        if (position == null) {
            return message;
        }
        StringBuilder sb = new StringBuilder();
        if (position.filename() != null) {
            sb.append(position.filename()).append(':');
        }
        sb.append(position.line()).append(':').append(position.column()).append(':');
        sb.append(message);
        return sb.toString();
    }
}
