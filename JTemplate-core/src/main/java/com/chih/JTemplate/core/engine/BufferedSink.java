package com.chih.JTemplate.core.engine;

/**
 * 基于 StringBuilder 的输出缓冲区
 * <p>
 * 用作整个模板的输出，以及块格式化器需要整体处理块内容时的临时缓冲区。
 * </p>
 */
public class BufferedSink implements OutputSink {

    private final StringBuilder buffer = new StringBuilder();

    @Override
    public void write(CharSequence text) {
        buffer.append(text);
    }

    @Override
    public String toString() {
        return buffer.toString();
    }
}
