package com.chih.JTemplate.core.engine;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * 写入调用方提供的 {@link Appendable}（如 Writer），IO 异常包装为 {@link UncheckedIOException}
 */
public class AppendableSink implements OutputSink {

    private final Appendable target;

    public AppendableSink(Appendable target) {
        if (target == null) {
            throw new IllegalArgumentException("Output target cannot be null");
        }
        this.target = target;
    }

    @Override
    public void write(CharSequence text) {
        try {
            target.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write template output", e);
        }
    }
}
