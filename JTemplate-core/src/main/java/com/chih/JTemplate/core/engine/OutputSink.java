package com.chih.JTemplate.core.engine;

/**
 * 渲染输出目标，只支持追加
 */
public interface OutputSink {

    void write(CharSequence text);
}
