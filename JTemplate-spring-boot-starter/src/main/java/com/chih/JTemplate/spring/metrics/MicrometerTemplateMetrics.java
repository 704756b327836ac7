package com.chih.JTemplate.spring.metrics;

import com.chih.JTemplate.core.spi.TemplateMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Micrometer 的监控实现
 * <p>
 * 监控指标说明：
 * <ul>
 *   <li>jtemplate.render.timer: 模板渲染耗时，tags: template={templateName}, result={success|failure}</li>
 *   <li>jtemplate.render.count: 模板渲染次数，tags 同上</li>
 * </ul>
 * </p>
 * <p>
 * 模板名称作为 tag，名称数量应保持有限，避免指标基数过大。
 * </p>
 */
public class MicrometerTemplateMetrics implements TemplateMetrics {

    public static final String TIMER_NAME = "jtemplate.render.timer";

    public static final String COUNTER_NAME = "jtemplate.render.count";

    private final MeterRegistry registry;

    public MicrometerTemplateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRender(String templateName, long durationNs, boolean success) {
        String result = success ? "success" : "failure";

        Timer.builder(TIMER_NAME)
                .description("Timer for template rendering")
                .tag("template", templateName)
                .tag("result", result)
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);

        Counter.builder(COUNTER_NAME)
                .description("Counter for template rendering")
                .tag("template", templateName)
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
