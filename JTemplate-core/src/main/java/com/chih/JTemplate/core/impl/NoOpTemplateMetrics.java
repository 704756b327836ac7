package com.chih.JTemplate.core.impl;

import com.chih.JTemplate.core.spi.TemplateMetrics;

public class NoOpTemplateMetrics implements TemplateMetrics {
    @Override
    public void recordRender(String templateName, long durationNs, boolean success) {
        // Do nothing
    }
}
