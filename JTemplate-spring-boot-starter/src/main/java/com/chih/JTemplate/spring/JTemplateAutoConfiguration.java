package com.chih.JTemplate.spring;

import com.chih.JTemplate.core.engine.TemplateManager;
import com.chih.JTemplate.core.impl.NoOpTemplateMetrics;
import com.chih.JTemplate.core.spi.IncludeResolver;
import com.chih.JTemplate.core.spi.TemplateMetrics;
import com.chih.JTemplate.spring.metrics.MicrometerTemplateMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * JTemplate Spring Boot 自动配置类。
 * <p>
 * 按 {@link JTemplateProperties} 创建模板仓库、监控组件和 {@link TemplateManager}，
 * 每个 Bean 都可以由用户自定义的同类型 Bean 覆盖。
 * 排在 Actuator 的 MeterRegistry 自动配置之后，保证检查 MeterRegistry 时它已注册。
 * </p>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * // application.yml
 * j-template:
 *   locations:
 *     - file:./templates/
 *     - classpath:templates/
 *   suffix: .tpl
 *
 * // 业务代码
 * String code = templateManager.render("entity", context);
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 * @see JTemplateProperties
 * @see SpringResourceTemplateRepository
 * @see TemplateManager
 */
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(JTemplateProperties.class)
public class JTemplateAutoConfiguration {

    /**
     * 默认模板仓库，用户自定义 IncludeResolver 时不创建
     */
    @Bean
    @ConditionalOnMissingBean(IncludeResolver.class)
    public SpringResourceTemplateRepository templateRepository(JTemplateProperties properties,
                                                               ResourceLoader resourceLoader) {
        return new SpringResourceTemplateRepository(resourceLoader, properties.getLocations(),
                properties.getSuffix(), properties.getCacheSize(), properties.getMaxIncludeDepth());
    }

    /**
     * 监控组件配置。
     * <p>
     * Micrometer 在类路径中且存在 MeterRegistry Bean 时使用 Micrometer 实现，
     * 否则使用下方的 NoOp 实现。
     * </p>
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(TemplateMetrics.class)
        public TemplateMetrics templateMetrics(MeterRegistry registry) {
            return new MicrometerTemplateMetrics(registry);
        }
    }

    // 保底配置：如果没有 Metrics 环境，注入空实现
    @Bean
    @ConditionalOnMissingBean(TemplateMetrics.class)
    public TemplateMetrics defaultTemplateMetrics() {
        return new NoOpTemplateMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(TemplateManager.class)
    public TemplateManager templateManager(IncludeResolver repository, TemplateMetrics metrics) {
        return new TemplateManager(repository, metrics);
    }
}
