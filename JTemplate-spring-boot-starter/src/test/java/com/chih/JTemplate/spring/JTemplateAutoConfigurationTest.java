package com.chih.JTemplate.spring;

import com.chih.JTemplate.core.engine.TemplateManager;
import com.chih.JTemplate.core.impl.MapTemplateRepository;
import com.chih.JTemplate.core.impl.NoOpTemplateMetrics;
import com.chih.JTemplate.core.spi.IncludeResolver;
import com.chih.JTemplate.core.spi.TemplateMetrics;
import com.chih.JTemplate.spring.metrics.MicrometerTemplateMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * JTemplateAutoConfiguration 单元测试
 *
 * 测试 Spring Boot 自动配置功能，包括：
 * - 默认 Bean 创建
 * - 配置属性绑定
 * - 用户自定义 Bean 覆盖
 * - Micrometer 监控接入
 */
@DisplayName("JTemplateAutoConfiguration 测试")
class JTemplateAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JTemplateAutoConfiguration.class));

    @Test
    @DisplayName("JTemplateProperties 默认配置应该正确")
    void testPropertiesDefaults() {
        JTemplateProperties properties = new JTemplateProperties();

        assertThat(properties.getLocations()).containsExactly("classpath:templates/");
        assertThat(properties.getSuffix()).isEqualTo(".tpl");
        assertThat(properties.getCacheSize()).isEqualTo(1000);
        assertThat(properties.getMaxIncludeDepth()).isEqualTo(64);
    }

    @Test
    @DisplayName("默认配置创建仓库、空监控和管理器")
    void testDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(SpringResourceTemplateRepository.class);
            assertThat(context).hasSingleBean(TemplateManager.class);
            assertThat(context.getBean(TemplateMetrics.class)).isInstanceOf(NoOpTemplateMetrics.class);

            TemplateManager manager = context.getBean(TemplateManager.class);
            assertThat(manager.render("greeting", Map.of("name", "Spring"))).isEqualTo("Hello Spring!");
            assertThat(manager.render("mail/footer", Collections.singletonMap("team", null))).isEqualTo("-- JTemplate");
        });
    }

    @Test
    @DisplayName("配置属性绑定到仓库")
    void testPropertyBinding() {
        contextRunner
                .withPropertyValues(
                        "j-template.locations[0]=classpath:templates/mail",
                        "j-template.suffix=.tpl",
                        "j-template.cache-size=10",
                        "j-template.max-include-depth=8")
                .run(context -> {
                    JTemplateProperties properties = context.getBean(JTemplateProperties.class);
                    assertThat(properties.getCacheSize()).isEqualTo(10);
                    assertThat(properties.getMaxIncludeDepth()).isEqualTo(8);

                    SpringResourceTemplateRepository repository = context.getBean(SpringResourceTemplateRepository.class);
                    assertThat(repository.getLocations()).containsExactly("classpath:templates/mail/");
                    assertThat(repository.get("signature").getMaxIncludeDepth()).isEqualTo(8);
                });
    }

    @Test
    @DisplayName("存在 MeterRegistry 时使用 Micrometer 监控")
    void testMicrometerMetrics() {
        contextRunner.withUserConfiguration(MeterRegistryConfiguration.class).run(context -> {
            assertThat(context).hasSingleBean(TemplateMetrics.class);
            assertThat(context.getBean(TemplateMetrics.class)).isInstanceOf(MicrometerTemplateMetrics.class);

            context.getBean(TemplateManager.class).render("greeting", Map.of("name", "m"));

            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(registry.get(MicrometerTemplateMetrics.COUNTER_NAME)
                    .tag("template", "greeting")
                    .tag("result", "success")
                    .counter().count()).isEqualTo(1.0);
        });
    }

    @Test
    @DisplayName("MeterRegistry 来自 Actuator 自动配置时同样使用 Micrometer 监控")
    void testMicrometerMetricsFromActuatorAutoConfiguration() {
        // 声明顺序与排序无关，由 @AutoConfiguration 的顺序约束决定
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        JTemplateAutoConfiguration.class,
                        CompositeMeterRegistryAutoConfiguration.class,
                        SimpleMetricsExportAutoConfiguration.class,
                        MetricsAutoConfiguration.class))
                .run(context -> {
                    assertThat(context.getBean(TemplateMetrics.class)).isInstanceOf(MicrometerTemplateMetrics.class);

                    context.getBean(TemplateManager.class).render("greeting", Map.of("name", "a"));
                    assertThat(context.getBean(MeterRegistry.class).get(MicrometerTemplateMetrics.TIMER_NAME)
                            .tag("template", "greeting")
                            .timer().count()).isEqualTo(1);
                });
    }

    @Test
    @DisplayName("用户自定义仓库时默认仓库退让")
    void testCustomRepository() {
        contextRunner.withUserConfiguration(CustomRepositoryConfiguration.class).run(context -> {
            assertThat(context).doesNotHaveBean(SpringResourceTemplateRepository.class);
            assertThat(context).hasSingleBean(IncludeResolver.class);

            TemplateManager manager = context.getBean(TemplateManager.class);
            assertThat(manager.getRepository()).isInstanceOf(MapTemplateRepository.class);
            assertThat(manager.render("inline", Map.of("items", List.of(1, 2)))).isEqualTo("12");
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfiguration {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomRepositoryConfiguration {

        @Bean
        IncludeResolver customRepository() {
            return new MapTemplateRepository().put("inline", "{{#items}}{{.}}{{/items}}");
        }
    }
}
