package com.chih.JTemplate.spring;

import com.chih.JTemplate.core.Template;
import com.chih.JTemplate.core.exception.TemplateNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * SpringResourceTemplateRepository 单元测试
 *
 * 测试基于 Spring Resource 抽象的模板仓库，包括：
 * - file: 与 classpath: 位置
 * - 多位置覆盖顺序
 * - 缓存与失效
 * - 错误处理
 */
@DisplayName("SpringResourceTemplateRepository 测试")
class SpringResourceTemplateRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("从 classpath 位置加载并解析包含")
    void testClasspathLocation() {
        SpringResourceTemplateRepository repository = new SpringResourceTemplateRepository(
                List.of("classpath:templates"), ".tpl");

        assertThat(repository.getLocations()).containsExactly("classpath:templates/");
        assertThat(repository.get("greeting").render(Map.of("name", "World"))).isEqualTo("Hello World!");
        assertThat(repository.get("mail/footer").render(Map.of("team", "Core"))).isEqualTo("-- Core");
    }

    @Test
    @DisplayName("外部文件覆盖内置模板")
    void testFileLocationOverridesClasspath() throws Exception {
        Files.createDirectories(tempDir.resolve("mail"));
        Files.writeString(tempDir.resolve("mail/signature.tpl"), "== {{team}} ==");

        SpringResourceTemplateRepository repository = new SpringResourceTemplateRepository(
                List.of("file:" + tempDir + "/", "classpath:templates/"), ".tpl");

        // footer 来自 classpath，包含的 signature 来自外部目录
        assertThat(repository.get("mail/footer").render(Map.of("team", "Ops"))).isEqualTo("== Ops ==");
        assertThat(repository.get("greeting").render(Map.of("name", "x"))).isEqualTo("Hello x!");
    }

    @Test
    @DisplayName("缓存与失效")
    void testCacheInvalidation() throws Exception {
        Path file = tempDir.resolve("v.tpl");
        Files.writeString(file, "one");
        SpringResourceTemplateRepository repository = new SpringResourceTemplateRepository(
                List.of("file:" + tempDir), ".tpl");

        Template first = repository.get("v");
        assertThat(repository.get("v")).isSameAs(first);

        Files.writeString(file, "two");
        repository.invalidate("v");
        assertThat(repository.get("v").getSource()).isEqualTo("two");

        Files.writeString(file, "three");
        repository.invalidateAll();
        assertThat(repository.get("v").getSource()).isEqualTo("three");
    }

    @Test
    @DisplayName("模板不存在或名称非法")
    void testNotFound() {
        SpringResourceTemplateRepository repository = new SpringResourceTemplateRepository(
                List.of("classpath:templates/mail/"), ".tpl");

        assertThatThrownBy(() -> repository.get("missing"))
                .isInstanceOf(TemplateNotFoundException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> repository.get("../greeting")).isInstanceOf(TemplateNotFoundException.class);
        assertThatThrownBy(() -> repository.get("")).isInstanceOf(TemplateNotFoundException.class);
    }

    @Test
    @DisplayName("构造参数校验")
    void testConstructorValidation() {
        assertThatThrownBy(() -> new SpringResourceTemplateRepository(List.of(), ".tpl"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SpringResourceTemplateRepository(List.of(" "), ".tpl"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
