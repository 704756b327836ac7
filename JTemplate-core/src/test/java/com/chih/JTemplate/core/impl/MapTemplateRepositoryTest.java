package com.chih.JTemplate.core.impl;

import com.chih.JTemplate.core.Template;
import com.chih.JTemplate.core.exception.TemplateNotFoundException;
import com.chih.JTemplate.core.exception.TemplateRecursionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * 模板包含（include）与内存仓库测试
 */
@DisplayName("MapTemplateRepository 与包含测试")
class MapTemplateRepositoryTest {

    private MapTemplateRepository repo;

    @BeforeEach
    void setUp() {
        repo = new MapTemplateRepository()
                .put("item", "{{item}}")
                .put("block", "{{#block}}{{.}}{{/block}}")
                .put("text", "text");
    }

    @Test
    @DisplayName("包含的模板使用当前上下文")
    void testIncludeUsesSharedContext() {
        assertThat(new Template("{{>item}}", repo).renderSimple("item", "theitem")).isEqualTo("theitem");
        assertThat(new Template("{{>block}}", repo).renderSimple("block", "theitem")).isEqualTo("theitem");
        assertThat(new Template("{{>text}}", repo).renderSimple()).isEqualTo("text");
    }

    @Test
    @DisplayName("块内的包含可以看到实例变量")
    void testIncludeInsideBlock() {
        repo.put("row", "[{{name}}]");
        Template template = new Template("{{#rows}}{{>row}}{{/rows}}", repo);

        assertThat(template.renderSimple("rows", List.of(Map.of("name", "a"), Map.of("name", "b"))))
                .isEqualTo("[a][b]");
    }

    @Test
    @DisplayName("有终止条件的递归包含")
    void testBoundedRecursion() {
        repo.put("tree", "{{name}}{{#children}}({{>tree}}){{/children}}");
        Map<String, Object> leaf = Map.of("name", "c", "children", List.of());
        Map<String, Object> mid = Map.of("name", "b", "children", List.of(leaf));

        String out = repo.get("tree").render(Map.of("name", "a", "children", List.of(mid)));

        assertThat(out).isEqualTo("a(b(c))");
    }

    @Test
    @DisplayName("无限递归包含超过深度上限")
    void testUnboundedRecursion() {
        repo.put("loop", "x{{>loop}}");

        assertThatThrownBy(() -> repo.get("loop").renderSimple())
                .isInstanceOf(TemplateRecursionException.class)
                .hasMessageContaining("loop");
    }

    @Test
    @DisplayName("自定义深度上限")
    void testCustomDepth() {
        MapTemplateRepository shallow = new MapTemplateRepository(1)
                .put("a", "a{{>b}}")
                .put("b", "b{{>c}}")
                .put("c", "c");

        assertThatThrownBy(() -> shallow.get("a").renderSimple())
                .isInstanceOf(TemplateRecursionException.class);

        MapTemplateRepository deeper = new MapTemplateRepository(2)
                .put("a", "a{{>b}}")
                .put("b", "b{{>c}}")
                .put("c", "c");
        assertThat(deeper.get("a").renderSimple()).isEqualTo("abc");
    }

    @Test
    @DisplayName("找不到被包含的模板")
    void testIncludeNotFound() {
        assertThatThrownBy(() -> new Template("{{>nope}}", repo).renderSimple())
                .isInstanceOf(TemplateNotFoundException.class)
                .hasMessageContaining("nope");
    }

    @Test
    @DisplayName("没有解析器时包含指令报错")
    void testIncludeWithoutResolver() {
        assertThatThrownBy(() -> new Template("{{>item}}").renderSimple())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("include resolver");
    }

    @Test
    @DisplayName("仓库管理")
    void testRepositoryOperations() {
        assertThat(repo.contains("item")).isTrue();
        assertThat(repo.get("item").getFilename()).isEqualTo("item");
        assertThat(repo.remove("item")).isTrue();
        assertThat(repo.contains("item")).isFalse();
        assertThatThrownBy(() -> repo.put("", "x")).isInstanceOf(IllegalArgumentException.class);

        MapTemplateRepository fromMap = new MapTemplateRepository(Map.of("x", "{{v}}"));
        assertThat(fromMap.get("x").renderSimple("v", 1)).isEqualTo("1");
    }
}
