package com.chih.JTemplate.core.impl;

import com.chih.JTemplate.core.Template;
import com.chih.JTemplate.core.exception.TemplateNotFoundException;
import com.chih.JTemplate.core.spi.IncludeResolver;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存模板仓库
 * <p>
 * 名称到模板源文本的映射，适合以编程方式组装模板或在测试中使用。
 * 返回的模板以自身作为包含解析器，因此被包含的模板还可以继续包含其他模板。
 * </p>
 *
 * <pre>{@code
 * MapTemplateRepository repo = new MapTemplateRepository();
 * repo.put("header", "// {{title}}");
 * new Template("{{>header}}", repo).renderSimple("title", "x");
 * }</pre>
 */
public class MapTemplateRepository implements IncludeResolver {

    private final Map<String, Template> templates = new ConcurrentHashMap<>();

    private final int maxIncludeDepth;

    public MapTemplateRepository() {
        this(Template.DEFAULT_MAX_INCLUDE_DEPTH);
    }

    public MapTemplateRepository(int maxIncludeDepth) {
        this.maxIncludeDepth = maxIncludeDepth;
    }

    public MapTemplateRepository(Map<String, String> sources) {
        this();
        sources.forEach(this::put);
    }

    /**
     * 注册或替换一个模板
     *
     * @return this，便于链式调用
     */
    public MapTemplateRepository put(String name, String source) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Template name cannot be null or empty");
        }
        templates.put(name, new Template(source, this, name, maxIncludeDepth));
        return this;
    }

    public boolean remove(String name) {
        return templates.remove(name) != null;
    }

    public boolean contains(String name) {
        return templates.containsKey(name);
    }

    @Override
    public Template get(String name) {
        Template template = name != null ? templates.get(name) : null;
        if (template == null) {
            throw new TemplateNotFoundException(name);
        }
        return template;
    }
}
