package com.chih.JTemplate.core;

import com.chih.JTemplate.core.engine.AppendableSink;
import com.chih.JTemplate.core.engine.BufferedSink;
import com.chih.JTemplate.core.engine.OutputSink;
import com.chih.JTemplate.core.engine.TemplateRenderer;
import com.chih.JTemplate.core.spi.IncludeResolver;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模板
 * <p>
 * 持有不可变的模板源文本、可选的包含解析器和用于错误定位的文件名。
 * 模板本身不保存渲染状态，每次 render 都从头扫描，可以被多个线程同时渲染。
 * </p>
 *
 * <pre>{@code
 * Template template = new Template("{{#items:l-s=, }}{{name}}{{/items}}");
 * String out = template.renderSimple("items", List.of(Map.of("name", "a"), Map.of("name", "b")));
 * // out = "a, b"
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public class Template {

    /**
     * 单次渲染中包含（include）的最大嵌套层数
     */
    public static final int DEFAULT_MAX_INCLUDE_DEPTH = 64;

    private final String source;

    private final IncludeResolver resolver;

    private final String filename;

    private final int maxIncludeDepth;

    public Template(String source) {
        this(source, null, null);
    }

    public Template(String source, IncludeResolver resolver) {
        this(source, resolver, null);
    }

    public Template(String source, IncludeResolver resolver, String filename) {
        this(source, resolver, filename, DEFAULT_MAX_INCLUDE_DEPTH);
    }

    /**
     * @param source 模板源文本
     * @param resolver 包含解析器，没有包含指令时可以为 null
     * @param filename 文件名，仅用于错误信息
     * @param maxIncludeDepth 包含嵌套上限，必须为正数
     */
    public Template(String source, IncludeResolver resolver, String filename, int maxIncludeDepth) {
        if (source == null) {
            throw new IllegalArgumentException("Template source cannot be null");
        }
        if (maxIncludeDepth <= 0) {
            throw new IllegalArgumentException("maxIncludeDepth must be positive, got " + maxIncludeDepth);
        }
        this.source = source;
        this.resolver = resolver;
        this.filename = filename;
        this.maxIncludeDepth = maxIncludeDepth;
    }

    /**
     * 渲染为字符串
     *
     * @param context 根上下文，null 视为空
     */
    public String render(Map<String, ?> context) {
        BufferedSink sink = new BufferedSink();
        render(context, sink);
        return sink.toString();
    }

    /**
     * 渲染到调用方提供的输出，写入失败抛出 {@link java.io.UncheckedIOException}
     */
    public void render(Map<String, ?> context, Appendable out) {
        render(context, new AppendableSink(out));
    }

    /**
     * 以名称/值交替的参数构造根上下文并渲染
     *
     * <pre>{@code
     * template.renderSimple("name", "World", "count", 3);
     * }</pre>
     *
     * @throws IllegalArgumentException 参数个数为奇数或名称不是字符串
     */
    public String renderSimple(Object... namesAndValues) {
        if (namesAndValues == null) {
            return render(null);
        }
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " arguments");
        }
        Map<String, Object> context = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            if (!(namesAndValues[i] instanceof String name)) {
                throw new IllegalArgumentException("Argument " + i + " must be a String name, got " + namesAndValues[i]);
            }
            context.put(name, namesAndValues[i + 1]);
        }
        return render(context);
    }

    private void render(Map<String, ?> context, OutputSink sink) {
        new TemplateRenderer(context, maxIncludeDepth).render(this, sink);
    }

    public String getSource() {
        return source;
    }

    public IncludeResolver getResolver() {
        return resolver;
    }

    public String getFilename() {
        return filename;
    }

    public int getMaxIncludeDepth() {
        return maxIncludeDepth;
    }

    @Override
    public String toString() {
        return "Template{" + (filename != null ? filename : "<inline>") + "}";
    }
}
