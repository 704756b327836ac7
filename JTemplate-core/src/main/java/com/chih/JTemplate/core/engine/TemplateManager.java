package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.Template;
import com.chih.JTemplate.core.exception.TemplateNotFoundException;
import com.chih.JTemplate.core.impl.NoOpTemplateMetrics;
import com.chih.JTemplate.core.spi.IncludeResolver;
import com.chih.JTemplate.core.spi.TemplateMetrics;
import com.chih.JTemplate.core.support.ContextLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

/**
 * 核心管理器：按名称渲染模板
 * <p>
 * 负责从仓库（{@link IncludeResolver}）取模板、渲染并上报指标。
 * 模板的缓存由仓库自身负责，管理器不持有状态，可以被多个线程共享。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public class TemplateManager {

    private static final Logger log = LoggerFactory.getLogger(TemplateManager.class);

    private final IncludeResolver repository;
    private final TemplateMetrics metrics;

    public TemplateManager(IncludeResolver repository) {
        this(repository, new NoOpTemplateMetrics());
    }

    public TemplateManager(IncludeResolver repository, TemplateMetrics metrics) {
        if (repository == null) {
            throw new IllegalArgumentException("Template repository cannot be null");
        }
        this.repository = repository;
        this.metrics = metrics != null ? metrics : new NoOpTemplateMetrics();
    }

    /**
     * 获取模板
     *
     * @throws TemplateNotFoundException 仓库中不存在
     */
    public Template getTemplate(String name) {
        Template template = repository.get(name);
        if (template == null) {
            throw new TemplateNotFoundException(name);
        }
        return template;
    }

    /**
     * 渲染指定模板
     *
     * @param name 模板名称
     * @param context 根上下文
     * @return 渲染结果
     */
    public String render(String name, Map<String, ?> context) {
        Template template = getTemplate(name);
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            String result = template.render(context);
            success = true;
            return result;
        } finally {
            record(name, startTime, success);
        }
    }

    /**
     * 渲染指定模板到输出
     */
    public void render(String name, Map<String, ?> context, Appendable out) {
        Template template = getTemplate(name);
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            template.render(context, out);
            success = true;
        } finally {
            record(name, startTime, success);
        }
    }

    /**
     * 从 YAML / JSON 文件加载上下文后渲染
     */
    public String render(String name, Path contextFile) {
        Map<String, Object> context = ContextLoader.load(contextFile);
        return render(name, context);
    }

    public IncludeResolver getRepository() {
        return repository;
    }

    private void record(String name, long startTime, boolean success) {
        long duration = System.nanoTime() - startTime;
        if (!success) {
            log.debug("Render of template '{}' failed after {} ns", name, duration);
        }
        try {
            metrics.recordRender(name, duration, success);
        } catch (RuntimeException e) {
            log.warn("Failed to record metrics for template '{}'", name, e);
        }
    }
}
