package com.chih.JTemplate.spring;

import com.chih.JTemplate.core.Template;
import com.chih.JTemplate.core.exception.TemplateLoadException;
import com.chih.JTemplate.core.exception.TemplateNotFoundException;
import com.chih.JTemplate.core.spi.IncludeResolver;
import com.chih.JTemplate.core.support.TemplateResource;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 基于 Spring Resource 的模板仓库。
 * <p>
 * 每个位置是一个 Spring 资源前缀（如 {@code classpath:templates/}、{@code file:./templates/}），
 * 名称 {@code a/b} 在位置 {@code L} 下解析为 {@code L + "a/b" + suffix}，按配置顺序取第一个存在的资源。
 * </p>
 *
 * <h3>支持的位置格式：</h3>
 * <ul>
 *   <li>Classpath 资源：<code>classpath:templates/</code></li>
 *   <li>文件系统资源：<code>file:/opt/app/templates/</code></li>
 *   <li>混合模式：<code>file:./templates/,classpath:templates/</code>（外部文件覆盖内置模板）</li>
 * </ul>
 *
 * @author lizhiyuan
 * @see org.springframework.core.io.Resource
 */
public class SpringResourceTemplateRepository implements IncludeResolver {

    private static final Logger log = LoggerFactory.getLogger(SpringResourceTemplateRepository.class);

    private final ResourceLoader resourceLoader;

    private final List<String> locations;

    private final String suffix;

    private final int maxIncludeDepth;

    private final Cache<String, Template> cache;

    public SpringResourceTemplateRepository(List<String> locations, String suffix) {
        this(new DefaultResourceLoader(), locations, suffix, 1000, Template.DEFAULT_MAX_INCLUDE_DEPTH);
    }

    /**
     * @param resourceLoader 资源加载器，Spring 环境中通常是 ApplicationContext
     * @param locations 资源位置前缀列表
     * @param suffix 文件后缀
     * @param cacheSize 缓存的模板数量上限
     * @param maxIncludeDepth 模板包含嵌套上限
     */
    public SpringResourceTemplateRepository(ResourceLoader resourceLoader, List<String> locations, String suffix,
                                            long cacheSize, int maxIncludeDepth) {
        if (locations == null || locations.isEmpty()) {
            throw new IllegalArgumentException("At least one template location is required");
        }
        this.resourceLoader = resourceLoader != null ? resourceLoader : new DefaultResourceLoader();
        this.locations = Collections.unmodifiableList(normalizeLocations(locations));
        this.suffix = suffix != null ? suffix : "";
        this.maxIncludeDepth = maxIncludeDepth;
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .expireAfterAccess(30, TimeUnit.MINUTES)
                .build();
        log.info("SpringResourceTemplateRepository created: locations={}, suffix='{}'", this.locations, this.suffix);
    }

    @Override
    public Template get(String name) {
        if (!StringUtils.hasText(name)) {
            throw new TemplateNotFoundException(name);
        }
        return cache.get(name, this::load);
    }

    public void invalidate(String name) {
        cache.invalidate(name);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public List<String> getLocations() {
        return locations;
    }

    public String getSuffix() {
        return suffix;
    }

    private Template load(String name) {
        String relative = name + suffix;
        String normalized = relative.replace('\\', '/');
        if (normalized.startsWith("/") || Arrays.asList(normalized.split("/")).contains("..")) {
            throw new TemplateNotFoundException(name);
        }

        for (String location : locations) {
            Resource resource = resourceLoader.getResource(location + normalized);
            if (!exists(resource)) {
                continue;
            }
            try (InputStream is = resource.getInputStream()) {
                String source = TemplateResource.readText(is, resource.getDescription());
                log.debug("Loaded template '{}' from {}", name, resource.getDescription());
                return new Template(source, this, relative, maxIncludeDepth);
            } catch (IOException e) {
                log.error("Failed to load template '{}' from {}", name, resource.getDescription(), e);
                throw new TemplateLoadException(name, e);
            }
        }
        log.warn("Template '{}' not found in locations {}", name, locations);
        throw new TemplateNotFoundException(name);
    }

    private boolean exists(Resource resource) {
        try {
            return resource.exists() && resource.isReadable();
        } catch (Exception e) {
            log.warn("Failed to check resource existence: {}", resource.getDescription(), e);
            return false;
        }
    }

    private static List<String> normalizeLocations(List<String> locations) {
        List<String> result = new ArrayList<>();
        for (String location : locations) {
            if (!StringUtils.hasText(location)) {
                continue;
            }
            String trimmed = location.trim();
            result.add(trimmed.endsWith("/") ? trimmed : trimmed + "/");
        }
        if (result.isEmpty()) {
            throw new IllegalArgumentException("At least one non-empty template location is required");
        }
        return result;
    }
}
