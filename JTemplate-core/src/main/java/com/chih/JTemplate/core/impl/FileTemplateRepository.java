package com.chih.JTemplate.core.impl;

import com.chih.JTemplate.core.Template;
import com.chih.JTemplate.core.exception.TemplateLoadException;
import com.chih.JTemplate.core.exception.TemplateNotFoundException;
import com.chih.JTemplate.core.spi.IncludeResolver;
import com.chih.JTemplate.core.support.TemplateResource;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 基于文件的模板仓库
 * <p>
 * 按配置顺序在多个基础目录中查找 {@code <目录>/<名称><后缀>}，
 * 文件系统中不存在的目录作为 Classpath 路径处理（支持开发环境目录和 JAR 包）。
 * </p>
 * <p>
 * 解析后的 {@link Template} 使用 Caffeine 缓存（容量上限 + 访问过期），
 * 模板以名称作为 filename，错误信息可以直接定位到文件。
 * </p>
 * <p>
 * <strong>使用示例：</strong>
 * <pre>{@code
 * // 单个目录，默认后缀 .tpl
 * FileTemplateRepository repo = new FileTemplateRepository("/templates");
 *
 * // 多个目录，自定义后缀
 * FileTemplateRepository repo2 = new FileTemplateRepository(
 *     Arrays.asList("/project/templates", "templates/"), ".txt");
 *
 * String out = repo.get("main").render(context);
 * }</pre>
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public class FileTemplateRepository implements IncludeResolver {

    private static final Logger log = LoggerFactory.getLogger(FileTemplateRepository.class);

    public static final String DEFAULT_SUFFIX = ".tpl";

    public static final long DEFAULT_CACHE_SIZE = 1000;

    private final List<String> directories;

    private final String suffix;

    private final int maxIncludeDepth;

    private final Cache<String, Template> cache;

    public FileTemplateRepository(String... directories) {
        this(Arrays.asList(directories), DEFAULT_SUFFIX);
    }

    public FileTemplateRepository(List<String> directories, String suffix) {
        this(directories, suffix, DEFAULT_CACHE_SIZE, Template.DEFAULT_MAX_INCLUDE_DEPTH);
    }

    /**
     * @param directories 基础目录列表，文件系统路径或 Classpath 路径，按顺序查找
     * @param suffix 文件后缀，拼接在名称之后，可以为空字符串
     * @param cacheSize 缓存的模板数量上限
     * @param maxIncludeDepth 模板包含嵌套上限
     */
    public FileTemplateRepository(List<String> directories, String suffix, long cacheSize, int maxIncludeDepth) {
        if (directories == null || directories.isEmpty()) {
            throw new IllegalArgumentException("At least one template directory is required");
        }
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got " + cacheSize);
        }
        this.directories = Collections.unmodifiableList(new ArrayList<>(directories));
        this.suffix = suffix != null ? suffix : "";
        this.maxIncludeDepth = maxIncludeDepth;
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .expireAfterAccess(30, TimeUnit.MINUTES)
                .build();
        log.info("FileTemplateRepository created: directories={}, suffix='{}'", this.directories, this.suffix);
    }

    /**
     * 获取模板，首次访问时加载并缓存
     *
     * @throws TemplateNotFoundException 所有目录中都不存在
     * @throws TemplateLoadException 读取失败
     */
    @Override
    public Template get(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new TemplateNotFoundException(name);
        }
        return cache.get(name, this::load);
    }

    /**
     * 移除单个缓存条目，下次访问时重新读取
     */
    public void invalidate(String name) {
        cache.invalidate(name);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long getCachedCount() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public List<String> getDirectories() {
        return directories;
    }

    public String getSuffix() {
        return suffix;
    }

    private Template load(String name) {
        String relative = name + suffix;
        for (String directory : directories) {
            TemplateResource resource = resolve(directory, relative);
            if (resource == null) {
                continue;
            }
            try {
                String source = resource.readText();
                log.debug("Loaded template '{}' from {}", name, resource.getDescription());
                return new Template(source, this, relative, maxIncludeDepth);
            } catch (IOException e) {
                log.error("Failed to load template '{}' from {}", name, resource.getDescription(), e);
                throw new TemplateLoadException(name, e);
            }
        }
        log.warn("Template '{}' not found (checked file system and classpath in {})", name, directories);
        throw new TemplateNotFoundException(name);
    }

    /**
     * 在单个目录中定位资源，不存在时返回 null
     */
    private TemplateResource resolve(String directory, String relative) {
        File dir = new File(directory);
        if (dir.isDirectory()) {
            Path base = dir.toPath().toAbsolutePath().normalize();
            Path file = base.resolve(relative).normalize();
            if (!file.startsWith(base)) {
                throw new TemplateNotFoundException(relative);
            }
            return Files.isRegularFile(file) ? TemplateResource.fromFile(file) : null;
        }
        return resolveClasspath(directory, relative);
    }

    private TemplateResource resolveClasspath(String directory, String relative) {
        String cleanPath = directory.startsWith("classpath:") ? directory.substring("classpath:".length()) : directory;
        // ClassLoader 资源路径不应以 / 开头
        while (cleanPath.startsWith("/")) {
            cleanPath = cleanPath.substring(1);
        }
        if (!cleanPath.isEmpty() && !cleanPath.endsWith("/")) {
            cleanPath = cleanPath + "/";
        }
        String normalized = relative.replace('\\', '/');
        if (normalized.startsWith("/") || Arrays.asList(normalized.split("/")).contains("..")) {
            throw new TemplateNotFoundException(relative);
        }
        String resourcePath = cleanPath + normalized;
        URL url = getClass().getClassLoader().getResource(resourcePath);
        return url != null ? TemplateResource.fromClasspath(url, "classpath:" + resourcePath) : null;
    }
}
