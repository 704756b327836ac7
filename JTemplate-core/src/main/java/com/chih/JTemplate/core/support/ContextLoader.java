package com.chih.JTemplate.core.support;

import com.chih.JTemplate.core.exception.ContextParseException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 渲染上下文加载器
 * <p>
 * 将 YAML（.yaml / .yml）或 JSON（.json）文件读取为有序的 {@code Map<String, Object>}，
 * 作为模板的根上下文。映射保持文件中的键顺序，序列读取为 List。
 * </p>
 *
 * <pre>{@code
 * Map<String, Object> context = ContextLoader.load(Path.of("model.yaml"));
 * String out = template.render(context);
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public final class ContextLoader {

    private static final Logger log = LoggerFactory.getLogger(ContextLoader.class);

    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".yaml", ".yml", ".json");

    private static final TypeReference<LinkedHashMap<String, Object>> CONTEXT_TYPE = new TypeReference<>() {
    };

    private static final ObjectMapper YAML_MAPPER = TemplateObjectMapperFactory.createYamlMapper();

    private static final ObjectMapper JSON_MAPPER = TemplateObjectMapperFactory.createJsonMapper();

    private ContextLoader() {
    }

    public static boolean isSupportedFile(String filename) {
        if (filename == null) {
            return false;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        return SUPPORTED_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    /**
     * 从文件加载上下文
     *
     * @throws ContextParseException 文件类型不支持、读取失败或内容不是映射
     */
    public static Map<String, Object> load(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("Context file cannot be null");
        }
        String filename = file.getFileName().toString();
        checkSupported(filename);
        try (InputStream is = Files.newInputStream(file)) {
            return load(is, filename);
        } catch (IOException e) {
            throw new ContextParseException(filename, e);
        }
    }

    /**
     * 从流加载上下文，文件名只用于判断格式和错误信息
     */
    public static Map<String, Object> load(InputStream is, String filename) {
        if (is == null) {
            throw new IllegalArgumentException("InputStream cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        checkSupported(filename);
        try {
            String content = TemplateResource.readText(is, filename);
            if (content.isBlank()) {
                log.debug("Context file '{}' is empty", filename);
                return new LinkedHashMap<>();
            }
            ObjectMapper mapper = filename.toLowerCase(Locale.ROOT).endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
            LinkedHashMap<String, Object> context = mapper.readValue(
                    new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), CONTEXT_TYPE);
            if (context == null) {
                return new LinkedHashMap<>();
            }
            log.debug("Loaded context '{}' with {} top-level key(s)", filename, context.size());
            return context;
        } catch (IOException e) {
            throw new ContextParseException(filename, e);
        }
    }

    private static void checkSupported(String filename) {
        if (!isSupportedFile(filename)) {
            throw new ContextParseException("Unsupported context file type: " + filename
                    + " (expected .yaml, .yml or .json)");
        }
    }
}
