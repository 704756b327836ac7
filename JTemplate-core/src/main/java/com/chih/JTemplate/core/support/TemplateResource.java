package com.chih.JTemplate.core.support;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 模板资源包装类
 * <p>
 * 统一文件系统和 Classpath 资源的读取方式，读取结果统一为 UTF-8 文本，
 * 并移除 BOM、将 CRLF 统一为 LF。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public final class TemplateResource {

    /**
     * 单个模板或上下文文件的大小上限（10MB）
     */
    public static final int MAX_FILE_SIZE = 10 * 1024 * 1024;

    private final Path filePath;

    private final URL classpathUrl;

    /**
     * 资源描述，仅用于日志和错误信息
     */
    private final String description;

    private TemplateResource(Path filePath, URL classpathUrl, String description) {
        this.filePath = filePath;
        this.classpathUrl = classpathUrl;
        this.description = description;
    }

    /**
     * 创建文件系统资源
     *
     * @throws IllegalArgumentException filePath 为 null
     */
    public static TemplateResource fromFile(Path filePath) {
        if (filePath == null) {
            throw new IllegalArgumentException("File path cannot be null");
        }
        return new TemplateResource(filePath, null, filePath.toString());
    }

    /**
     * 创建 Classpath 资源
     *
     * @param classpathUrl 资源 URL
     * @param description 资源路径，如 {@code classpath:templates/header.tpl}
     */
    public static TemplateResource fromClasspath(URL classpathUrl, String description) {
        if (classpathUrl == null) {
            throw new IllegalArgumentException("Classpath URL cannot be null");
        }
        if (description == null || description.trim().isEmpty()) {
            throw new IllegalArgumentException("Resource path cannot be null or empty");
        }
        return new TemplateResource(null, classpathUrl, description);
    }

    public InputStream getInputStream() throws IOException {
        if (filePath != null) {
            return Files.newInputStream(filePath);
        }
        return classpathUrl.openStream();
    }

    /**
     * 读取全部内容并标准化
     *
     * @throws IOException 读取失败或超过 {@link #MAX_FILE_SIZE}
     */
    public String readText() throws IOException {
        try (InputStream is = getInputStream()) {
            return readText(is, description);
        }
    }

    /**
     * 从流中读取文本，带大小保护
     */
    public static String readText(InputStream is, String description) throws IOException {
        // 多读一个字节用于判断是否超限
        byte[] bytes = is.readNBytes(MAX_FILE_SIZE + 1);
        if (bytes.length > MAX_FILE_SIZE) {
            throw new IOException("Resource '" + description + "' exceeds the size limit of " + MAX_FILE_SIZE + " bytes");
        }
        return normalizeContent(new String(bytes, StandardCharsets.UTF_8));
    }

    /**
     * 标准化内容：移除 UTF-8 BOM，CRLF 统一为 LF，null 返回空字符串
     */
    public static String normalizeContent(String content) {
        if (content == null) {
            return "";
        }
        if (content.startsWith("\uFEFF")) {
            content = content.substring(1);
        }
        return content.replace("\r\n", "\n");
    }

    public boolean isFileSystemResource() {
        return filePath != null;
    }

    public Path getFilePath() {
        return filePath;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 文件名（不含目录），用于判断文件类型
     */
    public String getFilename() {
        if (filePath != null) {
            return filePath.getFileName().toString();
        }
        String path = classpathUrl.getPath();
        int lastSlash = path.lastIndexOf('/');
        return lastSlash >= 0 ? path.substring(lastSlash + 1) : path;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Objects.equals(description, ((TemplateResource) obj).description);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(description);
    }

    @Override
    public String toString() {
        return "TemplateResource{path='" + description + "'}";
    }
}
