package com.chih.JTemplate.spring;

import com.chih.JTemplate.core.Template;
import com.chih.JTemplate.core.impl.FileTemplateRepository;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 模板仓库配置
 * @author lizhiyuan
 * @since 2025/12/14
*/
@ConfigurationProperties(prefix = "j-template")
public class JTemplateProperties {

    /**
     * 模板目录列表，按顺序查找
     * 支持 classpath: 和 file: 前缀
     */
    private List<String> locations = new ArrayList<>();

    /**
     * 模板文件后缀
     */
    private String suffix = FileTemplateRepository.DEFAULT_SUFFIX;

    /**
     * 解析后模板的缓存数量上限
     */
    private long cacheSize = FileTemplateRepository.DEFAULT_CACHE_SIZE;

    /**
     * 单次渲染中模板包含的嵌套上限
     */
    private int maxIncludeDepth = Template.DEFAULT_MAX_INCLUDE_DEPTH;

    public JTemplateProperties() {
        // 默认约定：classpath 下的 templates 目录
        locations.add("classpath:templates/");
    }

    public List<String> getLocations() {
        return locations;
    }

    public void setLocations(List<String> locations) {
        this.locations = locations;
    }

    public String getSuffix() {
        return suffix;
    }

    public void setSuffix(String suffix) {
        this.suffix = suffix;
    }

    public long getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(long cacheSize) {
        this.cacheSize = cacheSize;
    }

    public int getMaxIncludeDepth() {
        return maxIncludeDepth;
    }

    public void setMaxIncludeDepth(int maxIncludeDepth) {
        this.maxIncludeDepth = maxIncludeDepth;
    }
}
