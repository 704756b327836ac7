package com.chih.JTemplate.core.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * 上下文文件使用的 ObjectMapper 工厂
 * <p>
 * YAML 与 JSON 使用同一套配置：
 * </p>
 * <ul>
 *   <li>FAIL_ON_UNKNOWN_PROPERTIES: false</li>
 *   <li>USE_BIG_INTEGER_FOR_INTS: false，整数按 Integer / Long 读取，便于 hex 等格式化器处理</li>
 *   <li>FAIL_ON_TRAILING_TOKENS: true，JSON 文件末尾多余内容视为错误</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public class TemplateObjectMapperFactory {

    private TemplateObjectMapperFactory() {
    }

    /**
     * 创建用于 YAML 解析的 ObjectMapper，线程安全可重用
     */
    public static ObjectMapper createYamlMapper() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    /**
     * 创建用于 JSON 解析的 ObjectMapper，线程安全可重用
     */
    public static ObjectMapper createJsonMapper() {
        return configure(new ObjectMapper());
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        return mapper;
    }
}
