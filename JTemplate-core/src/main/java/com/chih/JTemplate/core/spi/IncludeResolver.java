package com.chih.JTemplate.core.spi;

import com.chih.JTemplate.core.Template;

/**
 * 模板包含（<code>{{&gt;name}}</code>）的解析接口
 * <p>
 * 实现方负责把名称映射到模板，可以来自内存、文件系统、classpath 或 Spring Resource。
 * 找不到时应抛出 {@link com.chih.JTemplate.core.exception.TemplateNotFoundException}，
 * 该异常会原样传递给 render 的调用方。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
@FunctionalInterface
public interface IncludeResolver {

    /**
     * 按名称获取模板
     *
     * @param name 包含指令中的名称
     * @return 模板实例
     */
    Template get(String name);
}
