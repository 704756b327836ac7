package com.chih.JTemplate.core.format;

import com.chih.JTemplate.core.exception.InvalidFormatterException;
import com.chih.JTemplate.core.text.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 格式化器注册表
 * <p>
 * 维护格式化器名称（含别名）到构造函数的映射。内置格式化器在类加载时注册：
 * </p>
 * <table>
 *   <caption>内置格式化器</caption>
 *   <tr><th>名称</th><th>类型</th><th>说明</th></tr>
 *   <tr><td>width / w</td><td>value</td><td>按宽度对齐，负数右对齐</td></tr>
 *   <tr><td>prefix / suffix</td><td>value</td><td>添加前缀 / 后缀</td></tr>
 *   <tr><td>default</td><td>value</td><td>值为 null 时的默认值</td></tr>
 *   <tr><td>upper-case / uc</td><td>value</td><td>转大写</td></tr>
 *   <tr><td>escape-newlines</td><td>value</td><td>转义换行</td></tr>
 *   <tr><td>escape-string</td><td>value</td><td>转义换行、制表符、双引号</td></tr>
 *   <tr><td>wrap-string</td><td>value</td><td>字符串加双引号</td></tr>
 *   <tr><td>cbool</td><td>value</td><td>布尔值输出为 true/false</td></tr>
 *   <tr><td>hex</td><td>value</td><td>整数输出为 0x 十六进制</td></tr>
 *   <tr><td>indent</td><td>block</td><td>制表符缩进</td></tr>
 *   <tr><td>list-separator / separator / l-s</td><td>block</td><td>实例间分隔符</td></tr>
 * </table>
 * <p>
 * 可以通过 {@link #register(FormatterFactory, String...)} 注册自定义格式化器。
 * 注册表是全局的、线程安全的；注册应在渲染开始前完成。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public final class FormatterRegistry {

    private static final Logger log = LoggerFactory.getLogger(FormatterRegistry.class);

    private static final Map<String, FormatterFactory> FACTORIES = new ConcurrentHashMap<>();

    static {
        register(p -> new WidthFormatter(requireInt("width", p)), "width", "w");
        register(p -> new PrefixFormatter(require("prefix", p)), "prefix");
        register(p -> new SuffixFormatter(require("suffix", p)), "suffix");
        register(p -> new DefaultFormatter(require("default", p)), "default");
        register(p -> new UppercaseFormatter(), "upper-case", "uc");
        register(p -> new EscapeNewlinesFormatter(), "escape-newlines");
        register(p -> new EscapeStringFormatter(), "escape-string");
        register(p -> new WrapStringFormatter(), "wrap-string");
        register(p -> new CBooleanFormatter(), "cbool");
        register(p -> new HexFormatter(), "hex");
        register(p -> new IndentFormatter(requireInt("indent", p)), "indent");
        register(p -> new ListSeparatorFormatter(require("list-separator", p)),
                "list-separator", "separator", "l-s");
    }

    private FormatterRegistry() {
    }

    /**
     * 注册格式化器，同名的已有注册会被覆盖
     *
     * @param factory 构造函数
     * @param names 名称及别名，至少一个
     */
    public static void register(FormatterFactory factory, String... names) {
        if (factory == null) {
            throw new IllegalArgumentException("Formatter factory cannot be null");
        }
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("At least one formatter name is required");
        }
        for (String name : names) {
            if (name == null || name.isEmpty() || name.indexOf(':') >= 0 || name.indexOf('=') >= 0) {
                throw new IllegalArgumentException("Invalid formatter name: '" + name + "'");
            }
            if (FACTORIES.put(name, factory) != null) {
                log.debug("Formatter '{}' re-registered", name);
            }
        }
    }

    /**
     * 移除一个已注册的名称
     *
     * @return 名称存在时返回 true
     */
    public static boolean unregister(String name) {
        return FACTORIES.remove(name) != null;
    }

    public static boolean isRegistered(String name) {
        return name != null && FACTORIES.containsKey(name);
    }

    /**
     * 已注册的全部名称（按字母序）
     */
    public static Set<String> getNames() {
        return Collections.unmodifiableSet(new TreeSet<>(FACTORIES.keySet()));
    }

    /**
     * 按名称创建格式化器
     *
     * @param name 格式化器名称
     * @param parameter 参数，没有时为 null
     * @param position Token 位置，用于错误信息
     * @return 新建的格式化器
     * @throws InvalidFormatterException 名称未注册或参数非法
     */
    public static Formatter create(String name, String parameter, SourcePosition position) {
        FormatterFactory factory = FACTORIES.get(name);
        if (factory == null) {
            throw new InvalidFormatterException(String.format("Invalid formatter '%s'", name), position);
        }
        try {
            Formatter formatter = factory.create(parameter);
            if (formatter == null) {
                throw new InvalidFormatterException(
                        String.format("Formatter factory for '%s' returned null", name), position);
            }
            return formatter;
        } catch (IllegalArgumentException e) {
            throw new InvalidFormatterException(
                    String.format("Cannot create formatter '%s': %s", name, e.getMessage()), position);
        }
    }

    private static String require(String name, String parameter) {
        if (parameter == null || parameter.isEmpty()) {
            throw new IllegalArgumentException("formatter '" + name + "' requires a value");
        }
        return parameter;
    }

    private static int requireInt(String name, String parameter) {
        String value = require(name, parameter);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("formatter '" + name + "' requires an integer, got '" + value + "'");
        }
    }
}
