package com.chih.JTemplate.core.engine;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 上下文栈中的一帧
 * <p>
 * 由三部分组成，查找顺序依次为：
 * </p>
 * <ol>
 *   <li>自引用 {@code "."}：当前块实例本身（根帧没有）</li>
 *   <li>实例标记 {@code <block>#First} / {@code #Separator} / {@code #Last}：只用于存在性判断</li>
 *   <li>实例数据：块实例为映射时就是该映射，根帧是调用方传入的上下文</li>
 * </ol>
 * <p>
 * 自引用和标记保存在帧自身，不写回调用方的数据，因此同一份上下文可以重复渲染。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public final class ContextFrame {

    /**
     * 自引用名称
     */
    public static final String SELF = ".";

    /**
     * 实例标记名称中块名与标记之间的分隔符，如 {@code items#First}
     */
    public static final char MARKER_SEPARATOR = '#';

    /**
     * 标记的值：一个空映射（非 null，作为块展开时渲染一次）
     */
    static final Map<String, Object> MARKER = Collections.emptyMap();

    private final Map<String, ?> values;
    private final boolean hasSelf;
    private final Object self;
    private final Set<String> markers;

    private ContextFrame(Map<String, ?> values, boolean hasSelf, Object self, Set<String> markers) {
        this.values = values != null ? values : Collections.emptyMap();
        this.hasSelf = hasSelf;
        this.self = self;
        this.markers = markers;
    }

    /**
     * 根帧：调用方传入的上下文，不含自引用
     */
    public static ContextFrame root(Map<String, ?> context) {
        return new ContextFrame(context, false, null, Collections.emptySet());
    }

    /**
     * 块实例帧
     *
     * @param blockName 块名称，用于生成标记
     * @param instance 实例值；为映射时其键可直接访问
     * @param index 实例序号
     * @param count 实例总数
     */
    @SuppressWarnings("unchecked")
    public static ContextFrame instance(String blockName, Object instance, int index, int count) {
        Set<String> markers = new HashSet<>(4);
        if (index == 0) {
            markers.add(blockName + MARKER_SEPARATOR + "First");
        }
        if (index + 1 < count) {
            markers.add(blockName + MARKER_SEPARATOR + "Separator");
        }
        if (index + 1 == count) {
            markers.add(blockName + MARKER_SEPARATOR + "Last");
        }
        Map<String, ?> values = instance instanceof Map ? (Map<String, ?>) instance : null;
        return new ContextFrame(values, true, instance, markers);
    }

    public boolean contains(String name) {
        if (hasSelf && SELF.equals(name)) {
            return true;
        }
        return markers.contains(name) || values.containsKey(name);
    }

    /**
     * 获取值，调用前应先用 {@link #contains(String)} 判断存在性
     */
    public Object get(String name) {
        if (hasSelf && SELF.equals(name)) {
            return self;
        }
        if (markers.contains(name)) {
            return MARKER;
        }
        return values.get(name);
    }
}
