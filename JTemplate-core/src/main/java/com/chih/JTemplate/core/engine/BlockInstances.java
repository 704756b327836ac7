package com.chih.JTemplate.core.engine;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 块值的归一化：将任意值展开为有序的实例列表
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public final class BlockInstances {

    private BlockInstances() {
    }

    /**
     * 块值的分类
     */
    public enum ValueKind {
        NULL,
        /** 字符串、数字、布尔、字符 */
        SCALAR,
        MAPPING,
        /** List、Set 及其他 Collection、数组、Iterable */
        SEQUENCE,
        /** 其他对象，按单个实例处理，其成员可通过复合路径访问 */
        OBJECT
    }

    public static ValueKind classify(Object value) {
        if (value == null) {
            return ValueKind.NULL;
        }
        if (value instanceof CharSequence || value instanceof Number
                || value instanceof Boolean || value instanceof Character) {
            return ValueKind.SCALAR;
        }
        if (value instanceof Map) {
            return ValueKind.MAPPING;
        }
        if (value instanceof Iterable || value.getClass().isArray()) {
            return ValueKind.SEQUENCE;
        }
        return ValueKind.OBJECT;
    }

    /**
     * 展开为实例列表
     * <ul>
     *   <li>映射、标量、普通对象：单元素列表</li>
     *   <li>序列：保持迭代顺序（Set 使用其自身迭代顺序）</li>
     *   <li>null：空列表，null 块的单次渲染由调用方处理</li>
     * </ul>
     */
    public static List<Object> normalize(Object value) {
        switch (classify(value)) {
            case NULL:
                return Collections.emptyList();
            case SEQUENCE:
                return toList(value);
            default:
                return Collections.singletonList(value);
        }
    }

    private static List<Object> toList(Object value) {
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return list;
        }
        List<Object> list = value instanceof Collection<?> c ? new ArrayList<>(c.size()) : new ArrayList<>();
        for (Object item : (Iterable<?>) value) {
            list.add(item);
        }
        return list;
    }
}
