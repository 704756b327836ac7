package com.chih.JTemplate.core.engine;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 复合路径（{@code a.b.c}）的逐段解析
 * <p>
 * 每一段依次尝试以下策略，第一个命中的生效：
 * </p>
 * <ol>
 *   <li>下标：{@code [n]} 作用于 List / 数组，负数从末尾计数</li>
 *   <li>映射键：作用于 Map</li>
 *   <li>成员：record 组件访问器、{@code getXxx()}、{@code isXxx()}、public 字段；
 *   其他方法不会被调用，渲染不会改变上下文中的对象</li>
 * </ol>
 * <p>
 * 每个策略返回 {@link Result}，而不是直接抛异常，由调用方决定如何报告。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public final class PathResolver {

    private static final Pattern INDEX = Pattern.compile("\\[(-?\\d+)]");

    private static final List<Strategy> STRATEGIES = List.of(
            PathResolver::byIndex,
            PathResolver::byKey,
            PathResolver::byMember
    );

    private PathResolver() {
    }

    /**
     * 单段解析结果
     */
    public record Result(Status status, Object value, String reason) {

        public enum Status {
            /** 解析成功，value 可能为 null */
            FOUND,
            /** 此策略不适用于该段 */
            NOT_FOUND,
            /** 策略适用但失败，例如下标越界 */
            TYPE_ERROR
        }

        static Result found(Object value) {
            return new Result(Status.FOUND, value, null);
        }

        static Result notFound() {
            return new Result(Status.NOT_FOUND, null, null);
        }

        static Result error(String reason) {
            return new Result(Status.TYPE_ERROR, null, reason);
        }

        public boolean isFound() {
            return status == Status.FOUND;
        }
    }

    @FunctionalInterface
    interface Strategy {
        Result resolve(Object target, String component);
    }

    /**
     * 解析一段路径
     *
     * @param target 当前值，为 null 时直接返回 TYPE_ERROR
     * @param component 路径段
     */
    public static Result resolve(Object target, String component) {
        if (component == null || component.isEmpty()) {
            return Result.error("empty path component");
        }
        if (target == null) {
            return Result.error("value is null");
        }
        for (Strategy strategy : STRATEGIES) {
            Result result = strategy.resolve(target, component);
            if (result.status() != Result.Status.NOT_FOUND) {
                return result;
            }
        }
        return Result.notFound();
    }

    /**
     * 将名称拆成路径段，保留空段以便报错
     */
    public static String[] split(String path) {
        return path.split("\\.", -1);
    }

    private static Result byIndex(Object target, String component) {
        Matcher m = INDEX.matcher(component);
        if (!m.matches()) {
            return Result.notFound();
        }
        int size;
        if (target instanceof List<?> list) {
            size = list.size();
        } else if (target.getClass().isArray()) {
            size = Array.getLength(target);
        } else {
            return Result.error("value of type " + target.getClass().getSimpleName() + " cannot be indexed");
        }
        int index;
        try {
            index = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return Result.error("index out of range");
        }
        if (index < 0) {
            index += size;
        }
        if (index < 0 || index >= size) {
            return Result.error("index " + m.group(1) + " out of range for size " + size);
        }
        return Result.found(target instanceof List<?> list ? list.get(index) : Array.get(target, index));
    }

    private static Result byKey(Object target, String component) {
        if (!(target instanceof Map<?, ?> map)) {
            return Result.notFound();
        }
        if (!map.containsKey(component)) {
            return Result.error("key '" + component + "' is absent");
        }
        return Result.found(map.get(component));
    }

    private static Result byMember(Object target, String component) {
        Class<?> type = target.getClass();
        for (Method accessor : accessors(type, component)) {
            try {
                return Result.found(accessor.invoke(target));
            } catch (IllegalAccessException e) {
                return Result.error("accessor '" + accessor.getName() + "' is not accessible");
            } catch (InvocationTargetException e) {
                return Result.error("accessor '" + accessor.getName() + "' failed: " + e.getCause());
            }
        }
        try {
            Field field = type.getField(component);
            if (!Modifier.isStatic(field.getModifiers())) {
                field.trySetAccessible();
                return Result.found(field.get(target));
            }
        } catch (NoSuchFieldException ignored) {
            // 没有同名字段，按未找到处理
        } catch (IllegalAccessException e) {
            return Result.error("field '" + component + "' is not accessible");
        }
        return Result.notFound();
    }

    /**
     * 只读访问器：record 组件、{@code getXxx()}、返回 boolean 的 {@code isXxx()}
     * <p>
     * 其他任意无参方法（如 {@code pollFirst}、{@code next}）可能修改调用方的数据，不予调用。
     * </p>
     */
    private static List<Method> accessors(Class<?> type, String component) {
        List<Method> result = new ArrayList<>(3);
        if (type.isRecord()) {
            for (RecordComponent rc : type.getRecordComponents()) {
                if (rc.getName().equals(component)) {
                    result.add(accessible(type, rc.getAccessor()));
                }
            }
        }
        String capitalized = component.substring(0, 1).toUpperCase(Locale.ROOT) + component.substring(1);
        Method getter = findAccessor(type, "get" + capitalized);
        if (getter != null) {
            result.add(getter);
        }
        Method is = findAccessor(type, "is" + capitalized);
        if (is != null && (is.getReturnType() == boolean.class || is.getReturnType() == Boolean.class)) {
            result.add(is);
        }
        return result;
    }

    private static Method findAccessor(Class<?> type, String name) {
        try {
            Method method = type.getMethod(name);
            if (Modifier.isStatic(method.getModifiers()) || method.getReturnType() == void.class) {
                return null;
            }
            return accessible(type, method);
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static Method accessible(Class<?> type, Method method) {
        if (method.trySetAccessible()) {
            return method;
        }
        // JDK 内部实现类（如不可变集合）不可访问，改用其公开接口上的声明
        Method publicMethod = findPublicDeclaration(type, method.getName());
        return publicMethod != null ? publicMethod : method;
    }

    private static Method findPublicDeclaration(Class<?> type, String name) {
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            if (Modifier.isPublic(c.getModifiers()) && c != type) {
                try {
                    return c.getMethod(name);
                } catch (NoSuchMethodException ignored) {
                    // 继续向上查找
                }
            }
            for (Class<?> itf : c.getInterfaces()) {
                if (Modifier.isPublic(itf.getModifiers())) {
                    try {
                        return itf.getMethod(name);
                    } catch (NoSuchMethodException ignored) {
                        // 接口上没有，继续
                    }
                }
            }
        }
        return null;
    }
}
