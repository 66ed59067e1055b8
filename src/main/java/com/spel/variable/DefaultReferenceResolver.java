package com.spel.variable;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Default implementation of ReferenceResolver.
 * Properties resolve against maps, map entries ({@code key}/{@code value}), arrays and
 * collections ({@code length}/{@code size}); beans come from a fixed registry; types
 * load through the class loader. Methods and constructors are left to subclasses.
 */
public class DefaultReferenceResolver implements ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultReferenceResolver.class);

    static final String FACTORY_BEAN_PREFIX = "&";

    private static final String JAVA_LANG = "java.lang.";

    private final Map<String, Object> beans;

    public DefaultReferenceResolver() {
        this(Map.of());
    }

    /**
     * @param beans Beans addressable through {@code @name}; factories are registered under {@code &name}
     */
    public DefaultReferenceResolver(Map<String, Object> beans) {
        this.beans = new HashMap<>(beans);
    }

    @Override
    public boolean canReadProperty(Object target, String name) {
        if (target instanceof Map<?, ?> map) {
            return map.containsKey(name);
        }
        if (target instanceof Map.Entry<?, ?>) {
            return "key".equals(name) || "value".equals(name);
        }
        if (target.getClass().isArray()) {
            return "length".equals(name);
        }
        if (target instanceof Collection<?>) {
            return "size".equals(name);
        }
        return false;
    }

    @Override
    public Object readProperty(Object target, String name) {
        if (target instanceof Map<?, ?> map) {
            return map.get(name);
        }
        if (target instanceof Map.Entry<?, ?> entry) {
            return "key".equals(name) ? entry.getKey() : entry.getValue();
        }
        if (target.getClass().isArray()) {
            return Array.getLength(target);
        }
        if (target instanceof Collection<?> collection) {
            return collection.size();
        }
        throw new EvaluationException(EvaluationErrorKind.UNRESOLVABLE_REFERENCE,
                "Property or field '" + name + "' cannot be found on object of type '"
                        + target.getClass().getName() + "'");
    }

    @Override
    @SuppressWarnings("unchecked")
    public void writeProperty(Object target, String name, Object value) {
        if (target instanceof Map<?, ?> map) {
            try {
                ((Map<String, Object>) map).put(name, value);
                return;
            } catch (UnsupportedOperationException e) {
                throw new EvaluationException(EvaluationErrorKind.NOT_ASSIGNABLE,
                        "Property '" + name + "' cannot be written: map is read-only", e);
            }
        }
        throw new EvaluationException(EvaluationErrorKind.NOT_ASSIGNABLE,
                "Property '" + name + "' cannot be written on object of type '"
                        + target.getClass().getName() + "'");
    }

    @Override
    public Object invokeMethod(Object target, String name, List<Object> arguments) {
        throw new EvaluationException(EvaluationErrorKind.UNRESOLVABLE_REFERENCE,
                "Method " + name + "(" + describeTypes(arguments) + ") cannot be found on type "
                        + target.getClass().getName());
    }

    @Override
    public Optional<Object> resolveBean(String name, boolean factoryBean) {
        String key = factoryBean ? FACTORY_BEAN_PREFIX + name : name;
        Object bean = beans.get(key);
        if (bean == null) {
            log.warn("Invalid bean reference: {}", key);
        }
        return Optional.ofNullable(bean);
    }

    @Override
    public Optional<Class<?>> resolveType(String typeName) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        try {
            return Optional.of(Class.forName(typeName, false, classLoader));
        } catch (ClassNotFoundException e) {
            if (typeName.indexOf('.') < 0) {
                return resolveType(JAVA_LANG + typeName);
            }
            log.warn("Invalid type reference: {}", typeName);
            return Optional.empty();
        }
    }

    @Override
    public Object construct(String typeName, List<Object> arguments) {
        throw new EvaluationException(EvaluationErrorKind.UNSUPPORTED_OPERATION,
                "Constructor " + typeName + "(" + describeTypes(arguments) + ") cannot be resolved");
    }

    protected static String describeTypes(List<Object> arguments) {
        return arguments.stream()
                .map(arg -> arg == null ? "null" : arg.getClass().getSimpleName())
                .collect(Collectors.joining(","));
    }
}
