package com.spel.variable;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the names an expression refers to: properties, methods, beans, types and constructors.
 * Every call site in the evaluator goes through this interface, so hosts can plug in
 * their own object model.
 */
public interface ReferenceResolver {

    /**
     * Whether a property can be read from the target.
     *
     * @param target Object the property is read from, never null
     * @param name   Property name
     */
    boolean canReadProperty(Object target, String name);

    /**
     * Read a property. Only called after {@link #canReadProperty} returned true.
     *
     * @param target Object the property is read from, never null
     * @param name   Property name
     * @return Property value, may be null
     */
    Object readProperty(Object target, String name);

    /**
     * Write a property.
     *
     * @param target Object the property is written to, never null
     * @param name   Property name
     * @param value  New value
     * @throws com.spel.exception.EvaluationException if the property is not writable
     */
    void writeProperty(Object target, String name, Object value);

    /**
     * Invoke a method on a target.
     *
     * @param target    Receiver, never null
     * @param name      Method name
     * @param arguments Evaluated arguments
     * @return Method result, may be null
     * @throws com.spel.exception.EvaluationException if no such method can be resolved
     */
    Object invokeMethod(Object target, String name, List<Object> arguments);

    /**
     * Look up a bean by name.
     *
     * @param name        Bean name
     * @param factoryBean Whether the factory itself was requested ({@code &name})
     * @return Bean, or empty if not found
     */
    Optional<Object> resolveBean(String name, boolean factoryBean);

    /**
     * Resolve a type name as written in {@code T(...)}.
     *
     * @param typeName Dotted type name
     * @return Type, or empty if not found
     */
    Optional<Class<?>> resolveType(String typeName);

    /**
     * Create an instance of a type.
     *
     * @param typeName  Dotted type name as written after {@code new}
     * @param arguments Evaluated constructor arguments
     * @return New instance
     * @throws com.spel.exception.EvaluationException if the type cannot be constructed
     */
    Object construct(String typeName, List<Object> arguments);
}
