package com.spel.ast;

import com.spel.config.ParserConfiguration;
import com.spel.variable.ReferenceResolver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a single evaluation: root object, variables, the active context
 * stack and the resolver. Created per evaluation call and never shared between threads.
 */
public class ExpressionState {

    private final ParserConfiguration configuration;
    private final Object rootObject;
    private final Map<String, Object> variables;
    private final ReferenceResolver resolver;

    // ArrayDeque rejects nulls, and null is a legal context object
    private final List<Object> contextObjects = new ArrayList<>();
    private final List<Object> scopeRoots = new ArrayList<>();

    public ExpressionState(ParserConfiguration configuration, Object rootObject,
                           Map<String, Object> variables, ReferenceResolver resolver) {
        this.configuration = configuration;
        this.rootObject = rootObject;
        this.variables = new HashMap<>(variables);
        this.resolver = resolver;
    }

    public ParserConfiguration getConfiguration() {
        return configuration;
    }

    public ReferenceResolver getResolver() {
        return resolver;
    }

    public Object getRootObject() {
        return rootObject;
    }

    /**
     * The object that unqualified references resolve against.
     */
    public Object getActiveContextObject() {
        return contextObjects.isEmpty() ? rootObject : contextObjects.get(contextObjects.size() - 1);
    }

    public void pushActiveContextObject(Object value) {
        contextObjects.add(value);
    }

    public void popActiveContextObject() {
        contextObjects.remove(contextObjects.size() - 1);
    }

    /**
     * The innermost scope root: the element under selection or projection, else the root object.
     * Arguments and index expressions evaluate against it.
     */
    public Object getScopeRootObject() {
        return scopeRoots.isEmpty() ? rootObject : scopeRoots.get(scopeRoots.size() - 1);
    }

    public void enterScope(Object element) {
        scopeRoots.add(element);
        contextObjects.add(element);
    }

    public void exitScope() {
        scopeRoots.remove(scopeRoots.size() - 1);
        contextObjects.remove(contextObjects.size() - 1);
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public Object lookupVariable(String name) {
        return variables.get(name);
    }

    public void setVariable(String name, Object value) {
        variables.put(name, value);
    }
}
