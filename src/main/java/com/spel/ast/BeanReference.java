package com.spel.ast;

import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;

import java.util.List;

/**
 * {@code @name} or, for the factory itself, {@code &name}.
 */
public record BeanReference(String name, boolean factoryBean,
                            int startPosition, int endPosition) implements SpelNode {

    @Override
    public List<SpelNode> children() {
        return List.of();
    }

    @Override
    public Object getValue(ExpressionState state) {
        return state.getResolver().resolveBean(name, factoryBean)
                .orElseThrow(() -> new EvaluationException(EvaluationErrorKind.UNRESOLVABLE_REFERENCE,
                        "Bean '" + name + "' cannot be resolved"));
    }

    @Override
    public String toStringAST() {
        String prefix = factoryBean ? "&" : "@";
        if (isSimpleName(name)) {
            return prefix + name;
        }
        return prefix + "'" + name.replace("'", "''") + "'";
    }

    private static boolean isSimpleName(String name) {
        if (name.isEmpty() || !(Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_' && c != '$') {
                return false;
            }
        }
        return true;
    }
}
