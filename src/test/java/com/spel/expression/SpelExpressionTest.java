package com.spel.expression;

import com.spel.config.ParserConfiguration;
import com.spel.exception.EvaluationErrorKind;
import com.spel.exception.EvaluationException;
import com.spel.variable.DefaultReferenceResolver;
import com.spel.variable.ExpressionFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SpelExpression evaluation against contexts: variables, functions,
 * assignment, beans, custom resolvers and typed results.
 */
class SpelExpressionTest {

    private SpelExpressionParser parser;

    @BeforeEach
    void setUp() {
        parser = new SpelExpressionParser();
    }

    private EvaluationErrorKind errorKind(Runnable evaluation) {
        return assertThrows(EvaluationException.class, evaluation::run).getKind();
    }

    // =====================================================================
    // Variables and functions
    // =====================================================================

    @Test
    @DisplayName("Variables are read with #name")
    void variables() {
        EvaluationContext context = EvaluationContext.builder()
                .variable("limit", 10)
                .variable("nothing", null)
                .variables(Map.of("tags", List.of("a", "b")))
                .build();

        assertEquals(true, parser.parseExpression("#limit > 5").getValue(context));
        assertNull(parser.parseExpression("#nothing").getValue(context));
        assertEquals("b", parser.parseExpression("#tags[1]").getValue(context));
        assertEquals(2, parser.parseExpression("#tags.size").getValue(context));
    }

    @Test
    @DisplayName("Undefined variable is an error")
    void undefinedVariable() {
        assertEquals(EvaluationErrorKind.UNRESOLVABLE_REFERENCE,
                errorKind(() -> parser.parseExpression("#missing").getValue()));
    }

    @Test
    @DisplayName("Functions registered as variables are invoked with evaluated arguments")
    void functions() {
        ExpressionFunction max = args -> Math.max(((Number) args.get(0)).longValue(),
                ((Number) args.get(1)).longValue());
        EvaluationContext context = EvaluationContext.builder()
                .rootObject(Map.of("a", 3, "b", 8))
                .variable("max", max)
                .variable("count", (ExpressionFunction) List::size)
                .build();

        assertEquals(8L, parser.parseExpression("#max(a, b)").getValue(context));
        assertEquals(16L, parser.parseExpression("#max(a, b) * 2").getValue(context));
        assertEquals(3, parser.parseExpression("#count(1, 'x', null)").getValue(context));
        assertEquals(0, parser.parseExpression("#count()").getValue(context));
    }

    @Test
    @DisplayName("Calling a variable that is not a function fails")
    void notAFunction() {
        EvaluationContext context = EvaluationContext.builder().variable("x", 1).build();

        assertEquals(EvaluationErrorKind.UNRESOLVABLE_REFERENCE,
                errorKind(() -> parser.parseExpression("#x()").getValue(context)));
        assertEquals(EvaluationErrorKind.UNRESOLVABLE_REFERENCE,
                errorKind(() -> parser.parseExpression("#nope(1)").getValue(context)));
    }

    // =====================================================================
    // Assignment
    // =====================================================================

    @Test
    @DisplayName("Variable assignment yields the value and stays within one evaluation")
    void variableAssignment() {
        EvaluationContext context = EvaluationContext.builder().variable("x", 1).build();

        assertEquals(5, parser.parseExpression("#x = 5").getValue(context));
        assertEquals(1, parser.parseExpression("#x").getValue(context));
        assertEquals(1, context.getVariable("x").orElseThrow());
        assertEquals("new", parser.parseExpression("#y = 'new'").getValue(context));
        assertTrue(context.getVariable("y").isEmpty());
    }

    @Test
    @DisplayName("Property and index assignment write through to mutable structures")
    void propertyAndIndexAssignment() {
        Map<String, Object> person = new HashMap<>();
        person.put("age", 30);
        List<Object> items = new ArrayList<>(List.of("a", "b"));
        Map<String, Object> root = new HashMap<>();
        root.put("person", person);
        root.put("items", items);

        assertEquals("root", parser.parseExpression("name = 'root'").getValue(root));
        assertEquals(41L, parser.parseExpression("person.age = person.age + 11").getValue(root));
        assertEquals("z", parser.parseExpression("items[0] = 'z'").getValue(root));
        assertEquals(1, parser.parseExpression("person['rank'] = 1").getValue(root));

        assertEquals("root", root.get("name"));
        assertEquals(41L, person.get("age"));
        assertEquals(1, person.get("rank"));
        assertEquals(List.of("z", "b"), items);
    }

    @Test
    @DisplayName("Index assignment past the end grows the list only when configured")
    void autoGrowCollections() {
        List<Object> items = new ArrayList<>(List.of("a"));
        Map<String, Object> root = Map.of("items", items);

        assertEquals(EvaluationErrorKind.INDEX_OUT_OF_BOUNDS,
                errorKind(() -> parser.parseExpression("items[1] = 'b'").getValue(root)));

        SpelExpressionParser growing = new SpelExpressionParser(
                new ParserConfiguration(1000, true, false, "#{", "}"));
        growing.parseExpression("items[1] = 'b'").getValue(root);

        assertEquals(List.of("a", "b"), items);
        assertEquals(EvaluationErrorKind.INDEX_OUT_OF_BOUNDS,
                errorKind(() -> growing.parseExpression("items[5] = 'x'").getValue(root)));
    }

    @Test
    @DisplayName("Read-only targets and non-references cannot be assigned")
    void notAssignable() {
        Map<String, Object> root = Map.of("name", "fixed", "list", List.of(1));

        assertEquals(EvaluationErrorKind.NOT_ASSIGNABLE,
                errorKind(() -> parser.parseExpression("name = 'x'").getValue(root)));
        assertEquals(EvaluationErrorKind.NOT_ASSIGNABLE,
                errorKind(() -> parser.parseExpression("list[0] = 2").getValue(root)));
        assertEquals(EvaluationErrorKind.NOT_ASSIGNABLE,
                errorKind(() -> parser.parseExpression("#root = 1").getValue(root)));
        assertEquals(EvaluationErrorKind.NOT_ASSIGNABLE,
                errorKind(() -> parser.parseExpression("#this = 1").getValue(root)));
        assertEquals(EvaluationErrorKind.NOT_ASSIGNABLE,
                errorKind(() -> parser.parseExpression("1 = 2").getValue(root)));
        assertEquals(EvaluationErrorKind.NOT_ASSIGNABLE,
                errorKind(() -> parser.parseExpression("name.length = 2").getValue(Map.of("name", List.of()))));
    }

    // =====================================================================
    // Beans, types and custom resolvers
    // =====================================================================

    @Test
    @DisplayName("Bean references resolve through the resolver")
    void beanReferences() {
        Map<String, Object> service = Map.of("limit", 7);
        EvaluationContext context = EvaluationContext.builder()
                .referenceResolver(new DefaultReferenceResolver(Map.of(
                        "service", service,
                        "&service", "factory",
                        "my.bean", "dotted")))
                .build();

        assertSame(service, parser.parseExpression("@service").getValue(context));
        assertEquals(7, parser.parseExpression("@service.limit").getValue(context));
        assertEquals("factory", parser.parseExpression("&service").getValue(context));
        assertEquals("dotted", parser.parseExpression("@'my.bean'").getValue(context));
        assertEquals(EvaluationErrorKind.UNRESOLVABLE_REFERENCE,
                errorKind(() -> parser.parseExpression("@unknown").getValue(context)));
    }

    @Test
    @DisplayName("A custom resolver supplies methods and constructors")
    void customResolver() {
        EvaluationContext context = EvaluationContext.builder()
                .rootObject(Map.of("name", "ann", "items", List.of("x", "y")))
                .referenceResolver(new StringMethodResolver())
                .build();

        assertEquals("ANN", parser.parseExpression("name.toUpperCase()").getValue(context));
        assertEquals("ann!", parser.parseExpression("name.concat('!')").getValue(context));
        assertEquals(List.of("X", "Y"), parser.parseExpression("items.![#this.toUpperCase()]").getValue(context));
        assertEquals("annx", parser.parseExpression("name.concat(items[0])").getValue(context));
        assertEquals("ANN", parser.parseExpression("toUpperCase('ann')").getValue(context));
        assertEquals("built:3", parser.parseExpression("new StringBuilder(1 + 2)").getValue(context));
        assertEquals(EvaluationErrorKind.UNRESOLVABLE_REFERENCE,
                errorKind(() -> parser.parseExpression("name.trim()").getValue(context)));
    }

    @Test
    @DisplayName("A lone inline-list constructor argument still goes to the resolver")
    void constructorWithListArgument() {
        List<String> constructed = new ArrayList<>();
        DefaultReferenceResolver recording = new DefaultReferenceResolver() {
            @Override
            public Object construct(String typeName, List<Object> arguments) {
                constructed.add(typeName + arguments);
                return new ArrayList<>((List<?>) arguments.get(0));
            }
        };
        EvaluationContext context = EvaluationContext.builder().referenceResolver(recording).build();

        SpelExpression expression = parser.parseExpression("new java.util.ArrayList({1, 2})");
        Object value = expression.getValue(context);

        assertEquals(List.of(1, 2), value);
        assertEquals(List.of("java.util.ArrayList[[1, 2]]"), constructed);
        assertEquals("new java.util.ArrayList[] {1,2}", expression.toStringAST());
        assertArrayEquals(new Object[]{1, 2}, (Object[]) parser.parseExpression("new Integer[]{1, 2}").getValue(context));
        assertEquals(1, constructed.size());
    }

    @Test
    @DisplayName("instanceof checks against resolved types")
    void instanceOfWithTypes() {
        assertEquals(true, parser.parseExpression("'a' instanceof T(String)").getValue());
        assertEquals(true, parser.parseExpression("{1} instanceof T(java.util.List)").getValue());
        assertEquals(false, parser.parseExpression("1 instanceof T(String)").getValue());
    }

    // =====================================================================
    // Typed results
    // =====================================================================

    @Test
    @DisplayName("Typed getValue converts numbers, strings and booleans")
    void typedValues() {
        assertEquals(3, parser.parseExpression("1 + 2").getValue((Object) null, Integer.class));
        assertEquals(3L, parser.parseExpression("1 + 2").getValue((Object) null, Long.class));
        assertEquals(2.5, parser.parseExpression("5 / 2.0").getValue((Object) null, Double.class));
        assertEquals("3", parser.parseExpression("1 + 2").getValue((Object) null, String.class));
        assertEquals(Boolean.TRUE, parser.parseExpression("'true'").getValue((Object) null, Boolean.class));
        assertEquals(Boolean.TRUE, parser.parseExpression("1 < 2").getValue((Object) null, boolean.class));
        assertNull(parser.parseExpression("null").getValue((Object) null, String.class));
    }

    @Test
    @DisplayName("Typed getValue rejects impossible conversions")
    void typedValueFailures() {
        SpelExpression nullExpression = parser.parseExpression("null");
        SpelExpression text = parser.parseExpression("'abc'");

        assertEquals(EvaluationErrorKind.TYPE_CONVERSION,
                errorKind(() -> nullExpression.getValue((Object) null, int.class)));
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION,
                errorKind(() -> text.getValue((Object) null, Integer.class)));
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION,
                errorKind(() -> text.getValue((Object) null, Boolean.class)));
    }

    @Test
    @DisplayName("Typed getValue refuses lossy integral conversions")
    void typedValueRange() {
        SpelExpression big = parser.parseExpression("4294967297L");
        SpelExpression fraction = parser.parseExpression("2.5");

        assertEquals(4294967297L, big.getValue((Object) null, Long.class));
        assertEquals(4.294967297E9, big.getValue((Object) null, Double.class));
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION, errorKind(() -> big.getValue((Object) null, Integer.class)));
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION, errorKind(() -> big.getValue((Object) null, int.class)));
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION,
                errorKind(() -> parser.parseExpression("300").getValue((Object) null, Byte.class)));
        assertEquals(EvaluationErrorKind.TYPE_CONVERSION,
                errorKind(() -> fraction.getValue((Object) null, Integer.class)));
        assertEquals(4, parser.parseExpression("8 / 2.0").getValue((Object) null, Integer.class));
        assertEquals((short) 7, parser.parseExpression("7").getValue((Object) null, Short.class));
    }

    @Test
    @DisplayName("A parsed expression can be evaluated repeatedly against different roots")
    void reuse() {
        SpelExpression expression = parser.parseExpression("price * quantity");

        assertEquals(20L, expression.getValue(Map.of("price", 5, "quantity", 4)));
        assertEquals(7.5, expression.getValue(Map.of("price", 2.5, "quantity", 3)));
    }

    /**
     * Resolver with a couple of String methods and a fake constructor.
     */
    private static class StringMethodResolver extends DefaultReferenceResolver {

        @Override
        public Object invokeMethod(Object target, String name, List<Object> arguments) {
            if (target instanceof String s) {
                if ("toUpperCase".equals(name) && arguments.isEmpty()) {
                    return s.toUpperCase();
                }
                if ("concat".equals(name) && arguments.size() == 1) {
                    return s.concat(String.valueOf(arguments.get(0)));
                }
            }
            if (target instanceof Map<?, ?> && "toUpperCase".equals(name) && arguments.size() == 1) {
                return String.valueOf(arguments.get(0)).toUpperCase();
            }
            return super.invokeMethod(target, name, arguments);
        }

        @Override
        public Object construct(String typeName, List<Object> arguments) {
            if ("StringBuilder".equals(typeName)) {
                return "built:" + arguments.get(0);
            }
            return super.construct(typeName, arguments);
        }
    }
}
