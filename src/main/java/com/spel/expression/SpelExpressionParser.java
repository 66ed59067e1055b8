package com.spel.expression;

import com.spel.ast.AstPrinter;
import com.spel.ast.Literal;
import com.spel.ast.SpelNode;
import com.spel.ast.TemplateExpression;
import com.spel.config.ParserConfiguration;
import com.spel.config.ParserContext;
import com.spel.config.expression.ExpressionParser;
import com.spel.config.expression.ExpressionTokenizer;
import com.spel.config.expression.Token;
import com.spel.exception.ParseErrorKind;
import com.spel.exception.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Facade for parsing expressions and templates into {@link SpelExpression}s.
 * <p>
 * Supports:
 * <ul>
 *   <li>Literals: int, long, hex, real, float, string, boolean, null</li>
 *   <li>Arithmetic: +, -, *, /, %, ^ and unary minus</li>
 *   <li>Relational: ==, !=, &gt;, &gt;=, &lt;, &lt;=, matches, between, instanceof (and textual aliases)</li>
 *   <li>Logical: and, or, not (and &amp;&amp;, ||, !)</li>
 *   <li>Ternary, elvis, assignment</li>
 *   <li>Properties, indexers, methods, null-safe navigation</li>
 *   <li>Variables, functions, bean and type references, constructors</li>
 *   <li>Inline lists and maps, selection and projection</li>
 * </ul>
 * Thread-safe: every call uses its own tokenizer and parser.
 */
public class SpelExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(SpelExpressionParser.class);

    private final ParserConfiguration configuration;

    public SpelExpressionParser() {
        this(ParserConfiguration.defaults());
    }

    public SpelExpressionParser(ParserConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public ParserConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Parse a plain expression.
     *
     * @param expressionString Expression source
     * @return Parsed expression
     * @throws ParseException on an empty or too long source, or any lexical or grammar error
     */
    public SpelExpression parseExpression(String expressionString) {
        return parseExpression(expressionString, ParserContext.STANDARD);
    }

    /**
     * Parse an expression, or a template when the context says so.
     */
    public SpelExpression parseExpression(String expressionString, ParserContext context) {
        checkLength(expressionString);
        if (context != null && context.template()) {
            return new SpelExpression(expressionString, parseTemplate(expressionString, context), configuration);
        }
        return new SpelExpression(expressionString, doParse(expressionString, tokenize(expressionString)),
                configuration);
    }

    /**
     * Parse a template using the configured delimiters.
     */
    public SpelExpression parseTemplate(String templateString) {
        return parseExpression(templateString, configuration.templateContext());
    }

    /**
     * Same as {@link #parseExpression(String)}, logging the token stream and the tree at debug level.
     */
    public SpelExpression parseExpressionDebug(String expressionString) {
        checkLength(expressionString);
        List<Token> tokens = tokenize(expressionString);
        if (log.isDebugEnabled()) {
            log.debug("Tokens for '{}':", expressionString);
            for (int i = 0; i < tokens.size(); i++) {
                log.debug("[{}] {}", i, tokens.get(i));
            }
        }
        SpelNode ast = doParse(expressionString, tokens);
        if (log.isDebugEnabled()) {
            log.debug("AST: {}", ast.toStringAST());
            log.debug("Tree:\n{}", AstPrinter.print(ast));
        }
        return new SpelExpression(expressionString, ast, configuration);
    }

    private void checkLength(String expressionString) {
        if (expressionString != null && expressionString.length() > configuration.maximumExpressionLength()) {
            throw new ParseException(ParseErrorKind.EXPRESSION_TOO_LONG, expressionString, -1,
                    "Expression of length " + expressionString.length()
                            + " exceeds the maximum of " + configuration.maximumExpressionLength());
        }
    }

    private List<Token> tokenize(String expressionString) {
        if (expressionString == null || expressionString.isBlank()) {
            throw new ParseException(ParseErrorKind.EMPTY_EXPRESSION, expressionString == null ? "" : expressionString,
                    0, "Expression is empty");
        }
        return new ExpressionTokenizer(expressionString).tokenize();
    }

    private SpelNode doParse(String expressionString, List<Token> tokens) {
        return new ExpressionParser(expressionString, tokens).parse();
    }

    /**
     * Split a template into literal text and embedded expressions. Only the first suffix
     * after a prefix closes the expression; embedded expressions cannot contain the suffix.
     */
    private SpelNode parseTemplate(String template, ParserContext context) {
        if (template == null || template.isEmpty()) {
            return Literal.ofString("", 0, 0);
        }
        String prefix = context.expressionPrefix();
        String suffix = context.expressionSuffix();
        List<SpelNode> parts = new ArrayList<>();
        int startIdx = 0;

        while (startIdx < template.length()) {
            int prefixIndex = template.indexOf(prefix, startIdx);
            if (prefixIndex < 0) {
                parts.add(Literal.ofString(template.substring(startIdx), startIdx, template.length()));
                break;
            }
            if (prefixIndex > startIdx) {
                parts.add(Literal.ofString(template.substring(startIdx, prefixIndex), startIdx, prefixIndex));
            }
            int afterPrefixIndex = prefixIndex + prefix.length();
            int suffixIndex = template.indexOf(suffix, afterPrefixIndex);
            if (suffixIndex < 0) {
                throw new ParseException(ParseErrorKind.TEMPLATE_SUFFIX_MISSING, template, prefixIndex,
                        "No closing '" + suffix + "' for expression starting at position " + prefixIndex);
            }
            String embedded = template.substring(afterPrefixIndex, suffixIndex).trim();
            if (embedded.isEmpty()) {
                throw new ParseException(ParseErrorKind.TEMPLATE_EXPRESSION_EMPTY, template, prefixIndex,
                        "No expression defined within '" + prefix + suffix + "' at position " + prefixIndex);
            }
            parts.add(doParse(embedded, tokenize(embedded)));
            startIdx = suffixIndex + suffix.length();
        }

        log.debug("Template '{}' split into {} parts", template, parts.size());
        if (parts.size() == 1 && parts.get(0) instanceof Literal literal) {
            return literal;
        }
        return new TemplateExpression(parts, 0, template.length());
    }
}
