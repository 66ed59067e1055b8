package com.spel.config.expression;

import com.spel.ast.ArrayConstructor;
import com.spel.ast.Assign;
import com.spel.ast.BeanReference;
import com.spel.ast.CompoundExpression;
import com.spel.ast.ConstructorReference;
import com.spel.ast.Elvis;
import com.spel.ast.FunctionReference;
import com.spel.ast.Identifier;
import com.spel.ast.Indexer;
import com.spel.ast.InlineList;
import com.spel.ast.InlineMap;
import com.spel.ast.Literal;
import com.spel.ast.LiteralKind;
import com.spel.ast.MethodReference;
import com.spel.ast.Operator;
import com.spel.ast.OperatorExpression;
import com.spel.ast.Projection;
import com.spel.ast.PropertyOrFieldReference;
import com.spel.ast.QualifiedIdentifier;
import com.spel.ast.Selection;
import com.spel.ast.SpelNode;
import com.spel.ast.Ternary;
import com.spel.ast.TypeReference;
import com.spel.ast.UnaryExpression;
import com.spel.ast.VariableReference;
import com.spel.exception.ParseErrorKind;
import com.spel.exception.ParseException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.spel.config.expression.ExpressionConfig.*;

/**
 * Parser for expressions.
 * Converts tokens into a {@link SpelNode} tree using recursive descent parsing.
 * A new instance is needed per token list.
 * <p>
 * Grammar (lowest precedence first):
 * <pre>
 * statement   := expression ('=' expression)?
 * expression  := logicalOr ('?:' logicalOr | '?' logicalOr ':' logicalOr)?
 * logicalOr   := logicalAnd (('||' | 'or') logicalAnd)*
 * logicalAnd  := relational (('&&' | 'and') relational)*
 * relational  := sum (relOp sum)?
 * relOp       := '==' | '!=' | '&gt;' | '&gt;=' | '&lt;' | '&lt;=' | 'matches' | 'between' | 'instanceof'
 * sum         := product (('+' | '-') product)*
 * product     := power (('*' | '/' | '%') power)*
 * power       := unary ('^' unary)?
 * unary       := '!' unary | '+' unary | '-' unary | primary
 * primary     := startNode node*
 * node        := ('.' | '?.') dotted | '[' expression ']'
 * dotted      := selection | projection | '[' expression ']' | IDENT '(' args ')' | IDENT
 * startNode   := literal | '(' expression ')' | beanRef | '#' IDENT ('(' args ')')? | 'null'
 *              | 'T(' qualifiedName ')' | constructor | '{' inlineCollection '}'
 *              | IDENT '(' args ')' | IDENT
 * </pre>
 * Keywords and textual operators are matched case-insensitively, except {@code T}.
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into an AST.
     *
     * @return Root node
     * @throws ParseException if the tokens do not form exactly one expression
     */
    public SpelNode parse() {
        SpelNode ast = eatExpression();
        if (match(TokenKind.ASSIGN)) {
            SpelNode value = eatExpression();
            ast = new Assign(ast, value, ast.startPosition(), value.endPosition());
        }
        if (!isAtEnd()) {
            Token next = peek();
            throw error(ParseErrorKind.UNEXPECTED_DATA_AFTER_EXPRESSION, next.start(),
                    "Unexpected tokens after expression: " + describe(next));
        }
        return ast;
    }

    // ==================== Operators ====================

    private SpelNode eatExpression() {
        SpelNode condition = eatLogicalOr();
        if (match(TokenKind.ELVIS)) {
            SpelNode fallback = eatLogicalOr();
            return new Elvis(condition, fallback, condition.startPosition(), fallback.endPosition());
        }
        if (match(TokenKind.QMARK)) {
            SpelNode ifTrue = eatLogicalOr();
            consume(TokenKind.COLON, "Expected ':' in ternary expression");
            SpelNode ifFalse = eatLogicalOr();
            return new Ternary(condition, ifTrue, ifFalse, condition.startPosition(), ifFalse.endPosition());
        }
        return condition;
    }

    private SpelNode eatLogicalOr() {
        SpelNode left = eatLogicalAnd();
        while (match(TokenKind.SYMBOLIC_OR) || matchKeyword(Keywords.OR)) {
            SpelNode right = eatLogicalAnd();
            left = binary(Operator.OR, left, right);
        }
        return left;
    }

    private SpelNode eatLogicalAnd() {
        SpelNode left = eatRelational();
        while (match(TokenKind.SYMBOLIC_AND) || matchKeyword(Keywords.AND)) {
            SpelNode right = eatRelational();
            left = binary(Operator.AND, left, right);
        }
        return left;
    }

    private SpelNode eatRelational() {
        SpelNode left = eatSum();
        Operator operator = maybeEatRelationalOperator();
        if (operator == null) {
            return left;
        }
        SpelNode right = eatSum();
        return binary(operator, left, right);
    }

    private Operator maybeEatRelationalOperator() {
        if (isAtEnd()) {
            return null;
        }
        Token token = peek();
        if (token.isIdentifier(Keywords.MATCHES)) {
            token = token.as(TokenKind.MATCHES);
        } else if (token.isIdentifier(Keywords.INSTANCEOF)) {
            token = token.as(TokenKind.INSTANCEOF);
        } else if (token.isIdentifier(Keywords.BETWEEN)) {
            token = token.as(TokenKind.BETWEEN);
        }
        Operator operator = switch (token.kind()) {
            case EQ -> Operator.EQ;
            case NE -> Operator.NE;
            case GT -> Operator.GT;
            case GE -> Operator.GE;
            case LT -> Operator.LT;
            case LE -> Operator.LE;
            case MATCHES -> Operator.MATCHES;
            case BETWEEN -> Operator.BETWEEN;
            case INSTANCEOF -> Operator.INSTANCEOF;
            default -> null;
        };
        if (operator != null) {
            advance();
        }
        return operator;
    }

    private SpelNode eatSum() {
        SpelNode left = eatProduct();
        while (check(TokenKind.PLUS) || check(TokenKind.MINUS)) {
            Operator operator = advance().kind() == TokenKind.PLUS ? Operator.PLUS : Operator.MINUS;
            left = binary(operator, left, eatProduct());
        }
        return left;
    }

    private SpelNode eatProduct() {
        SpelNode left = eatPower();
        while (check(TokenKind.STAR) || check(TokenKind.DIV) || check(TokenKind.MOD)) {
            Operator operator = switch (advance().kind()) {
                case STAR -> Operator.MULTIPLY;
                case DIV -> Operator.DIVIDE;
                default -> Operator.MODULUS;
            };
            left = binary(operator, left, eatPower());
        }
        return left;
    }

    private SpelNode eatPower() {
        SpelNode left = eatUnary();
        if (match(TokenKind.POWER)) {
            return binary(Operator.POWER, left, eatUnary());
        }
        return left;
    }

    private SpelNode eatUnary() {
        if (match(TokenKind.NOT)) {
            int start = previous().start();
            SpelNode operand = eatUnary();
            return new UnaryExpression(UnaryExpression.Kind.NOT, operand, start, operand.endPosition());
        }
        if (match(TokenKind.PLUS)) {
            return eatUnary();
        }
        if (match(TokenKind.MINUS)) {
            int start = previous().start();
            SpelNode operand = eatUnary();
            return new UnaryExpression(UnaryExpression.Kind.MINUS, operand, start, operand.endPosition());
        }
        return eatPrimary();
    }

    private static SpelNode binary(Operator operator, SpelNode left, SpelNode right) {
        return new OperatorExpression(operator, left, right, left.startPosition(), right.endPosition());
    }

    // ==================== Primary and trailers ====================

    private SpelNode eatPrimary() {
        SpelNode start = eatStartNode();
        List<SpelNode> nodes = new ArrayList<>();
        nodes.add(start);
        SpelNode node;
        while ((node = maybeEatNode()) != null) {
            nodes.add(node);
        }
        if (nodes.size() == 1) {
            return start;
        }
        return new CompoundExpression(nodes, start.startPosition(), nodes.get(nodes.size() - 1).endPosition());
    }

    private SpelNode maybeEatNode() {
        if (check(TokenKind.DOT) || check(TokenKind.SAFE_NAVI)) {
            Token dot = advance();
            return eatDottedNode(dot);
        }
        if (check(TokenKind.LSQUARE)) {
            return eatIndexer(false, advance().start());
        }
        return null;
    }

    private SpelNode eatDottedNode(Token dot) {
        boolean nullSafe = dot.kind() == TokenKind.SAFE_NAVI;
        if (isAtEnd()) {
            throw error(ParseErrorKind.MISSING_TOKEN, dot.end(),
                    "Expected identifier after " + dot.kind() + " at position " + dot.end());
        }
        Token token = peek();
        switch (token.kind()) {
            case SELECT -> {
                return eatSelection(nullSafe, Selection.Kind.ALL, dot);
            }
            case SELECT_FIRST -> {
                return eatSelection(nullSafe, Selection.Kind.FIRST, dot);
            }
            case SELECT_LAST -> {
                return eatSelection(nullSafe, Selection.Kind.LAST, dot);
            }
            case PROJECT -> {
                advance();
                SpelNode expression = eatExpression();
                Token close = consume(TokenKind.RSQUARE, "Expected ']' to close projection");
                return new Projection(nullSafe, expression, dot.start(), close.end());
            }
            case LSQUARE -> {
                advance();
                return eatIndexer(nullSafe, dot.start());
            }
            default -> {
                // Textual operators such as 'div' are plain names after a dot
                if (token.isIdentifier() || (token.data() != null && !token.kind().hasPayload())) {
                    advance();
                    if (check(TokenKind.LPAREN)) {
                        List<SpelNode> arguments = eatMethodArguments();
                        return new MethodReference(nullSafe, token.data(), arguments,
                                token.start(), previous().end());
                    }
                    return new PropertyOrFieldReference(nullSafe, false, token.data(), token.start(), token.end());
                }
                throw error(ParseErrorKind.UNEXPECTED_TOKEN, token.start(),
                        "Expected identifier after " + dot.kind() + " at position " + token.start()
                                + " but found " + describe(token));
            }
        }
    }

    private SpelNode eatSelection(boolean nullSafe, Selection.Kind kind, Token dot) {
        advance();
        SpelNode criteria = eatExpression();
        Token close = consume(TokenKind.RSQUARE, "Expected ']' to close selection");
        return new Selection(nullSafe, kind, criteria, dot.start(), close.end());
    }

    /**
     * Called with the opening '[' already consumed.
     */
    private SpelNode eatIndexer(boolean nullSafe, int start) {
        SpelNode index = eatExpression();
        Token close = consume(TokenKind.RSQUARE, "Expected ']' to close indexer");
        return new Indexer(nullSafe, index, start, close.end());
    }

    private SpelNode eatStartNode() {
        if (isAtEnd()) {
            int position = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).end();
            throw error(ParseErrorKind.UNEXPECTED_TOKEN, position, "Unexpected end of expression");
        }
        SpelNode node = maybeEatLiteral();
        if (node == null) {
            node = maybeEatParenExpression();
        }
        if (node == null) {
            node = maybeEatBeanReference();
        }
        if (node == null) {
            node = maybeEatVariableOrFunctionReference();
        }
        if (node == null) {
            node = maybeEatNullReference();
        }
        if (node == null) {
            node = maybeEatTypeReference();
        }
        if (node == null) {
            node = maybeEatConstructorReference();
        }
        if (node == null) {
            node = maybeEatInlineCollection();
        }
        if (node == null) {
            node = maybeEatMethodReference();
        }
        if (node == null) {
            node = maybeEatPropertyReference();
        }
        if (node == null) {
            Token token = peek();
            throw error(ParseErrorKind.UNEXPECTED_TOKEN, token.start(), "Unexpected token " + describe(token));
        }
        return node;
    }

    // ==================== Start nodes ====================

    private SpelNode maybeEatLiteral() {
        Token token = peek();
        Literal literal = switch (token.kind()) {
            case LITERAL_INT -> new Literal(LiteralKind.INT, parseInt(token), token.start(), token.end());
            case LITERAL_LONG -> new Literal(LiteralKind.LONG, parseLong(token), token.start(), token.end());
            case LITERAL_HEXINT -> new Literal(LiteralKind.INT, parseHexInt(token), token.start(), token.end());
            case LITERAL_HEXLONG -> new Literal(LiteralKind.LONG, parseHexLong(token), token.start(), token.end());
            case LITERAL_REAL -> new Literal(LiteralKind.REAL, parseDouble(token), token.start(), token.end());
            case LITERAL_REAL_FLOAT -> new Literal(LiteralKind.FLOAT, parseFloat(token), token.start(), token.end());
            case LITERAL_STRING -> Literal.ofString(unquote(token.data()), token.start(), token.end());
            case IDENTIFIER -> {
                if (token.isIdentifier(Keywords.TRUE)) {
                    yield Literal.ofBoolean(true, token.start(), token.end());
                }
                if (token.isIdentifier(Keywords.FALSE)) {
                    yield Literal.ofBoolean(false, token.start(), token.end());
                }
                yield null;
            }
            default -> null;
        };
        if (literal != null) {
            advance();
        }
        return literal;
    }

    private SpelNode maybeEatParenExpression() {
        if (!match(TokenKind.LPAREN)) {
            return null;
        }
        SpelNode expression = eatExpression();
        consume(TokenKind.RPAREN, "Expected ')' to close parenthesized expression");
        return expression;
    }

    private SpelNode maybeEatBeanReference() {
        if (!check(TokenKind.BEAN_REF) && !check(TokenKind.FACTORY_BEAN_REF)) {
            return null;
        }
        Token marker = advance();
        boolean factoryBean = marker.kind() == TokenKind.FACTORY_BEAN_REF;
        String name;
        if (match(TokenKind.IDENTIFIER)) {
            name = previous().data();
        } else if (match(TokenKind.LITERAL_STRING)) {
            name = unquote(previous().data());
        } else {
            throw error(ParseErrorKind.MISSING_TOKEN, marker.end(),
                    "Expected bean name after '" + marker.kind().tokenChars() + "'");
        }
        return new BeanReference(name, factoryBean, marker.start(), previous().end());
    }

    private SpelNode maybeEatVariableOrFunctionReference() {
        if (!match(TokenKind.HASH)) {
            return null;
        }
        Token hash = previous();
        Token name = consume(TokenKind.IDENTIFIER, "Expected variable name after '#'");
        if (check(TokenKind.LPAREN)) {
            List<SpelNode> arguments = eatMethodArguments();
            return new FunctionReference(name.data(), arguments, hash.start(), previous().end());
        }
        return new VariableReference(name.data(), hash.start(), name.end());
    }

    private SpelNode maybeEatNullReference() {
        if (!peek().isIdentifier(Keywords.NULL)) {
            return null;
        }
        Token token = advance();
        return Literal.ofNull(token.start(), token.end());
    }

    private SpelNode maybeEatTypeReference() {
        Token token = peek();
        if (!token.isIdentifier() || !Keywords.TYPE.equals(token.data()) || !checkNext(TokenKind.LPAREN)) {
            return null;
        }
        int saved = index;
        advance();
        advance();
        QualifiedIdentifier qualifier = maybeEatQualifiedName();
        if (qualifier == null || !check(TokenKind.RPAREN)) {
            index = saved;
            return null;
        }
        Token close = advance();
        return new TypeReference(qualifier.toStringAST(), token.start(), close.end());
    }

    private SpelNode maybeEatConstructorReference() {
        Token newToken = peek();
        if (!newToken.isIdentifier(Keywords.NEW)) {
            return null;
        }
        int saved = index;
        advance();
        QualifiedIdentifier qualifier = maybeEatQualifiedName();
        if (qualifier == null) {
            index = saved;
            return null;
        }
        String typeName = qualifier.toStringAST();

        if (check(TokenKind.LSQUARE)) {
            SpelNode sized = maybeEatArrayConstructorWithSizes(newToken, typeName, qualifier);
            if (sized != null) {
                return sized;
            }
            return eatArrayConstructorWithInitializer(newToken, typeName, qualifier);
        }
        if (check(TokenKind.LPAREN)) {
            List<SpelNode> arguments = eatMethodArguments();
            return new ConstructorReference(typeName, qualifier, arguments, newToken.start(), previous().end());
        }
        index = saved;
        return null;
    }

    /**
     * {@code new T[e1][e2]...} with an optional initializer. Backs out, without consuming
     * anything, when the first dimension is empty.
     */
    private SpelNode maybeEatArrayConstructorWithSizes(Token newToken, String typeName,
                                                        QualifiedIdentifier qualifier) {
        if (checkNext(TokenKind.RSQUARE)) {
            return null;
        }
        StringBuilder dimensions = new StringBuilder();
        boolean sized = true;
        while (match(TokenKind.LSQUARE)) {
            if (match(TokenKind.RSQUARE)) {
                dimensions.append("[]");
                sized = false;
                continue;
            }
            if (!sized) {
                throw error(ParseErrorKind.UNEXPECTED_TOKEN, peek().start(),
                        "Array dimension size cannot follow an unsized dimension");
            }
            SpelNode size = eatExpression();
            consume(TokenKind.RSQUARE, "Expected ']' after array dimension");
            dimensions.append('[').append(size.toStringAST()).append(']');
        }
        InlineList initializer = null;
        if (check(TokenKind.LCURLY)) {
            initializer = eatInlineListBody(advance());
        }
        return new ArrayConstructor(typeName, qualifier, dimensions.toString(), initializer,
                newToken.start(), previous().end());
    }

    /**
     * {@code new T[][]...{elements}}: only empty dimensions, initializer required.
     */
    private SpelNode eatArrayConstructorWithInitializer(Token newToken, String typeName,
                                                        QualifiedIdentifier qualifier) {
        StringBuilder arrayType = new StringBuilder(typeName);
        while (match(TokenKind.LSQUARE)) {
            consume(TokenKind.RSQUARE, "Expected ']' in array type");
            arrayType.append("[]");
        }
        Token open = consume(TokenKind.LCURLY, "Expected '{' to initialize array of type " + arrayType);
        InlineList initializer = eatInlineListBody(open);
        return new ConstructorReference(arrayType.toString(), qualifier, List.of(initializer),
                newToken.start(), previous().end());
    }

    private SpelNode maybeEatInlineCollection() {
        if (!match(TokenKind.LCURLY)) {
            return null;
        }
        Token open = previous();
        if (match(TokenKind.RCURLY)) {
            return new InlineList(List.of(), open.start(), previous().end());
        }
        if (check(TokenKind.COLON) && checkNext(TokenKind.RCURLY)) {
            advance();
            Token close = advance();
            return new InlineMap(List.of(), open.start(), close.end());
        }
        SpelNode first = eatExpression();
        if (!match(TokenKind.COLON)) {
            return finishInlineList(open, first);
        }
        List<InlineMap.Entry> entries = new ArrayList<>();
        entries.add(new InlineMap.Entry(asMapKey(first), eatExpression()));
        while (match(TokenKind.COMMA)) {
            SpelNode key = eatExpression();
            consume(TokenKind.COLON, "Expected ':' after map key");
            entries.add(new InlineMap.Entry(asMapKey(key), eatExpression()));
        }
        Token close = consume(TokenKind.RCURLY, "Expected '}' to close inline map");
        return new InlineMap(entries, open.start(), close.end());
    }

    /**
     * Called with the opening '{' already consumed.
     */
    private InlineList eatInlineListBody(Token open) {
        if (match(TokenKind.RCURLY)) {
            return new InlineList(List.of(), open.start(), previous().end());
        }
        return finishInlineList(open, eatExpression());
    }

    private InlineList finishInlineList(Token open, SpelNode first) {
        List<SpelNode> elements = new ArrayList<>();
        elements.add(first);
        while (match(TokenKind.COMMA)) {
            elements.add(eatExpression());
        }
        Token close = consume(TokenKind.RCURLY, "Expected '}' to close inline list");
        return new InlineList(elements, open.start(), close.end());
    }

    /**
     * A bare name used as a map key is the key text itself, not a property lookup.
     */
    private static SpelNode asMapKey(SpelNode key) {
        if (key instanceof PropertyOrFieldReference ref && ref.direct() && !ref.nullSafe()) {
            return new Identifier(ref.name(), ref.startPosition(), ref.endPosition());
        }
        return key;
    }

    private SpelNode maybeEatMethodReference() {
        Token token = peek();
        if (!token.isIdentifier() || token.isIdentifier(Keywords.NEW) || !checkNext(TokenKind.LPAREN)) {
            return null;
        }
        advance();
        List<SpelNode> arguments = eatMethodArguments();
        return new MethodReference(false, token.data(), arguments, token.start(), previous().end());
    }

    private SpelNode maybeEatPropertyReference() {
        Token token = peek();
        if (!token.isIdentifier() || token.isIdentifier(Keywords.NEW)) {
            return null;
        }
        advance();
        return new PropertyOrFieldReference(false, true, token.data(), token.start(), token.end());
    }

    /**
     * Parenthesized, comma separated arguments. Expects to be positioned on '('.
     */
    private List<SpelNode> eatMethodArguments() {
        consume(TokenKind.LPAREN, "Expected '('");
        List<SpelNode> arguments = new ArrayList<>();
        if (match(TokenKind.RPAREN)) {
            return arguments;
        }
        arguments.add(eatExpression());
        while (match(TokenKind.COMMA)) {
            arguments.add(eatExpression());
        }
        consume(TokenKind.RPAREN, "Expected ')' to close argument list");
        return arguments;
    }

    /**
     * IDENT ('.' IDENT)*, or null without consuming anything when no identifier is next.
     */
    private QualifiedIdentifier maybeEatQualifiedName() {
        if (!check(TokenKind.IDENTIFIER)) {
            return null;
        }
        List<Identifier> parts = new ArrayList<>();
        Token part = advance();
        parts.add(new Identifier(part.data(), part.start(), part.end()));
        while (check(TokenKind.DOT) && checkNext(TokenKind.IDENTIFIER)) {
            advance();
            part = advance();
            parts.add(new Identifier(part.data(), part.start(), part.end()));
        }
        return new QualifiedIdentifier(parts, parts.get(0).startPosition(), part.end());
    }

    // ==================== Literal values ====================

    private static String unquote(String quoted) {
        char quote = quoted.charAt(0);
        String body = quoted.substring(1, quoted.length() - 1);
        String doubled = String.valueOf(quote) + quote;
        return body.replace(doubled, String.valueOf(quote));
    }

    private int parseInt(Token token) {
        try {
            return Integer.parseInt(token.data());
        } catch (NumberFormatException e) {
            throw error(ParseErrorKind.NOT_AN_INTEGER, token.start(),
                    "The value '" + token.data() + "' cannot be parsed as an int", e);
        }
    }

    private long parseLong(Token token) {
        try {
            return Long.parseLong(token.data());
        } catch (NumberFormatException e) {
            throw error(ParseErrorKind.NOT_A_LONG, token.start(),
                    "The value '" + token.data() + "' cannot be parsed as a long", e);
        }
    }

    private int parseHexInt(Token token) {
        BigInteger value = new BigInteger(token.data(), 16);
        if (value.bitLength() > 32) {
            throw error(ParseErrorKind.NOT_AN_INTEGER, token.start(),
                    "The value '0x" + token.data() + "' cannot be parsed as an int");
        }
        return value.intValue();
    }

    private long parseHexLong(Token token) {
        BigInteger value = new BigInteger(token.data(), 16);
        if (value.bitLength() > 64) {
            throw error(ParseErrorKind.NOT_A_LONG, token.start(),
                    "The value '0x" + token.data() + "' cannot be parsed as a long");
        }
        return value.longValue();
    }

    private double parseDouble(Token token) {
        try {
            return Double.parseDouble(token.data());
        } catch (NumberFormatException e) {
            throw error(ParseErrorKind.NOT_A_REAL, token.start(),
                    "The value '" + token.data() + "' cannot be parsed as a double", e);
        }
    }

    private float parseFloat(Token token) {
        try {
            return Float.parseFloat(token.data());
        } catch (NumberFormatException e) {
            throw error(ParseErrorKind.NOT_A_REAL, token.start(),
                    "The value '" + token.data() + "' cannot be parsed as a float", e);
        }
    }

    // ==================== Token cursor ====================

    private boolean match(TokenKind kind) {
        if (check(kind)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String word) {
        if (!isAtEnd() && peek().isIdentifier(word)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenKind kind, String message) {
        if (check(kind)) {
            return advance();
        }
        if (isAtEnd()) {
            int position = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).end();
            throw error(ParseErrorKind.MISSING_TOKEN, position, message + " but reached end of expression");
        }
        Token found = peek();
        throw error(ParseErrorKind.UNEXPECTED_TOKEN, found.start(), message + " but found " + describe(found));
    }

    private boolean check(TokenKind kind) {
        return !isAtEnd() && peek().kind() == kind;
    }

    private boolean checkNext(TokenKind kind) {
        return index + 1 < tokens.size() && tokens.get(index + 1).kind() == kind;
    }

    private Token advance() {
        return tokens.get(index++);
    }

    private boolean isAtEnd() {
        return index >= tokens.size();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private static String describe(Token token) {
        if (token.data() != null) {
            return "'" + token.data() + "'";
        }
        return "'" + token.kind().tokenChars() + "'";
    }

    private ParseException error(ParseErrorKind kind, int position, String message) {
        return new ParseException(kind, input, position, message);
    }

    private ParseException error(ParseErrorKind kind, int position, String message, Throwable cause) {
        return new ParseException(kind, input, position, message, cause);
    }
}
