package com.spel.config.expression;

import com.spel.exception.ParseErrorKind;
import com.spel.exception.ParseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.spel.config.expression.ExpressionConfig.*;

/**
 * Tokenizer for expressions.
 * Converts the input string into a sequence of tokens in a single left-to-right pass.
 * A new instance is needed per input.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final char[] chars;
    private final int max;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.chars = (input + Operators.SENTINEL).toCharArray();
        this.max = chars.length;
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, in source order
     * @throws ParseException on any lexical error
     */
    public List<Token> tokenize() {
        while (pos < max) {
            char c = chars[pos];

            if (Character.isLetter(c)) {
                lexIdentifier();
                continue;
            }

            switch (c) {
                case Operators.PLUS -> pushOneOrTwo(TokenKind.INC, TokenKind.PLUS);
                case Operators.MINUS -> pushOneOrTwo(TokenKind.DEC, TokenKind.MINUS);
                case Operators.UNDERSCORE -> lexIdentifier();
                case Operators.COLON -> pushCharToken(TokenKind.COLON);
                case Operators.DOT -> pushCharToken(TokenKind.DOT);
                case Operators.COMMA -> pushCharToken(TokenKind.COMMA);
                case Operators.STAR -> pushCharToken(TokenKind.STAR);
                case Operators.SLASH -> pushCharToken(TokenKind.DIV);
                case Operators.PERCENT -> pushCharToken(TokenKind.MOD);
                case Operators.LEFT_PAREN -> pushCharToken(TokenKind.LPAREN);
                case Operators.RIGHT_PAREN -> pushCharToken(TokenKind.RPAREN);
                case Operators.LEFT_BRACKET -> pushCharToken(TokenKind.LSQUARE);
                case Operators.RIGHT_BRACKET -> pushCharToken(TokenKind.RSQUARE);
                case Operators.LEFT_BRACE -> pushCharToken(TokenKind.LCURLY);
                case Operators.RIGHT_BRACE -> pushCharToken(TokenKind.RCURLY);
                case Operators.HASH -> pushCharToken(TokenKind.HASH);
                case Operators.AT -> pushCharToken(TokenKind.BEAN_REF);
                case Operators.CARET -> pushOneOrTwo(TokenKind.SELECT_FIRST, TokenKind.POWER);
                case Operators.BANG -> {
                    if (isTwoCharToken(TokenKind.NE)) {
                        pushPairToken(TokenKind.NE);
                    } else if (isTwoCharToken(TokenKind.PROJECT)) {
                        pushPairToken(TokenKind.PROJECT);
                    } else {
                        pushCharToken(TokenKind.NOT);
                    }
                }
                case Operators.EQUALS -> pushOneOrTwo(TokenKind.EQ, TokenKind.ASSIGN);
                case Operators.AMPERSAND -> pushOneOrTwo(TokenKind.SYMBOLIC_AND, TokenKind.FACTORY_BEAN_REF);
                case Operators.PIPE -> {
                    if (!isTwoCharToken(TokenKind.SYMBOLIC_OR)) {
                        throw error(ParseErrorKind.MISSING_CHARACTER, pos, "Missing character '|' after '|'");
                    }
                    pushPairToken(TokenKind.SYMBOLIC_OR);
                }
                case Operators.QUESTION -> {
                    if (isTwoCharToken(TokenKind.SELECT)) {
                        pushPairToken(TokenKind.SELECT);
                    } else if (isTwoCharToken(TokenKind.ELVIS)) {
                        pushPairToken(TokenKind.ELVIS);
                    } else if (isTwoCharToken(TokenKind.SAFE_NAVI)) {
                        pushPairToken(TokenKind.SAFE_NAVI);
                    } else {
                        pushCharToken(TokenKind.QMARK);
                    }
                }
                case Operators.DOLLAR -> {
                    if (isTwoCharToken(TokenKind.SELECT_LAST)) {
                        pushPairToken(TokenKind.SELECT_LAST);
                    } else {
                        lexIdentifier();
                    }
                }
                case Operators.GREATER -> pushOneOrTwo(TokenKind.GE, TokenKind.GT);
                case Operators.LESS -> pushOneOrTwo(TokenKind.LE, TokenKind.LT);
                case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> lexNumericLiteral(c == '0');
                case ' ', '\t', '\r', '\n' -> pos++;
                case Operators.QUOTE_SINGLE -> lexQuotedString(Operators.QUOTE_SINGLE,
                        ParseErrorKind.NON_TERMINATING_QUOTED_STRING);
                case Operators.QUOTE_DOUBLE -> lexQuotedString(Operators.QUOTE_DOUBLE,
                        ParseErrorKind.NON_TERMINATING_DOUBLE_QUOTED_STRING);
                case Operators.SENTINEL -> {
                    if (!isExhausted()) {
                        throw error(ParseErrorKind.UNSUPPORTED_CHARACTER, pos,
                                "Unsupported character '\\0' (0)");
                    }
                    pos++;
                }
                case Operators.BACKSLASH -> throw error(ParseErrorKind.UNEXPECTED_ESCAPE_CHAR, pos,
                        "Unexpected escape character '\\'");
                default -> throw error(ParseErrorKind.UNSUPPORTED_CHARACTER, pos + 1,
                        "Unsupported character '" + c + "' (" + (int) c + ")");
            }
        }
        return tokens;
    }

    /**
     * Quoted strings keep their quotes in the token data. A doubled quote
     * character inside the literal is an escaped quote.
     */
    private void lexQuotedString(char quote, ParseErrorKind unterminated) {
        int start = pos;
        boolean terminated = false;
        while (!terminated) {
            pos++;
            if (isExhausted()) {
                throw error(unterminated, start, "Non-terminating string literal");
            }
            if (chars[pos] == quote) {
                if (chars[pos + 1] == quote) {
                    pos++;
                } else {
                    terminated = true;
                }
            }
        }
        pos++;
        tokens.add(new Token(TokenKind.LITERAL_STRING, subarray(start, pos), start, pos));
    }

    private void lexNumericLiteral(boolean firstCharIsZero) {
        int start = pos;

        if (firstCharIsZero && (chars[pos + 1] == 'x' || chars[pos + 1] == 'X')) {
            pos += 2;
            int hexStart = pos;
            while (isHexDigit(chars[pos])) {
                pos++;
            }
            boolean isLong = isChar('L', 'l');
            String data = subarray(hexStart, pos);
            if (data.isEmpty()) {
                ParseErrorKind kind = isLong ? ParseErrorKind.NOT_A_LONG : ParseErrorKind.NOT_AN_INTEGER;
                throw error(kind, start, "Hexadecimal literal '" + subarray(start, isLong ? pos + 1 : pos)
                        + "' has no digits");
            }
            if (isLong) {
                pos++;
                tokens.add(new Token(TokenKind.LITERAL_HEXLONG, data, start, pos));
            } else {
                tokens.add(new Token(TokenKind.LITERAL_HEXINT, data, start, pos));
            }
            return;
        }

        boolean isReal = false;
        while (isDigit(chars[pos])) {
            pos++;
        }

        if (chars[pos] == Operators.DOT) {
            int dotPos = pos;
            pos++;
            while (isDigit(chars[pos])) {
                pos++;
            }
            if (pos == dotPos + 1) {
                // "3.foo" is an int followed by a dot
                pos = dotPos;
                tokens.add(new Token(TokenKind.LITERAL_INT, subarray(start, pos), start, pos));
                return;
            }
            isReal = true;
        }

        int endOfNumber = pos;

        if (isChar('L', 'l')) {
            if (isReal) {
                throw error(ParseErrorKind.REAL_CANNOT_BE_LONG, start,
                        "Real number '" + subarray(start, pos + 1) + "' cannot be suffixed with a long 'L'");
            }
            pos++;
            tokens.add(new Token(TokenKind.LITERAL_LONG, subarray(start, endOfNumber), start, pos));
            return;
        }

        if (chars[pos] == 'e' || chars[pos] == 'E') {
            isReal = true;
            pos++;
            if (chars[pos] == Operators.PLUS || chars[pos] == Operators.MINUS) {
                pos++;
            }
            while (isDigit(chars[pos])) {
                pos++;
            }
            endOfNumber = pos;
        }

        if (isChar('F', 'f')) {
            pos++;
            tokens.add(new Token(TokenKind.LITERAL_REAL_FLOAT, subarray(start, endOfNumber), start, pos));
        } else if (isChar('D', 'd')) {
            pos++;
            tokens.add(new Token(TokenKind.LITERAL_REAL, subarray(start, endOfNumber), start, pos));
        } else if (isReal) {
            tokens.add(new Token(TokenKind.LITERAL_REAL, subarray(start, endOfNumber), start, pos));
        } else {
            tokens.add(new Token(TokenKind.LITERAL_INT, subarray(start, endOfNumber), start, pos));
        }
    }

    private void lexIdentifier() {
        int start = pos;
        do {
            pos++;
        } while (isIdentifierPart(chars[pos]));

        String text = subarray(start, pos);

        // Textual operator aliases such as 'div' or 'NE'
        if (text.length() >= 2 && text.length() <= 7) {
            String upper = text.toUpperCase();
            if (Arrays.binarySearch(ALTERNATIVE_OPERATOR_NAMES, upper) >= 0) {
                tokens.add(new Token(ALTERNATIVE_OPERATORS.get(upper), text, start, pos));
                return;
            }
        }

        tokens.add(new Token(TokenKind.IDENTIFIER, text, start, pos));
    }

    private void pushOneOrTwo(TokenKind twoChar, TokenKind oneChar) {
        if (isTwoCharToken(twoChar)) {
            pushPairToken(twoChar);
        } else {
            pushCharToken(oneChar);
        }
    }

    private boolean isTwoCharToken(TokenKind kind) {
        String tokenChars = kind.tokenChars();
        return tokenChars.length() == 2
                && chars[pos] == tokenChars.charAt(0)
                && chars[pos + 1] == tokenChars.charAt(1);
    }

    private void pushCharToken(TokenKind kind) {
        tokens.add(new Token(kind, pos, pos + 1));
        pos++;
    }

    private void pushPairToken(TokenKind kind) {
        tokens.add(new Token(kind, pos, pos + 2));
        pos += 2;
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.UNDERSCORE || c == Operators.DOLLAR;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isChar(char a, char b) {
        char c = chars[pos];
        return c == a || c == b;
    }

    private boolean isExhausted() {
        return pos == max - 1;
    }

    private String subarray(int start, int end) {
        return new String(chars, start, Math.min(end, max - 1) - start);
    }

    private ParseException error(ParseErrorKind kind, int position, String message) {
        return new ParseException(kind, input, position, message);
    }
}
