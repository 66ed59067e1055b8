package com.spel.config;

/**
 * Tells the parser whether the source is a plain expression or a template
 * mixing literal text with delimited expressions.
 *
 * @param template         Whether the source is a template
 * @param expressionPrefix Opening delimiter of an embedded expression
 * @param expressionSuffix Closing delimiter of an embedded expression
 */
public record ParserContext(boolean template, String expressionPrefix, String expressionSuffix) {

    public static final String DEFAULT_PREFIX = "#{";
    public static final String DEFAULT_SUFFIX = "}";

    public static final ParserContext STANDARD = new ParserContext(false, DEFAULT_PREFIX, DEFAULT_SUFFIX);

    public static final ParserContext TEMPLATE = new ParserContext(true, DEFAULT_PREFIX, DEFAULT_SUFFIX);

    public static ParserContext template(String prefix, String suffix) {
        return new ParserContext(true, prefix, suffix);
    }
}
