package com.spel.config;

import com.spel.exception.ConfigurationException;

/**
 * Parser and evaluation settings. Immutable.
 *
 * @param maximumExpressionLength Longest accepted source, checked before tokenizing
 * @param autoGrowCollections     Whether indexing past the end of a list may grow it
 * @param autoGrowNullReferences  Whether null intermediate references may be auto-created
 * @param templatePrefix          Prefix opening an embedded expression in template mode
 * @param templateSuffix          Suffix closing an embedded expression in template mode
 */
public record ParserConfiguration(
        int maximumExpressionLength,
        boolean autoGrowCollections,
        boolean autoGrowNullReferences,
        String templatePrefix,
        String templateSuffix
) {

    public static final int DEFAULT_MAX_EXPRESSION_LENGTH = 10_000;

    public ParserConfiguration {
        if (maximumExpressionLength <= 0) {
            throw new ConfigurationException("maximum-expression-length must be positive, got "
                    + maximumExpressionLength);
        }
        if (templatePrefix == null || templatePrefix.isEmpty()) {
            throw new ConfigurationException("template prefix must not be empty");
        }
        if (templateSuffix == null || templateSuffix.isEmpty()) {
            throw new ConfigurationException("template suffix must not be empty");
        }
    }

    public static ParserConfiguration defaults() {
        return new ParserConfiguration(DEFAULT_MAX_EXPRESSION_LENGTH, false, false,
                ParserContext.DEFAULT_PREFIX, ParserContext.DEFAULT_SUFFIX);
    }

    public ParserConfiguration withMaximumExpressionLength(int length) {
        return new ParserConfiguration(length, autoGrowCollections, autoGrowNullReferences,
                templatePrefix, templateSuffix);
    }

    /**
     * Template context using this configuration's delimiters.
     */
    public ParserContext templateContext() {
        return ParserContext.template(templatePrefix, templateSuffix);
    }
}
