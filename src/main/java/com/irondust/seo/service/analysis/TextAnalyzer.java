package com.irondust.seo.service.analysis;

/**
 * Measures one readability aspect of plain or marked-up text.
 *
 * @param <M> metrics produced by the analyzer
 */
public interface TextAnalyzer<M> {

    M analyze(String text);

    default String getName() {
        return this.getClass().getSimpleName();
    }
}
