package com.irondust.seo.service.correction;

import com.irondust.seo.model.Content;

import java.util.List;

/**
 * Rewrites one aspect of a piece of content.
 *
 * <p>Implementations must not modify {@code content}; they return a corrected
 * copy, or an unchanged copy when there is nothing they can do.
 */
public interface Corrector {

    /** Pipeline component this corrector serves, e.g. {@code meta_description}. */
    String getComponent();

    Content correct(Content content, String focusKeyword, List<String> secondaryKeywords, CorrectionOptions options);
}
