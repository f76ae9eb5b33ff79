package com.irondust.seo.service.correction;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MetaDescriptionCorrectorTest {
    private static final String KEYWORD = "protein powder";
    private final MetaDescriptionCorrector corrector = new MetaDescriptionCorrector();

    @Test
    public void longDescription_isCutAtSentenceKeepingKeyword() {
        String first = "Protein powder supports recovery after hard training sessions and helps you reach "
                + "your daily protein target without extra cooking.";
        String in = first + " It also mixes well with milk, water, oats and yogurt for quick snacks.";

        assertEquals(first, corrector.correctDescription(in, KEYWORD, 120, 156));
    }

    @Test
    public void shortDescription_getsKeywordAfterArticleThenExpanded() {
        String out = corrector.correctDescription("The right supplement helps you recover faster after training.",
                KEYWORD, 120, 156);

        assertTrue(out.startsWith("The protein powder right supplement"));
        assertTrue(out.endsWith("Learn more about protein powder and how it can benefit you."));
        assertTrue(out.length() >= 120 && out.length() <= 156, out);
    }

    @Test
    public void emptyDescription_usesKeywordFallback() {
        String out = corrector.correctDescription("  ", KEYWORD, 120, 156);
        assertEquals(120, out.length());
        assertTrue(out.contains(KEYWORD));
    }

    @Test
    public void compliantDescription_isUntouched() {
        String ok = "Protein powder supports recovery after hard training sessions and helps you reach "
                + "your daily protein target without extra cooking.";
        assertEquals(ok, corrector.correctDescription(ok, KEYWORD, 120, 156));
    }
}
