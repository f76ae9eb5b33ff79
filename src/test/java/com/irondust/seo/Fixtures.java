package com.irondust.seo;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.ImagePrompt;
import com.irondust.seo.service.cache.InMemoryKeyValueStore;
import com.irondust.seo.service.cache.KeyValueStore;
import com.irondust.seo.service.cache.ValidationCache;
import com.irondust.seo.service.correction.TitleUniquenessChecker;
import com.irondust.seo.service.error.SeoErrorHandler;
import com.irondust.seo.service.pipeline.ValidationPipeline;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/** Shared content samples and wiring for service tests. */
public final class Fixtures {
    private Fixtures() {}

    public static final String KEYWORD = "protein powder";

    public static final String TITLE = "Protein Powder Guide for Busy Athletes";

    public static final String META = "Learn how protein powder supports recovery, which type suits your training, "
            + "and how to use it every day for steady results at home.";

    public static final String BODY = "<h2>Why protein powder helps recovery</h2>"
            + "<p>Protein powder gives your muscles the amino acids they need after hard training. "
            + "Additionally, a single scoop adds about twenty grams of protein to a shake. "
            + "Most athletes mix it with water or milk right after a workout. "
            + "However, timing matters less than your total daily intake. "
            + "Therefore, aim for steady protein across all your meals.</p>"
            + "<h2>Choosing the right type</h2>"
            + "<p>Whey digests quickly and suits morning shakes. "
            + "Casein digests slowly, so many people drink it before bed. "
            + "Plant blends offer a good option for vegan diets. "
            + "For example, pea and rice protein together cover the essential amino acids. "
            + "Check the label for added sugar and fillers.</p>"
            + "<h2>How to use it every day</h2>"
            + "<p>Start with one scoop per day and track how you feel. "
            + "Next, blend it into oatmeal, yogurt or pancakes for variety. "
            + "Drink plenty of water throughout the day. "
            + "Finally, pair protein powder with whole foods rather than replacing full meals.</p>";

    /** Passes every default threshold; scores 100 in both the detector and the pipeline. */
    public static Content compliantContent() {
        Content c = new Content(TITLE, BODY, META);
        c.setFocusKeyword(KEYWORD);
        c.setSecondaryKeywords(new ArrayList<>());
        List<ImagePrompt> images = new ArrayList<>();
        images.add(new ImagePrompt("Scoop of whey next to a shaker bottle", "Scoop of protein powder next to a shaker bottle"));
        c.setImagePrompts(images);
        return c;
    }

    /** Over 200 words with a single mention of the keyword, below the minimum density. */
    public static Content lowDensityContent() {
        Content c = compliantContent();
        c.setBody(BODY.replace("Why protein powder helps recovery", "Why a daily shake helps recovery")
                .replace("Protein powder gives", "A good supplement gives")
                + "<p>Many brands sell tubs in several sizes. Compare the price per serving before you buy. "
                + "Also, read reviews from other athletes. Still, your own taste decides what you enjoy. "
                + "Keep the tub sealed and dry after each use. Then store it away from heat and light. "
                + "Besides flavor, look at how well the powder mixes in cold water. "
                + "Finally, buy a small tub first so you can test it.</p>");
        return c;
    }

    public static ValidationPipeline pipeline(OptimizerProperties props, KeyValueStore store, Clock clock) {
        ValidationCache cache = new ValidationCache(props, store, clock);
        SeoErrorHandler errorHandler = new SeoErrorHandler(props, store, clock);
        return new ValidationPipeline(props, cache, errorHandler, new TitleUniquenessChecker(store, cache), clock);
    }

    public static ValidationPipeline pipeline(OptimizerProperties props, Clock clock) {
        return pipeline(props, new InMemoryKeyValueStore(clock), clock);
    }
}
