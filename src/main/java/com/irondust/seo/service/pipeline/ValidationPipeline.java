package com.irondust.seo.service.pipeline;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.DegradationLevel;
import com.irondust.seo.model.ValidationMessage;
import com.irondust.seo.model.ValidationResult;
import com.irondust.seo.service.cache.CacheTier;
import com.irondust.seo.service.cache.ValidationCache;
import com.irondust.seo.service.correction.CorrectionOptions;
import com.irondust.seo.service.correction.TitleUniquenessChecker;
import com.irondust.seo.service.error.SeoErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Runs content through the ordered validation steps, correcting each failing
 * aspect before moving on, then re-validates everything on the fully corrected
 * content. A step that throws is reported as an error for its component and
 * does not stop the remaining steps.
 */
@Service
public class ValidationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ValidationPipeline.class);

    static final String PIPELINE_COMPONENT = "pipeline";
    static final String ERROR_PREFIX = "Validation pipeline error: ";

    private final OptimizerProperties properties;
    private final ValidationCache cache;
    private final SeoErrorHandler errorHandler;
    private final List<ValidationStep> steps;
    private final Clock clock;

    @Autowired
    public ValidationPipeline(OptimizerProperties properties, ValidationCache cache, SeoErrorHandler errorHandler,
                              TitleUniquenessChecker titleUniquenessChecker, Clock clock) {
        this(properties, cache, errorHandler, List.of(
                new MetaDescriptionStep(properties),
                new KeywordDensityStep(properties),
                new ReadabilityStep(properties),
                new TitleStep(properties, titleUniquenessChecker),
                new ImageStep(properties)), clock);
    }

    public ValidationPipeline(OptimizerProperties properties, ValidationCache cache, SeoErrorHandler errorHandler,
                              List<ValidationStep> steps, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.cache = cache;
        this.errorHandler = errorHandler;
        this.steps = List.copyOf(steps);
    }

    public List<ValidationStep> getSteps() {
        return steps;
    }

    /**
     * Validates and, when auto-correction is on, corrects the content. Keywords
     * default to the ones carried by the content.
     */
    public ValidationResult validateAndCorrect(Content content, String focusKeyword, List<String> secondaryKeywords) {
        String keyword = focusKeyword != null ? focusKeyword : content.getFocusKeyword();
        List<String> secondary = secondaryKeywords != null ? secondaryKeywords : content.getSecondaryKeywords();
        String[] parts = resultKey("result", content, keyword, secondary);
        Optional<ValidationResult> cached = cache.get(CacheTier.VALIDATION, ValidationResult.class, parts);
        if (cached.isPresent()) {
            log.debug("Validation cache hit for '{}'", content.getTitle());
            return cached.get();
        }

        ValidationResult result = new ValidationResult(true, clock);
        Content current = content.copy();
        try {
            Map<String, String> faults = new LinkedHashMap<>();
            List<String> corrections = new ArrayList<>();
            CorrectionOptions options = new CorrectionOptions(properties.getThresholds(),
                    new Random(properties.getRandomSeed() ^ parts[1].hashCode()));

            for (ValidationStep step : steps) {
                try {
                    StepOutcome outcome = validateStep(step, current, keyword, secondary);
                    if (!outcome.isValid() && properties.isAutoCorrection()) {
                        Content corrected = step.correct(current, keyword, secondary, options);
                        if (step.hasChanged(current, corrected, keyword, secondary)) {
                            corrections.add(step.getComponent());
                            log.debug("Corrected {} for '{}'", step.getComponent(), content.getTitle());
                        }
                        current = corrected;
                    }
                } catch (RuntimeException e) {
                    log.error("Error applying {} to content '{}': {}", step.getComponent(), content.getTitle(), e.getMessage());
                    faults.put(step.getComponent(), String.valueOf(e.getMessage()));
                }
            }

            boolean allValid = finalValidation(result, current, keyword, secondary, faults);
            result.setValid(allValid && result.getErrors().isEmpty());
            result.setCorrectedContent(current);
            result.setCorrectionsMade(corrections);
            result.calculateScore();
            logFailures(result, content);
            if (faults.isEmpty()) {
                cache.set(CacheTier.VALIDATION, result, parts);
            }
        } catch (RuntimeException e) {
            log.error("Error applying {} to content '{}': {}", PIPELINE_COMPONENT, content.getTitle(), e.getMessage());
            result.addError(ERROR_PREFIX + e.getMessage(), PIPELINE_COMPONENT);
            errorHandler.logValidationFailure(PIPELINE_COMPONENT, String.valueOf(e.getMessage()),
                    Map.of("content_title", String.valueOf(content.getTitle()), "focus_keyword", String.valueOf(keyword)),
                    "error");
            result.setCorrectedContent(current);
            result.calculateScore();
        }
        return result;
    }

    /**
     * Validates without correcting. The returned result carries an unchanged
     * copy of the content.
     */
    public ValidationResult validate(Content content, String focusKeyword, List<String> secondaryKeywords) {
        String keyword = focusKeyword != null ? focusKeyword : content.getFocusKeyword();
        List<String> secondary = secondaryKeywords != null ? secondaryKeywords : content.getSecondaryKeywords();
        String[] parts = resultKey("check", content, keyword, secondary);
        Optional<ValidationResult> cached = cache.get(CacheTier.VALIDATION, ValidationResult.class, parts);
        if (cached.isPresent()) return cached.get();

        ValidationResult result = new ValidationResult(true, clock);
        Map<String, String> faults = new LinkedHashMap<>();
        boolean allValid = finalValidation(result, content, keyword, secondary, faults);
        result.setValid(allValid && result.getErrors().isEmpty());
        result.setCorrectedContent(content.copy());
        result.calculateScore();
        if (faults.isEmpty()) {
            cache.set(CacheTier.VALIDATION, result, parts);
        }
        return result;
    }

    private String[] resultKey(String kind, Content content, String keyword, List<String> secondary) {
        return new String[]{kind, cache.contentHash(content), cache.contentStateHash(content), cache.configHash(),
                cache.keywordHash(keyword, secondary)};
    }

    /**
     * Re-runs every step and folds the outcomes into {@code result}. Faults from
     * this pass are merged into {@code faults}; each faulted component gets one
     * error no matter how many times it failed.
     *
     * @return true when every step that ran was valid
     */
    private boolean finalValidation(ValidationResult result, Content content, String keyword, List<String> secondary,
                                    Map<String, String> faults) {
        boolean allValid = true;
        for (ValidationStep step : steps) {
            String component = step.getComponent();
            try {
                StepOutcome o = validateStep(step, content, keyword, secondary);
                o.getErrors().forEach(m -> result.addError(m, component));
                o.getWarnings().forEach(m -> result.addWarning(m, component));
                o.getSuggestions().forEach(m -> result.addSuggestion(m, component));
                result.getMetrics().put(component, new LinkedHashMap<>(o.getMetrics()));
                allValid &= o.isValid();
            } catch (RuntimeException e) {
                log.error("Error applying {} to content '{}': {}", component, content.getTitle(), e.getMessage());
                faults.putIfAbsent(component, String.valueOf(e.getMessage()));
                allValid = false;
            }
        }
        for (Map.Entry<String, String> f : faults.entrySet()) {
            result.addError(ERROR_PREFIX + f.getValue(), f.getKey());
        }
        if (!faults.isEmpty()) {
            int failed = faults.size();
            DegradationLevel level = errorHandler.applyGracefulDegradation("validation", steps.size() - failed, failed);
            result.setDegradationLevel(level != null ? level : DegradationLevel.fromCounts(steps.size() - failed, failed));
        }
        return allValid;
    }

    private StepOutcome validateStep(ValidationStep step, Content content, String keyword, List<String> secondary) {
        String fingerprint = step.fingerprint(content);
        if (fingerprint == null) {
            return step.validate(content, keyword, secondary);
        }
        return cache.computeIfAbsent(step.cacheTier(), StepOutcome.class,
                () -> step.validate(content, keyword, secondary),
                step.getComponent(), fingerprint, cache.configHash(), cache.keywordHash(keyword, secondary));
    }

    private void logFailures(ValidationResult result, Content content) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("validation_step", "component_validation");
        ctx.put("auto_correction", properties.isAutoCorrection());
        ctx.put("content_title", String.valueOf(content.getTitle()));
        for (ValidationMessage m : result.getErrors()) {
            errorHandler.logValidationFailure(m.getComponent(), m.getMessage(), ctx, "error");
        }
        for (ValidationMessage m : result.getWarnings()) {
            errorHandler.logValidationFailure(m.getComponent(), m.getMessage(), ctx, "warning");
        }
    }
}
