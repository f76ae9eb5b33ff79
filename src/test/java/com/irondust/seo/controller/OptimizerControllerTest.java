package com.irondust.seo.controller;

import com.irondust.seo.Fixtures;
import com.irondust.seo.MutableClock;
import com.irondust.seo.admin.SessionRegistry;
import com.irondust.seo.config.AppProperties;
import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.dto.OptimizerDtos;
import com.irondust.seo.model.DetectionReport;
import com.irondust.seo.model.TerminationReason;
import com.irondust.seo.model.ValidationResult;
import com.irondust.seo.service.IssueDetector;
import com.irondust.seo.service.MultiPassOptimizer;
import com.irondust.seo.service.OptimizationReport;
import com.irondust.seo.service.cache.InMemoryKeyValueStore;
import com.irondust.seo.service.cache.ValidationCache;
import com.irondust.seo.service.correction.CorrectionPromptGenerator;
import com.irondust.seo.service.correction.TitleUniquenessChecker;
import com.irondust.seo.service.error.SeoErrorHandler;
import com.irondust.seo.service.pipeline.ValidationPipeline;
import com.irondust.seo.service.retry.RecordingSleeper;
import com.irondust.seo.service.retry.RetryManager;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class OptimizerControllerTest {

    private final MutableClock clock = new MutableClock();
    private final OptimizerProperties props = new OptimizerProperties();
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);
    private final ValidationCache cache = new ValidationCache(props, store, clock);
    private final SeoErrorHandler errorHandler = new SeoErrorHandler(props, store, clock);
    private final SessionRegistry registry = new SessionRegistry(new AppProperties());

    private OptimizerController controller() {
        ValidationPipeline pipeline = new ValidationPipeline(props, cache, errorHandler,
                new TitleUniquenessChecker(store, cache), clock);
        IssueDetector detector = new IssueDetector(props);
        RetryManager retryManager = new RetryManager(props, cache, store, errorHandler, new RecordingSleeper(), clock);
        MultiPassOptimizer optimizer = new MultiPassOptimizer(props, pipeline, detector, cache, retryManager,
                errorHandler, new CorrectionPromptGenerator(props), registry, clock);
        return new OptimizerController(optimizer, pipeline, detector, registry);
    }

    private static OptimizerDtos.OptimizeRequest request() {
        OptimizerDtos.OptimizeRequest body = new OptimizerDtos.OptimizeRequest();
        body.setContent(Fixtures.compliantContent());
        return body;
    }

    @Test
    public void optimize_registersSession() {
        OptimizerController c = controller();

        OptimizationReport report = c.optimize(request()).block().getBody();

        assertEquals(TerminationReason.INITIAL_COMPLIANCE, report.optimizationSummary.terminationReason);
        ResponseEntity<SessionRegistry.SessionInfo> found = c.session(report.sessionId).block();
        assertEquals(200, found.getStatusCode().value());
        assertEquals(Fixtures.KEYWORD, found.getBody().focusKeyword);
        assertEquals(1, ((List<?>) c.sessions(20).block().getBody().get("sessions")).size());
    }

    @Test
    public void unknownSession_isNotFound() {
        assertEquals(404, controller().session("opt_missing").block().getStatusCode().value());
    }

    @Test
    public void issues_fallBackToContentKeywords() {
        OptimizerDtos.OptimizeRequest body = request();
        body.getContent().setMetaDescription("Too short.");

        DetectionReport r = controller().issues(body).block().getBody();

        assertTrue(r.issueTypeCodes().contains("meta_description_short"));
        assertTrue(r.issueTypeCodes().contains("meta_description_no_keyword"));
    }

    @Test
    public void validate_returnsCorrectedContent() {
        OptimizerDtos.OptimizeRequest body = request();
        body.setFocusKeyword(Fixtures.KEYWORD);
        body.getContent().setMetaDescription("Too short.");

        ValidationResult r = controller().validate(body).block().getBody();

        assertTrue(r.getCorrectionsMade().contains("meta_description"));
        assertTrue(r.getCorrectedContent().getMetaDescription().length() >= 120);
    }

    @Test
    public void sessions_limitIsAtLeastOne() {
        Map<String, Object> body = controller().sessions(0).block().getBody();
        assertTrue(((List<?>) body.get("sessions")).isEmpty());
    }
}
