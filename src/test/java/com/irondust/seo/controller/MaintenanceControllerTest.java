package com.irondust.seo.controller;

import com.irondust.seo.Fixtures;
import com.irondust.seo.MutableClock;
import com.irondust.seo.config.AppProperties;
import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.dto.OptimizerDtos;
import com.irondust.seo.service.IssueDetector;
import com.irondust.seo.service.cache.InMemoryKeyValueStore;
import com.irondust.seo.service.cache.ValidationCache;
import com.irondust.seo.service.correction.TitleUniquenessChecker;
import com.irondust.seo.service.error.SeoErrorHandler;
import com.irondust.seo.service.retry.RecordingSleeper;
import com.irondust.seo.service.retry.RetryManager;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MaintenanceControllerTest {

    private final MutableClock clock = new MutableClock();
    private final OptimizerProperties props = new OptimizerProperties();
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);
    private final ValidationCache cache = new ValidationCache(props, store, clock);
    private final SeoErrorHandler errorHandler = new SeoErrorHandler(props, store, clock);
    private final TitleUniquenessChecker titles = new TitleUniquenessChecker(store, cache);

    private MaintenanceController controller() {
        AppProperties app = new AppProperties();
        app.setAdminKey("secret");
        RetryManager retryManager = new RetryManager(props, cache, store, errorHandler, new RecordingSleeper(), clock);
        return new MaintenanceController(cache, new IssueDetector(props), retryManager, errorHandler, titles, app);
    }

    @Test
    public void adminEndpoints_requireKey() {
        MaintenanceController c = controller();
        OptimizerDtos.TitlesRequest body = new OptimizerDtos.TitlesRequest();
        body.setTitles(List.of("Whey Basics"));

        assertEquals(401, c.clearCache(null).block().getStatusCode().value());
        assertEquals(401, c.clearCache("wrong").block().getStatusCode().value());
        assertEquals(401, c.errors(null, 10, null).block().getStatusCode().value());
        assertEquals(401, c.errorReport("", 10).block().getStatusCode().value());
        assertEquals(401, c.registerTitles(null, body).block().getStatusCode().value());
        assertTrue(titles.registeredTitles().isEmpty());
    }

    @Test
    public void registerTitles_storesNormalizedTitles() {
        OptimizerDtos.TitlesRequest body = new OptimizerDtos.TitlesRequest();
        body.setTitles(List.of("Whey Basics!", "whey basics", "Creatine 101"));

        ResponseEntity<Map<String, Object>> r = controller().registerTitles("secret", body).block();

        assertEquals(200, r.getStatusCode().value());
        assertEquals(2, r.getBody().get("registered"));
        assertTrue(titles.registeredTitles().contains("whey basics"));
    }

    @Test
    public void warmUpAndClear_workWithKey() {
        MaintenanceController c = controller();
        OptimizerDtos.WarmUpRequest body = new OptimizerDtos.WarmUpRequest();
        body.setContents(List.of(Fixtures.compliantContent(), Fixtures.lowDensityContent()));

        ResponseEntity<Map<String, Object>> warmed = c.warmUp("secret", body).block();
        assertEquals(2, warmed.getBody().get("processed"));
        assertEquals(2, c.cacheStats().block().getBody().getSets());

        assertEquals(200, c.clearCache("secret").block().getStatusCode().value());
        assertEquals(0, c.cacheStats().block().getBody().getMemoryCacheSize());
    }

    @Test
    public void errors_listLoggedFailures() {
        errorHandler.logValidationFailure("title", "Title too long");
        MaintenanceController c = controller();

        Map<String, Object> body = c.errors("secret", 10, "title").block().getBody();
        assertEquals(1, ((List<?>) body.get("errors")).size());
        assertEquals(1, ((List<?>) body.get("stats")).size());
        assertEquals("1 recoverable error(s) detected", c.errorReport("secret", 10).block().getBody().summary);
        assertEquals(0, c.retryStats().block().getBody().totalRetries);
    }
}
