package com.irondust.seo.controller;

import com.irondust.seo.config.AppProperties;
import com.irondust.seo.dto.OptimizerDtos;
import com.irondust.seo.service.IssueDetector;
import com.irondust.seo.service.cache.CacheStats;
import com.irondust.seo.service.cache.ValidationCache;
import com.irondust.seo.service.correction.TitleUniquenessChecker;
import com.irondust.seo.service.error.ErrorReport;
import com.irondust.seo.service.error.SeoErrorHandler;
import com.irondust.seo.service.retry.RetryManager;
import com.irondust.seo.service.retry.RetryStats;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Cache, retry, error-log and title-registry endpoints. Mutating and
 * error-log endpoints require the {@code x-admin-key} header.
 */
@RestController
@RequestMapping("/seo")
public class MaintenanceController {
    private final ValidationCache cache;
    private final IssueDetector issueDetector;
    private final RetryManager retryManager;
    private final SeoErrorHandler errorHandler;
    private final TitleUniquenessChecker titleUniquenessChecker;
    private final AppProperties appProperties;

    public MaintenanceController(ValidationCache cache, IssueDetector issueDetector, RetryManager retryManager,
                                 SeoErrorHandler errorHandler, TitleUniquenessChecker titleUniquenessChecker,
                                 AppProperties appProperties) {
        this.cache = cache;
        this.issueDetector = issueDetector;
        this.retryManager = retryManager;
        this.errorHandler = errorHandler;
        this.titleUniquenessChecker = titleUniquenessChecker;
        this.appProperties = appProperties;
    }

    private boolean unauthorized(String adminKey) {
        return adminKey == null || !adminKey.equals(appProperties.getAdminKey());
    }

    @GetMapping(path = "/cache/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CacheStats>> cacheStats() {
        return Mono.just(ResponseEntity.ok(cache.getStats()));
    }

    @DeleteMapping(path = "/cache", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> clearCache(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey) {
        if (unauthorized(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.fromRunnable(cache::clearAll)
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn(ResponseEntity.ok(Map.<String, Object>of("ok", true)));
    }

    @PostMapping(path = "/cache/warm-up", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> warmUp(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @Valid @RequestBody OptimizerDtos.WarmUpRequest body) {
        if (unauthorized(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.fromCallable(() -> cache.warmUp(body.getContents(), issueDetector))
                .subscribeOn(Schedulers.boundedElastic())
                .map(n -> ResponseEntity.ok(Map.<String, Object>of("ok", true, "processed", n)));
    }

    @GetMapping(path = "/retry/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<RetryStats>> retryStats() {
        return Mono.just(ResponseEntity.ok(retryManager.getRetryStats()));
    }

    @GetMapping(path = "/errors", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> errors(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @RequestParam(value = "limit", defaultValue = "50") int limit,
            @RequestParam(value = "component", required = false) String component) {
        if (unauthorized(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.just(ResponseEntity.ok(Map.<String, Object>of(
                "errors", errorHandler.getRecentErrors(Math.max(1, limit), component),
                "stats", errorHandler.getErrorStats(component, 7))));
    }

    @GetMapping(path = "/errors/report", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ErrorReport>> errorReport(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        if (unauthorized(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.just(ResponseEntity.ok(errorHandler.generateUserFriendlyReport(Math.max(1, limit))));
    }

    @PostMapping(path = "/titles", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> registerTitles(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @Valid @RequestBody OptimizerDtos.TitlesRequest body) {
        if (unauthorized(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.fromCallable(() -> {
                    body.getTitles().forEach(titleUniquenessChecker::registerTitle);
                    return titleUniquenessChecker.registeredTitles().size();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .map(n -> ResponseEntity.ok(Map.<String, Object>of("ok", true, "registered", n)));
    }
}
