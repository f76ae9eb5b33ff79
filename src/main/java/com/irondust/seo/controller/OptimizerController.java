package com.irondust.seo.controller;

import com.irondust.seo.admin.SessionRegistry;
import com.irondust.seo.dto.OptimizerDtos;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.DetectionReport;
import com.irondust.seo.model.ValidationResult;
import com.irondust.seo.service.IssueDetector;
import com.irondust.seo.service.MultiPassOptimizer;
import com.irondust.seo.service.OptimizationReport;
import com.irondust.seo.service.pipeline.ValidationPipeline;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/seo")
public class OptimizerController {
    private static final Logger log = LoggerFactory.getLogger(OptimizerController.class);

    private final MultiPassOptimizer optimizer;
    private final ValidationPipeline pipeline;
    private final IssueDetector issueDetector;
    private final SessionRegistry sessionRegistry;

    public OptimizerController(MultiPassOptimizer optimizer, ValidationPipeline pipeline,
                               IssueDetector issueDetector, SessionRegistry sessionRegistry) {
        this.optimizer = optimizer;
        this.pipeline = pipeline;
        this.issueDetector = issueDetector;
        this.sessionRegistry = sessionRegistry;
    }

    @PostMapping(path = "/optimize", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<OptimizationReport>> optimize(@Valid @RequestBody OptimizerDtos.OptimizeRequest body) {
        Content content = body.getContent();
        log.info("Optimize request for '{}' (keyword={})", content.getTitle(), body.getFocusKeyword());
        return Mono.fromCallable(() -> optimizer.optimizeContent(content, body.getFocusKeyword(), body.getSecondaryKeywords()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping(path = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ValidationResult>> validate(@Valid @RequestBody OptimizerDtos.OptimizeRequest body) {
        return Mono.fromCallable(() -> pipeline.validateAndCorrect(body.getContent(), body.getFocusKeyword(), body.getSecondaryKeywords()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping(path = "/issues", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<DetectionReport>> issues(@Valid @RequestBody OptimizerDtos.OptimizeRequest body) {
        Content content = body.getContent();
        String keyword = body.getFocusKeyword() != null ? body.getFocusKeyword() : content.getFocusKeyword();
        List<String> secondary = body.getSecondaryKeywords() != null ? body.getSecondaryKeywords() : content.getSecondaryKeywords();
        return Mono.fromCallable(() -> issueDetector.detectAllIssues(content, keyword, secondary))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping(path = "/sessions", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> sessions(@RequestParam(value = "limit", defaultValue = "20") int limit) {
        return Mono.just(ResponseEntity.ok(Map.of("sessions", sessionRegistry.recent(Math.max(1, limit)))));
    }

    @GetMapping(path = "/sessions/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<SessionRegistry.SessionInfo>> session(@PathVariable("id") String id) {
        SessionRegistry.SessionInfo info = sessionRegistry.get(id);
        return Mono.just(info != null ? ResponseEntity.ok(info) : ResponseEntity.notFound().build());
    }
}
