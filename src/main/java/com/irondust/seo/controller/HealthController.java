package com.irondust.seo.controller;

import com.irondust.seo.service.cache.ValidationCache;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
public class HealthController {
    private final ValidationCache cache;

    public HealthController(ValidationCache cache) { this.cache = cache; }

    @GetMapping("/healthz")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> ResponseEntity.ok(Map.<String, Object>of(
                        "ok", Boolean.TRUE,
                        "cacheEnabled", cache.getStats().isEnabled())))
                .onErrorReturn(ResponseEntity.status(500).body(Map.<String, Object>of("ok", Boolean.FALSE)));
    }
}
