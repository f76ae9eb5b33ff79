package com.irondust.seo.controller;

import com.irondust.seo.service.cache.StoreException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GlobalErrorHandlerTest {
    private final GlobalErrorHandler handler = new GlobalErrorHandler();

    @Test
    public void storeFailure_isServiceUnavailable() {
        ResponseEntity<Map<String, Object>> r = handler.handleStore(
                new StoreException("Failed to persist key-value store tmp/seo-store.json", new IOException("disk full")));

        assertEquals(503, r.getStatusCode().value());
        assertEquals("store_unavailable", r.getBody().get("error"));
    }

    @Test
    public void unexpectedFailure_isServerError() {
        ResponseEntity<Map<String, Object>> r = handler.handleOther(new IllegalStateException("boom"));

        assertEquals(500, r.getStatusCode().value());
        assertEquals("IllegalStateException", r.getBody().get("exception"));
        assertEquals("boom", r.getBody().get("message"));
    }
}
