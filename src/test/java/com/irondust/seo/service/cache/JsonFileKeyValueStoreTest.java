package com.irondust.seo.service.cache;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.irondust.seo.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class JsonFileKeyValueStoreTest {

    @TempDir
    Path dir;

    @Test
    public void values_surviveReload() {
        MutableClock clock = new MutableClock();
        Path file = dir.resolve("nested/store.json");
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file, clock);
        store.set("seo_cache_a", JsonNodeFactory.instance.textNode("alpha"));
        store.set("seo_cache_b", JsonNodeFactory.instance.numberNode(7), 60);
        store.set("other", JsonNodeFactory.instance.booleanNode(true));

        assertTrue(Files.exists(file));
        JsonFileKeyValueStore reloaded = new JsonFileKeyValueStore(file, clock);
        assertEquals("alpha", reloaded.get("seo_cache_a").get().asText());
        assertEquals(7, reloaded.get("seo_cache_b").get().asInt());
        assertEquals(Set.of("seo_cache_a", "seo_cache_b"), reloaded.keys("seo_cache_"));
    }

    @Test
    public void expiredEntries_areDroppedOnReadAndLoad() {
        MutableClock clock = new MutableClock();
        Path file = dir.resolve("store.json");
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file, clock);
        store.set("short", JsonNodeFactory.instance.textNode("x"), 10);
        store.set("long", JsonNodeFactory.instance.textNode("y"), 100);

        clock.advance(Duration.ofSeconds(10));

        assertTrue(store.get("short").isEmpty());
        assertEquals(Set.of("long"), store.keys(""));
        clock.advance(Duration.ofSeconds(100));
        assertTrue(new JsonFileKeyValueStore(file, clock).keys("").isEmpty());
    }

    @Test
    public void unreadableFile_startsEmpty() throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{not json");

        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file, new MutableClock());

        assertTrue(store.keys("").isEmpty());
        assertFalse(store.delete("missing"));
        assertEquals("fallback", store.get("missing", JsonNodeFactory.instance.textNode("fallback")).asText());
    }
}
