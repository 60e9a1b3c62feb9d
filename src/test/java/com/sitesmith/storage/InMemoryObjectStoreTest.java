package com.sitesmith.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryObjectStoreTest {

    private final InMemoryObjectStore store = new InMemoryObjectStore();

    @Test
    @DisplayName("put overwrites and get returns a defensive copy")
    void putAndGet() {
        store.put("website/a.example/index.html", "<html>1</html>".getBytes(StandardCharsets.UTF_8), "text/html");
        store.put("website/a.example/index.html", "<html>2</html>".getBytes(StandardCharsets.UTF_8), "text/html");

        byte[] first = store.get("website/a.example/index.html").orElseThrow();
        first[0] = 'X';
        assertEquals("<html>2</html>",
                new String(store.get("website/a.example/index.html").orElseThrow(), StandardCharsets.UTF_8));
        assertEquals("text/html", store.contentType("website/a.example/index.html").orElseThrow());
    }

    @Test
    @DisplayName("deleting a missing key is not an error")
    void deleteMissing() {
        assertDoesNotThrow(() -> store.delete("website/none/index.html"));
        assertTrue(store.get("website/none/index.html").isEmpty());
    }

    @Test
    @DisplayName("list returns keys under the prefix in lexical order")
    void list() {
        store.put("website/b.example/index.html", new byte[]{1}, "text/html");
        store.put("website/a.example/assets/z.png", new byte[]{1}, "image/png");
        store.put("website/a.example/index.html", new byte[]{1}, "text/html");

        assertEquals(List.of("website/a.example/assets/z.png", "website/a.example/index.html"),
                store.list("website/a.example/"));
    }
}
