package com.sitesmith.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local {@link ObjectStore} for development and tests. Contents are
 * lost on restart.
 */
public class InMemoryObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryObjectStore.class);

    private final ConcurrentSkipListMap<String, StoredObject> objects = new ConcurrentSkipListMap<>();

    @Override
    public void put(String key, byte[] content, String contentType) {
        objects.put(key, new StoredObject(content.clone(), contentType));
        log.debug("Stored {} ({} bytes, {})", key, content.length, contentType);
    }

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.ofNullable(objects.get(key)).map(o -> o.content().clone());
    }

    @Override
    public void delete(String key) {
        objects.remove(key);
    }

    @Override
    public List<String> list(String prefix) {
        return objects.keySet().stream().filter(k -> k.startsWith(prefix)).toList();
    }

    public Optional<String> contentType(String key) {
        return Optional.ofNullable(objects.get(key)).map(StoredObject::contentType);
    }

    @Override
    public String describe() {
        return "in-memory (" + objects.size() + " objects)";
    }

    private record StoredObject(byte[] content, String contentType) {}
}
