package com.sitesmith.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry that only remembers hostnames in memory. Used when no domain API is
 * configured.
 */
public class InMemoryDomainRegistry implements DomainRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDomainRegistry.class);

    private final Set<String> hostnames = ConcurrentHashMap.newKeySet();

    @Override
    public void register(String hostname) {
        hostnames.add(hostname);
        log.info("Registered domain {} (in-memory)", hostname);
    }

    @Override
    public void unregister(String hostname) {
        hostnames.remove(hostname);
        log.info("Unregistered domain {} (in-memory)", hostname);
    }

    public boolean isRegistered(String hostname) {
        return hostnames.contains(hostname);
    }

    @Override
    public String describe() {
        return "in-memory (" + hostnames.size() + " domains)";
    }
}
