package com.sitesmith.core.health;

import com.sitesmith.core.model.SortOrder;
import com.sitesmith.core.store.ProjectStore;
import com.sitesmith.registry.DomainRegistry;
import com.sitesmith.storage.ObjectStore;
import com.sitesmith.storage.StorageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ProjectStore projectStore;
    private final ObjectStore objectStore;
    private final DomainRegistry domainRegistry;
    private final StorageKeys keys;

    public HealthCheckService(
            @Autowired(required = false) ProjectStore projectStore,
            @Autowired(required = false) ObjectStore objectStore,
            @Autowired(required = false) DomainRegistry domainRegistry,
            StorageKeys keys) {
        this.projectStore = projectStore;
        this.objectStore = objectStore;
        this.domainRegistry = domainRegistry;
        this.keys = keys;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkObjectStore());
        results.add(checkDomainRegistry());
        return results;
    }

    private HealthStatus checkStore() {
        if (projectStore == null) {
            return HealthStatus.down("store", "No ProjectStore configured");
        }
        try {
            int count = projectStore.list(1, 1, SortOrder.DESC).totalCount();
            return new HealthStatus("store", HealthStatus.Status.UP,
                    "Project store readable", Map.of("projects", String.valueOf(count)));
        } catch (Exception e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return HealthStatus.down("store", "Store error: " + e.getMessage());
        }
    }

    private HealthStatus checkObjectStore() {
        if (objectStore == null) {
            return HealthStatus.down("object-store", "No ObjectStore configured");
        }
        try {
            objectStore.list(keys.site("health-probe"));
            return HealthStatus.up("object-store", "Object store reachable (" + objectStore.describe() + ")");
        } catch (Exception e) {
            log.warn("Object store health check failed: {}", e.getMessage());
            return HealthStatus.down("object-store", "Object store error: " + e.getMessage());
        }
    }

    private HealthStatus checkDomainRegistry() {
        if (domainRegistry == null) {
            return HealthStatus.down("domain-registry", "No DomainRegistry configured");
        }
        // the registry API has no read endpoint to probe
        return HealthStatus.up("domain-registry", "Domain registry configured (" + domainRegistry.describe() + ")");
    }
}
