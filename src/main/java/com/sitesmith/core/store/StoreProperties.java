package com.sitesmith.core.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sitesmith.store")
public class StoreProperties {

    /** Location of the JSON file holding every project record. */
    private String path = "data/projects.json";

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
}
