package com.sitesmith.core.generation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sitesmith.generation")
public class GenerationProperties {

    private int timeoutSeconds = 180;

    /** Publish each generated version as soon as it is stored. */
    private boolean autoPublish = true;

    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public boolean isAutoPublish() { return autoPublish; }
    public void setAutoPublish(boolean autoPublish) { this.autoPublish = autoPublish; }
}
