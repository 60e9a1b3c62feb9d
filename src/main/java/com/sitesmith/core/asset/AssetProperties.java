package com.sitesmith.core.asset;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sitesmith.assets")
public class AssetProperties {

    private int captionTimeoutSeconds = 60;
    private String captionPlaceholder = "No caption available";

    public int getCaptionTimeoutSeconds() { return captionTimeoutSeconds; }
    public void setCaptionTimeoutSeconds(int captionTimeoutSeconds) { this.captionTimeoutSeconds = captionTimeoutSeconds; }
    public String getCaptionPlaceholder() { return captionPlaceholder; }
    public void setCaptionPlaceholder(String captionPlaceholder) { this.captionPlaceholder = captionPlaceholder; }
}
