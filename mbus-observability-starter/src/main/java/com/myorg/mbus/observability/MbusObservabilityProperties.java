package com.myorg.mbus.observability;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "mbus.observability")
public class MbusObservabilityProperties {
    private boolean enabled = true;

    private boolean mdcEnabled = true;
    private boolean metricsEnabled = true;
    private boolean loggingEnabled = true;

    // topic is bounded; event ids are never used as tags
    private boolean tagTopic = true;
}
