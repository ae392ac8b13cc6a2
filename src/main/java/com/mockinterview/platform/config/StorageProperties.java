package com.mockinterview.platform.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "interview.storage")
public class StorageProperties {
    private String sessionsDir = "./data/sessions";
}
