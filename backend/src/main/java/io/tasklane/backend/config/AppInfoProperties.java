package io.tasklane.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "tasklane.app")
public record AppInfoProperties(
    @DefaultValue("Tasklane API") String name, @DefaultValue("1.0.0") String version) {}
