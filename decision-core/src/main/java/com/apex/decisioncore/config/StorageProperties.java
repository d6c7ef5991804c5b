package com.apex.decisioncore.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Configuration
@ConfigurationProperties(prefix = "storage")
@Data
@Validated
public class StorageProperties {

    @NotBlank
    private String logDir = "logs";

    @NotBlank
    private String stateDir = "state";

    public Path logPath(String fileName) {
        return Path.of(logDir).resolve(fileName);
    }

    public Path statePath(String fileName) {
        return Path.of(stateDir).resolve(fileName);
    }
}
