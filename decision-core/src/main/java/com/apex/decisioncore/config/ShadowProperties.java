package com.apex.decisioncore.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "shadow")
@Data
@Validated
public class ShadowProperties {

    private boolean enabled = true;

    @NotEmpty
    private List<Integer> horizonsMin = List.of(15, 60, 240, 1440);

    @NotEmpty
    private List<Double> tpPcts = List.of(1.0, 2.0);

    @NotEmpty
    private List<Double> slPcts = List.of(0.75, 1.5);

    private Duration pollInterval = Duration.ofSeconds(60);

    @Min(0)
    private int archivedIdMemory = 10_000;
}
