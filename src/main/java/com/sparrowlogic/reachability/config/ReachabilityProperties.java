package com.sparrowlogic.reachability.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "reachability")
public record ReachabilityProperties(
    @Valid @DefaultValue Aws aws,
    @Min(1) @Max(65535) @DefaultValue("5432") int defaultPort
) {

    public record Aws(String profile, @NotBlank @DefaultValue("us-east-1") String region) {}
}
