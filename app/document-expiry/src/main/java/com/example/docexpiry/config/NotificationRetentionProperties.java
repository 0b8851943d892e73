/*
 * Where: Document expiry application configuration binding
 * What: Holds audit retention cleanup settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.example.docexpiry.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "docexpiry.retention")
@Validated
public record NotificationRetentionProperties(
    boolean enabled, @Positive int retentionDays, @NotNull Duration cleanupInterval) {}
