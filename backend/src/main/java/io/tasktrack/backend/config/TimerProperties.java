package io.tasktrack.backend.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for timer transitions.
 *
 * @param lockTimeout how long a start or stop waits for another transition on the same entity
 *     before giving up with a conflict
 */
@ConfigurationProperties(prefix = "tasktrack.timer")
public record TimerProperties(@DefaultValue("5s") Duration lockTimeout) {}
