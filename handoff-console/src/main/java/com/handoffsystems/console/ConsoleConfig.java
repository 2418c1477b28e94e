package com.handoffsystems.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration for the console demo: how long each side waits and what the
 * scripted automated participant says.
 *
 * Values can be set through the builder or read from system properties:
 * <ul>
 *   <li>{@code handoff.console.waitTimeoutSeconds} - manual side wait per attempt (default 300)</li>
 *   <li>{@code handoff.agent.replyTimeoutSeconds} - automated side wait for a reply (default 120)</li>
 *   <li>{@code handoff.agent.maxTimeouts} - consecutive reply timeouts before giving up (default 3)</li>
 *   <li>{@code handoff.agent.script} - file with one scripted line per row (default: bundled script)</li>
 * </ul>
 */
public class ConsoleConfig {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleConfig.class);

    public static final String WAIT_TIMEOUT_PROPERTY = "handoff.console.waitTimeoutSeconds";
    public static final String REPLY_TIMEOUT_PROPERTY = "handoff.agent.replyTimeoutSeconds";
    public static final String MAX_TIMEOUTS_PROPERTY = "handoff.agent.maxTimeouts";
    public static final String SCRIPT_PROPERTY = "handoff.agent.script";

    public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_REPLY_TIMEOUT = Duration.ofMinutes(2);
    public static final int DEFAULT_MAX_TIMEOUTS = 3;

    private Duration waitTimeout = DEFAULT_WAIT_TIMEOUT;
    private Duration replyTimeout = DEFAULT_REPLY_TIMEOUT;
    private int maxConsecutiveTimeouts = DEFAULT_MAX_TIMEOUTS;
    private Path scriptPath;

    public ConsoleConfig() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the configuration from JVM system properties.
     *
     * @return the configuration
     */
    public static ConsoleConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the configuration from the given properties. Missing keys keep their
     * defaults; malformed numbers and timeouts that are not positive are logged and ignored.
     *
     * @param properties the source properties
     * @return the configuration
     */
    public static ConsoleConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties cannot be null");
        Builder builder = builder();
        seconds(properties, WAIT_TIMEOUT_PROPERTY).ifPresent(builder::waitTimeout);
        seconds(properties, REPLY_TIMEOUT_PROPERTY).ifPresent(builder::replyTimeout);
        integer(properties, MAX_TIMEOUTS_PROPERTY).ifPresent(builder::maxConsecutiveTimeouts);
        String script = properties.getProperty(SCRIPT_PROPERTY);
        if (script != null && !script.isBlank()) {
            builder.scriptPath(Path.of(script.strip()));
        }
        return builder.build();
    }

    public static class Builder {
        private final ConsoleConfig config = new ConsoleConfig();

        public Builder waitTimeout(Duration timeout) {
            config.waitTimeout = Objects.requireNonNull(timeout, "timeout cannot be null");
            return this;
        }

        public Builder replyTimeout(Duration timeout) {
            config.replyTimeout = Objects.requireNonNull(timeout, "timeout cannot be null");
            return this;
        }

        public Builder maxConsecutiveTimeouts(int max) {
            config.maxConsecutiveTimeouts = Math.max(1, max);
            return this;
        }

        public Builder scriptPath(Path path) {
            config.scriptPath = path;
            return this;
        }

        public ConsoleConfig build() {
            config.validate();
            return config;
        }
    }

    private void validate() {
        if (waitTimeout.isZero() || waitTimeout.isNegative()) {
            throw new IllegalArgumentException("Wait timeout must be positive");
        }
        if (replyTimeout.isZero() || replyTimeout.isNegative()) {
            throw new IllegalArgumentException("Reply timeout must be positive");
        }
    }

    public Duration getWaitTimeout() {
        return waitTimeout;
    }

    public Duration getReplyTimeout() {
        return replyTimeout;
    }

    public int getMaxConsecutiveTimeouts() {
        return maxConsecutiveTimeouts;
    }

    /**
     * Gets the script file, if one was configured.
     *
     * @return the script path, or empty to use the bundled script
     */
    public Optional<Path> getScriptPath() {
        return Optional.ofNullable(scriptPath);
    }

    private static Optional<Duration> seconds(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            double seconds = Double.parseDouble(value.strip());
            long millis = Double.isFinite(seconds) ? Math.round(seconds * 1000) : 0;
            if (millis <= 0) {
                logger.warn("Ignoring {}={}: expected a positive number of seconds", key, value);
                return Optional.empty();
            }
            return Optional.of(Duration.ofMillis(millis));
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: not a number", key, value);
            return Optional.empty();
        }
    }

    private static Optional<Integer> integer(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(value.strip()));
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: not an integer", key, value);
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "ConsoleConfig{" +
                "waitTimeout=" + waitTimeout +
                ", replyTimeout=" + replyTimeout +
                ", maxConsecutiveTimeouts=" + maxConsecutiveTimeouts +
                ", scriptPath=" + scriptPath +
                '}';
    }
}
