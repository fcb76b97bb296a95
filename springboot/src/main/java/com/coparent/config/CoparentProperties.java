package com.coparent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Application settings bound from the {@code coparent.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "coparent")
public class CoparentProperties {

    /**
     * Zone used to compute the boundaries of all-day events.
     */
    private String zoneId = "UTC";

    private final Cors cors = new Cors();
    private final FamilyAccess family = new FamilyAccess();
    private final Scheduling scheduling = new Scheduling();
    private final Reminders reminders = new Reminders();
    private final Push push = new Push();
    private final Mail mail = new Mail();
    private final Storage storage = new Storage();
    private final Errors errors = new Errors();

    @Data
    public static class Cors {
        private String allowedOrigins = "http://localhost:8100,http://localhost:4200";
    }

    @Data
    public static class FamilyAccess {
        /**
         * Create the family and/or membership on first access instead of rejecting non-members.
         */
        private boolean autoEnroll = false;
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
    }

    @Data
    public static class Reminders {
        private int batchSize = 50;
        private Duration retention = Duration.ofDays(7);
        private String sweepCron = "0 * * * * *";
        private String cleanupCron = "0 0 0 * * *";
    }

    @Data
    public static class Push {
        /**
         * {@code log} or {@code http}.
         */
        private String provider = "log";
        private String gatewayUrl;
        private String apiKey;
    }

    @Data
    public static class Mail {
        private boolean enabled = false;
        private String from = "no-reply@coparent.local";
        private String appUrl = "http://localhost:4200";
    }

    @Data
    public static class Storage {
        /**
         * {@code s3}, or {@code local} to keep files on disk during development.
         */
        private String provider = "s3";
        private String bucket = "coparent-files";
        private String region = "eu-central-1";
        private String cdnUrl;
        // local provider only
        private String rootDir = "./uploads";
        private String publicBaseUrl = "/files";
    }

    @Data
    public static class Errors {
        private boolean exposeDetails = false;
    }
}
