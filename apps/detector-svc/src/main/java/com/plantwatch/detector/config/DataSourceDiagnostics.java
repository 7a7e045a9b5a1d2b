package com.plantwatch.detector.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * The readings feed, the anomaly sink and the checkpoints all live in one PostgreSQL database.
 * A misconfigured URL would otherwise surface as store retries in every detection stream, so it
 * is rejected at startup.
 */
@Component
@Profile("!test")
public class DataSourceDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(DataSourceDiagnostics.class);

    static final String POSTGRES_PREFIX = "jdbc:postgresql://";

    @Value("${spring.datasource.url:}")
    private String jdbcUrl;

    @Value("${spring.datasource.username:}")
    private String username;

    @PostConstruct
    void validate() {
        String user = username == null || username.isBlank() ? "<none>" : username;
        log.info("Detector store: url='{}' user='{}' (process_readings, anomaly_records, detection_checkpoints)",
                safe(jdbcUrl), user);
        requireDetectorUrl(jdbcUrl);
    }

    static void requireDetectorUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("spring.datasource.url is blank (ensure SPRING_DATASOURCE_URL is set)");
        }
        if (!url.startsWith(POSTGRES_PREFIX)) {
            throw new IllegalStateException("spring.datasource.url must start with '" + POSTGRES_PREFIX
                    + "' (actual='" + safe(url) + "')");
        }
        String location = url.substring(POSTGRES_PREFIX.length());
        int query = location.indexOf('?');
        if (query >= 0) {
            location = location.substring(0, query);
        }
        int slash = location.indexOf('/');
        if (slash < 0 || slash == location.length() - 1) {
            throw new IllegalStateException("spring.datasource.url must name the detector database (actual='"
                    + safe(url) + "')");
        }
    }

    /**
     * Masks a password given as a query parameter or as URL user info.
     */
    static String safe(String url) {
        if (url == null) return null;
        return url.replaceAll("(?i)(password=)[^&]+", "$1***")
                .replaceAll("(//[^/:@]+:)[^@/]+@", "$1***@");
    }
}
