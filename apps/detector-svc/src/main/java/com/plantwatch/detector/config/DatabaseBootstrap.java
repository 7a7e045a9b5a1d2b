package com.plantwatch.detector.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.stream.Collectors;

/**
 * Optional bootstrap that creates the detector tables (readings feed, anomaly sink, checkpoints)
 * when they are missing. Statements are idempotent. Enable with DETECTOR_DB_BOOTSTRAP=true.
 */
@Component("databaseBootstrap")
public class DatabaseBootstrap {
    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);

    private static final String SCHEMA = "db/bootstrap/schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public DatabaseBootstrap(DataSource dataSource,
                             @Value("${detector.db.bootstrap-enabled:false}") boolean enabled) {
        this.dataSource = dataSource;
        this.enabled = enabled;
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("DB bootstrap disabled (detector.db.bootstrap-enabled=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            if (tableExists(conn, "anomaly_records") && tableExists(conn, "detection_checkpoints")) {
                log.info("DB bootstrap skipped: detector tables already present");
                return;
            }
            log.warn("DB bootstrap starting: applying {}", SCHEMA);
            int applied = 0;
            for (String stmt : loadSchemaSql().split(";")) {
                String trimmed = stmt.trim();
                if (trimmed.isEmpty()) continue;
                try (Statement s = conn.createStatement()) {
                    s.execute(trimmed);
                    applied++;
                } catch (Exception ex) {
                    log.error("Failed executing bootstrap statement: {}", trimmed, ex);
                    throw ex;
                }
            }
            log.info("DB bootstrap completed: {} statements applied", applied);
        } catch (Exception e) {
            // The workers surface store failures themselves; operations can inspect logs
            log.error("DB bootstrap failed (application will continue to start)", e);
        }
    }

    private boolean tableExists(Connection conn, String table) {
        try (PreparedStatement ps = conn.prepareStatement(
                "select 1 from information_schema.tables where table_name = ? and table_schema = current_schema()")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (Exception e) {
            log.warn("Could not check for table {}: {}", table, e.getMessage());
            return false;
        }
    }

    private String loadSchemaSql() throws Exception {
        ClassPathResource res = new ClassPathResource(SCHEMA);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        }
    }
}
