package com.pennywise.expense.config;

import jakarta.annotation.PostConstruct;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Startup check of the expense store connection settings. A blank or non-JDBC URL fails
 * the boot; a store other than PostgreSQL is allowed but flagged, because
 * {@code db/schema.sql} and the repository SQL are written against PostgreSQL.
 */
@Component
@Profile("!test")
public class DataSourceDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(DataSourceDiagnostics.class);

    static final String EXPECTED_VENDOR = "postgresql";

    private final String jdbcUrl;
    private final String username;
    private final boolean bootstrapEnabled;

    public DataSourceDiagnostics(
            @Value("${spring.datasource.url:}") String jdbcUrl,
            @Value("${spring.datasource.username:}") String username,
            PennywiseProperties properties
    ) {
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.bootstrapEnabled = properties.db().bootstrapEnabledFlag();
    }

    @PostConstruct
    void validate() {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalStateException("spring.datasource.url is blank (set SPRING_DATASOURCE_URL)");
        }
        String vendor = vendorOf(jdbcUrl);
        if (vendor == null) {
            throw new IllegalStateException("spring.datasource.url is not a JDBC URL (actual='" + redact(jdbcUrl) + "')");
        }
        String user = username == null || username.isBlank() ? "<none>" : username;
        log.info("Expense store: vendor={} url='{}' user='{}' schemaBootstrap={}", vendor, redact(jdbcUrl), user, bootstrapEnabled);
        if (!EXPECTED_VENDOR.equals(vendor)) {
            log.warn("Expense store vendor '{}' is not {}; schema.sql and listing SQL may need adjusting", vendor, EXPECTED_VENDOR);
        }
    }

    /**
     * @return the sub-protocol of a {@code jdbc:<vendor>:...} URL in lower case, or null when
     *         the URL is not a JDBC URL
     */
    static String vendorOf(String url) {
        if (url == null || !url.regionMatches(true, 0, "jdbc:", 0, 5)) {
            return null;
        }
        int end = url.indexOf(':', 5);
        if (end <= 5) {
            return null;
        }
        return url.substring(5, end).toLowerCase(Locale.ROOT);
    }

    static String redact(String url) {
        if (url == null) return null;
        return url.replaceAll("(?i)(password=)[^&;]+", "$1***");
    }
}
