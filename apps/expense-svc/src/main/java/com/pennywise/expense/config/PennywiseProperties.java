package com.pennywise.expense.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "pennywise")
public record PennywiseProperties(
        Cors cors,
        Listing listing,
        Db db
) {

    @ConstructorBinding
    public PennywiseProperties {
        // every section is optional; missing sections fall back to local development defaults
        if (cors == null) {
            cors = new Cors(null, null, null);
        }
        if (listing == null) {
            listing = new Listing(null);
        }
        if (db == null) {
            db = new Db(null);
        }
    }

    public record Cors(List<String> allowedOrigins, List<String> allowedMethods, Boolean allowCredentials) {
        public Cors {
            if (allowedOrigins == null || allowedOrigins.isEmpty()) {
                allowedOrigins = List.of("http://localhost:3000");
            }
            if (allowedMethods == null || allowedMethods.isEmpty()) {
                allowedMethods = List.of("GET", "POST", "DELETE", "OPTIONS");
            }
            if (allowCredentials == null) {
                allowCredentials = Boolean.TRUE;
            }
            if (allowCredentials && allowedOrigins.contains("*")) {
                throw new IllegalArgumentException("allowedOrigins must list explicit origins when allowCredentials is true");
            }
            allowedOrigins = List.copyOf(allowedOrigins);
            allowedMethods = List.copyOf(allowedMethods);
        }

        public String[] allowedOriginsArray() {
            return allowedOrigins.toArray(String[]::new);
        }

        public String[] allowedMethodsArray() {
            return allowedMethods.toArray(String[]::new);
        }
    }

    public record Listing(Integer defaultLimit) {
        public Listing {
            if (defaultLimit == null) {
                defaultLimit = 20;
            }
            if (defaultLimit <= 0) {
                throw new IllegalArgumentException("defaultLimit must be positive");
            }
        }
    }

    public record Db(Boolean bootstrapEnabled) {
        public boolean bootstrapEnabledFlag() {
            return bootstrapEnabled != null && bootstrapEnabled;
        }
    }
}
