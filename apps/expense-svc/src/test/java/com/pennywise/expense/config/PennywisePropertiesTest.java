package com.pennywise.expense.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class PennywisePropertiesTest {

    @Test
    void missingSectionsFallBackToDefaults() {
        PennywiseProperties props = new PennywiseProperties(null, null, null);

        assertThat(props.cors().allowedOrigins()).containsExactly("http://localhost:3000");
        assertThat(props.cors().allowedMethods()).contains("GET", "POST", "DELETE");
        assertThat(props.cors().allowCredentials()).isTrue();
        assertThat(props.listing().defaultLimit()).isEqualTo(20);
        assertThat(props.db().bootstrapEnabledFlag()).isFalse();
    }

    @Test
    void wildcardOriginWithCredentialsIsRejected() {
        assertThatThrownBy(() -> new PennywiseProperties.Cors(List.of("*"), null, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void wildcardOriginWithoutCredentialsIsAllowed() {
        PennywiseProperties.Cors cors = new PennywiseProperties.Cors(List.of("*"), List.of("GET"), false);

        assertThat(cors.allowedOriginsArray()).containsExactly("*");
    }

    @Test
    void nonPositiveDefaultLimitIsRejected() {
        assertThatThrownBy(() -> new PennywiseProperties.Listing(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
