package net.papermentat.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;

class PaperMentatPropertiesTest {

    @Test
    @DisplayName("defaults pass validation")
    void defaults_areValid() {
        PaperMentatProperties properties = new PaperMentatProperties();

        assertThatCode(properties::validate).doesNotThrowAnyException();
        assertThat(properties.getEnrichment().getProvider()).isEqualTo("none");
        assertThat(properties.getHttp().getMaxRetries()).isEqualTo(3);
    }

    @Test
    @DisplayName("unknown enrichment providers are rejected")
    void unknownProvider_isRejected() {
        PaperMentatProperties properties = new PaperMentatProperties();
        properties.getEnrichment().setProvider("Claude");

        assertThatThrownBy(properties::validate).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("non-positive timeouts are rejected")
    void zeroTimeout_isRejected() {
        PaperMentatProperties properties = new PaperMentatProperties();
        properties.setTimeout(Duration.ZERO);

        assertThatThrownBy(properties::validate).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("effective rate limit is floored")
    void effectiveRateLimit_isFloored() {
        PaperMentatProperties properties = new PaperMentatProperties();
        properties.setRateLimitPerSecond(0.01);

        assertThat(properties.effectiveRateLimit()).isEqualTo(0.1);
    }
}
