package io.fluenthttp.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link BodyReadLimit#evaluate(long, long)}. */
@DisplayName("BodyReadLimit — limit against declared content length")
class BodyReadLimitTest {

    @ParameterizedTest(name = "limit={0}, declared={1} → unlimited")
    @CsvSource({"-1, -1", "-1, 0", "-1, 1000000", "-42, 10"})
    void negativeLimitDisablesTheCheck(long limit, long declared) {
        assertThat(BodyReadLimit.evaluate(limit, declared)).isInstanceOf(BodyReadLimit.Unlimited.class);
    }

    @ParameterizedTest(name = "limit={0}, declared unknown → capped at {0}")
    @CsvSource({"0", "1", "65536"})
    void unknownLengthCapsAtLimit(long limit) {
        assertThat(BodyReadLimit.evaluate(limit, -1)).isEqualTo(new BodyReadLimit.Capped(limit));
    }

    @ParameterizedTest(name = "limit={0}, declared={1} → capped at {1}")
    @CsvSource({"0, 0", "0, 5000", "10, 10", "100, 10", "1, 0"})
    void limitAtOrAboveDeclaredCapsAtDeclared(long limit, long declared) {
        assertThat(BodyReadLimit.evaluate(limit, declared)).isEqualTo(new BodyReadLimit.Capped(declared));
    }

    @ParameterizedTest(name = "limit={0}, declared={1} → exceeded")
    @CsvSource({"1, 2", "9, 10", "65536, 65537"})
    void limitBelowDeclaredIsExceeded(long limit, long declared) {
        assertThat(BodyReadLimit.evaluate(limit, declared)).isEqualTo(new BodyReadLimit.Exceeded(declared, limit));
    }

    @Test
    @DisplayName("Every (limit, declared) pair in a grid maps to exactly the documented outcome")
    void exhaustiveGrid() {
        for (long limit = -2; limit <= 6; limit++) {
            for (long declared = -2; declared <= 6; declared++) {
                BodyReadLimit outcome = BodyReadLimit.evaluate(limit, declared);
                if (limit < 0) {
                    assertThat(outcome).isInstanceOf(BodyReadLimit.Unlimited.class);
                } else if (declared < 0) {
                    assertThat(outcome).isEqualTo(new BodyReadLimit.Capped(limit));
                } else if (limit == 0 || limit >= declared) {
                    assertThat(outcome).isEqualTo(new BodyReadLimit.Capped(declared));
                } else {
                    assertThat(outcome).isInstanceOf(BodyReadLimit.Exceeded.class);
                }
            }
        }
    }

    @Test
    void cappedRejectsNegativeMaximum() {
        assertThatThrownBy(() -> new BodyReadLimit.Capped(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
