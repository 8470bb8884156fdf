package org.iceforge.ocient.connector.service;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampParserTest {

    @Test
    void nativeFormatWithNanosecondsUsesNativeBranch() {
        var parsed = TimestampParser.parseWithEncoding("2024-01-15 10:30:00.123456789");

        assertThat(parsed).isPresent();
        assertThat(parsed.get().encoding()).isEqualTo(TimestampParser.Encoding.NATIVE);
        assertThat(parsed.get().instant()).isEqualTo(Instant.parse("2024-01-15T10:30:00.123456789Z"));
    }

    @Test
    void nativeBranchAcceptsShortFractionsAndNoFraction() {
        assertThat(TimestampParser.parseWithEncoding("2024-01-15 10:30:00.5").get().encoding())
                .isEqualTo(TimestampParser.Encoding.NATIVE);
        // Native comes first, so the bare form never reaches the last branch.
        assertThat(TimestampParser.parseWithEncoding("2024-01-15 10:30:00").get().encoding())
                .isEqualTo(TimestampParser.Encoding.NATIVE);
    }

    @Test
    void internetFormatWithZuluAndOffset() {
        var zulu = TimestampParser.parseWithEncoding("2024-01-15T10:30:00Z");
        assertThat(zulu.get().encoding()).isEqualTo(TimestampParser.Encoding.INTERNET);
        assertThat(zulu.get().instant()).isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));

        var offset = TimestampParser.parse("2024-01-15T12:30:00.250+02:00");
        assertThat(offset).contains(Instant.parse("2024-01-15T10:30:00.250Z"));
    }

    @Test
    void rejectsNonTimestamps() {
        assertThat(TimestampParser.isTimestamp("hello world, not a date")).isFalse();
        assertThat(TimestampParser.isTimestamp("2024-01-15")).isFalse();
        assertThat(TimestampParser.isTimestamp("2024-13-45 10:30:00")).isFalse();
        assertThat(TimestampParser.isTimestamp("2024-01-15T10:30:00")).isFalse();
        assertThat(TimestampParser.isTimestamp("2024-01-15 10:30:00.1234567890")).isFalse();
        assertThat(TimestampParser.isTimestamp(null)).isFalse();
    }

    @Test
    void formatsInstantInNativeUtcForm() {
        assertThat(TimestampParser.format(Instant.parse("2024-03-01T07:05:09.999Z"))).isEqualTo("2024-03-01 07:05:09");
    }

    @Test
    void zeroInstantIsYearOne() {
        assertThat(TimestampParser.ZERO_INSTANT).isEqualTo(Instant.parse("0001-01-01T00:00:00Z"));
    }
}
