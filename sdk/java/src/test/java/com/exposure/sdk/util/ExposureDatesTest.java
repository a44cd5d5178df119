package com.exposure.sdk.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ExposureDatesTest {

    @Test
    void parsesServerTimestamps() {
        Instant expected = Instant.parse("2017-10-02T10:00:00Z");

        assertThat(ExposureDates.parse("2017-10-02T10:00:00.000Z")).contains(expected);
        assertThat(ExposureDates.parse("2017-10-02T12:00:00+02:00")).contains(expected);
        assertThat(ExposureDates.parse("2017-10-02T10:00:00")).contains(expected);
    }

    @Test
    void unparsableTimestampsAreEmpty() {
        assertThat(ExposureDates.parse(null)).isEmpty();
        assertThat(ExposureDates.parse("")).isEmpty();
        assertThat(ExposureDates.parse("licenseActivation")).isEmpty();
    }

    @Test
    void formatsUtcWithMillis() {
        Instant instant = ExposureDates.fromEpochMillis(1506938400123L);

        assertThat(ExposureDates.formatUtc(instant)).isEqualTo("2017-10-02T10:00:00.123Z");
        assertThat(ExposureDates.toEpochMillis(instant)).isEqualTo(1506938400123L);
    }
}
