package com.verlumen.curvestream.time;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DateTimesTest {
    @Test
    public void parseLocalDateTime_bareDate_isMidnight() {
        assertThat(DateTimes.parseLocalDateTime("2024-03-01"))
            .isEqualTo(LocalDateTime.of(2024, 3, 1, 0, 0));
    }

    @Test
    public void parseLocalDateTime_acceptsSpaceSeparator() {
        assertThat(DateTimes.parseLocalDateTime("2024-03-01 06:30:00"))
            .isEqualTo(LocalDateTime.of(2024, 3, 1, 6, 30));
    }

    @Test
    public void parseLocalDateTime_dropsOffset() {
        assertThat(DateTimes.parseLocalDateTime("2024-03-01T06:30:00+01:00"))
            .isEqualTo(LocalDateTime.of(2024, 3, 1, 6, 30));
    }

    @Test
    public void parseLocalDateTime_rejectsGarbage() {
        assertThrows(DateTimeParseException.class, () -> DateTimes.parseLocalDateTime("yesterday"));
    }

    @Test
    public void parseOffsetDateTime_keepsOffset() {
        assertThat(DateTimes.parseOffsetDateTime("2024-03-01T06:30:00+01:00"))
            .isEqualTo(OffsetDateTime.of(2024, 3, 1, 6, 30, 0, 0, ZoneOffset.ofHours(1)));
    }

    @Test
    public void parseOffsetDateTime_withoutOffset_isUtc() {
        assertThat(DateTimes.parseOffsetDateTime("2024-03-01"))
            .isEqualTo(OffsetDateTime.of(2024, 3, 1, 0, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    public void format_usesSpaceSeparatedWireFormat() {
        assertThat(DateTimes.format(LocalDateTime.of(2024, 3, 1, 6, 5, 9)))
            .isEqualTo("2024-03-01 06:05:09");
    }
}
