package com.zplat.ipld.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IplTimestampsTest {

    @Test
    void shortSpanFormatsAsHoursMinutesSeconds() {
        assertThat(IplTimestamps.between("2024-01-01 10:00:00", "2024-01-01 10:05:30")).isEqualTo("00:05:30");
    }

    @Test
    void multiDaySpanAccumulatesIntoHours() {
        assertThat(IplTimestamps.between("2024-01-01 00:00:00", "2024-01-02 06:00:00")).isEqualTo("30:00:00");
        assertThat(IplTimestamps.formatDuration(3 * 86_400 + 61)).isEqualTo("72:01:01");
    }

    @Test
    void negativeSpanKeepsSign() {
        assertThat(IplTimestamps.between("2024-01-01 10:05:30", "2024-01-01 10:00:00")).isEqualTo("-00:05:30");
    }

    @Test
    void onlyStrictFormatIsValid() {
        assertThat(IplTimestamps.isValid("2024-02-29 23:59:59")).isTrue();
        assertThat(IplTimestamps.isValid("2023-02-29 10:00:00")).isFalse();
        assertThat(IplTimestamps.isValid("2024-01-01T10:00:00")).isFalse();
        assertThat(IplTimestamps.isValid("2024-01-01 25:00:00")).isFalse();
        assertThat(IplTimestamps.isValid("")).isFalse();
        assertThat(IplTimestamps.isValid(null)).isFalse();
    }

    @Test
    void iplDateUsesShortMonthName() {
        assertThat(IplTimestamps.toIplDate("2024-03-07 10:00:00")).isEqualTo("Mar 07, 2024");
        assertThat(IplTimestamps.toIplDate("garbage")).isNull();
    }

    @Test
    void rowKeyDistinguishesNullFromEmpty() {
        assertThat(RowKeys.of("A", null)).isNotEqualTo(RowKeys.of("A", ""));
        assertThat(RowKeys.of("A", "B")).isEqualTo(RowKeys.of("A", "B")).hasSize(64);
        assertThat(RowKeys.of("AB", "C")).isNotEqualTo(RowKeys.of("A", "BC"));
    }
}
