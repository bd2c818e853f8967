package com.eainde.insight.ingestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class DateParserTest {

    private static final LocalDate JAN_15 = LocalDate.of(2024, 1, 15);

    @Nested
    @DisplayName("Format hint")
    class Hint {

        @Test
        @DisplayName("should honour a day-first Java pattern")
        void dayFirstHint() {
            assertThat(DateParser.parse("03/04/2024", "dd/MM/yyyy")).contains(LocalDate.of(2024, 4, 3));
        }

        @Test
        @DisplayName("should honour a strftime pattern")
        void strftimeHint() {
            assertThat(DateParser.parse("2024-15-01", "%Y-%d-%m")).contains(JAN_15);
        }

        @Test
        @DisplayName("should fall back when the hint does not match")
        void wrongHint() {
            assertThat(DateParser.parse("2024-01-15", "MM/dd/yyyy")).contains(JAN_15);
        }

        @Test
        @DisplayName("should ignore an invalid pattern")
        void invalidHint() {
            assertThat(DateParser.parse("2024-01-15", "{{nonsense}}")).contains(JAN_15);
        }
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', value = {
            "2024-01-15",
            "1/15/2024",
            "01/15/2024",
            "15/01/2024",
            "2024/01/15",
            "15.01.2024",
            "20240115",
            "'Jan 15, 2024'",
            "15 January 2024",
            "1705312800",
            "1705312800000",
            "1705312800.0",
            "2024-01-15T10:00:00Z",
            "1/15/24"
    })
    @DisplayName("should recognise common export formats")
    void commonFormats(String raw) {
        assertThat(DateParser.parse(raw)).contains(JAN_15);
    }

    @Test
    @DisplayName("should read an ambiguous slash date month-first")
    void ambiguousMonthFirst() {
        assertThat(DateParser.parse("03/04/2024")).contains(LocalDate.of(2024, 3, 4));
    }

    @Test
    @DisplayName("should return empty for blank or unparseable input")
    void unparseable() {
        assertThat(DateParser.parse(null)).isEmpty();
        assertThat(DateParser.parse("  ")).isEmpty();
        assertThat(DateParser.parse("last tuesday")).isEmpty();
        assertThat(DateParser.parse("13/13/2024")).isEmpty();
    }

    @Test
    @DisplayName("should convert strftime patterns")
    void toJavaPattern() {
        assertThat(DateParser.toJavaPattern("%m/%d/%Y")).isEqualTo("MM/dd/uuuu");
        assertThat(DateParser.toJavaPattern("MM/dd/yyyy")).isEqualTo("MM/dd/uuuu");
    }
}
