package com.todayatsg.backend.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SingaporeDateTimeParserTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 7, 15); // a Monday

    private final SingaporeDateTimeParser parser = new SingaporeDateTimeParser();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2024-08-01                      | 2024-08-01",
            "01/08/2024                      | 2024-08-01",
            "1 Aug 2024                      | 2024-08-01",
            "1st August 2024                 | 2024-08-01",
            "August 1, 2024                  | 2024-08-01",
            "Thu, 1 Aug 2024                 | 2024-08-01",
            "Sat, 3 Aug 2024, 7:30 PM        | 2024-08-03",
            "1-5 Aug 2024                    | 2024-08-01",
            "1 Aug - 5 Aug 2024              | 2024-08-01",
            "Fri 2 Aug - Sun 4 Aug 2024      | 2024-08-02",
            "15 Sept 2024                    | 2024-09-15",
            "Date: 20 Aug 2024 onwards       | 2024-08-20",
            "20 Aug                          | 2024-08-20",
            "10 Jan                          | 2025-01-10",
            "tomorrow                        | 2024-07-16",
            "this weekend                    | 2024-07-20",
            "in 3 days                       | 2024-07-18"
    })
    void parsesSingaporeDateNotations(String text, String expected) {
        assertThat(parser.parseDate(text, TODAY)).contains(LocalDate.parse(expected));
    }

    @Test
    void rejectsTextWithoutADate() {
        assertThat(parser.parseDate("Coming soon", TODAY)).isEmpty();
        assertThat(parser.parseDate("  ", TODAY)).isEmpty();
        assertThat(parser.parseDate(null, TODAY)).isEmpty();
    }

    @Test
    void isoTimestampsAreConvertedToSingaporeTime() {
        Optional<LocalDateTime> fromUtc = parser.parseIsoDateTime("2024-08-01T11:30:00Z");
        Optional<LocalDateTime> local = parser.parseIsoDateTime("2024-08-01T19:30:00");

        assertThat(fromUtc).contains(LocalDateTime.of(2024, 8, 1, 19, 30));
        assertThat(local).contains(LocalDateTime.of(2024, 8, 1, 19, 30));
        assertThat(parser.parseIsoDateTime("1 Aug 2024")).isEmpty();
    }

    @Test
    void rangeEndIsTheSecondDate() {
        assertThat(parser.parseRangeEnd("1 Aug - 5 Aug 2024", TODAY)).contains(LocalDate.of(2024, 8, 5));
        assertThat(parser.parseRangeEnd("1-5 Aug 2024", TODAY)).contains(LocalDate.of(2024, 8, 5));
        assertThat(parser.parseRangeEnd("1 Aug 2024", TODAY)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "7:30 PM      | 19:30",
            "7.30pm       | 19:30",
            "10am - 2pm   | 10:00",
            "7 - 10pm     | 19:00",
            "11 - 2pm     | 11:00",
            "12pm         | 12:00",
            "12am         | 00:00",
            "19:30        | 19:30",
            "1930hrs      | 19:30",
            "noon         | 12:00"
    })
    void parsesStartTimes(String text, String expected) {
        assertThat(parser.parseTime(text)).contains(LocalTime.parse(expected));
    }

    @Test
    void findsTimeInsideDateText() {
        assertThat(parser.parseTimeInDateText("Sat, 3 Aug 2024, 7:30 PM")).contains(LocalTime.of(19, 30));
        assertThat(parser.parseTimeInDateText("03/08/2024 20:00")).contains(LocalTime.of(20, 0));
        assertThat(parser.parseTimeInDateText("3 Aug 2024")).isEmpty();
    }
}
