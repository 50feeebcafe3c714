package com.dragnet.core.time;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.exception.PatternException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.Test;

class PartitionEnumeratorTest {

    private static List<String> values(String pattern, String start, String end) {
        List<String> out = new ArrayList<>();
        PartitionEnumerator.enumerate(pattern, Instant.parse(start), Instant.parse(end)).forEach(out::add);
        return out;
    }

    @Test
    void patternWithoutDatesYieldsOneValue() {
        assertThat(values("my_pattern", "2010-01-01T00:00:00Z", "2010-01-10T00:00:00Z"))
                .containsExactly("my_pattern");
        assertThat(values("my_%%pattern", "2010-01-01T00:00:00Z", "2010-01-10T00:00:00Z"))
                .containsExactly("my_%pattern");
        assertThat(values("my_pattern%%", "2010-01-01T00:00:00Z", "2010-01-10T00:00:00Z"))
                .containsExactly("my_pattern%");
    }

    @Test
    void yearsStopBeforeEnd() {
        assertThat(values("%Y", "2010-12-03T01:23:45.678Z", "2013-01-01T00:00:00Z"))
                .containsExactly("2010", "2011", "2012");
        assertThat(values("%Y", "2010-01-01T00:00:00Z", "2013-01-01T00:00:00.001Z"))
                .containsExactly("2010", "2011", "2012", "2013");
        assertThat(values("%Y", "2014-12-31T23:59:59.999Z", "2015-01-01T00:00:00.001Z"))
                .containsExactly("2014", "2015");
    }

    @Test
    void monthsUseCalendarArithmetic() {
        assertThat(values("%Y-%m", "2010-10-30T00:00:00Z", "2011-05-01T00:00:00Z"))
                .containsExactly("2010-10", "2010-11", "2010-12", "2011-01", "2011-02", "2011-03", "2011-04");
        assertThat(values("%Y/%m", "2014-01-31T23:59:59.999Z", "2014-02-01T00:00:00.001Z"))
                .containsExactly("2014/01", "2014/02");
    }

    @Test
    void monthOnlyPatternRepeatsAcrossYears() {
        List<String> months = values("%m", "2010-06-01T00:00:00Z", "2012-08-01T00:00:00Z");

        assertThat(months).hasSize(26);
        assertThat(months.subList(0, 8)).containsExactly("06", "07", "08", "09", "10", "11", "12", "01");
        assertThat(months.get(months.size() - 1)).isEqualTo("07");
    }

    @Test
    void daysAcrossMonthBoundary() {
        assertThat(values("year_%Y/month_%m/day_%d/some/other/stuff", "2014-02-26T00:00:00Z", "2014-03-03T00:00:00Z"))
                .containsExactly(
                        "year_2014/month_02/day_26/some/other/stuff",
                        "year_2014/month_02/day_27/some/other/stuff",
                        "year_2014/month_02/day_28/some/other/stuff",
                        "year_2014/month_03/day_01/some/other/stuff",
                        "year_2014/month_03/day_02/some/other/stuff");
        assertThat(values("%d", "2010-06-12T03:05:06Z", "2010-06-18T00:00:00Z"))
                .containsExactly("12", "13", "14", "15", "16", "17");
    }

    @Test
    void hoursAcrossDayBoundary() {
        assertThat(values("%Y/%m/%d/%H", "2014-03-09T22:30:00Z", "2014-03-10T02:00:00Z"))
                .containsExactly("2014/03/09/22", "2014/03/09/23", "2014/03/10/00", "2014/03/10/01");
    }

    @Test
    void emptyRangeYieldsNothing() {
        assertThat(values("%Y/%m", "2014-02-01T00:00:00Z", "2014-02-01T00:00:00Z")).isEmpty();
        assertThat(values("%Y/%m/%d", "2014-02-01T10:00:00Z", "2014-02-01T10:00:00Z")).isEmpty();
    }

    @Test
    void smallestNonEmptyRangeYieldsAlignedStart() {
        assertThat(values("%Y/%m", "2014-02-11T00:00:00Z", "2014-02-11T00:00:00.001Z"))
                .containsExactly("2014/02");
        assertThat(values("%Y/%m/%d/%H", "2014-02-11T07:59:59Z", "2014-02-11T08:00:00Z"))
                .containsExactly("2014/02/11/07");
    }

    @Test
    void eachIterationRestarts() {
        PartitionEnumerator e = PartitionEnumerator.enumerate(
                "%Y/%m/%d", Instant.parse("2014-02-27T00:00:00Z"), Instant.parse("2014-03-02T00:00:00Z"));
        Iterator<String> first = e.iterator();
        first.next();
        first.next();

        List<String> again = new ArrayList<>();
        e.forEach(again::add);
        assertThat(again).containsExactly("2014/02/27", "2014/02/28", "2014/03/01");
    }

    @Test
    void startAfterEndIsRejected() {
        ConfigException e = assertThrows(
                ConfigException.class,
                () -> PartitionEnumerator.enumerate(
                        "%Y", Instant.parse("2010-01-11T00:00:00Z"), Instant.parse("2010-01-10T00:00:00Z")));
        assertThat(e).hasMessageContaining("start");
    }

    @Test
    void invalidPatternIsRejectedEagerly() {
        Instant start = Instant.parse("2010-01-01T00:00:00Z");
        Instant end = Instant.parse("2010-01-10T00:00:00Z");

        PatternException e =
                assertThrows(PatternException.class, () -> PartitionEnumerator.enumerate("my_pattern%", start, end));
        assertThat(e).hasMessage("unexpected \"%\" at char 11");
    }

    @Test
    void outOfOrderPatternIsRejected() {
        Instant start = Instant.parse("2014-05-02T00:00:00Z");
        Instant end = Instant.parse("2014-05-04T00:00:00Z");

        PatternException e =
                assertThrows(PatternException.class, () -> PartitionEnumerator.enumerate("%d/%m/%Y", start, end));
        assertThat(e).hasMessage("\"%m\" must appear before \"%d\"");
    }
}
