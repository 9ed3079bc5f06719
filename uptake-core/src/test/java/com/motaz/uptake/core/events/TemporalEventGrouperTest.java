package com.motaz.uptake.core.events;

import com.motaz.uptake.core.model.LabeledPoint;
import com.motaz.uptake.core.model.TemporalEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TemporalEventGrouperTest {

    private static final LocalDate D0 = LocalDate.of(2022, 3, 7);

    private static LabeledPoint at(int day, String label) {
        return LabeledPoint.of(D0.plusDays(day), label);
    }

    @Nested
    @DisplayName("Gap of at most 7 days")
    class WithinDays {

        private final TemporalEventGrouper grouper = new TemporalEventGrouper(ContinuityRule.withinDays(7));

        @Test
        void weeklyRun_isOneEvent() {
            List<TemporalEvent> events = grouper.group(List.of(
                    at(0, "promotion"), at(7, "promotion"), at(14, "promotion")));

            assertThat(events).containsExactly(new TemporalEvent("promotion", D0, D0.plusDays(14), 3));
        }

        @Test
        void eightDayGap_splitsIntoTwo() {
            List<TemporalEvent> events = grouper.group(List.of(
                    at(0, "supply_issue"), at(7, "supply_issue"), at(15, "supply_issue")));

            assertThat(events).hasSize(2);
            assertThat(events.get(0).getEnd()).isEqualTo(D0.plusDays(7));
            assertThat(events.get(1).getStart()).isEqualTo(D0.plusDays(15));
        }

        @Test
        void shorterGap_continues() {
            List<TemporalEvent> events = grouper.group(List.of(at(0, "promotion"), at(5, "promotion")));

            assertThat(events).hasSize(1);
            assertThat(events.get(0).spanDays()).isEqualTo(5);
        }

        @Test
        void labelChange_startsNewEvent() {
            List<TemporalEvent> events = grouper.group(List.of(
                    at(0, "supply_issue"), at(7, "competitor_entry"), at(14, "competitor_entry")));

            assertThat(events).extracting(TemporalEvent::getLabel)
                    .containsExactly("supply_issue", "competitor_entry");
            assertThat(events.get(1).getPointCount()).isEqualTo(2);
        }

        @Test
        void inactiveLabel_closesEvent() {
            List<TemporalEvent> events = grouper.group(List.of(
                    at(0, "promotion"), at(7, "none"), at(14, "promotion"), at(21, "none"), at(28, "none")));

            assertThat(events).hasSize(2);
            assertThat(events).allSatisfy(e -> assertThat(e.getPointCount()).isEqualTo(1));
        }

        @Test
        void openEventAtEnd_isEmitted() {
            List<TemporalEvent> events = grouper.group(List.of(at(0, "none"), at(7, "promotion")));

            assertThat(events).containsExactly(new TemporalEvent("promotion", D0.plusDays(7), D0.plusDays(7), 1));
        }

        @Test
        void nothingActive_yieldsNoEvents() {
            assertThat(grouper.group(List.of(at(0, "none"), at(7, "none")))).isEmpty();
            assertThat(grouper.group(List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Gap of exactly 7 days")
    class ExactCadence {

        private final TemporalEventGrouper grouper = new TemporalEventGrouper(ContinuityRule.exactCadence(7));

        @Test
        void missingWeek_endsEvent() {
            List<TemporalEvent> events = grouper.group(List.of(
                    at(0, "anomaly"), at(7, "anomaly"), at(21, "anomaly"), at(28, "anomaly")));

            assertThat(events).hasSize(2);
            assertThat(events).extracting(TemporalEvent::getPointCount).containsExactly(2, 2);
        }

        @Test
        void eightDayGap_endsEventLikeFourteen() {
            List<TemporalEvent> events = grouper.group(List.of(at(0, "anomaly"), at(8, "anomaly")));

            assertThat(events).hasSize(2);
        }

        @Test
        void shorterGap_alsoEndsEvent() {
            List<TemporalEvent> exact = grouper.group(List.of(at(0, "anomaly"), at(5, "anomaly")));
            List<TemporalEvent> lenient = new TemporalEventGrouper(ContinuityRule.withinDays(7))
                    .group(List.of(at(0, "anomaly"), at(5, "anomaly")));

            assertThat(exact).hasSize(2);
            assertThat(lenient).hasSize(1);
        }
    }
}
