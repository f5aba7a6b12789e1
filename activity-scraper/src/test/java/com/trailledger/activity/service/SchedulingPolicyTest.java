package com.trailledger.activity.service;

import com.trailledger.activity.model.Activity;
import com.trailledger.activity.model.ActivityStatus;
import com.trailledger.activity.model.TimeStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulingPolicyTest {

    private final SchedulingPolicy policy = new SchedulingPolicy();

    private static final LocalDate END = LocalDate.of(2024, 7, 14);

    @Test
    void futureActivityIsCheckedTwiceADay() {
        LocalDateTime now = LocalDateTime.of(2024, 7, 1, 9, 30);

        assertThat(policy.nextScrapeDue(ActivityStatus.FUTURE, END, now)).contains(now.plusHours(12));
    }

    @Test
    void pastActivityBacksOffThenStops() {
        LocalDateTime base = END.atStartOfDay();

        assertThat(policy.nextScrapeDue(ActivityStatus.PAST, END, base.plusDays(2))).contains(base.plusDays(3));
        assertThat(policy.nextScrapeDue(ActivityStatus.PAST, END, base.plusDays(30))).contains(base.plusDays(37));
        assertThat(policy.nextScrapeDue(ActivityStatus.PAST, END, base.plusDays(200))).contains(base.plusDays(230));
        assertThat(policy.nextScrapeDue(ActivityStatus.PAST, END, base.plusDays(400))).isEmpty();
    }

    @Test
    void closedActivityWaitsTwiceTheElapsedTime() {
        LocalDateTime base = END.atStartOfDay();

        assertThat(policy.nextScrapeDue(ActivityStatus.CLOSED, END, base.plusDays(1))).contains(base.plusDays(3));
        assertThat(policy.nextScrapeDue(ActivityStatus.CLOSED, END, base.plusDays(3))).contains(base.plusDays(9));
    }

    @Test
    void closedActivityWaitsAtLeastSixHours() {
        LocalDateTime now = END.atStartOfDay().plusHours(1);

        assertThat(policy.nextScrapeDue(ActivityStatus.CLOSED, END, now)).contains(now.plusHours(6));
    }

    @Test
    void closedActivitySettlesAfterAQuarter() {
        LocalDateTime base = END.atStartOfDay();

        assertThat(policy.nextScrapeDue(ActivityStatus.CLOSED, END, base.plusDays(30))).contains(base.plusDays(51));
        assertThat(policy.nextScrapeDue(ActivityStatus.CLOSED, END, base.plusDays(100))).isEmpty();
    }

    @Test
    void scheduleNeverMovesBackwardsAsTimePasses() {
        for (ActivityStatus status : new ActivityStatus[]{ActivityStatus.PAST, ActivityStatus.CLOSED}) {
            LocalDateTime previous = null;
            for (int hour = 0; hour < 24 * 400; hour++) {
                Optional<LocalDateTime> next = policy.nextScrapeDue(status, END, END.atStartOfDay().plusHours(hour));
                if (next.isEmpty()) {
                    break;
                }
                if (previous != null) {
                    assertThat(next.get()).as("%s at hour %d", status, hour).isAfterOrEqualTo(previous);
                }
                previous = next.get();
            }
        }
    }

    @Test
    void nextScrapeIsAlwaysInTheFuture() {
        LocalDateTime now = END.atStartOfDay().plusDays(5);
        for (ActivityStatus status : ActivityStatus.values()) {
            policy.nextScrapeDue(status, END, now).ifPresent(next -> assertThat(next).isAfter(now));
        }
    }

    @Test
    void activityOverloadReadsStatusAndEndDate() {
        Activity activity = Activity.builder().status(ActivityStatus.PAST).dateEnd(END).build();
        LocalDateTime now = END.atStartOfDay().plusDays(2);

        assertThat(policy.nextScrapeDue(activity, now)).isEqualTo(policy.nextScrapeDue(ActivityStatus.PAST, END, now));
    }

    @Test
    void timeStatusFollowsTheCalendar() {
        Activity activity = Activity.builder()
                .dateStart(LocalDate.of(2024, 7, 13))
                .dateEnd(END)
                .build();

        assertThat(policy.timeStatus(activity, LocalDateTime.of(2024, 7, 12, 23, 0))).isEqualTo(TimeStatus.FUTURE);
        assertThat(policy.timeStatus(activity, LocalDateTime.of(2024, 7, 13, 0, 0))).isEqualTo(TimeStatus.CURRENT);
        assertThat(policy.timeStatus(activity, LocalDateTime.of(2024, 7, 14, 18, 0))).isEqualTo(TimeStatus.CURRENT);
        assertThat(policy.timeStatus(activity, LocalDateTime.of(2024, 7, 15, 0, 1))).isEqualTo(TimeStatus.PAST);
    }
}
