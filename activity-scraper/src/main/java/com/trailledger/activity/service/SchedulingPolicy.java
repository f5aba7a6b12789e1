package com.trailledger.activity.service;

import com.trailledger.activity.model.Activity;
import com.trailledger.activity.model.ActivityStatus;
import com.trailledger.activity.model.TimeStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Decides when an activity should next be re-fetched.
 *
 * Future activities change often (sign-ups, waitlists) and are checked twice a
 * day. Past activities that the leader has not closed yet are checked at
 * growing intervals and abandoned after a year. Closed activities get a short
 * burst of checks for late edits, then settle.
 */
@Component
public class SchedulingPolicy {

    static final Duration FUTURE_INTERVAL = Duration.ofHours(12);
    static final Duration CLOSED_MIN_INTERVAL = Duration.ofHours(6);

    private static final Duration WEEK = Duration.ofDays(7);
    private static final Duration QUARTER = Duration.ofDays(90);
    private static final Duration YEAR = Duration.ofDays(365);

    /**
     * @param status  lifecycle status reported by the source
     * @param dateEnd last day of the activity
     * @param now     current time
     * @return the next eligible re-fetch time, or empty when the activity is stable
     */
    public Optional<LocalDateTime> nextScrapeDue(ActivityStatus status, LocalDate dateEnd, LocalDateTime now) {
        if (status == ActivityStatus.FUTURE) {
            return Optional.of(now.plus(FUTURE_INTERVAL));
        }

        Duration elapsed = Duration.between(dateEnd.atStartOfDay(), now);

        if (status == ActivityStatus.PAST) {
            if (elapsed.compareTo(WEEK) < 0) return Optional.of(now.plusDays(1));
            if (elapsed.compareTo(QUARTER) < 0) return Optional.of(now.plusDays(7));
            if (elapsed.compareTo(YEAR) < 0) return Optional.of(now.plusDays(30));
            return Optional.empty();
        }

        // CLOSED: double the time since close, at least 6 hours, for the first week
        if (elapsed.compareTo(WEEK) < 0) {
            Duration doubled = elapsed.multipliedBy(2);
            return Optional.of(now.plus(doubled.compareTo(CLOSED_MIN_INTERVAL) > 0 ? doubled : CLOSED_MIN_INTERVAL));
        }
        if (elapsed.compareTo(QUARTER) < 0) return Optional.of(now.plusDays(21));
        return Optional.empty();
    }

    public Optional<LocalDateTime> nextScrapeDue(Activity activity, LocalDateTime now) {
        return nextScrapeDue(activity.getStatus(), activity.getDateEnd(), now);
    }

    /**
     * Calendar position of the activity: FUTURE before its first day, PAST once
     * its last day is over, CURRENT in between.
     */
    public TimeStatus timeStatus(Activity activity, LocalDateTime now) {
        LocalDateTime start = activity.getDateStart().atStartOfDay();
        LocalDateTime end = activity.getDateEnd().atStartOfDay().plusDays(1);

        if (now.isBefore(start)) return TimeStatus.FUTURE;
        if (now.isAfter(end)) return TimeStatus.PAST;
        return TimeStatus.CURRENT;
    }
}
