package com.trailledger.activity.source;

import com.trailledger.activity.model.ActivityStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Full detail of one activity as read from its page, roster in page order.
 */
@Value
@Builder
public class ActivitySnapshot {

    LocalDate dateStart;
    LocalDate dateEnd;
    String name;
    String committee;
    String branch;
    String activityType;
    String difficulty;
    String leaderRating;
    String mileage;
    String routeName;
    String routeUrl;
    ActivityStatus status;
    String result;

    @Singular
    List<ParticipantSnapshot> participants;
}
