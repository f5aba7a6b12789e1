package com.trailledger.activity.model;

/**
 * An activity in a person's history together with that person's participation.
 */
public record ActivityEntry(Activity activity, Participation participation) {}
