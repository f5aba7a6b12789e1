package com.trailledger.activity.model;

/**
 * A participant on an activity's roster.
 */
public record RosterEntry(Person person, Participation participation) {}
