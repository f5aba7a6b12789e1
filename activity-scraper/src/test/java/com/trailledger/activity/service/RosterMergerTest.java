package com.trailledger.activity.service;

import com.trailledger.activity.model.Activity;
import com.trailledger.activity.model.Participation;
import com.trailledger.activity.model.Person;
import com.trailledger.activity.model.RosterEntry;
import com.trailledger.activity.source.ParticipantSnapshot;
import com.trailledger.activity.store.InMemoryParticipationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RosterMergerTest {

    private static final String ACTIVITY = "https://club.example/activities/rainier";
    private static final String A = "https://club.example/members/alice";
    private static final String B = "https://club.example/members/bob";
    private static final String C = "https://club.example/members/carol";
    private static final String D = "https://club.example/members/dave";

    private InMemoryParticipationStore store;
    private RosterMerger merger;

    @BeforeEach
    void setUp() {
        store = new InMemoryParticipationStore();
        merger = new RosterMerger(store);
        store.createActivity(Activity.builder().activityUrl(ACTIVITY).name("Mount Rainier").build());
    }

    @Test
    void updatesAddsAndRemovesParticipants() {
        seed(A, "Alice", "Leader");
        seed(B, "Bob", "Participant");
        seed(C, "Carol", "Participant");

        MergeStats stats = merger.merge(ACTIVITY, List.of(
                participant(A, "Alice", "Co-Leader"),
                participant(D, "Dave", "Participant")));

        assertThat(stats).isEqualTo(new MergeStats(1, 1, 2, 1));
        assertThat(store.listRoster(ACTIVITY))
                .extracting(e -> e.person().getProfileUrl(), e -> e.participation().getRole())
                .containsExactly(tuple(A, "Co-Leader"), tuple(D, "Participant"));
    }

    @Test
    void newParticipantBecomesStubPerson() {
        merger.merge(ACTIVITY, List.of(participant(D, "Dave", "Participant")));

        Person dave = store.findPersonByUrl(D).orElseThrow();
        assertThat(dave.isScraped()).isFalse();
        assertThat(dave.getFullName()).isEqualTo("Dave");
        assertThat(dave.getLastScraped()).isNull();
    }

    @Test
    void removedParticipantKeepsTheirPerson() {
        seed(B, "Bob", "Participant");

        merger.merge(ACTIVITY, List.of());

        assertThat(store.listRoster(ACTIVITY)).isEmpty();
        assertThat(store.findPersonByUrl(B)).isPresent();
        assertThat(store.findParticipation(B, ACTIVITY)).isEmpty();
    }

    @Test
    void mergingTheSameRosterTwiceChangesNothing() {
        List<ParticipantSnapshot> roster = List.of(
                participant(A, "Alice", "Leader"),
                participant(D, "Dave", "Participant"));
        merger.merge(ACTIVITY, roster);
        List<RosterEntry> first = store.listRoster(ACTIVITY);

        MergeStats second = merger.merge(ACTIVITY, roster);

        assertThat(second).isEqualTo(new MergeStats(0, 2, 0, 0));
        assertThat(store.listRoster(ACTIVITY)).isEqualTo(first);
    }

    @Test
    void resultDependsOnlyOnTheScrapedRoster() {
        List<ParticipantSnapshot> roster = List.of(
                participant(A, "Alice", "Leader"),
                participant(C, "Carol", "Participant"));

        merger.merge(ACTIVITY, roster);
        List<RosterEntry> fromEmpty = store.listRoster(ACTIVITY);

        InMemoryParticipationStore other = new InMemoryParticipationStore();
        other.createActivity(Activity.builder().activityUrl(ACTIVITY).build());
        RosterMerger otherMerger = new RosterMerger(other);
        otherMerger.merge(ACTIVITY, List.of(
                participant(A, "Alice", "Participant"),
                participant(B, "Bob", "Leader")));
        otherMerger.merge(ACTIVITY, roster);

        assertThat(other.listRoster(ACTIVITY))
                .extracting(RosterEntry::participation)
                .isEqualTo(fromEmpty.stream().map(RosterEntry::participation).toList());
    }

    @Test
    void canceledFlagAndResultsAreCopied() {
        merger.merge(ACTIVITY, List.of(
                new ParticipantSnapshot(A, "Alice", "Participant", true, "Canceled", "Canceled")));

        Participation alice = store.findParticipation(A, ACTIVITY).orElseThrow();
        assertThat(alice.isCanceled()).isTrue();
        assertThat(alice.getRegistration()).isEqualTo("Canceled");
        assertThat(alice.getMemberResult()).isEqualTo("Canceled");
    }

    private void seed(String profileUrl, String name, String role) {
        store.createPerson(Person.stub(profileUrl, name));
        store.createParticipation(Participation.builder()
                .profileUrl(profileUrl)
                .activityUrl(ACTIVITY)
                .role(role)
                .registration("Registered")
                .memberResult("Successful")
                .build());
    }

    private static ParticipantSnapshot participant(String profileUrl, String name, String role) {
        return new ParticipantSnapshot(profileUrl, name, role, false, "Registered", "Successful");
    }
}
