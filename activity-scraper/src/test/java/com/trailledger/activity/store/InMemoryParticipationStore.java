package com.trailledger.activity.store;

import com.trailledger.activity.model.Activity;
import com.trailledger.activity.model.ActivityEntry;
import com.trailledger.activity.model.Participation;
import com.trailledger.activity.model.Person;
import com.trailledger.activity.model.RosterEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Map-backed store for service tests. Hands out copies so callers never share
 * state with the store, and rolls back to a snapshot when a transaction throws.
 */
public class InMemoryParticipationStore implements ParticipationStore {

    private Map<String, Person> people = new LinkedHashMap<>();
    private Map<String, Activity> activities = new LinkedHashMap<>();
    private Map<String, Participation> participations = new LinkedHashMap<>();

    private int transactions;
    private int rollbacks;

    @Override
    public void ensureSchema() {
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        transactions++;
        Map<String, Person> savedPeople = copyPeople(people);
        Map<String, Activity> savedActivities = copyActivities(activities);
        Map<String, Participation> savedParticipations = copyParticipations(participations);
        try {
            return work.get();
        } catch (RuntimeException e) {
            people = savedPeople;
            activities = savedActivities;
            participations = savedParticipations;
            rollbacks++;
            throw e;
        }
    }

    public int getTransactions() {
        return transactions;
    }

    public int getRollbacks() {
        return rollbacks;
    }

    @Override
    public Optional<Person> findPersonByUrl(String profileUrl) {
        return Optional.ofNullable(people.get(profileUrl)).map(p -> p.toBuilder().build());
    }

    @Override
    public Optional<Person> findPersonByUsername(String userName) {
        if (userName == null || userName.isBlank()) return Optional.empty();
        return people.values().stream()
                .filter(p -> userName.equals(p.getUserName()))
                .findFirst()
                .map(p -> p.toBuilder().build());
    }

    @Override
    public Person createPerson(Person person) {
        if (people.containsKey(person.getProfileUrl())) {
            throw new StoreIntegrityException("Person already exists: " + person.getProfileUrl());
        }
        checkUserName(person);
        people.put(person.getProfileUrl(), person.toBuilder().build());
        return person;
    }

    @Override
    public Person updatePerson(Person person) {
        if (!people.containsKey(person.getProfileUrl())) {
            throw new StoreIntegrityException("No person with profile " + person.getProfileUrl());
        }
        checkUserName(person);
        people.put(person.getProfileUrl(), person.toBuilder().build());
        return person;
    }

    @Override
    public Optional<Activity> findActivityByUrl(String activityUrl) {
        return Optional.ofNullable(activities.get(activityUrl)).map(a -> a.toBuilder().build());
    }

    @Override
    public Activity createActivity(Activity activity) {
        if (activities.containsKey(activity.getActivityUrl())) {
            throw new StoreIntegrityException("Activity already exists: " + activity.getActivityUrl());
        }
        activities.put(activity.getActivityUrl(), activity.toBuilder().build());
        return activity;
    }

    @Override
    public Activity updateActivity(Activity activity) {
        if (!activities.containsKey(activity.getActivityUrl())) {
            throw new StoreIntegrityException("No activity " + activity.getActivityUrl());
        }
        activities.put(activity.getActivityUrl(), activity.toBuilder().build());
        return activity;
    }

    @Override
    public Optional<Participation> findParticipation(String profileUrl, String activityUrl) {
        return Optional.ofNullable(participations.get(key(profileUrl, activityUrl))).map(m -> m.toBuilder().build());
    }

    @Override
    public Participation createParticipation(Participation m) {
        String key = key(m.getProfileUrl(), m.getActivityUrl());
        if (participations.containsKey(key)) {
            throw new StoreIntegrityException("Participation already exists: " + key);
        }
        if (!people.containsKey(m.getProfileUrl()) || !activities.containsKey(m.getActivityUrl())) {
            throw new StoreIntegrityException("Unknown person or activity: " + key);
        }
        participations.put(key, m.toBuilder().build());
        return m;
    }

    @Override
    public Participation updateParticipation(Participation m) {
        String key = key(m.getProfileUrl(), m.getActivityUrl());
        if (!participations.containsKey(key)) {
            throw new StoreIntegrityException("No participation for " + key);
        }
        participations.put(key, m.toBuilder().build());
        return m;
    }

    @Override
    public boolean removeParticipation(String profileUrl, String activityUrl) {
        return participations.remove(key(profileUrl, activityUrl)) != null;
    }

    @Override
    public List<ActivityEntry> listParticipationsForPerson(String profileUrl) {
        List<ActivityEntry> result = new ArrayList<>();
        for (Participation m : participations.values()) {
            if (m.getProfileUrl().equals(profileUrl)) {
                result.add(new ActivityEntry(activities.get(m.getActivityUrl()).toBuilder().build(),
                        m.toBuilder().build()));
            }
        }
        result.sort(Comparator.comparing((ActivityEntry e) -> e.activity().getDateStart(),
                        Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(e -> e.activity().getActivityUrl()));
        return result;
    }

    @Override
    public List<RosterEntry> listRoster(String activityUrl) {
        List<RosterEntry> result = new ArrayList<>();
        for (Participation m : participations.values()) {
            if (m.getActivityUrl().equals(activityUrl)) {
                result.add(new RosterEntry(people.get(m.getProfileUrl()).toBuilder().build(),
                        m.toBuilder().build()));
            }
        }
        result.sort(Comparator.comparing((RosterEntry e) -> e.person().getFullName(),
                        Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(e -> e.person().getProfileUrl()));
        return result;
    }

    private void checkUserName(Person person) {
        String userName = person.getUserName();
        if (userName == null || userName.isBlank()) return;
        for (Person other : people.values()) {
            if (userName.equals(other.getUserName()) && !other.getProfileUrl().equals(person.getProfileUrl())) {
                throw new StoreIntegrityException("User name already taken: " + userName);
            }
        }
    }

    private static String key(String profileUrl, String activityUrl) {
        return profileUrl + "|" + activityUrl;
    }

    private static Map<String, Person> copyPeople(Map<String, Person> source) {
        Map<String, Person> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, v.toBuilder().build()));
        return copy;
    }

    private static Map<String, Activity> copyActivities(Map<String, Activity> source) {
        Map<String, Activity> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, v.toBuilder().build()));
        return copy;
    }

    private static Map<String, Participation> copyParticipations(Map<String, Participation> source) {
        Map<String, Participation> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, v.toBuilder().build()));
        return copy;
    }
}
