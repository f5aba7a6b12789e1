package com.trailledger.activity.store;

import com.trailledger.activity.model.Activity;
import com.trailledger.activity.model.ActivityEntry;
import com.trailledger.activity.model.Participation;
import com.trailledger.activity.model.Person;
import com.trailledger.activity.model.RosterEntry;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable storage for people, activities and their participations.
 *
 * Implementations enforce uniqueness of {@code profileUrl}, {@code userName}
 * (when set) and {@code activityUrl}, and of one participation per
 * (person, activity) pair. Creating a duplicate, or updating a row that does
 * not exist, raises {@link StoreIntegrityException}.
 */
public interface ParticipationStore {

    /** Creates tables, indexes or constraints if they are missing. */
    void ensureSchema();

    /**
     * Runs {@code work} as one unit: either all of its writes commit or none do.
     * Exceptions thrown by {@code work} roll back and propagate unchanged.
     */
    <T> T inTransaction(Supplier<T> work);

    default void inTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    // ── People ───────────────────────────────────────────────────────────────

    Optional<Person> findPersonByUrl(String profileUrl);

    Optional<Person> findPersonByUsername(String userName);

    Person createPerson(Person person);

    Person updatePerson(Person person);

    // ── Activities ───────────────────────────────────────────────────────────

    Optional<Activity> findActivityByUrl(String activityUrl);

    Activity createActivity(Activity activity);

    Activity updateActivity(Activity activity);

    // ── Participations ───────────────────────────────────────────────────────

    Optional<Participation> findParticipation(String profileUrl, String activityUrl);

    Participation createParticipation(Participation participation);

    Participation updateParticipation(Participation participation);

    /** @return whether a participation was removed */
    boolean removeParticipation(String profileUrl, String activityUrl);

    /** The person's activities ordered by start date, earliest first. */
    List<ActivityEntry> listParticipationsForPerson(String profileUrl);

    /** Everyone on the activity's roster, ordered by name. */
    List<RosterEntry> listRoster(String activityUrl);
}
