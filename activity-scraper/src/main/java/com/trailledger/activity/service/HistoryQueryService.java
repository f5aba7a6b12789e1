package com.trailledger.activity.service;

import com.trailledger.activity.model.Activity;
import com.trailledger.activity.model.ActivityEntry;
import com.trailledger.activity.model.Person;
import com.trailledger.activity.model.RosterEntry;
import com.trailledger.activity.model.ScrapeRun;
import com.trailledger.activity.store.ParticipationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Answers questions about a person's stored participation history.
 *
 * The person is picked by profile URL, or by user name when no URL is given.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HistoryQueryService {

    private final ParticipationStore store;
    private final ScrapeService scrapeService;

    public record Companion(Person person, List<Activity> sharedActivities) {}

    public record WhoWith(Person person, List<Activity> activitiesOnDate, List<Companion> companions) {}

    /**
     * @param refresh the run that re-fetched the activity, null when no refresh was asked for
     */
    public record TripStatus(Activity activity, List<RosterEntry> roster, ScrapeRun refresh) {}

    public Person selectPerson(String profileUrl, String userName) {
        if (profileUrl != null && !profileUrl.isBlank()) {
            return store.findPersonByUrl(profileUrl)
                    .orElseThrow(() -> new IllegalArgumentException("No person with profile " + profileUrl));
        }
        if (userName != null && !userName.isBlank()) {
            return store.findPersonByUsername(userName)
                    .orElseThrow(() -> new IllegalArgumentException("No person with user name " + userName));
        }
        throw new IllegalArgumentException("Must provide either a profile URL or a user name");
    }

    /**
     * Everything the person did, earliest first, optionally limited to one activity type.
     */
    public List<ActivityEntry> whatDid(String profileUrl, String userName, String activityType) {
        Person person = selectPerson(profileUrl, userName);
        return store.listParticipationsForPerson(person.getProfileUrl()).stream()
                .filter(e -> activityType == null || activityType.isBlank()
                        || activityType.equals(e.activity().getActivityType()))
                .toList();
    }

    /**
     * Activities whose name contains the phrase, ignoring case.
     */
    public List<ActivityEntry> didDo(String profileUrl, String userName, String phrase) {
        if (phrase == null || phrase.isBlank()) {
            throw new IllegalArgumentException("A phrase is required");
        }
        Person person = selectPerson(profileUrl, userName);
        String needle = phrase.toLowerCase(Locale.ROOT);
        return store.listParticipationsForPerson(person.getProfileUrl()).stream()
                .filter(e -> e.activity().getName() != null
                        && e.activity().getName().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    /**
     * Who the person was out with on a date, and every other activity they shared with each of them.
     */
    public WhoWith whoWith(String profileUrl, String userName, LocalDate date) {
        Person person = selectPerson(profileUrl, userName);
        List<ActivityEntry> history = store.listParticipationsForPerson(person.getProfileUrl());

        List<Activity> onDate = activitiesOn(history, date);

        // profile URL -> companion, with the activities shared across the whole history
        Map<String, Person> companions = new LinkedHashMap<>();
        for (Activity activity : onDate) {
            for (RosterEntry entry : store.listRoster(activity.getActivityUrl())) {
                String url = entry.person().getProfileUrl();
                if (!url.equals(person.getProfileUrl())) {
                    companions.putIfAbsent(url, entry.person());
                }
            }
        }

        Map<String, List<Activity>> shared = new LinkedHashMap<>();
        for (ActivityEntry entry : history) {
            for (RosterEntry rosterEntry : store.listRoster(entry.activity().getActivityUrl())) {
                String url = rosterEntry.person().getProfileUrl();
                if (companions.containsKey(url)) {
                    shared.computeIfAbsent(url, k -> new ArrayList<>()).add(entry.activity());
                }
            }
        }

        List<Companion> result = companions.values().stream()
                .sorted(Comparator.comparing(Person::getFullName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)))
                .map(p -> new Companion(p, shared.getOrDefault(p.getProfileUrl(), List.of())))
                .toList();

        log.debug("{} on {}: {} activities, {} companions", person.getFullName(), date, onDate.size(), result.size());
        return new WhoWith(person, onDate, result);
    }

    /**
     * Full detail and roster of the person's activities on a date.
     * Each entry carries the refresh run for its activity, so a SKIPPED or
     * FAILED refresh shows that the stored detail may be stale.
     *
     * @param update re-fetch those activities from the source first
     */
    public List<TripStatus> tripStatus(String profileUrl, String userName, LocalDate date, boolean update) {
        Person person = selectPerson(profileUrl, userName);
        List<Activity> onDate = activitiesOn(store.listParticipationsForPerson(person.getProfileUrl()), date);

        // activity URL -> refresh run
        Map<String, ScrapeRun> refreshes = new LinkedHashMap<>();
        if (update && !onDate.isEmpty()) {
            List<ScrapeRun> runs = scrapeService.updateActivities("tripstatus",
                    onDate.stream().map(Activity::getActivityUrl).toList());
            for (ScrapeRun run : runs) {
                refreshes.put(run.getTarget(), run);
                if (!"SUCCESS".equals(run.getStatus())) {
                    log.warn("Refresh of {} was {}: {}, showing stored detail",
                            run.getTarget(), run.getStatus(), run.getErrorMessage());
                }
            }
        }

        List<TripStatus> result = new ArrayList<>();
        for (Activity activity : onDate) {
            Activity current = update
                    ? store.findActivityByUrl(activity.getActivityUrl()).orElse(activity)
                    : activity;
            result.add(new TripStatus(current, store.listRoster(activity.getActivityUrl()),
                    refreshes.get(activity.getActivityUrl())));
        }
        return result;
    }

    private static List<Activity> activitiesOn(List<ActivityEntry> history, LocalDate date) {
        return history.stream()
                .map(ActivityEntry::activity)
                .filter(a -> a.getDateStart() != null && a.getDateEnd() != null)
                .filter(a -> !date.isBefore(a.getDateStart()) && !date.isAfter(a.getDateEnd()))
                .toList();
    }
}
