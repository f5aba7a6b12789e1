package com.trailledger.activity.service;

import com.trailledger.activity.model.Activity;
import com.trailledger.activity.model.Person;
import com.trailledger.activity.model.TimeStatus;
import com.trailledger.activity.source.ActivitySnapshot;
import com.trailledger.activity.source.ActivityStub;
import com.trailledger.activity.source.ProfileSnapshot;
import com.trailledger.activity.source.ScrapeException;
import com.trailledger.activity.source.SourceAdapter;
import com.trailledger.activity.source.SourceSession;
import com.trailledger.activity.store.ParticipationStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Drives the scrape cycle for one person: profile freshness, activity
 * discovery, due-ness, detail fetch and roster merge.
 *
 * Single-threaded and synchronous. An engine owns its adapter session for the
 * length of one invocation and must not be shared. Each activity is committed
 * on its own, so a failure part way through a person's list leaves the
 * activities already processed in place.
 */
@Slf4j
public class ScrapeEngine {

    private static final int MAX_ERROR_LENGTH = 200;

    private final SourceAdapter adapter;
    private final ParticipationStore store;
    private final EngineSettings settings;
    private final SchedulingPolicy policy;
    private final RetryingFetcher fetcher;
    private final RosterMerger merger;
    private final Clock clock;

    @Getter
    private boolean forceFutureRescan;

    private SourceSession session;

    /** The logged-in person, set by {@link #login()}. */
    @Getter
    private Person loginPerson;

    public ScrapeEngine(SourceAdapter adapter, ParticipationStore store, EngineSettings settings,
                        SchedulingPolicy policy, RetryingFetcher fetcher, Clock clock) {
        this.adapter = adapter;
        this.store = store;
        this.settings = settings;
        this.policy = policy;
        this.fetcher = fetcher;
        this.merger = new RosterMerger(store);
        this.clock = clock;
    }

    /** Re-fetch every activity that has not started yet, whatever its schedule says. */
    public void setForceFutureRescan(boolean forceFutureRescan) {
        this.forceFutureRescan = forceFutureRescan;
    }

    /**
     * Logs in and makes sure the logged-in user's own profile is current.
     */
    public void login() {
        session = adapter.login(settings.userName(), settings.password());
        log.info("Logged in as {}", session.userName());

        Person known = store.findPersonByUsername(settings.userName()).orElse(null);
        if (known == null || isStale(known)) {
            ProfileSnapshot profile = adapter.fetchCurrentProfile();
            loginPerson = store.inTransaction(() -> saveProfile(known, profile, settings.userName()));
            log.info("Refreshed own profile {}", loginPerson.getProfileUrl());
        } else {
            loginPerson = known;
        }
    }

    /**
     * Runs the full cycle for one person.
     *
     * @param profileUrl the person to scrape; null or blank for the logged-in user
     */
    public ScrapeReport scrapeProfile(String profileUrl) {
        requireLogin();
        String targetUrl = profileUrl == null || profileUrl.isBlank() ? loginPerson.getProfileUrl() : profileUrl;

        Person target = resolveTarget(targetUrl);
        List<ActivityStub> stubs = adapter.fetchMemberActivityStubs(target.getProfileUrl());
        log.info("{}: {} activities listed", target.getFullName(), stubs.size());

        ScrapeReport report = new ScrapeReport();
        for (ActivityStub stub : stubs) {
            processStub(target, stub, report);
        }

        log.info("Scrape of {} complete: {}", target.getProfileUrl(), report);
        return report;
    }

    /**
     * Fetches and merges one activity that is already stored, regardless of its schedule.
     */
    public MergeStats updateSingleActivity(String activityUrl) {
        requireLogin();
        Activity activity = store.findActivityByUrl(activityUrl)
                .orElseThrow(() -> new IllegalArgumentException("Unknown activity: " + activityUrl));
        return refresh(activity);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void processStub(Person target, ActivityStub stub, ScrapeReport report) {
        String url = stub.activityUrl();
        Optional<Activity> stored = store.findActivityByUrl(url);

        if (stored.isEmpty()) {
            if (stub.canceled()) {
                // Never recorded, nothing to cancel
                report.activityUnchanged();
                return;
            }
            log.info("{}: {}", stub.registration(), url);
            log.info("  Creating");
            ActivitySnapshot detail = fetcher.fetch(url, () -> adapter.fetchActivityDetail(url));
            log.info("  {}: {} {}", detail.getName(), detail.getStatus(), detail.getResult());
            store.inTransaction(() -> create(url, detail));
            report.activityCreated();
            return;
        }

        Activity activity = stored.get();
        if (stub.canceled()) {
            boolean removed = store.inTransaction(() -> store.removeParticipation(target.getProfileUrl(), url));
            if (removed) {
                log.info("{}: {}", stub.registration(), url);
                log.info("  Canceled from activity");
                report.participationCanceled();
            } else {
                report.activityUnchanged();
            }
            return;
        }

        if (isDue(activity)) {
            log.info("{}: {}", stub.registration(), url);
            log.info("  Updating");
            refresh(activity);
            report.activityUpdated();
        } else {
            report.activityUnchanged();
        }
    }

    private boolean isDue(Activity activity) {
        LocalDateTime now = now();
        boolean scheduled = activity.getNextScrape() != null && !activity.getNextScrape().isAfter(now);
        return scheduled || (forceFutureRescan && policy.timeStatus(activity, now) == TimeStatus.FUTURE);
    }

    private MergeStats create(String url, ActivitySnapshot detail) {
        Activity activity = Activity.builder().activityUrl(url).build();
        apply(activity, detail);
        store.createActivity(activity);
        return merger.merge(url, detail.getParticipants());
    }

    private MergeStats refresh(Activity activity) {
        String url = activity.getActivityUrl();
        ActivitySnapshot detail;
        try {
            detail = fetcher.fetch(url, () -> adapter.fetchActivityDetail(url));
        } catch (ScrapeException e) {
            recordFailure(activity, e);
            throw e;
        }

        return store.inTransaction(() -> {
            apply(activity, detail);
            store.updateActivity(activity);
            return merger.merge(url, detail.getParticipants());
        });
    }

    /** Copies the snapshot onto the activity and schedules the next fetch. */
    private void apply(Activity activity, ActivitySnapshot detail) {
        LocalDateTime now = now();
        activity.setDateStart(detail.getDateStart());
        activity.setDateEnd(detail.getDateEnd());
        activity.setName(detail.getName());
        activity.setCommittee(detail.getCommittee());
        activity.setBranch(detail.getBranch());
        activity.setActivityType(detail.getActivityType());
        activity.setDifficulty(detail.getDifficulty());
        activity.setLeaderRating(detail.getLeaderRating());
        activity.setMileage(detail.getMileage());
        activity.setRouteName(detail.getRouteName());
        activity.setRouteUrl(detail.getRouteUrl());
        activity.setStatus(detail.getStatus());
        activity.setResult(detail.getResult());
        activity.setScrapedAt(now);
        activity.setNextScrape(policy.nextScrapeDue(activity, now).orElse(null));
        activity.clearScrapeError();
    }

    private void recordFailure(Activity activity, ScrapeException error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        if (message.length() > MAX_ERROR_LENGTH) {
            message = message.substring(0, MAX_ERROR_LENGTH);
        }
        activity.recordScrapeError(message, now());
        try {
            store.inTransaction(() -> store.updateActivity(activity));
        } catch (RuntimeException e) {
            error.addSuppressed(e);
            log.warn("Could not record scrape error on {}: {}", activity.getActivityUrl(), e.getMessage());
        }
    }

    private Person resolveTarget(String profileUrl) {
        Person known = store.findPersonByUrl(profileUrl).orElse(null);
        if (known != null && !isStale(known)) {
            return known;
        }
        ProfileSnapshot profile = adapter.fetchProfile(profileUrl);
        return store.inTransaction(() -> saveProfile(known, profile, null));
    }

    /**
     * Creates or refreshes a fully scraped person. A stub already stored under
     * the profile URL is promoted rather than duplicated.
     *
     * When the login user's profile has moved to a new URL, the user name is
     * taken off the old record and the person stored at the new URL carries it.
     */
    private Person saveProfile(Person known, ProfileSnapshot profile, String userName) {
        Person person = known;
        if (known != null && !known.getProfileUrl().equals(profile.profileUrl())) {
            log.warn("Profile of {} moved from {} to {}", known.getUserName(), known.getProfileUrl(),
                    profile.profileUrl());
            if (userName != null) {
                known.setUserName(null);
                store.updatePerson(known);
            }
            person = null;
        }
        if (person == null) {
            person = store.findPersonByUrl(profile.profileUrl()).orElse(null);
        }
        boolean isNew = person == null;
        if (isNew) {
            person = Person.builder().profileUrl(profile.profileUrl()).build();
        }

        if (userName != null) {
            person.setUserName(userName);
        }
        person.setFullName(profile.fullName());
        person.setPortraitUrl(profile.portraitUrl());
        person.setEmail(profile.email());
        person.setBranch(profile.branch());
        person.setScraped(true);
        person.setLastScraped(now());

        return isNew ? store.createPerson(person) : store.updatePerson(person);
    }

    private boolean isStale(Person person) {
        return person.getLastScraped() == null
                || person.getLastScraped().isBefore(now().minus(settings.profileRefreshInterval()));
    }

    private void requireLogin() {
        if (session == null || loginPerson == null) {
            throw new IllegalStateException("login() must be called first");
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
