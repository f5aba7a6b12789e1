package com.trailledger.activity.store;

import com.trailledger.activity.model.Activity;
import com.trailledger.activity.model.ActivityEntry;
import com.trailledger.activity.model.ActivityStatus;
import com.trailledger.activity.model.Participation;
import com.trailledger.activity.model.Person;
import com.trailledger.activity.model.RosterEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational backend: person, activity and participation tables.
 *
 * Participation rows reference person and activity by surrogate id; every
 * public operation addresses rows by natural key and resolves ids in SQL.
 * Runs against PostgreSQL in production and H2 in tests, so the DDL sticks to
 * the syntax both accept. Text columns are unbounded, as graph properties are.
 * Only unique key violations become {@link StoreIntegrityException}.
 */
@Slf4j
@RequiredArgsConstructor
public class TabularParticipationStore implements ParticipationStore {

    private static final String PERSON_COLUMNS =
            "p.profile_url, p.user_name, p.full_name, p.portrait_url, p.email, p.branch, p.is_scraped, p.last_scraped";

    private static final String ACTIVITY_COLUMNS = """
            a.activity_url, a.date_start, a.date_end, a.name, a.committee, a.branch, a.activity_type,
            a.difficulty, a.leader_rating, a.mileage, a.route_name, a.route_url, a.status, a.result,
            a.scraped_at, a.next_scrape, a.scrape_error, a.scrape_error_count, a.scrape_error_time""";

    private static final String PARTICIPATION_COLUMNS =
            "p.profile_url, a.activity_url, m.role, m.is_canceled, m.registration, m.member_result";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    @Override
    public void ensureSchema() {
        log.info("Ensuring relational schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS person
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                profile_url     VARCHAR      NOT NULL,
                user_name       VARCHAR,
                full_name       VARCHAR      DEFAULT '' NOT NULL,
                portrait_url    VARCHAR      DEFAULT '' NOT NULL,
                email           VARCHAR      DEFAULT '' NOT NULL,
                branch          VARCHAR      DEFAULT '' NOT NULL,
                is_scraped      BOOLEAN      DEFAULT FALSE NOT NULL,
                last_scraped    TIMESTAMP,
                CONSTRAINT uq_person_profile_url UNIQUE (profile_url),
                CONSTRAINT uq_person_user_name UNIQUE (user_name)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS activity
            (
                id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                activity_url        VARCHAR      NOT NULL,
                date_start          DATE,
                date_end            DATE,
                name                VARCHAR      DEFAULT '' NOT NULL,
                committee           VARCHAR      DEFAULT '' NOT NULL,
                branch              VARCHAR      DEFAULT '' NOT NULL,
                activity_type       VARCHAR      DEFAULT '' NOT NULL,
                difficulty          VARCHAR      DEFAULT '' NOT NULL,
                leader_rating       VARCHAR      DEFAULT '' NOT NULL,
                mileage             VARCHAR      DEFAULT '' NOT NULL,
                route_name          VARCHAR      DEFAULT '' NOT NULL,
                route_url           VARCHAR      DEFAULT '' NOT NULL,
                status              VARCHAR      DEFAULT '' NOT NULL,
                result              VARCHAR      DEFAULT '' NOT NULL,
                scraped_at          TIMESTAMP,
                next_scrape         TIMESTAMP,
                scrape_error        VARCHAR      DEFAULT '' NOT NULL,
                scrape_error_count  INTEGER      DEFAULT 0 NOT NULL,
                scrape_error_time   TIMESTAMP,
                CONSTRAINT uq_activity_url UNIQUE (activity_url)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS participation
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                person_id       BIGINT NOT NULL REFERENCES person (id) ON DELETE CASCADE,
                activity_id     BIGINT NOT NULL REFERENCES activity (id) ON DELETE CASCADE,
                role            VARCHAR      DEFAULT '' NOT NULL,
                is_canceled     BOOLEAN      DEFAULT FALSE NOT NULL,
                registration    VARCHAR      DEFAULT '' NOT NULL,
                member_result   VARCHAR      DEFAULT '' NOT NULL,
                CONSTRAINT uq_participation_pair UNIQUE (person_id, activity_id)
            )
        """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS ix_activity_date_start ON activity (date_start)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS ix_participation_activity ON participation (activity_id)");

        log.info("Relational schema ready.");
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    // ── People ───────────────────────────────────────────────────────────────

    @Override
    public Optional<Person> findPersonByUrl(String profileUrl) {
        return first(jdbcTemplate.query(
                "SELECT " + PERSON_COLUMNS + " FROM person p WHERE p.profile_url = ?",
                PERSON_MAPPER, profileUrl));
    }

    @Override
    public Optional<Person> findPersonByUsername(String userName) {
        if (isBlank(userName)) return Optional.empty();
        return first(jdbcTemplate.query(
                "SELECT " + PERSON_COLUMNS + " FROM person p WHERE p.user_name = ?",
                PERSON_MAPPER, userName));
    }

    @Override
    public Person createPerson(Person person) {
        try {
            jdbcTemplate.update("""
                INSERT INTO person
                (profile_url, user_name, full_name, portrait_url, email, branch, is_scraped, last_scraped)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                    person.getProfileUrl(),
                    blankToNull(person.getUserName()),
                    str(person.getFullName()),
                    str(person.getPortraitUrl()),
                    str(person.getEmail()),
                    str(person.getBranch()),
                    person.isScraped(),
                    person.getLastScraped());
        } catch (DuplicateKeyException e) {
            throw new StoreIntegrityException("Person already exists: " + person.getProfileUrl(), e);
        }
        return person;
    }

    @Override
    public Person updatePerson(Person person) {
        int rows;
        try {
            rows = jdbcTemplate.update("""
                UPDATE person
                SET user_name = ?, full_name = ?, portrait_url = ?, email = ?, branch = ?,
                    is_scraped = ?, last_scraped = ?
                WHERE profile_url = ?
                """,
                    blankToNull(person.getUserName()),
                    str(person.getFullName()),
                    str(person.getPortraitUrl()),
                    str(person.getEmail()),
                    str(person.getBranch()),
                    person.isScraped(),
                    person.getLastScraped(),
                    person.getProfileUrl());
        } catch (DuplicateKeyException e) {
            throw new StoreIntegrityException("User name already taken: " + person.getUserName(), e);
        }
        if (rows == 0) {
            throw new StoreIntegrityException("No person with profile " + person.getProfileUrl());
        }
        return person;
    }

    // ── Activities ───────────────────────────────────────────────────────────

    @Override
    public Optional<Activity> findActivityByUrl(String activityUrl) {
        return first(jdbcTemplate.query(
                "SELECT " + ACTIVITY_COLUMNS + " FROM activity a WHERE a.activity_url = ?",
                ACTIVITY_MAPPER, activityUrl));
    }

    @Override
    public Activity createActivity(Activity a) {
        try {
            jdbcTemplate.update("""
                INSERT INTO activity
                (activity_url, date_start, date_end, name, committee, branch, activity_type,
                 difficulty, leader_rating, mileage, route_name, route_url, status, result,
                 scraped_at, next_scrape, scrape_error, scrape_error_count, scrape_error_time)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                    a.getActivityUrl(), a.getDateStart(), a.getDateEnd(),
                    str(a.getName()), str(a.getCommittee()), str(a.getBranch()), str(a.getActivityType()),
                    str(a.getDifficulty()), str(a.getLeaderRating()), str(a.getMileage()),
                    str(a.getRouteName()), str(a.getRouteUrl()), statusName(a.getStatus()), str(a.getResult()),
                    a.getScrapedAt(), a.getNextScrape(),
                    str(a.getScrapeError()), a.getScrapeErrorCount(), a.getScrapeErrorTime());
        } catch (DuplicateKeyException e) {
            throw new StoreIntegrityException("Activity already exists: " + a.getActivityUrl(), e);
        }
        return a;
    }

    @Override
    public Activity updateActivity(Activity a) {
        int rows = jdbcTemplate.update("""
            UPDATE activity
            SET date_start = ?, date_end = ?, name = ?, committee = ?, branch = ?, activity_type = ?,
                difficulty = ?, leader_rating = ?, mileage = ?, route_name = ?, route_url = ?,
                status = ?, result = ?, scraped_at = ?, next_scrape = ?,
                scrape_error = ?, scrape_error_count = ?, scrape_error_time = ?
            WHERE activity_url = ?
            """,
                a.getDateStart(), a.getDateEnd(),
                str(a.getName()), str(a.getCommittee()), str(a.getBranch()), str(a.getActivityType()),
                str(a.getDifficulty()), str(a.getLeaderRating()), str(a.getMileage()),
                str(a.getRouteName()), str(a.getRouteUrl()),
                statusName(a.getStatus()), str(a.getResult()), a.getScrapedAt(), a.getNextScrape(),
                str(a.getScrapeError()), a.getScrapeErrorCount(), a.getScrapeErrorTime(),
                a.getActivityUrl());
        if (rows == 0) {
            throw new StoreIntegrityException("No activity " + a.getActivityUrl());
        }
        return a;
    }

    // ── Participations ───────────────────────────────────────────────────────

    @Override
    public Optional<Participation> findParticipation(String profileUrl, String activityUrl) {
        return first(jdbcTemplate.query("""
            SELECT %s
            FROM participation m
            JOIN person p ON p.id = m.person_id
            JOIN activity a ON a.id = m.activity_id
            WHERE p.profile_url = ? AND a.activity_url = ?
            """.formatted(PARTICIPATION_COLUMNS),
                PARTICIPATION_MAPPER, profileUrl, activityUrl));
    }

    @Override
    public Participation createParticipation(Participation m) {
        int rows;
        try {
            rows = jdbcTemplate.update("""
                INSERT INTO participation (person_id, activity_id, role, is_canceled, registration, member_result)
                SELECT p.id, a.id, ?, ?, ?, ?
                FROM person p, activity a
                WHERE p.profile_url = ? AND a.activity_url = ?
                """,
                    str(m.getRole()), m.isCanceled(), str(m.getRegistration()), str(m.getMemberResult()),
                    m.getProfileUrl(), m.getActivityUrl());
        } catch (DuplicateKeyException e) {
            throw new StoreIntegrityException(
                    "Participation already exists: " + m.getProfileUrl() + " on " + m.getActivityUrl(), e);
        }
        if (rows == 0) {
            throw new StoreIntegrityException(
                    "Unknown person or activity: " + m.getProfileUrl() + " on " + m.getActivityUrl());
        }
        return m;
    }

    @Override
    public Participation updateParticipation(Participation m) {
        int rows = jdbcTemplate.update("""
            UPDATE participation
            SET role = ?, is_canceled = ?, registration = ?, member_result = ?
            WHERE person_id = (SELECT id FROM person WHERE profile_url = ?)
              AND activity_id = (SELECT id FROM activity WHERE activity_url = ?)
            """,
                str(m.getRole()), m.isCanceled(), str(m.getRegistration()), str(m.getMemberResult()),
                m.getProfileUrl(), m.getActivityUrl());
        if (rows == 0) {
            throw new StoreIntegrityException(
                    "No participation for " + m.getProfileUrl() + " on " + m.getActivityUrl());
        }
        return m;
    }

    @Override
    public boolean removeParticipation(String profileUrl, String activityUrl) {
        int rows = jdbcTemplate.update("""
            DELETE FROM participation
            WHERE person_id = (SELECT id FROM person WHERE profile_url = ?)
              AND activity_id = (SELECT id FROM activity WHERE activity_url = ?)
            """, profileUrl, activityUrl);
        return rows > 0;
    }

    @Override
    public List<ActivityEntry> listParticipationsForPerson(String profileUrl) {
        return jdbcTemplate.query("""
            SELECT %s, %s
            FROM participation m
            JOIN person p ON p.id = m.person_id
            JOIN activity a ON a.id = m.activity_id
            WHERE p.profile_url = ?
            ORDER BY a.date_start ASC, a.activity_url ASC
            """.formatted(ACTIVITY_COLUMNS, PARTICIPATION_COLUMNS),
                (rs, i) -> new ActivityEntry(ACTIVITY_MAPPER.mapRow(rs, i), PARTICIPATION_MAPPER.mapRow(rs, i)),
                profileUrl);
    }

    @Override
    public List<RosterEntry> listRoster(String activityUrl) {
        return jdbcTemplate.query("""
            SELECT %s, %s
            FROM participation m
            JOIN person p ON p.id = m.person_id
            JOIN activity a ON a.id = m.activity_id
            WHERE a.activity_url = ?
            ORDER BY p.full_name ASC, p.profile_url ASC
            """.formatted(PERSON_COLUMNS, PARTICIPATION_COLUMNS),
                (rs, i) -> new RosterEntry(PERSON_MAPPER.mapRow(rs, i), PARTICIPATION_MAPPER.mapRow(rs, i)),
                activityUrl);
    }

    // ── Row mapping ──────────────────────────────────────────────────────────

    private static final RowMapper<Person> PERSON_MAPPER = (rs, i) -> Person.builder()
            .profileUrl(rs.getString("profile_url"))
            .userName(rs.getString("user_name"))
            .fullName(rs.getString("full_name"))
            .portraitUrl(rs.getString("portrait_url"))
            .email(rs.getString("email"))
            .branch(rs.getString("branch"))
            .scraped(rs.getBoolean("is_scraped"))
            .lastScraped(rs.getObject("last_scraped", LocalDateTime.class))
            .build();

    private static final RowMapper<Activity> ACTIVITY_MAPPER = (rs, i) -> Activity.builder()
            .activityUrl(rs.getString("activity_url"))
            .dateStart(rs.getObject("date_start", LocalDate.class))
            .dateEnd(rs.getObject("date_end", LocalDate.class))
            .name(rs.getString("name"))
            .committee(rs.getString("committee"))
            .branch(rs.getString("branch"))
            .activityType(rs.getString("activity_type"))
            .difficulty(rs.getString("difficulty"))
            .leaderRating(rs.getString("leader_rating"))
            .mileage(rs.getString("mileage"))
            .routeName(rs.getString("route_name"))
            .routeUrl(rs.getString("route_url"))
            .status(parseStatus(rs))
            .result(rs.getString("result"))
            .scrapedAt(rs.getObject("scraped_at", LocalDateTime.class))
            .nextScrape(rs.getObject("next_scrape", LocalDateTime.class))
            .scrapeError(rs.getString("scrape_error"))
            .scrapeErrorCount(rs.getInt("scrape_error_count"))
            .scrapeErrorTime(rs.getObject("scrape_error_time", LocalDateTime.class))
            .build();

    private static final RowMapper<Participation> PARTICIPATION_MAPPER = (rs, i) -> Participation.builder()
            .profileUrl(rs.getString("profile_url"))
            .activityUrl(rs.getString("activity_url"))
            .role(rs.getString("role"))
            .canceled(rs.getBoolean("is_canceled"))
            .registration(rs.getString("registration"))
            .memberResult(rs.getString("member_result"))
            .build();

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static ActivityStatus parseStatus(ResultSet rs) throws SQLException {
        String status = rs.getString("status");
        return isBlank(status) ? null : ActivityStatus.valueOf(status);
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static String statusName(ActivityStatus status) {
        return status == null ? "" : status.name();
    }

    private static String str(String val) {
        return val == null ? "" : val;
    }

    private static String blankToNull(String val) {
        return isBlank(val) ? null : val;
    }

    private static boolean isBlank(String val) {
        return val == null || val.isBlank();
    }
}
