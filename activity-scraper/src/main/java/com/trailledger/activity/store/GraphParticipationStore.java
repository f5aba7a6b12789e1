package com.trailledger.activity.store;

import com.trailledger.activity.model.Activity;
import com.trailledger.activity.model.ActivityEntry;
import com.trailledger.activity.model.Participation;
import com.trailledger.activity.model.Person;
import com.trailledger.activity.model.RosterEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph backend: {@code (:Person)-[:PARTICIPATE]->(:Activity)}.
 *
 * Nodes are addressed by their natural key properties, which carry unique
 * constraints. Participation lives on the relationship; the store keeps at
 * most one PARTICIPATE relationship per node pair.
 */
@Slf4j
@RequiredArgsConstructor
public class GraphParticipationStore implements ParticipationStore {

    private final Neo4jClient neo4jClient;
    private final TransactionTemplate transactionTemplate;

    @Override
    public void ensureSchema() {
        log.info("Ensuring graph constraints exist...");
        neo4jClient.query("CREATE CONSTRAINT person_profile_url IF NOT EXISTS "
                + "FOR (p:Person) REQUIRE p.profile_url IS UNIQUE").run();
        neo4jClient.query("CREATE CONSTRAINT person_user_name IF NOT EXISTS "
                + "FOR (p:Person) REQUIRE p.user_name IS UNIQUE").run();
        neo4jClient.query("CREATE CONSTRAINT activity_url IF NOT EXISTS "
                + "FOR (a:Activity) REQUIRE a.activity_url IS UNIQUE").run();
        neo4jClient.query("CREATE INDEX person_full_name IF NOT EXISTS FOR (p:Person) ON (p.full_name)").run();
        neo4jClient.query("CREATE INDEX activity_dates IF NOT EXISTS FOR (a:Activity) ON (a.date_start, a.date_end)").run();
        log.info("Graph constraints ready.");
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    // ── People ───────────────────────────────────────────────────────────────

    @Override
    public Optional<Person> findPersonByUrl(String profileUrl) {
        return neo4jClient.query("MATCH (p:Person {profile_url: $url}) RETURN p")
                .bind(profileUrl).to("url")
                .fetchAs(Person.class)
                .mappedBy((types, record) -> GraphRecordMapper.toPerson(record.get("p")))
                .one();
    }

    @Override
    public Optional<Person> findPersonByUsername(String userName) {
        if (userName == null || userName.isBlank()) return Optional.empty();
        return neo4jClient.query("MATCH (p:Person {user_name: $userName}) RETURN p")
                .bind(userName).to("userName")
                .fetchAs(Person.class)
                .mappedBy((types, record) -> GraphRecordMapper.toPerson(record.get("p")))
                .one();
    }

    @Override
    public Person createPerson(Person person) {
        try {
            neo4jClient.query("CREATE (p:Person) SET p = $props")
                    .bind(GraphRecordMapper.withoutNulls(GraphRecordMapper.personProperties(person))).to("props")
                    .run();
        } catch (DataIntegrityViolationException e) {
            throw new StoreIntegrityException("Person already exists: " + person.getProfileUrl(), e);
        }
        return person;
    }

    @Override
    public Person updatePerson(Person person) {
        long matched;
        try {
            matched = count("""
                    MATCH (p:Person {profile_url: $url})
                    SET p += $props
                    RETURN count(p) AS n
                    """, Map.of("url", person.getProfileUrl(),
                    "props", GraphRecordMapper.personProperties(person)));
        } catch (DataIntegrityViolationException e) {
            throw new StoreIntegrityException("User name already taken: " + person.getUserName(), e);
        }
        if (matched == 0) {
            throw new StoreIntegrityException("No person with profile " + person.getProfileUrl());
        }
        return person;
    }

    // ── Activities ───────────────────────────────────────────────────────────

    @Override
    public Optional<Activity> findActivityByUrl(String activityUrl) {
        return neo4jClient.query("MATCH (a:Activity {activity_url: $url}) RETURN a")
                .bind(activityUrl).to("url")
                .fetchAs(Activity.class)
                .mappedBy((types, record) -> GraphRecordMapper.toActivity(record.get("a")))
                .one();
    }

    @Override
    public Activity createActivity(Activity activity) {
        try {
            neo4jClient.query("CREATE (a:Activity) SET a = $props")
                    .bind(GraphRecordMapper.withoutNulls(GraphRecordMapper.activityProperties(activity))).to("props")
                    .run();
        } catch (DataIntegrityViolationException e) {
            throw new StoreIntegrityException("Activity already exists: " + activity.getActivityUrl(), e);
        }
        return activity;
    }

    @Override
    public Activity updateActivity(Activity activity) {
        // += with null values removes the property, which is how next_scrape is cleared
        long matched = count("""
                MATCH (a:Activity {activity_url: $url})
                SET a += $props
                RETURN count(a) AS n
                """, Map.of("url", activity.getActivityUrl(),
                "props", GraphRecordMapper.activityProperties(activity)));
        if (matched == 0) {
            throw new StoreIntegrityException("No activity " + activity.getActivityUrl());
        }
        return activity;
    }

    // ── Participations ───────────────────────────────────────────────────────

    @Override
    public Optional<Participation> findParticipation(String profileUrl, String activityUrl) {
        return neo4jClient.query("""
                MATCH (:Person {profile_url: $personUrl})-[r:PARTICIPATE]->(:Activity {activity_url: $activityUrl})
                RETURN r
                """)
                .bind(profileUrl).to("personUrl")
                .bind(activityUrl).to("activityUrl")
                .fetchAs(Participation.class)
                .mappedBy((types, record) ->
                        GraphRecordMapper.toParticipation(record.get("r"), profileUrl, activityUrl))
                .one();
    }

    @Override
    public Participation createParticipation(Participation m) {
        long created = count("""
                MATCH (p:Person {profile_url: $personUrl}), (a:Activity {activity_url: $activityUrl})
                WHERE NOT (p)-[:PARTICIPATE]->(a)
                CREATE (p)-[r:PARTICIPATE]->(a)
                SET r = $props
                RETURN count(r) AS n
                """, Map.of("personUrl", m.getProfileUrl(),
                "activityUrl", m.getActivityUrl(),
                "props", GraphRecordMapper.participationProperties(m)));
        if (created == 0) {
            String reason = findParticipation(m.getProfileUrl(), m.getActivityUrl()).isPresent()
                    ? "Participation already exists: "
                    : "Unknown person or activity: ";
            throw new StoreIntegrityException(reason + m.getProfileUrl() + " on " + m.getActivityUrl());
        }
        return m;
    }

    @Override
    public Participation updateParticipation(Participation m) {
        long matched = count("""
                MATCH (:Person {profile_url: $personUrl})-[r:PARTICIPATE]->(:Activity {activity_url: $activityUrl})
                SET r += $props
                RETURN count(r) AS n
                """, Map.of("personUrl", m.getProfileUrl(),
                "activityUrl", m.getActivityUrl(),
                "props", GraphRecordMapper.participationProperties(m)));
        if (matched == 0) {
            throw new StoreIntegrityException(
                    "No participation for " + m.getProfileUrl() + " on " + m.getActivityUrl());
        }
        return m;
    }

    @Override
    public boolean removeParticipation(String profileUrl, String activityUrl) {
        long removed = count("""
                MATCH (:Person {profile_url: $personUrl})-[r:PARTICIPATE]->(:Activity {activity_url: $activityUrl})
                DELETE r
                RETURN count(*) AS n
                """, Map.of("personUrl", profileUrl, "activityUrl", activityUrl));
        return removed > 0;
    }

    @Override
    public List<ActivityEntry> listParticipationsForPerson(String profileUrl) {
        return List.copyOf(neo4jClient.query("""
                MATCH (:Person {profile_url: $url})-[r:PARTICIPATE]->(a:Activity)
                RETURN a, r
                ORDER BY a.date_start ASC, a.activity_url ASC
                """)
                .bind(profileUrl).to("url")
                .fetchAs(ActivityEntry.class)
                .mappedBy((types, record) -> {
                    Activity activity = GraphRecordMapper.toActivity(record.get("a"));
                    return new ActivityEntry(activity, GraphRecordMapper.toParticipation(
                            record.get("r"), profileUrl, activity.getActivityUrl()));
                })
                .all());
    }

    @Override
    public List<RosterEntry> listRoster(String activityUrl) {
        return List.copyOf(neo4jClient.query("""
                MATCH (p:Person)-[r:PARTICIPATE]->(:Activity {activity_url: $url})
                RETURN p, r
                ORDER BY p.full_name ASC, p.profile_url ASC
                """)
                .bind(activityUrl).to("url")
                .fetchAs(RosterEntry.class)
                .mappedBy((types, record) -> {
                    Person person = GraphRecordMapper.toPerson(record.get("p"));
                    return new RosterEntry(person, GraphRecordMapper.toParticipation(
                            record.get("r"), person.getProfileUrl(), activityUrl));
                })
                .all());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private long count(String cypher, Map<String, Object> parameters) {
        return neo4jClient.query(cypher)
                .bindAll(parameters)
                .fetchAs(Long.class)
                .mappedBy((types, record) -> record.get("n").asLong())
                .one()
                .orElse(0L);
    }
}
