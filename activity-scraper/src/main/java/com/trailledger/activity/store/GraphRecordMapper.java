package com.trailledger.activity.store;

import com.trailledger.activity.model.Activity;
import com.trailledger.activity.model.ActivityStatus;
import com.trailledger.activity.model.Participation;
import com.trailledger.activity.model.Person;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.MapAccessor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps domain objects to and from Neo4j node and relationship properties.
 *
 * Property names follow the relational column names so the two backends read
 * the same in ad-hoc queries. Dates are stored as native temporal values.
 */
final class GraphRecordMapper {

    private GraphRecordMapper() {}

    // ── To properties ────────────────────────────────────────────────────────

    static Map<String, Object> personProperties(Person p) {
        Map<String, Object> props = new HashMap<>();
        props.put("profile_url", p.getProfileUrl());
        props.put("user_name", blankToNull(p.getUserName()));
        props.put("full_name", str(p.getFullName()));
        props.put("portrait_url", str(p.getPortraitUrl()));
        props.put("email", str(p.getEmail()));
        props.put("branch", str(p.getBranch()));
        props.put("is_scraped", p.isScraped());
        props.put("last_scraped", p.getLastScraped());
        return props;
    }

    static Map<String, Object> activityProperties(Activity a) {
        Map<String, Object> props = new HashMap<>();
        props.put("activity_url", a.getActivityUrl());
        props.put("date_start", a.getDateStart());
        props.put("date_end", a.getDateEnd());
        props.put("name", str(a.getName()));
        props.put("committee", str(a.getCommittee()));
        props.put("branch", str(a.getBranch()));
        props.put("activity_type", str(a.getActivityType()));
        props.put("difficulty", str(a.getDifficulty()));
        props.put("leader_rating", str(a.getLeaderRating()));
        props.put("mileage", str(a.getMileage()));
        props.put("route_name", str(a.getRouteName()));
        props.put("route_url", str(a.getRouteUrl()));
        props.put("status", a.getStatus() == null ? "" : a.getStatus().name());
        props.put("result", str(a.getResult()));
        props.put("scraped_at", a.getScrapedAt());
        props.put("next_scrape", a.getNextScrape());
        props.put("scrape_error", str(a.getScrapeError()));
        props.put("scrape_error_count", a.getScrapeErrorCount());
        props.put("scrape_error_time", a.getScrapeErrorTime());
        return props;
    }

    static Map<String, Object> participationProperties(Participation m) {
        Map<String, Object> props = new HashMap<>();
        props.put("role", str(m.getRole()));
        props.put("is_canceled", m.isCanceled());
        props.put("registration", str(m.getRegistration()));
        props.put("member_result", str(m.getMemberResult()));
        return props;
    }

    /** Node properties cannot hold null, so CREATE only gets the values that are set. */
    static Map<String, Object> withoutNulls(Map<String, Object> props) {
        Map<String, Object> copy = new HashMap<>(props);
        copy.values().removeIf(v -> v == null);
        return copy;
    }

    // ── From properties ──────────────────────────────────────────────────────

    static Person toPerson(MapAccessor node) {
        return Person.builder()
                .profileUrl(string(node, "profile_url"))
                .userName(nullableString(node, "user_name"))
                .fullName(string(node, "full_name"))
                .portraitUrl(string(node, "portrait_url"))
                .email(string(node, "email"))
                .branch(string(node, "branch"))
                .scraped(!node.get("is_scraped").isNull() && node.get("is_scraped").asBoolean())
                .lastScraped(dateTime(node, "last_scraped"))
                .build();
    }

    static Activity toActivity(MapAccessor node) {
        String status = string(node, "status");
        return Activity.builder()
                .activityUrl(string(node, "activity_url"))
                .dateStart(date(node, "date_start"))
                .dateEnd(date(node, "date_end"))
                .name(string(node, "name"))
                .committee(string(node, "committee"))
                .branch(string(node, "branch"))
                .activityType(string(node, "activity_type"))
                .difficulty(string(node, "difficulty"))
                .leaderRating(string(node, "leader_rating"))
                .mileage(string(node, "mileage"))
                .routeName(string(node, "route_name"))
                .routeUrl(string(node, "route_url"))
                .status(status.isEmpty() ? null : ActivityStatus.valueOf(status))
                .result(string(node, "result"))
                .scrapedAt(dateTime(node, "scraped_at"))
                .nextScrape(dateTime(node, "next_scrape"))
                .scrapeError(string(node, "scrape_error"))
                .scrapeErrorCount(node.get("scrape_error_count").isNull() ? 0 : node.get("scrape_error_count").asInt())
                .scrapeErrorTime(dateTime(node, "scrape_error_time"))
                .build();
    }

    static Participation toParticipation(MapAccessor rel, String profileUrl, String activityUrl) {
        return Participation.builder()
                .profileUrl(profileUrl)
                .activityUrl(activityUrl)
                .role(string(rel, "role"))
                .canceled(!rel.get("is_canceled").isNull() && rel.get("is_canceled").asBoolean())
                .registration(string(rel, "registration"))
                .memberResult(string(rel, "member_result"))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String string(MapAccessor source, String key) {
        Value v = source.get(key);
        return v.isNull() ? "" : v.asString();
    }

    private static String nullableString(MapAccessor source, String key) {
        Value v = source.get(key);
        return v.isNull() ? null : v.asString();
    }

    private static LocalDate date(MapAccessor source, String key) {
        Value v = source.get(key);
        return v.isNull() ? null : v.asLocalDate();
    }

    private static LocalDateTime dateTime(MapAccessor source, String key) {
        Value v = source.get(key);
        return v.isNull() ? null : v.asLocalDateTime();
    }

    private static String str(String val) {
        return val == null ? "" : val;
    }

    private static String blankToNull(String val) {
        return val == null || val.isBlank() ? null : val;
    }
}
