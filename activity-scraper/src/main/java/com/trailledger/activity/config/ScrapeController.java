package com.trailledger.activity.config;

import com.trailledger.activity.model.ActivityEntry;
import com.trailledger.activity.model.Person;
import com.trailledger.activity.output.HistoryCsvWriter;
import com.trailledger.activity.service.HistoryQueryService;
import com.trailledger.activity.service.ScrapeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScrapeController {

    private final ScrapeService scrapeService;
    private final HistoryQueryService historyQueryService;
    private final HistoryCsvWriter historyCsvWriter;

    // ── Scrape triggers ───────────────────────────────────────────────────────

    /**
     * Scrape one person's activity list in the background.
     *
     * POST /scrape/trigger?profile=https://club.example/members/jdoe&forceFuture=true
     *
     * Without a profile the logged-in user is scraped.
     */
    @PostMapping("/scrape/trigger")
    public ResponseEntity<Map<String, String>> trigger(
            @RequestParam(required = false) String profile,
            @RequestParam(defaultValue = "false") boolean forceFuture) {
        if (scrapeService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "A scrape is already running"));
        }
        String target = profile == null || profile.isBlank() ? "self" : profile;
        new Thread(() -> scrapeService.scrapeProfile("manual", profile, forceFuture), "manual-scrape").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", target));
    }

    /**
     * Re-fetch one stored activity in the background, ignoring its schedule.
     */
    @PostMapping("/scrape/activity")
    public ResponseEntity<Map<String, String>> triggerActivity(@RequestParam String url) {
        if (url.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "url is required"));
        }
        if (scrapeService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "A scrape is already running"));
        }
        new Thread(() -> scrapeService.updateActivities("activity", List.of(url)), "manual-activity").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", url));
    }

    @GetMapping("/scrape/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "trail-ledger-activity-scraper");
        body.put("version", "1.0.0");
        body.put("adapterAvailable", scrapeService.isAdapterAvailable());
        body.put("running", scrapeService.isRunning());
        body.put("recentRuns", scrapeService.recentRuns());
        return ResponseEntity.ok(body);
    }

    // ── History query API ─────────────────────────────────────────────────────

    /**
     * Everything a person took part in.
     *
     * GET /history/whatdid?user=jdoe&type=Hiking
     */
    @GetMapping("/history/whatdid")
    public ResponseEntity<?> whatDid(
            @RequestParam(required = false) String profile,
            @RequestParam(required = false) String user,
            @RequestParam(required = false) String type) {
        return answer("whatdid", () -> historyQueryService.whatDid(profile, user, type));
    }

    /**
     * Activities whose name contains a phrase.
     *
     * GET /history/diddo?user=jdoe&phrase=rainier
     */
    @GetMapping("/history/diddo")
    public ResponseEntity<?> didDo(
            @RequestParam(required = false) String profile,
            @RequestParam(required = false) String user,
            @RequestParam String phrase) {
        return answer("diddo", () -> historyQueryService.didDo(profile, user, phrase));
    }

    /**
     * Companions on a date, with everything else done together.
     *
     * GET /history/whowith?user=jdoe&date=2024-07-13
     */
    @GetMapping("/history/whowith")
    public ResponseEntity<?> whoWith(
            @RequestParam(required = false) String profile,
            @RequestParam(required = false) String user,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return answer("whowith", () -> historyQueryService.whoWith(profile, user, date));
    }

    @GetMapping("/history/tripstatus")
    public ResponseEntity<?> tripStatus(
            @RequestParam(required = false) String profile,
            @RequestParam(required = false) String user,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "false") boolean update) {
        return answer("tripstatus", () -> historyQueryService.tripStatus(profile, user, date, update));
    }

    /**
     * Write a person's full history to CSV under the configured output directory.
     */
    @PostMapping("/history/export")
    public ResponseEntity<?> export(
            @RequestParam(required = false) String profile,
            @RequestParam(required = false) String user) {
        return answer("export", () -> {
            Person person = historyQueryService.selectPerson(profile, user);
            List<ActivityEntry> history = historyQueryService.whatDid(person.getProfileUrl(), null, null);
            Path path = historyCsvWriter.write(person, history);
            return Map.of("path", path.toString(), "activities", history.size());
        });
    }

    private ResponseEntity<?> answer(String query, Supplier<?> work) {
        try {
            return ResponseEntity.ok(work.get());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("History query {} failed: {}", query, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
