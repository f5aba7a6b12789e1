package com.trailledger.activity.output;

import com.opencsv.CSVWriter;
import com.trailledger.activity.config.TrailLedgerProperties;
import com.trailledger.activity.model.Activity;
import com.trailledger.activity.model.ActivityEntry;
import com.trailledger.activity.model.Participation;
import com.trailledger.activity.model.Person;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Writes a person's participation history to CSV.
 *
 * Output path pattern: {outputDir}/history_{person}.csv
 * e.g. /data/output/history_jane-doe.csv
 *
 * Rows are in the order given, which for store listings is start date ascending.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HistoryCsvWriter {

    private final TrailLedgerProperties properties;

    private static final String[] HEADERS = {
            "date_start", "date_end",
            "name", "activity_type",
            "committee", "branch",
            "role", "registration", "member_result",
            "status", "result",
            "activity_url"
    };

    public Path write(Person person, List<ActivityEntry> history) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        Path outputPath = outputDir.resolve("history_" + slug(person) + ".csv");

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (ActivityEntry entry : history) {
                writer.writeNext(toRow(entry));
            }

            log.info("Written {} activities for {} to CSV: {}", history.size(), person.getFullName(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed: " + outputPath, e);
        }
    }

    private String[] toRow(ActivityEntry entry) {
        Activity a = entry.activity();
        Participation m = entry.participation();
        return new String[]{
                str(a.getDateStart()),
                str(a.getDateEnd()),
                str(a.getName()),
                str(a.getActivityType()),
                str(a.getCommittee()),
                str(a.getBranch()),
                str(m.getRole()),
                str(m.getRegistration()),
                str(m.getMemberResult()),
                str(a.getStatus()),
                str(a.getResult()),
                str(a.getActivityUrl())
        };
    }

    /** File-name-safe form of the person's name, falling back to the last profile URL segment. */
    static String slug(Person person) {
        String base = person.getFullName();
        if (base == null || base.isBlank()) {
            String url = person.getProfileUrl();
            base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
            base = base.substring(base.lastIndexOf('/') + 1);
        }
        String slug = base.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("^-|-$", "");
        return slug.isEmpty() ? "person" : slug;
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
