package com.patentintel.status.output;

import com.opencsv.CSVWriter;
import com.patentintel.status.config.PatentStatusProperties;
import com.patentintel.status.model.UsageLogEntry;
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
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Appends usage entries to one CSV file per UTC day.
 *
 * Output path pattern: {outputDir}/usage_{yyyy-MM-dd}.csv
 * The header row is written only when the file is created.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvUsageLogWriter {

    private final PatentStatusProperties properties;

    static final String[] HEADERS = {
            "entry_id", "patent_number", "client_key_hash", "user_tier",
            "cache_hit", "degraded", "source",
            "duration_ms", "outcome_code", "created_at"
    };

    public synchronized void write(UsageLogEntry entry) {
        Path outputDir = Paths.get(properties.getUsageLog().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        LocalDate day = entry.getCreatedAt().atOffset(ZoneOffset.UTC).toLocalDate();
        Path outputPath = outputDir.resolve("usage_" + day + ".csv");
        boolean newFile = Files.notExists(outputPath);

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (newFile && properties.getUsageLog().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }
            writer.writeNext(toRow(entry));
            log.debug("Appended usage entry {} to {}", entry.getEntryId(), outputPath);

        } catch (IOException e) {
            throw new UncheckedIOException("Usage CSV write failed: " + outputPath, e);
        }
    }

    private String[] toRow(UsageLogEntry e) {
        return new String[]{
                str(e.getEntryId()),
                str(e.getPatentNumber()),
                str(e.getClientKeyHash()),
                str(e.getTier()),
                str(e.isCacheHit()),
                str(e.isDegraded()),
                str(e.getSource()),
                str(e.getDurationMs()),
                str(e.getOutcomeCode()),
                str(e.getCreatedAt())
        };
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
