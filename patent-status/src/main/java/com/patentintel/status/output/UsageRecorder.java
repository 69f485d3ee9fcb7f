package com.patentintel.status.output;

import com.patentintel.status.config.PatentStatusProperties;
import com.patentintel.status.model.UsageLogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes usage entries to the configured sink(s): DATABASE, CSV, or BOTH.
 * A failing sink is logged and skipped; recording never fails the request.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class UsageRecorder {

    private final JdbcUsageLogWriter jdbcWriter;
    private final CsvUsageLogWriter csvWriter;
    private final PatentStatusProperties properties;

    public void record(UsageLogEntry entry) {
        PatentStatusProperties.UsageLog.OutputMode mode = properties.getUsageLog().getMode();

        switch (mode) {
            case DATABASE -> toDatabase(entry);
            case CSV -> toCsv(entry);
            case BOTH -> {
                toDatabase(entry);
                toCsv(entry);
            }
        }
    }

    private void toDatabase(UsageLogEntry entry) {
        try {
            jdbcWriter.write(entry);
        } catch (Exception e) {
            log.warn("Failed to write usage entry {} to request_log: {}", entry.getEntryId(), e.getMessage());
        }
    }

    private void toCsv(UsageLogEntry entry) {
        try {
            csvWriter.write(entry);
        } catch (Exception e) {
            log.warn("Failed to append usage entry {} to CSV: {}", entry.getEntryId(), e.getMessage());
        }
    }
}
