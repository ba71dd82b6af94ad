package im.arun.docingest.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run JSON journal. Entries accumulate in memory and the whole journal is rewritten on each entry,
 * so the file is readable while a run is in progress. Workers write concurrently.
 */
public class IngestionJournal {
    private static final Logger systemLogger = LoggerFactory.getLogger(IngestionJournal.class);
    private final Path logPath;
    private final List<Map<String, Object>> entries = Collections.synchronizedList(new ArrayList<>());
    private final ObjectMapper objectMapper;

    /**
     * @param directory where to write; {@code null} keeps the journal in memory only
     * @param runName   batch id or other label for the file name
     */
    public IngestionJournal(String directory, String runName) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.logPath = directory == null ? null : resolvePath(directory, runName);
    }

    public static IngestionJournal inMemory(String runName) {
        return new IngestionJournal(null, runName);
    }

    private Path resolvePath(String directory, String runName) {
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS"));
        String logFileName = String.format("%s_%s.json", sanitize(runName), timestamp);
        try {
            Files.createDirectories(Paths.get(directory));
        } catch (IOException e) {
            systemLogger.error("Failed to create journal directory {}", directory, e);
        }
        return Paths.get(directory, logFileName);
    }

    private String sanitize(String runName) {
        if (runName == null || runName.isBlank()) {
            return "run";
        }
        return runName.replaceAll("[/\\\\:*?\"<>|\\s]", "-");
    }

    public void info(String event, Map<String, ?> details) {
        log("INFO", event, details);
    }

    public void info(String event) {
        log("INFO", event, Map.of());
    }

    public void warn(String event, Map<String, ?> details) {
        log("WARNING", event, details);
    }

    public void error(String event, Map<String, ?> details) {
        log("ERROR", event, details);
    }

    private void log(String level, String event, Map<String, ?> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("time", Instant.now().toString());
        entry.put("level", level);
        entry.put("event", event);
        if (details != null && !details.isEmpty()) {
            entry.putAll(details);
        }
        entries.add(entry);
        writeToFile();
    }

    private void writeToFile() {
        if (logPath == null) {
            return;
        }
        synchronized (entries) {
            try {
                objectMapper.writeValue(logPath.toFile(), entries);
            } catch (IOException e) {
                systemLogger.error("Failed to write journal file: {}", logPath, e);
            }
        }
    }

    public List<Map<String, Object>> getEntries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    /**
     * File being written, or {@code null} for an in-memory journal.
     */
    public Path getLogPath() {
        return logPath;
    }
}
