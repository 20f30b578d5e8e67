package im.arun.pdf2md.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.pdf2md.model.ConversionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch journal: accumulates entries and rewrites them as a JSON array after each one, so a
 * partially finished batch still leaves a readable log.
 */
public class JsonLogger {
    private static final Logger systemLogger = LoggerFactory.getLogger(JsonLogger.class);
    private final Path logPath;
    private final List<Object> logData = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public JsonLogger(Path logDir, String batchName) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        String logFileName = String.format("%s_%s.json", sanitize(batchName), timestamp);

        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            systemLogger.error("Failed to create logs directory {}", logDir, e);
        }

        this.logPath = logDir.resolve(logFileName);
    }

    private static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return "batch";
        }
        return name.replaceAll("[/\\\\:*?\"<>|\\s]", "-");
    }

    public synchronized void info(String message, Map<String, Object> details) {
        log("INFO", message, details);
    }

    public synchronized void warn(String message, Map<String, Object> details) {
        log("WARNING", message, details);
    }

    public synchronized void error(String message, Map<String, Object> details) {
        log("ERROR", message, details);
    }

    /**
     * Record the outcome of one document.
     */
    public synchronized void result(ConversionResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("document", result.getSourceName());
        details.put("artifact_count", result.getArtifacts().size());
        if (result.isSuccess()) {
            log("INFO", "Document converted", details);
        } else {
            details.put("error", result.getError());
            log("ERROR", "Document failed", details);
        }
    }

    private void log(String level, String message, Map<String, Object> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("time", LocalDateTime.now().toString());
        entry.put("level", level);
        entry.put("message", message);
        if (details != null) {
            entry.putAll(details);
        }
        logData.add(entry);
        writeToFile();
    }

    private void writeToFile() {
        try {
            objectMapper.writeValue(logPath.toFile(), logData);
        } catch (IOException e) {
            systemLogger.error("Failed to write log file: {}", logPath, e);
        }
    }

    public Path getLogPath() {
        return logPath;
    }
}
