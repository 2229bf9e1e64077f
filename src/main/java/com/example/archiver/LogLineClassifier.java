package com.example.archiver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Turns crawler log lines into {@link LogSignal}s. The crawler logs one JSON object
 * per line; anything else is only scanned for known error patterns.
 */
public class LogLineClassifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(LogLineClassifier.class);
    private static final Pattern TIMEOUT_PATTERN =
            Pattern.compile("Navigation timeout|net::ERR_TIMED_OUT", Pattern.CASE_INSENSITIVE);
    private static final Pattern HTTP_ERROR_PATTERN = Pattern.compile("net::ERR_|status\":([45]\\d{2})");
    private static final int EXCERPT_LENGTH = 200;

    private final ObjectMapper mapper = new ObjectMapper();

    public LogSignal classify(String rawLine) {
        String line = rawLine == null ? "" : rawLine.strip();
        if (line.isEmpty()) {
            return LogSignal.none();
        }
        JsonNode entry = parseObject(line);
        if (entry == null) {
            return classifyPlainText(line);
        }

        String message = entry.path("message").asText("");
        String context = entry.path("context").asText("");
        JsonNode details = entry.path("details");
        String level = entry.path("logLevel").asText("info");

        if ("crawlStatus".equals(context) && "Crawl statistics".equals(message) && details.isObject()) {
            return LogSignal.progress(CrawlStats.fromDetails(details));
        }

        if ("pageStatus".equals(context) && "Page Load Failed: will retry".equals(message)) {
            String failure = details.path("msg").asText("");
            if (TIMEOUT_PATTERN.matcher(failure).find()) {
                LOGGER.warn("Timeout reported by pageStatus: {}", excerpt(line));
                return LogSignal.error(ErrorCategory.TIMEOUT);
            }
            if (HTTP_ERROR_PATTERN.matcher(failure).find()) {
                LOGGER.warn("HTTP/Network error reported by pageStatus: {}", excerpt(line));
                return LogSignal.error(ErrorCategory.HTTP);
            }
            LOGGER.warn("Unknown page load failure: {}", excerpt(line));
            return LogSignal.error(ErrorCategory.OTHER);
        }

        if ("error".equals(level) || "warn".equals(level)) {
            if (TIMEOUT_PATTERN.matcher(message).find() || TIMEOUT_PATTERN.matcher(line).find()) {
                LOGGER.warn("Timeout detected in logs: {}", excerpt(line));
                return LogSignal.error(ErrorCategory.TIMEOUT);
            }
            if (HTTP_ERROR_PATTERN.matcher(message).find() || HTTP_ERROR_PATTERN.matcher(line).find()) {
                LOGGER.warn("HTTP/Network error detected in logs: {}", excerpt(line));
                return LogSignal.error(ErrorCategory.HTTP);
            }
            if ("error".equals(level)) {
                LOGGER.warn("Generic error detected in logs: {}", excerpt(line));
                return LogSignal.error(ErrorCategory.OTHER);
            }
        }
        return LogSignal.none();
    }

    private JsonNode parseObject(String line) {
        if (line.charAt(0) != '{') {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(line);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private static LogSignal classifyPlainText(String line) {
        if (TIMEOUT_PATTERN.matcher(line).find()) {
            LOGGER.warn("Timeout detected in non-JSON log: {}", excerpt(line));
            return LogSignal.error(ErrorCategory.TIMEOUT);
        }
        if (HTTP_ERROR_PATTERN.matcher(line).find()) {
            LOGGER.warn("HTTP/Network error detected in non-JSON log: {}", excerpt(line));
            return LogSignal.error(ErrorCategory.HTTP);
        }
        return LogSignal.none();
    }

    private static String excerpt(String line) {
        return line.length() <= EXCERPT_LENGTH ? line : line.substring(0, EXCERPT_LENGTH) + "...";
    }
}
