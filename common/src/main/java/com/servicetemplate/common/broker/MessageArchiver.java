package com.servicetemplate.common.broker;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.rabbitmq.client.LongString;

/**
 * Writes a message body and its headers to {@code <correlationId>.json} and
 * {@code <correlationId>_headers.json}. Independent of the retry path.
 */
public class MessageArchiver {

    private static final Logger logger = LoggerFactory.getLogger(MessageArchiver.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final Path directory;

    public MessageArchiver(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    /**
     * @return the path of the body file
     */
    public Path save(String correlationId, String body, Map<String, Object> headers) throws IOException {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("Correlation id is required to name archive files");
        }
        if (correlationId.contains("/") || correlationId.contains("\\") || correlationId.contains("..")) {
            throw new IllegalArgumentException("Correlation id is not a valid file name: " + correlationId);
        }
        Files.createDirectories(directory);

        Path bodyFile = directory.resolve(correlationId + ".json");
        Path headersFile = directory.resolve(correlationId + "_headers.json");
        try {
            Files.writeString(bodyFile, body == null ? "" : body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IOException("Failed to write message body to file " + bodyFile, e);
        }
        try {
            Files.writeString(headersFile, GSON.toJson(plain(headers)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IOException("Failed to write headers to file " + headersFile, e);
        }
        logger.debug("[MQEngine] Archived message {} to {}", correlationId, directory);
        return bodyFile;
    }

    public Path getDirectory() {
        return directory;
    }

    /** Converts client header values (LongString, Date, nested tables) to JSON-friendly ones. */
    private static Map<String, Object> plain(Map<String, Object> headers) {
        Map<String, Object> result = new TreeMap<>();
        if (headers != null) {
            headers.forEach((key, value) -> result.put(key, plainValue(value)));
        }
        return result;
    }

    private static Object plainValue(Object value) {
        if (value instanceof LongString) {
            return value.toString();
        }
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((k, v) -> nested.put(String.valueOf(k), plainValue(v)));
            return nested;
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>();
            list.forEach(item -> items.add(plainValue(item)));
            return items;
        }
        return value;
    }
}
