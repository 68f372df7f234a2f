package com.servicetemplate.common.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the service's release notes file.
 */
public final class ReleaseNotes {

    private static final Logger logger = LoggerFactory.getLogger(ReleaseNotes.class);

    public static final Path DEFAULT_PATH = Path.of("releasenotes.txt");

    private ReleaseNotes() {}

    public static String read() throws IOException {
        return read(DEFAULT_PATH);
    }

    public static String read(Path path) throws IOException {
        logger.debug("Reading release notes from: {}", path);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.error("Error reading release notes {}: {}", path, e.getMessage());
            throw e;
        }
    }
}
