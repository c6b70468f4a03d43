package com.weatherledger.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.weatherledger.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());
    public static final String INGEST_FILE = "ingest.json";

    private ConfigLoader() {
    }

    /**
     * Reads {@code ingest.json} from {@code configDir}. A missing file means every setting is defaulted;
     * a file that cannot be parsed, or names an unknown time zone, fails fast.
     */
    public static IngestConfig loadIngest(Path configDir) {
        Path path = configDir.resolve(INGEST_FILE);
        if (!Files.exists(path)) {
            LOGGER.info("No " + INGEST_FILE + " in " + configDir.toAbsolutePath() + "; using defaults");
            return IngestConfig.defaults();
        }
        IngestConfig config = read(path, new TypeReference<IngestConfig>() {
        });
        if (config == null) {
            throw new IllegalStateException("Failed loading config from " + path + ": file is empty");
        }
        IngestConfig resolved = config.withDefaults();
        try {
            resolved.zone();
        } catch (DateTimeException e) {
            throw new IllegalStateException("Failed loading config from " + path + ": unknown timezone "
                    + resolved.timezone(), e);
        }
        LOGGER.info("Loaded ingest config from " + path + " for " + resolved.location());
        return resolved;
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
