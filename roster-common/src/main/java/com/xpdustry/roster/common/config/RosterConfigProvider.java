package com.xpdustry.roster.common.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Provider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RosterConfigProvider implements Provider<RosterConfig> {

    public static final String FILE_NAME = "roster.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(RosterConfigProvider.class);

    private final Gson gson = new Gson();
    private final Path directory;

    @Inject
    public RosterConfigProvider(final @Named("directory") Path directory) {
        this.directory = directory;
    }

    @Override
    public RosterConfig get() {
        final var file = this.directory.resolve(FILE_NAME);
        if (!Files.exists(file)) {
            LOGGER.info(
                    "No {} found in {}, using default limits {}",
                    FILE_NAME,
                    this.directory,
                    RosterConfig.DEFAULT.limits());
            return RosterConfig.DEFAULT;
        }
        final RosterConfig config;
        try (final var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            config = this.gson.fromJson(reader, RosterConfig.class);
        } catch (final IOException | JsonParseException e) {
            throw new IllegalStateException("Failed to load config from " + file, e);
        } catch (final RuntimeException e) {
            // Gson wraps exceptions thrown by record constructors in a bare RuntimeException
            throw new IllegalStateException("Invalid config in " + file, e);
        }
        if (config == null) {
            throw new IllegalStateException("The config file " + file + " is empty");
        }
        LOGGER.info("Loaded config from {} with limits {}", file, config.limits());
        return config;
    }
}
