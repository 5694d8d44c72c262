package com.foodinsight.pipeline.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import lombok.extern.slf4j.Slf4j;

/**
 * Loads pipeline properties from an external file (working directory, then
 * {@code config/}), falling back to the classpath copy.
 */
@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_FILE = "foodinsight.properties";

    private ConfigLoader() {}

    public static Properties loadDefault() throws IOException {
        return load(DEFAULT_FILE);
    }

    /**
     * Reads {@code fileName}, preferring an operator-edited copy next to the
     * process (the one the reloader watches) over the packaged defaults.
     */
    public static Properties load(String fileName) throws IOException {
        Path externalPath = resolveExternal(fileName);
        if (externalPath != null) {
            try {
                Properties props = read(Files.newInputStream(externalPath));
                log.info("Edge settings read from {} (eligible for runtime reload)", externalPath.toAbsolutePath());
                return props;
            } catch (IOException ex) {
                log.warn("Cannot read edge settings from {}, using the packaged {}", externalPath, fileName, ex);
            }
        }

        InputStream packaged = ConfigLoader.class.getClassLoader().getResourceAsStream(fileName);
        if (packaged == null) {
            throw new IOException("No " + fileName + " next to the process, under config/ or packaged with the application");
        }
        Properties props = read(packaged);
        log.info("Edge settings read from packaged {}; runtime reload is off without an external copy", fileName);
        return props;
    }

    private static Properties read(InputStream source) throws IOException {
        Properties props = new Properties();
        try (InputStream input = source) {
            props.load(input);
        }
        return props;
    }

    /**
     * Where the external copy of {@code fileName} lives, or null if there is none.
     */
    public static Path resolveExternal(String fileName) {
        Path externalPath = Paths.get(fileName);
        if (!Files.exists(externalPath)) {
            externalPath = Paths.get("config", fileName);
        }
        return Files.isRegularFile(externalPath) ? externalPath : null;
    }
}
