package com.foodinsight.pipeline.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import com.foodinsight.pipeline.model.Region;

class ConfigLoaderTest {

    @Test
    void loadsDefaultFileFromClasspath() throws IOException {
        Properties props = ConfigLoader.loadDefault();

        PipelineSettings settings = PipelineSettings.fromProperties(props);
        assertEquals("test-machine", settings.machineId());
        assertEquals(320, settings.frameWidth());
        assertEquals(new Region(10, 20, 110, 120), settings.region());
        assertEquals(5, settings.debounceThreshold());
    }

    @Test
    void missingFileIsAnError() {
        IOException missing = assertThrows(IOException.class, () -> ConfigLoader.load("does-not-exist.properties"));
        assertTrue(missing.getMessage().contains("does-not-exist.properties"));
        assertTrue(missing.getMessage().contains("config/"));
        assertNull(ConfigLoader.resolveExternal("does-not-exist.properties"));
    }
}
