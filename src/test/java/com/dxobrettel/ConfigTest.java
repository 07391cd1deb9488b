package com.dxobrettel;

import com.dxobrettel.letterboxd.LetterboxdSession;
import com.dxobrettel.letterboxd.LetterboxdUrls;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("defaults apply when nothing is configured")
    void defaults() {
        Config config = Config.load(tempDir.resolve("missing.properties"), Map.of());

        assertEquals(LetterboxdUrls.DEFAULT_BASE_URL, config.getBaseUrl());
        assertEquals(4, config.getEnrichWorkers());
        assertEquals(LetterboxdSession.DEFAULT_USER_AGENT, config.getUserAgent());
        assertTrue(config.getCachePath().endsWith(Path.of(".letterboxd-connector", "cache.db")));
        assertTrue(config.getDownloadDir().endsWith(Path.of(".letterboxd-connector", "static")));
        assertFalse(config.hasCredentials());
    }

    @Test
    @DisplayName("environment overrides the properties file")
    void environmentWins() throws Exception {
        Path file = tempDir.resolve("connector.properties");
        Files.writeString(file, """
                LETTERBOXD_USERNAME=from-file
                LETTERBOXD_PASSWORD=file-secret
                LETTERBOXD_BASE_URL=http://localhost:9000/
                LETTERBOXD_ENRICH_WORKERS=8
                """);

        Config config = Config.load(file, Map.of(
                Config.USERNAME, "from-env",
                Config.CACHE_PATH, tempDir.resolve("c.db").toString()
        ));

        assertEquals("from-env", config.getUsername());
        assertEquals("file-secret", config.getPassword());
        assertEquals("http://localhost:9000", config.getBaseUrl());
        assertEquals(8, config.getEnrichWorkers());
        assertEquals(tempDir.resolve("c.db"), config.getCachePath());
        assertTrue(config.hasCredentials());
    }

    @Test
    @DisplayName("invalid worker counts fall back to the default")
    void invalidWorkers() {
        assertEquals(4, Config.of(Map.of(Config.ENRICH_WORKERS, "many")).getEnrichWorkers());
        assertEquals(4, Config.of(Map.of(Config.ENRICH_WORKERS, "0")).getEnrichWorkers());
    }

    @Test
    @DisplayName("toString never prints the password")
    void toStringMasksPassword() {
        Config config = Config.of(Map.of(Config.USERNAME, "tester", Config.PASSWORD, "hunter2"));
        assertFalse(config.toString().contains("hunter2"));
        assertTrue(config.toString().contains("tester"));
    }
}
