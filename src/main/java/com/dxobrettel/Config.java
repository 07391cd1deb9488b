package com.dxobrettel;

import com.dxobrettel.letterboxd.LetterboxdSession;
import com.dxobrettel.letterboxd.LetterboxdUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/**
 * Connector settings. Built once at startup and passed to the connector; there is no
 * process-wide instance.
 *
 * <p>Sources, lowest precedence first: defaults, the properties file, environment.
 */
public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    static final Path APP_DIR = Path.of(System.getProperty("user.home"), ".letterboxd-connector");
    static final Path DEFAULT_CONFIG_FILE = APP_DIR.resolve("connector.properties");

    public static final String USERNAME = "LETTERBOXD_USERNAME";
    public static final String PASSWORD = "LETTERBOXD_PASSWORD";
    public static final String BASE_URL = "LETTERBOXD_BASE_URL";
    public static final String CACHE_PATH = "LETTERBOXD_CACHE_PATH";
    public static final String DOWNLOAD_DIR = "LETTERBOXD_DOWNLOAD_DIR";
    public static final String ENRICH_WORKERS = "LETTERBOXD_ENRICH_WORKERS";
    public static final String USER_AGENT = "LETTERBOXD_USER_AGENT";

    private static final String[] KEYS = {USERNAME, PASSWORD, BASE_URL, CACHE_PATH, DOWNLOAD_DIR, ENRICH_WORKERS, USER_AGENT};
    private static final int DEFAULT_ENRICH_WORKERS = 4;

    private final String username;
    private final String password;
    private final String baseUrl;
    private final Path cachePath;
    private final Path downloadDir;
    private final int enrichWorkers;
    private final String userAgent;

    private Config(Properties props) {
        this.username = trimOrNull(props.getProperty(USERNAME));
        this.password = trimOrNull(props.getProperty(PASSWORD));
        this.baseUrl = new LetterboxdUrls(props.getProperty(BASE_URL)).baseUrl();
        this.cachePath = pathOr(props.getProperty(CACHE_PATH), APP_DIR.resolve("cache.db"));
        this.downloadDir = pathOr(props.getProperty(DOWNLOAD_DIR), APP_DIR.resolve("static"));
        this.enrichWorkers = parseWorkers(props.getProperty(ENRICH_WORKERS));
        String ua = trimOrNull(props.getProperty(USER_AGENT));
        this.userAgent = ua != null ? ua : LetterboxdSession.DEFAULT_USER_AGENT;
    }

    public static Config load() {
        return load(DEFAULT_CONFIG_FILE, System.getenv());
    }

    public static Config load(Path configFile) {
        return load(configFile, System.getenv());
    }

    /**
     * @param env environment lookup; tests pass a plain map instead of mutating the process
     */
    public static Config load(Path configFile, Map<String, String> env) {
        Properties props = new Properties();

        // 1) file
        if (configFile != null && Files.exists(configFile)) {
            try (InputStream in = Files.newInputStream(configFile)) {
                props.load(in);
                log.debug("Loaded configuration from {}", configFile);
            } catch (IOException e) {
                log.warn("Could not load config file {}: {}", configFile, e.getMessage());
            }
        }

        // 2) environment wins
        if (env != null) {
            for (String key : KEYS) {
                String value = env.get(key);
                if (value != null && !value.isBlank()) {
                    props.setProperty(key, value);
                }
            }
        }
        return new Config(props);
    }

    public static Config of(Map<String, String> values) {
        Properties props = new Properties();
        values.forEach(props::setProperty);
        return new Config(props);
    }

    public boolean hasCredentials() {
        return username != null && password != null;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Path getCachePath() {
        return cachePath;
    }

    public Path getDownloadDir() {
        return downloadDir;
    }

    public int getEnrichWorkers() {
        return enrichWorkers;
    }

    public String getUserAgent() {
        return userAgent;
    }

    @Override
    public String toString() {
        return "Config{username=" + username
                + ", password=" + (password == null ? "<unset>" : "<set>")
                + ", baseUrl=" + baseUrl
                + ", cachePath=" + cachePath
                + ", downloadDir=" + downloadDir
                + ", enrichWorkers=" + enrichWorkers + "}";
    }

    private static int parseWorkers(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_ENRICH_WORKERS;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed > 0 ? parsed : DEFAULT_ENRICH_WORKERS;
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {} value '{}'", ENRICH_WORKERS, raw);
            return DEFAULT_ENRICH_WORKERS;
        }
    }

    private static Path pathOr(String raw, Path fallback) {
        String value = trimOrNull(raw);
        if (value == null) {
            return fallback;
        }
        if (value.startsWith("~")) {
            value = System.getProperty("user.home") + value.substring(1);
        }
        return Path.of(value);
    }

    private static String trimOrNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
