package com.dxobrettel;

import com.dxobrettel.letterboxd.LetterboxdConnector;
import com.dxobrettel.letterboxd.error.LetterboxdException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        Config config = Config.load();
        log.info("Starting with {}", config);
        try {
            LetterboxdConnector connector = LetterboxdConnector.create(config);
            connector.initialize();

            if (!config.hasCredentials()) {
                log.error("No credentials configured. Set {} and {}.", Config.USERNAME, Config.PASSWORD);
                System.exit(1);
                return;
            }
            connector.login(config.getUsername(), config.getPassword());

            Path extracted = connector.downloadExport(config.getDownloadDir());
            log.info("Data successfully downloaded in {}", extracted);
        } catch (LetterboxdException e) {
            log.error("Export failed: {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted");
            System.exit(1);
        }
    }
}
