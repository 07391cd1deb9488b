package com.dxobrettel.letterboxd;

import com.dxobrettel.letterboxd.error.LetterboxdConnectionException;
import com.dxobrettel.letterboxd.error.LetterboxdException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Downloads the account's export archive and unpacks it next to where it was saved.
 */
public class DataExportRetriever {

    private static final Logger log = LoggerFactory.getLogger(DataExportRetriever.class);
    private static final String ARCHIVE_CONTENT_TYPE = "application/zip";

    private final LetterboxdSession session;

    public DataExportRetriever(LetterboxdSession session) {
        this.session = session;
    }

    /**
     * @return the directory the archive was extracted into
     */
    public Path downloadAndExtract(Path destinationDir) throws LetterboxdException, InterruptedException {
        session.requireAuthenticated("download export data");

        HttpResponse<byte[]> resp = session.getBytes(session.urls().dataExport());
        if (resp.statusCode() != 200) {
            throw new LetterboxdConnectionException("Failed to download export data from Letterboxd", resp.statusCode());
        }
        String contentType = resp.headers().firstValue("Content-Type").orElse("");
        if (!contentType.contains(ARCHIVE_CONTENT_TYPE)) {
            log.warn("Unexpected export content type: {}", contentType);
            throw new LetterboxdConnectionException("Received invalid response. Expected a ZIP file, got '" + contentType + "'");
        }
        String filename = filenameFromDisposition(resp.headers().firstValue("Content-Disposition").orElse(null))
                .orElseThrow(() -> new LetterboxdConnectionException("Could not determine the filename from the response headers"));

        try {
            Files.createDirectories(destinationDir);
            Path archive = destinationDir.resolve(filename);
            Files.write(archive, resp.body());
            log.info("Export data saved to '{}'", archive);

            Path extractDir = destinationDir.resolve(stripExtension(filename));
            extract(archive, extractDir);
            log.info("Export data extracted to '{}'", extractDir);

            Files.delete(archive);
            log.debug("Temporary archive '{}' deleted", archive);
            return extractDir;
        } catch (IOException e) {
            throw new LetterboxdConnectionException("Failed to store export archive: " + e.getMessage(), e);
        }
    }

    /**
     * Pulls the file name out of a header such as
     * {@code attachment; filename="letterboxd-user-2024-01-01.zip"}.
     */
    static Optional<String> filenameFromDisposition(String disposition) {
        if (disposition == null) {
            return Optional.empty();
        }
        int idx = disposition.toLowerCase().indexOf("filename=");
        if (idx < 0) {
            return Optional.empty();
        }
        String name = disposition.substring(idx + "filename=".length()).trim();
        int semicolon = name.indexOf(';');
        if (semicolon >= 0) {
            name = name.substring(0, semicolon);
        }
        name = name.replace("\"", "").trim();
        if (name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Path.of(name).getFileName().toString());
    }

    private static void extract(Path archive, Path targetDir) throws IOException, LetterboxdConnectionException {
        Path root = targetDir.toAbsolutePath().normalize();
        Files.createDirectories(root);
        try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path out = root.resolve(entry.getName()).normalize();
                if (!out.startsWith(root)) {
                    throw new LetterboxdConnectionException("Archive entry escapes target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(out);
                } else {
                    Files.createDirectories(out.getParent());
                    Files.copy(zip, out, StandardCopyOption.REPLACE_EXISTING);
                }
                zip.closeEntry();
            }
        }
    }

    private static String stripExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
