package com.dataops.loader.storage;

import com.dataops.loader.config.LoaderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.UUID;
import java.util.zip.GZIPInputStream;

/**
 * Stores source files in a local directory.
 *
 * Stored names are {@code <uuid>_<sanitized original name>}; the original
 * extension is kept so {@code .gz} files can be decompressed on read.
 */
@Service
public class LocalSourceFileStorage implements SourceFileStorage {

    private static final Logger logger = LoggerFactory.getLogger(LocalSourceFileStorage.class);

    private final Path directory;

    public LocalSourceFileStorage(LoaderProperties properties) {
        this.directory = Paths.get(properties.getStorage().getDirectory()).toAbsolutePath().normalize();
    }

    @Override
    public String save(byte[] content, String originalName) throws IOException {
        String storedName = UUID.randomUUID() + "_" + sanitizeFileName(originalName);
        Path path = resolve(storedName);
        if (!Files.exists(path.getParent())) {
            Files.createDirectories(path.getParent());
        }
        Files.write(path, content);
        logger.debug("Stored {} ({} bytes) as {}", originalName, content.length, path);
        return storedName;
    }

    @Override
    public InputStream open(String storedName) throws IOException {
        Path path = resolve(storedName);
        InputStream inputStream = new BufferedInputStream(Files.newInputStream(path));
        if (storedName.toLowerCase(Locale.ROOT).endsWith(".gz")) {
            logger.debug("Decompressing GZIP file: {}", storedName);
            try {
                return new GZIPInputStream(inputStream);
            } catch (IOException e) {
                inputStream.close();
                throw e;
            }
        }
        return inputStream;
    }

    @Override
    public boolean exists(String storedName) {
        return Files.isRegularFile(resolve(storedName));
    }

    public Path getDirectory() {
        return directory;
    }

    private Path resolve(String storedName) {
        Path path = directory.resolve(storedName).normalize();
        if (!path.startsWith(directory)) {
            throw new IllegalArgumentException("Stored name escapes the storage directory: " + storedName);
        }
        return path;
    }

    /**
     * Keep letters, digits, dot, dash and underscore; everything else becomes '_'.
     */
    static String sanitizeFileName(String name) {
        if (name == null || name.isBlank()) {
            return "upload";
        }
        String normalized = name.replace('\\', '/');
        String base = normalized.substring(normalized.lastIndexOf('/') + 1);
        String sanitized = base.replaceAll("[^A-Za-z0-9._-]", "_").replaceAll("^\\.+", "");
        return sanitized.isEmpty() ? "upload" : sanitized;
    }
}
