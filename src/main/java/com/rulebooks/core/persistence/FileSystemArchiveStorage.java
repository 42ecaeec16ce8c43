package com.rulebooks.core.persistence;

import com.rulebooks.core.importer.ProjectImportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link ArchiveStorage} keeping blobs as plain files in one directory.
 * <p>
 * An existing blob is never overwritten: a clashing name gets a numeric
 * suffix ({@code 0000000042_1.archive.tar.gz}) and the new name is returned.
 */
public class FileSystemArchiveStorage implements ArchiveStorage {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArchiveStorage.class);

    private final Path root;

    public FileSystemArchiveStorage(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    @Override
    public String store(String filename, Path source) {
        requirePlainName(filename);
        try {
            Files.createDirectories(root);
            for (int attempt = 0; ; attempt++) {
                String candidate = attempt == 0 ? filename : withSuffix(filename, attempt);
                try {
                    Files.copy(source, root.resolve(candidate));
                    log.debug("Stored archive {} ({} bytes)", candidate, Files.size(root.resolve(candidate)));
                    return candidate;
                } catch (FileAlreadyExistsException e) {
                    log.debug("Archive {} already exists, trying another name", candidate);
                }
            }
        } catch (IOException e) {
            throw new ProjectImportException("Failed to store archive " + filename + " in " + root, e);
        }
    }

    @Override
    public void delete(String storedName) {
        requirePlainName(storedName);
        try {
            if (Files.deleteIfExists(root.resolve(storedName))) {
                log.debug("Deleted archive {}", storedName);
            }
        } catch (IOException e) {
            throw new ProjectImportException("Failed to delete archive " + storedName, e);
        }
    }

    @Override
    public Path resolve(String storedName) {
        requirePlainName(storedName);
        return root.resolve(storedName);
    }

    public Path root() {
        return root;
    }

    private static String withSuffix(String filename, int n) {
        int dot = filename.indexOf('.');
        if (dot < 0) {
            return filename + "_" + n;
        }
        return filename.substring(0, dot) + "_" + n + filename.substring(dot);
    }

    private static void requirePlainName(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.startsWith(".")) {
            throw new IllegalArgumentException("Invalid archive name: " + name);
        }
    }
}
