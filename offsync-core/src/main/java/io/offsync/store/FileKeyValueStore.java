package io.offsync.store;

import io.offsync.spi.KeyValueStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link KeyValueStore} keeping one file per key under a directory.
 *
 * <p>File names are the URL-safe Base64 encoding of the key. Writes go to a temporary file
 * that is then moved over the target, atomically where the file system supports it, so a
 * crash mid-write leaves the previous value intact.
 */
public final class FileKeyValueStore implements KeyValueStore {
    private static final String SUFFIX = ".json";

    private final Path directory;

    public FileKeyValueStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path directory() {
        return directory;
    }

    @Override
    public Optional<String> get(String key) {
        Path file = fileFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StoreException("Failed to read key=" + key + " from " + file, e);
        }
    }

    @Override
    public void set(String key, String value) {
        Objects.requireNonNull(value, "value");
        Path target = fileFor(key);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, ".kv-", ".tmp");
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new StoreException("Failed to write key=" + key + " to " + target, e);
        }
    }

    @Override
    public void remove(String key) {
        Path file = fileFor(key);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StoreException("Failed to remove key=" + key + " at " + file, e);
        }
    }

    private Path fileFor(String key) {
        Objects.requireNonNull(key, "key");
        String name = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(key.getBytes(StandardCharsets.UTF_8));
        return directory.resolve(name + SUFFIX);
    }

    private static void deleteQuietly(Path temp, IOException primary) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
