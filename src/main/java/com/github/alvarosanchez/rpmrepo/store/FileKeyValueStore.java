package com.github.alvarosanchez.rpmrepo.store;

import com.github.alvarosanchez.rpmrepo.config.RepositorySettings;
import com.github.alvarosanchez.rpmrepo.exception.StorageUnavailableException;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link KeyValueStore} keeping one file per key under {@code <data dir>/kv}.
 *
 * <p>Keys are URL-encoded into file names. Each write goes to its own uniquely named temporary sibling
 * and is then moved over the target, so readers never observe a partially written value and concurrent
 * writers of the same key never share a temporary file.
 */
@Singleton
public final class FileKeyValueStore implements KeyValueStore {

    private static final String TEMP_SUFFIX = ".tmp";

    private final RepositorySettings settings;

    FileKeyValueStore(RepositorySettings settings) {
        this.settings = settings;
    }

    @Override
    public Optional<byte[]> get(String key) {
        Path file = fileFor(key);
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read `" + key + "` from " + file, e);
        }
    }

    @Override
    public void put(String key, byte[] value) {
        Path file = fileFor(key);
        Path temp = null;
        try {
            Files.createDirectories(file.getParent());
            temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), TEMP_SUFFIX);
            Files.write(temp, value);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            StorageUnavailableException failure =
                new StorageUnavailableException("Failed to write `" + key + "` to " + file, e);
            deleteTemporary(temp, failure);
            throw failure;
        }
    }

    @Override
    public void delete(String key) {
        Path file = fileFor(key);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to delete `" + key + "` at " + file, e);
        }
    }

    static String fileName(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Store key is required.");
        }
        String encoded = URLEncoder.encode(key, StandardCharsets.UTF_8);
        if (encoded.equals(".") || encoded.equals("..")) {
            throw new IllegalArgumentException("Store key `" + key + "` is not allowed.");
        }
        return encoded;
    }

    private static void deleteTemporary(Path temp, StorageUnavailableException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private Path fileFor(String key) {
        return storeDirectory().resolve(fileName(key));
    }

    private Path storeDirectory() {
        return settings.dataDirectory().resolve("kv");
    }
}
