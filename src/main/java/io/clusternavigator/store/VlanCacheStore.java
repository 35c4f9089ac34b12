package io.clusternavigator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.clusternavigator.models.CacheEnvelope;
import io.clusternavigator.models.SyncDataset;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Optional;

import static io.clusternavigator.config.Constants.CACHE_READ_MAX_RETRIES;
import static io.clusternavigator.config.Constants.CACHE_READ_RETRY_DELAY_MILLIS;
import static io.clusternavigator.config.Constants.CACHE_TEMP_SUFFIX;
import static io.clusternavigator.config.Constants.CACHE_WRITE_MAX_RETRIES;
import static io.clusternavigator.config.Constants.CACHE_WRITE_RETRY_DELAY_MILLIS;

/**
 * File-backed cache of the last synchronized VLAN dataset.
 * <p>
 * Several replicas may share the cache file. Writers serialize into a sibling temporary file
 * under an exclusive lock, force it to disk and atomically rename it over the target, so
 * readers always see either the previous or the new complete file. Readers hold a shared lock.
 * <p>
 * The JVM allows one lock per file and process, so callers inside this process are serialized
 * before the file locks are taken.
 */
@Slf4j
public class VlanCacheStore {

    private final Path cacheFile;
    private final Path tempFile;
    private final ObjectMapper objectMapper;

    // One monitor for reads and writes: the renamed file keeps the writer's lock until it is released
    private final Object monitor = new Object();

    public VlanCacheStore(Path cacheFile) {
        this.cacheFile = cacheFile.toAbsolutePath();
        this.tempFile = this.cacheFile.resolveSibling(this.cacheFile.getFileName() + CACHE_TEMP_SUFFIX);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
        log.info("VlanCacheStore using cache file {}", this.cacheFile);
    }

    /**
     * Persist a dataset, stamped with the current time.
     *
     * @return true once the new file is in place, false after all retries failed
     */
    public boolean save(SyncDataset dataset) {
        byte[] content;
        try {
            content = objectMapper.writeValueAsBytes(new CacheEnvelope(Instant.now(), dataset));
        } catch (JsonProcessingException e) {
            log.error("Cache - failed to serialize dataset: {}", e.getMessage(), e);
            return false;
        }

        synchronized (monitor) {
            for (int attempt = 1; attempt <= CACHE_WRITE_MAX_RETRIES; attempt++) {
                try {
                    if (writeOnce(content)) {
                        log.debug("Cache - wrote {} bytes to {}", content.length, cacheFile);
                        return true;
                    }
                    log.debug("Cache - temporary file was replaced by another writer, retrying");
                } catch (IOException e) {
                    if (attempt == CACHE_WRITE_MAX_RETRIES) {
                        log.error("Cache - failed to write {} after {} attempts: {}",
                            cacheFile, CACHE_WRITE_MAX_RETRIES, e.getMessage());
                        return false;
                    }
                    log.warn("Cache - write attempt {} failed for {}, retrying: {}", attempt, cacheFile, e.getMessage());
                }
                if (!pause(CACHE_WRITE_RETRY_DELAY_MILLIS)) {
                    return false;
                }
            }
            log.error("Cache - gave up writing {} after {} attempts", cacheFile, CACHE_WRITE_MAX_RETRIES);
            return false;
        }
    }

    /**
     * @return false when the locked file is no longer the current temporary file
     */
    private boolean writeOnce(byte[] content) throws IOException {
        Path parent = cacheFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (FileChannel channel = FileChannel.open(tempFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            Object openedKey = fileKey(tempFile);
            try (FileLock lock = channel.lock()) {
                // Another replica may have renamed the file we opened while we were blocked
                if (!isCurrentTempFile(openedKey)) {
                    return false;
                }
                channel.truncate(0);
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
                Files.move(tempFile, cacheFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                return true;
            }
        }
    }

    /**
     * True when the temporary path still names the file identified by {@code openedKey}.
     * Without file keys on this platform only existence can be checked.
     */
    boolean isCurrentTempFile(Object openedKey) throws IOException {
        try {
            Object currentKey = fileKey(tempFile);
            return openedKey == null || openedKey.equals(currentKey);
        } catch (NoSuchFileException e) {
            return false;
        }
    }

    /**
     * @return the platform file identity, or null when the platform has none
     * @throws NoSuchFileException when the path does not exist
     */
    static Object fileKey(Path path) throws IOException {
        return Files.readAttributes(path, BasicFileAttributes.class).fileKey();
    }

    public Optional<SyncDataset> load() {
        return loadEnvelope().map(CacheEnvelope::getData);
    }

    /**
     * Read the cache file. Missing, unreadable and malformed files all read as absent.
     */
    public Optional<CacheEnvelope> loadEnvelope() {
        synchronized (monitor) {
            for (int attempt = 1; attempt <= CACHE_READ_MAX_RETRIES; attempt++) {
                if (!Files.exists(cacheFile)) {
                    return Optional.empty();
                }
                try {
                    CacheEnvelope envelope = objectMapper.readValue(readLocked(), CacheEnvelope.class);
                    if (envelope == null || envelope.getData() == null) {
                        log.error("Cache - {} holds no dataset", cacheFile);
                        return Optional.empty();
                    }
                    return Optional.of(envelope);
                } catch (NoSuchFileException e) {
                    return Optional.empty();
                } catch (JsonProcessingException e) {
                    log.error("Cache - invalid JSON in {}: {}", cacheFile, e.getOriginalMessage());
                    return Optional.empty();
                } catch (IOException e) {
                    if (attempt == CACHE_READ_MAX_RETRIES) {
                        log.error("Cache - failed to read {} after {} attempts: {}",
                            cacheFile, CACHE_READ_MAX_RETRIES, e.getMessage());
                        return Optional.empty();
                    }
                    log.warn("Cache - read attempt {} failed for {}, retrying", attempt, cacheFile);
                    if (!pause(CACHE_READ_RETRY_DELAY_MILLIS)) {
                        return Optional.empty();
                    }
                }
            }
            return Optional.empty();
        }
    }

    private byte[] readLocked() throws IOException {
        try (FileChannel channel = FileChannel.open(cacheFile, StandardOpenOption.READ);
             FileLock lock = channel.lock(0L, Long.MAX_VALUE, true)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.max(channel.size(), 0L));
            ByteBuffer buffer = ByteBuffer.allocate(8192);
            while (channel.read(buffer) > 0) {
                buffer.flip();
                out.write(buffer.array(), 0, buffer.limit());
                buffer.clear();
            }
            return out.toByteArray();
        }
    }

    public Optional<Instant> getLastUpdated() {
        return loadEnvelope().map(CacheEnvelope::getLastUpdated);
    }

    public boolean exists() {
        return Files.exists(cacheFile);
    }

    /**
     * Modification time of the cache file, used for cache age reporting.
     */
    public Optional<Instant> lastModified() {
        try {
            return Optional.of(Files.getLastModifiedTime(cacheFile).toInstant());
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Cache - cannot read modification time of {}: {}", cacheFile, e.getMessage());
            return Optional.empty();
        }
    }

    public Path getCacheFile() {
        return cacheFile;
    }

    private static boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Cache - interrupted while waiting to retry");
            return false;
        }
    }
}
