package com.programmewatch.watcher.infrastructure.file;

import com.programmewatch.watcher.domain.exceptions.StorageException;
import com.programmewatch.watcher.domain.programme.ProgrammeSnapshot;
import com.programmewatch.watcher.domain.snapshot.SnapshotStore;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * One JSON file per market under the storage directory. A commit writes a temp
 * file in the same directory, forces it to disk and renames it over the market's
 * file, so readers only ever see a complete old or a complete new snapshot.
 */
@Slf4j
public class FileSnapshotStore implements SnapshotStore {

    private static final Pattern MARKET_KEY = Pattern.compile("[A-Za-z0-9_-]+");
    private static final String SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Map<String, ReentrantLock> commitLocks = new ConcurrentHashMap<>();

    public FileSnapshotStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ProgrammeSnapshot> load(String marketKey) {
        var file = fileFor(marketKey);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw StorageException.readFailed(marketKey, file, e);
        }

        try {
            var document = objectMapper.readValue(bytes, SnapshotDocument.class);
            if (document == null) {
                throw StorageException.corrupt(marketKey, file, new IllegalStateException("Snapshot document is null"));
            }
            if (document.version() != SnapshotDocument.CURRENT_VERSION) {
                throw StorageException.corrupt(marketKey, file,
                        new IllegalStateException("Unsupported snapshot version " + document.version()));
            }
            if (!marketKey.equals(document.marketKey()) || document.observedAt() == null) {
                throw StorageException.corrupt(marketKey, file,
                        new IllegalStateException("Snapshot header does not match market " + marketKey));
            }
            return Optional.of(document.toSnapshot());
        } catch (JacksonException | IllegalArgumentException e) {
            throw StorageException.corrupt(marketKey, file, e);
        }
    }

    @Override
    public void commit(String marketKey, ProgrammeSnapshot snapshot) {
        if (!marketKey.equals(snapshot.marketKey())) {
            throw new IllegalArgumentException(
                    "Snapshot of market " + snapshot.marketKey() + " cannot be committed as " + marketKey);
        }
        var target = fileFor(marketKey);
        var lock = commitLocks.computeIfAbsent(marketKey, k -> new ReentrantLock());
        lock.lock();
        try {
            var bytes = objectMapper.writeValueAsBytes(SnapshotDocument.from(snapshot));
            Files.createDirectories(directory);
            var temp = Files.createTempFile(directory, marketKey + "-", TEMP_SUFFIX);
            try {
                write(temp, bytes);
                replace(temp, target);
            } catch (IOException | RuntimeException e) {
                Files.deleteIfExists(temp);
                throw e;
            }
            log.debug("snapshot.committed: market={}, programmes={}, file={}", marketKey, snapshot.size(), target);
        } catch (IOException | JacksonException e) {
            throw StorageException.writeFailed(marketKey, target, e);
        } finally {
            lock.unlock();
        }
    }

    private void write(Path temp, byte[] bytes) throws IOException {
        try (var channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            var buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private void replace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename unsupported in {}, falling back to replacing move", directory);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path fileFor(String marketKey) {
        if (marketKey == null || !MARKET_KEY.matcher(marketKey).matches()) {
            throw new IllegalArgumentException("Invalid market key: " + marketKey);
        }
        return directory.resolve(marketKey + SUFFIX);
    }
}
