package com.ryuqq.runcontrol.adapter.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.runcontrol.core.model.FlagName;
import com.ryuqq.runcontrol.core.model.RunId;
import com.ryuqq.runcontrol.core.spi.AbstractControlStore;
import com.ryuqq.runcontrol.core.spi.ControlStore;
import com.ryuqq.runcontrol.core.spi.StoreUnavailableException;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * File-backed implementation of {@link ControlStore} for processes on the same host.
 *
 * <p>Each run is one JSON document ({@code <runId>.json}) in the configured directory.
 * The file name is the percent-encoded run id, see {@link #fileStem(RunId)}.
 * Writers serialize through an exclusive OS file lock on {@code <runId>.lock} and replace
 * the document with an atomic rename, so readers never observe a partial write and
 * need no lock at all.</p>
 *
 * <p><strong>Write path:</strong></p>
 * <pre>
 * in-JVM stripe lock          (FileChannel.lock is per JVM, not per thread)
 *   → OS lock on runId.lock   (other processes)
 *     → read runId.json
 *     → apply change          (compare-and-set may abort here)
 *     → write runId.json.tmp, atomic move over runId.json
 * </pre>
 *
 * <p><strong>Purge:</strong> deletes the document but keeps the zero-byte lock file, so every
 * process keeps locking the same inode.</p>
 *
 * <p><strong>Failures:</strong> I/O errors and unparseable documents surface as
 * {@link StoreUnavailableException}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FileControlStore extends AbstractControlStore {

    private static final Logger log = LoggerFactory.getLogger(FileControlStore.class);
    private static final int LOCK_STRIPES = 64;
    private static final int MAX_STEM_LENGTH = 200;

    /**
     * JVM-wide: two store instances on the same directory must not request overlapping
     * file locks from the same JVM.
     */
    private static final ReentrantLock[] STRIPES = new ReentrantLock[LOCK_STRIPES];

    static {
        for (int i = 0; i < LOCK_STRIPES; i++) {
            STRIPES[i] = new ReentrantLock();
        }
    }

    private final Path directory;
    private final ObjectMapper mapper;

    /**
     * Creates a store in the given configuration's directory, creating it if needed.
     *
     * @param config store configuration
     * @throws IllegalArgumentException if config is null
     * @throws StoreUnavailableException if the directory cannot be created
     */
    public FileControlStore(FileStoreConfig config) {
        this(config, new ObjectMapper());
    }

    /**
     * Creates a store with a caller-supplied mapper.
     *
     * @param config store configuration
     * @param mapper Jackson mapper used for run documents
     * @throws IllegalArgumentException if an argument is null
     * @throws StoreUnavailableException if the directory cannot be created
     */
    public FileControlStore(FileStoreConfig config, ObjectMapper mapper) {
        super(Duration.ofMillis(requireConfig(config).pollIntervalMs()));
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.directory = config.directory().toAbsolutePath().normalize();
        this.mapper = mapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot create store directory " + directory, e);
        }
        log.info("File control store initialised at {}", directory);
    }

    @Override
    protected Boolean readFlag(RunId runId, FlagName flagName) {
        RunDocument document = readDocument(runId);
        return document == null ? null : document.flags().get(flagName.getValue());
    }

    @Override
    protected void writeFlag(RunId runId, FlagName flagName, boolean value) {
        mutate(runId, document -> document.withFlag(flagName.getValue(), value));
    }

    @Override
    protected boolean compareAndSetFlag(RunId runId, FlagName flagName, Boolean expected, boolean value) {
        return mutate(runId, document -> Objects.equals(document.flags().get(flagName.getValue()), expected)
            ? document.withFlag(flagName.getValue(), value)
            : null);
    }

    @Override
    protected RunStatus readStatus(RunId runId) {
        RunDocument document = readDocument(runId);
        return document == null ? null : document.status();
    }

    @Override
    protected boolean compareAndSetStatus(RunId runId, RunStatus expected, RunStatus next) {
        return mutate(runId, document -> document.status() == expected ? document.withStatus(next) : null);
    }

    @Override
    protected String readMetadata(RunId runId, String key) {
        RunDocument document = readDocument(runId);
        return document == null ? null : document.metadata().get(key);
    }

    @Override
    protected void writeMetadata(RunId runId, String key, String value) {
        mutate(runId, document -> document.withMetadata(key, value));
    }

    @Override
    protected void deleteRun(RunId runId) {
        withRunLock(runId, () -> {
            if (Files.deleteIfExists(documentPath(runId))) {
                log.debug("Purged run {}", runId.getValue());
            }
            return true;
        });
    }

    /**
     * Store directory.
     *
     * @return absolute directory path
     */
    public Path getDirectory() {
        return directory;
    }

    Path documentPath(RunId runId) {
        return directory.resolve(fileStem(runId) + ".json");
    }

    private Path lockPath(RunId runId) {
        return directory.resolve(fileStem(runId) + ".lock");
    }

    /**
     * Maps a run id onto a file name stem.
     *
     * <p>The id is percent-encoded ({@code job:42} becomes {@code job%3A42}), so path
     * separators never reach the file system. Stems longer than 200
     * characters are replaced by {@code ~} plus the SHA-256 of the id; the encoder always
     * escapes {@code ~}, so the two forms cannot collide.</p>
     */
    static String fileStem(RunId runId) {
        String value = runId.getValue();
        String encoded = URLEncoder.encode(value, StandardCharsets.UTF_8).replace("*", "%2A");
        if (encoded.length() <= MAX_STEM_LENGTH) {
            return encoded;
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return "~" + HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Applies a change under the run lock.
     *
     * @param change returns the new document, or null to abort without writing
     * @return true if a new document was written
     */
    private boolean mutate(RunId runId, UnaryOperator<RunDocument> change) {
        return withRunLock(runId, () -> {
            RunDocument current = readDocument(runId);
            RunDocument next = change.apply(current == null ? RunDocument.empty() : current);
            if (next == null) {
                return false;
            }
            writeDocument(runId, next);
            return true;
        });
    }

    private boolean withRunLock(RunId runId, LockedAction action) {
        Path lockPath = lockPath(runId);
        ReentrantLock stripe = STRIPES[Math.floorMod(lockPath.hashCode(), LOCK_STRIPES)];
        stripe.lock();
        try (FileChannel channel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            return action.run();
        } catch (IOException e) {
            throw new StoreUnavailableException("File store I/O failure for run " + runId.getValue(), e);
        } finally {
            stripe.unlock();
        }
    }

    private RunDocument readDocument(RunId runId) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(documentPath(runId));
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot read run document " + documentPath(runId), e);
        }
        try {
            return mapper.readValue(bytes, RunDocument.class);
        } catch (IOException e) {
            throw new StoreUnavailableException("Corrupted run document " + documentPath(runId), e);
        }
    }

    private void writeDocument(RunId runId, RunDocument document) throws IOException {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Cannot serialise run document for " + runId.getValue(), e);
        }
        Path target = documentPath(runId);
        Path temp = directory.resolve(fileStem(runId) + ".json.tmp");
        Files.write(temp, bytes);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    private static FileStoreConfig requireConfig(FileStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    @FunctionalInterface
    private interface LockedAction {
        boolean run() throws IOException;
    }
}
