package io.github.drompincen.javaclawsessions.persistence.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.drompincen.javaclawsessions.protocol.api.SessionMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Metadata record of each session, kept in {@code metadata.json}.
 *
 * <p>Writes go through a temp file and an atomic move, so readers never see a partial record.
 * Updates of one session are serialized on a per-session lock; updates of different sessions
 * run independently.
 */
public class SessionMetadataStore {

    private static final Logger log = LoggerFactory.getLogger(SessionMetadataStore.class);

    private final SessionJsonCodec codec;
    private final String defaultWorkingDir;
    private final SessionLocks locks = new SessionLocks();

    public SessionMetadataStore(SessionJsonCodec codec, String defaultWorkingDir) {
        this.codec = codec;
        this.defaultWorkingDir = defaultWorkingDir;
    }

    /** Empty when nothing has been persisted for the session yet. */
    public Optional<SessionMetadata> find(SessionLocation location) {
        Path file = location.metadataFile();
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new SessionStorageException("Failed to read metadata of session " + location.id(), e);
        }
        try {
            SessionMetadata metadata = codec.readMetadata(content);
            if (metadata == null) {
                throw new CorruptSessionDataException(location.id().value(), file, "metadata is null", null);
            }
            return Optional.of(metadata);
        } catch (JsonProcessingException e) {
            throw new CorruptSessionDataException(location.id().value(), file, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CorruptSessionDataException(location.id().value(), file, e.getMessage(), e);
        }
    }

    /** The stored metadata, or {@link #defaults()} when none was persisted. */
    public SessionMetadata read(SessionLocation location) {
        return find(location).orElseGet(this::defaults);
    }

    public SessionMetadata defaults() {
        return SessionMetadata.defaults(defaultWorkingDir);
    }

    /** Replaces the metadata record, creating the session directory if needed. */
    public void write(SessionLocation location, SessionMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        locks.run(location, () -> persist(location, metadata));
    }

    /**
     * Applies {@code mutate} to the current record and commits the result atomically.
     *
     * @throws SessionNotFoundException if the session directory does not exist
     */
    public SessionMetadata update(SessionLocation location, UnaryOperator<SessionMetadata> mutate) {
        Objects.requireNonNull(mutate, "mutate");
        return locks.call(location, () -> {
            if (!Files.isDirectory(location.directory())) {
                throw new SessionNotFoundException(location.id().value());
            }
            SessionMetadata updated = mutate.apply(read(location));
            if (updated == null) {
                throw new IllegalArgumentException("Metadata mutation returned null for session " + location.id());
            }
            persist(location, updated);
            return updated;
        });
    }

    private void persist(SessionLocation location, SessionMetadata metadata) {
        try {
            AtomicFiles.write(location.metadataFile(), codec.writeMetadata(metadata));
            log.debug("Saved metadata of session {}", location.id());
        } catch (IOException e) {
            throw new SessionStorageException("Failed to write metadata of session " + location.id(), e);
        }
    }

    int lockCount() {
        return locks.size();
    }
}
