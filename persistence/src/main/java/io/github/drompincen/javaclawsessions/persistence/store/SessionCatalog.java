package io.github.drompincen.javaclawsessions.persistence.store;

import io.github.drompincen.javaclawsessions.protocol.api.SessionInfo;
import io.github.drompincen.javaclawsessions.protocol.api.SessionMetadata;
import io.github.drompincen.javaclawsessions.protocol.api.SortOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Enumerates every session below the catalog root. A session whose record cannot be read is
 * left out of the listing and logged; only a failure to enumerate the root itself is raised.
 */
public class SessionCatalog {

    private static final Logger log = LoggerFactory.getLogger(SessionCatalog.class);

    private final SessionPathResolver resolver;
    private final SessionMetadataStore metadataStore;

    public SessionCatalog(SessionPathResolver resolver, SessionMetadataStore metadataStore) {
        this.resolver = resolver;
        this.metadataStore = metadataStore;
    }

    public List<SessionInfo> list() {
        return list(SortOrder.DESCENDING);
    }

    /** Sessions ordered by modification time to the second, ties broken by id ascending. */
    public List<SessionInfo> list(SortOrder order) {
        List<CatalogEntry> entries = new ArrayList<>();
        for (Path directory : sessionDirectories()) {
            String name = directory.getFileName().toString();
            if (!SessionId.isValid(name)) {
                log.debug("Ignoring directory {} in session catalog", name);
                continue;
            }
            try {
                SessionLocation location = resolver.resolve(name);
                Optional<Instant> modified = lastModified(location);
                if (modified.isEmpty()) {
                    log.debug("Ignoring empty session directory {}", name);
                    continue;
                }
                entries.add(new CatalogEntry(name, modified.get(), metadataStore.read(location)));
            } catch (SessionStoreException e) {
                log.warn("Skipping unreadable session {}: {}", name, e.getMessage());
            }
        }

        Comparator<CatalogEntry> byModified = Comparator.comparing(CatalogEntry::modified);
        if (order == SortOrder.DESCENDING) {
            byModified = byModified.reversed();
        }
        return entries.stream()
                .sorted(byModified.thenComparing(CatalogEntry::id))
                .map(e -> new SessionInfo(e.id(), SessionInfo.MODIFIED_FORMAT.format(e.modified()), e.metadata()))
                .collect(Collectors.toList());
    }

    public boolean exists(String sessionId) {
        return Files.isDirectory(resolver.resolve(sessionId).directory());
    }

    private List<Path> sessionDirectories() {
        Path root = resolver.root();
        if (!Files.exists(root)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(root)) {
            return children.filter(Files::isDirectory).collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new SessionStorageException("Failed to enumerate session catalog " + root, e);
        }
    }

    private Optional<Instant> lastModified(SessionLocation location) {
        Instant latest = null;
        for (Path file : List.of(location.metadataFile(), location.messagesFile())) {
            if (!Files.isRegularFile(file)) {
                continue;
            }
            try {
                Instant modified = Files.getLastModifiedTime(file).toInstant().truncatedTo(ChronoUnit.SECONDS);
                if (latest == null || modified.isAfter(latest)) {
                    latest = modified;
                }
            } catch (IOException e) {
                throw new SessionStorageException("Failed to stat " + file, e);
            }
        }
        return Optional.ofNullable(latest);
    }

    private record CatalogEntry(String id, Instant modified, SessionMetadata metadata) {}
}
