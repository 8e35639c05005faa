package io.github.drompincen.javaclawsessions.runtime.session;

import io.github.drompincen.javaclawsessions.persistence.store.SessionCatalog;
import io.github.drompincen.javaclawsessions.persistence.store.SessionLocation;
import io.github.drompincen.javaclawsessions.persistence.store.SessionMessageLog;
import io.github.drompincen.javaclawsessions.persistence.store.SessionMetadataStore;
import io.github.drompincen.javaclawsessions.persistence.store.SessionNotFoundException;
import io.github.drompincen.javaclawsessions.persistence.store.SessionPathResolver;
import io.github.drompincen.javaclawsessions.protocol.api.Message;
import io.github.drompincen.javaclawsessions.protocol.api.SessionHistory;
import io.github.drompincen.javaclawsessions.protocol.api.SessionInfo;
import io.github.drompincen.javaclawsessions.protocol.api.SessionMetadata;
import io.github.drompincen.javaclawsessions.protocol.api.SortOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionPathResolver resolver;
    private final SessionCatalog catalog;
    private final SessionMessageLog messageLog;
    private final SessionMetadataStore metadataStore;

    public SessionService(SessionPathResolver resolver,
                          SessionCatalog catalog,
                          SessionMessageLog messageLog,
                          SessionMetadataStore metadataStore) {
        this.resolver = resolver;
        this.catalog = catalog;
        this.messageLog = messageLog;
        this.metadataStore = metadataStore;
    }

    public List<SessionInfo> listSessions(SortOrder order) {
        return catalog.list(order);
    }

    public SessionHistory getHistory(String sessionId) {
        SessionLocation location = resolver.resolve(sessionId);
        if (!catalog.exists(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        SessionMetadata metadata = metadataStore.read(location);
        List<Message> messages = messageLog.read(location);
        return new SessionHistory(sessionId, metadata, messages);
    }

    /** Replaces the description with a user-chosen title; an empty title is allowed. */
    public SessionMetadata updateTitle(String sessionId, String title) {
        Objects.requireNonNull(title, "title");
        SessionMetadata updated = metadataStore.update(resolver.resolve(sessionId), m -> m.withTitle(title));
        log.info("Updated title of session {}", sessionId);
        return updated;
    }

    /**
     * Appends messages to the session, creating it on first use, and brings
     * {@code message_count} in line with the log.
     */
    public SessionMetadata persistMessages(String sessionId, List<Message> messages, String workingDir) {
        SessionLocation location = resolver.resolve(sessionId);
        boolean firstPersist = metadataStore.find(location).isEmpty();
        messageLog.append(location, messages);
        return metadataStore.update(location, m -> {
            SessionMetadata updated = m.withMessageCount(messageLog.read(location).size());
            if (firstPersist && workingDir != null) {
                updated = updated.withWorkingDir(workingDir);
            }
            return updated;
        });
    }

    /** Records the token usage of one exchange and adds it to the session's running totals. */
    public SessionMetadata recordTokenUsage(String sessionId, int inputTokens, int outputTokens) {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("Token counts must not be negative: input="
                    + inputTokens + ", output=" + outputTokens);
        }
        int totalTokens = Math.addExact(inputTokens, outputTokens);
        return metadataStore.update(resolver.resolve(sessionId), m -> m.withTokens(
                totalTokens, inputTokens, outputTokens,
                accumulate(m.accumulatedTotalTokens(), totalTokens),
                accumulate(m.accumulatedInputTokens(), inputTokens),
                accumulate(m.accumulatedOutputTokens(), outputTokens)));
    }

    private static Integer accumulate(Integer current, int delta) {
        return Math.addExact(current != null ? current : 0, delta);
    }
}
