package io.github.drompincen.javaclawsessions.runtime.insights;

import io.github.drompincen.javaclawsessions.persistence.store.SessionCatalog;
import io.github.drompincen.javaclawsessions.persistence.store.SessionMessageLog;
import io.github.drompincen.javaclawsessions.persistence.store.SessionNotFoundException;
import io.github.drompincen.javaclawsessions.persistence.store.SessionPathResolver;
import io.github.drompincen.javaclawsessions.persistence.store.SessionStoreException;
import io.github.drompincen.javaclawsessions.protocol.api.DailyActivity;
import io.github.drompincen.javaclawsessions.protocol.api.DirectoryUsage;
import io.github.drompincen.javaclawsessions.protocol.api.Message;
import io.github.drompincen.javaclawsessions.protocol.api.SessionInfo;
import io.github.drompincen.javaclawsessions.protocol.api.SessionInsights;
import io.github.drompincen.javaclawsessions.protocol.api.SortOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Usage statistics across the catalog. Only sessions with a description take part; sessions
 * without one have not produced anything worth reporting yet.
 */
@Service
public class SessionInsightsService {

    private static final Logger log = LoggerFactory.getLogger(SessionInsightsService.class);

    static final int TOP_DIRECTORIES = 3;
    static final int RECENT_DAYS = 7;

    private final SessionCatalog catalog;
    private final SessionPathResolver resolver;
    private final SessionMessageLog messageLog;

    public SessionInsightsService(SessionCatalog catalog, SessionPathResolver resolver, SessionMessageLog messageLog) {
        this.catalog = catalog;
        this.resolver = resolver;
        this.messageLog = messageLog;
    }

    public SessionInsights compute() {
        return compute(catalog.list(SortOrder.DESCENDING));
    }

    public SessionInsights compute(List<SessionInfo> sessions) {
        List<SessionInfo> described = sessions.stream()
                .filter(s -> !s.metadata().description().isEmpty())
                .collect(Collectors.toList());
        int totalSessions = described.size();
        if (totalSessions == 0) {
            log.info("No sessions with descriptions found");
            return SessionInsights.empty();
        }

        Map<String, Integer> dirCounts = new HashMap<>();
        Map<LocalDate, Integer> activityByDate = new HashMap<>();
        double totalDuration = 0.0;
        long totalTokens = 0;

        for (SessionInfo session : described) {
            dirCounts.merge(session.metadata().workingDir(), 1, Integer::sum);

            Integer tokens = session.metadata().accumulatedTotalTokens();
            if (tokens != null && tokens > 0) {
                totalTokens += tokens;
            } else if (tokens != null && tokens < 0) {
                log.warn("Session {} has negative accumulated_total_tokens: {}", session.id(), tokens);
            }

            SessionTimestamps.modifiedDate(session)
                    .ifPresent(date -> activityByDate.merge(date, 1, Integer::sum));

            totalDuration += durationMinutes(session.id());
        }

        List<DirectoryUsage> mostActiveDirs = dirCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_DIRECTORIES)
                .map(e -> new DirectoryUsage(e.getKey(), e.getValue()))
                .collect(Collectors.toList());

        List<DailyActivity> recentActivity = activityByDate.entrySet().stream()
                .sorted(Map.Entry.<LocalDate, Integer>comparingByKey().reversed())
                .limit(RECENT_DAYS)
                .map(e -> new DailyActivity(e.getKey().toString(), e.getValue()))
                .collect(Collectors.toList());

        SessionInsights insights = new SessionInsights(totalSessions, mostActiveDirs,
                totalDuration / totalSessions, totalTokens, recentActivity);
        log.info("Computed insights over {} sessions: {} tokens, {} active dirs",
                totalSessions, totalTokens, mostActiveDirs.size());
        return insights;
    }

    /** Minutes between the first and last message; 0 when there is no usable log. */
    private double durationMinutes(String sessionId) {
        try {
            List<Message> messages = messageLog.read(resolver.resolve(sessionId));
            if (messages.size() < 2) {
                return 0.0;
            }
            Message first = messages.get(0);
            Message last = messages.get(messages.size() - 1);
            return (last.created() - first.created()) / 60.0;
        } catch (SessionNotFoundException e) {
            log.debug("Session {} has no message log", sessionId);
            return 0.0;
        } catch (SessionStoreException e) {
            log.warn("Ignoring messages of session {}: {}", sessionId, e.getMessage());
            return 0.0;
        }
    }
}
