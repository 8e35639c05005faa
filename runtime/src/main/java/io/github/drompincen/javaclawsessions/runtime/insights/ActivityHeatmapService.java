package io.github.drompincen.javaclawsessions.runtime.insights;

import io.github.drompincen.javaclawsessions.persistence.store.SessionCatalog;
import io.github.drompincen.javaclawsessions.protocol.api.ActivityHeatmapCell;
import io.github.drompincen.javaclawsessions.protocol.api.SessionInfo;
import io.github.drompincen.javaclawsessions.protocol.api.SortOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Counts described sessions per (ISO week, weekday) of their modification date. Weeks are
 * 0-based, days run 0=Sunday to 6=Saturday. Cells come back in no particular order.
 */
@Service
public class ActivityHeatmapService {

    private static final Logger log = LoggerFactory.getLogger(ActivityHeatmapService.class);

    private final SessionCatalog catalog;

    public ActivityHeatmapService(SessionCatalog catalog) {
        this.catalog = catalog;
    }

    public List<ActivityHeatmapCell> compute() {
        return compute(catalog.list(SortOrder.DESCENDING));
    }

    public List<ActivityHeatmapCell> compute(List<SessionInfo> sessions) {
        Map<CellKey, Integer> counts = new HashMap<>();
        for (SessionInfo session : sessions) {
            if (session.metadata().description().isEmpty()) {
                continue;
            }
            Optional<LocalDate> date = SessionTimestamps.modifiedDate(session);
            if (date.isEmpty()) {
                log.debug("Skipping session {} with unparsable modified time '{}'", session.id(), session.modified());
                continue;
            }
            counts.merge(CellKey.of(date.get()), 1, Integer::sum);
        }
        return counts.entrySet().stream()
                .map(e -> new ActivityHeatmapCell(e.getKey().week(), e.getKey().day(), e.getValue()))
                .collect(Collectors.toList());
    }

    private record CellKey(int week, int day) {
        static CellKey of(LocalDate date) {
            int week = date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR) - 1;
            int day = date.getDayOfWeek().getValue() % 7;
            return new CellKey(week, day);
        }
    }
}
