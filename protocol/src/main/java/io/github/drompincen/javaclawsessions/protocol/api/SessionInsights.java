package io.github.drompincen.javaclawsessions.protocol.api;

import java.util.List;

public record SessionInsights(
        int totalSessions,
        List<DirectoryUsage> mostActiveDirs,
        double avgSessionDuration,
        long totalTokens,
        List<DailyActivity> recentActivity
) {
    public static SessionInsights empty() {
        return new SessionInsights(0, List.of(), 0.0, 0L, List.of());
    }
}
