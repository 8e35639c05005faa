package io.github.drompincen.javaclawsessions.protocol.api;

public record ActivityHeatmapCell(
        int week,
        int day,
        int count
) {}
