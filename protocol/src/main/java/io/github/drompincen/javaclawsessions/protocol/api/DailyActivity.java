package io.github.drompincen.javaclawsessions.protocol.api;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Serialized as {@code [date, count]}, date formatted {@code yyyy-MM-dd}. */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"date", "count"})
public record DailyActivity(
        String date,
        int count
) {}
