package io.github.drompincen.javaclawsessions.protocol.api;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Serialized as {@code [path, count]}. */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"path", "count"})
public record DirectoryUsage(
        String path,
        int count
) {}
