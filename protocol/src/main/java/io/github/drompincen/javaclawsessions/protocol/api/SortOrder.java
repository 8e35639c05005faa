package io.github.drompincen.javaclawsessions.protocol.api;

public enum SortOrder {
    ASCENDING,
    DESCENDING
}
