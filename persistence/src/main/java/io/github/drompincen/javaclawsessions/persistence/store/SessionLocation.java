package io.github.drompincen.javaclawsessions.persistence.store;

import java.nio.file.Path;

/** Where one session's files live: {@code <root>/<id>/metadata.json} and {@code messages.jsonl}. */
public record SessionLocation(SessionId id, Path directory) {

    public static final String METADATA_FILE = "metadata.json";
    public static final String MESSAGES_FILE = "messages.jsonl";

    public Path metadataFile() {
        return directory.resolve(METADATA_FILE);
    }

    public Path messagesFile() {
        return directory.resolve(MESSAGES_FILE);
    }
}
