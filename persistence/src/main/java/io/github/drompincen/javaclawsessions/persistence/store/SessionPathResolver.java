package io.github.drompincen.javaclawsessions.persistence.store;

import java.nio.file.Path;

/**
 * Maps session ids to directories below a fixed catalog root. Resolution is pure: it never
 * touches the file system, so resolving an id says nothing about whether the session exists.
 */
public class SessionPathResolver {

    private final Path root;

    public SessionPathResolver(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public SessionLocation resolve(String sessionId) {
        return resolve(SessionId.of(sessionId));
    }

    public SessionLocation resolve(SessionId sessionId) {
        Path directory = root.resolve(sessionId.value()).normalize();
        if (!root.equals(directory.getParent())) {
            throw new InvalidSessionIdException("Session id escapes the catalog root: " + sessionId);
        }
        return new SessionLocation(sessionId, directory);
    }
}
