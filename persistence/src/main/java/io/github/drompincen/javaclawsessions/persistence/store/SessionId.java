package io.github.drompincen.javaclawsessions.persistence.store;

/**
 * Validated session identifier. The value is used verbatim as a directory name below the
 * catalog root, so anything that could name another directory is rejected.
 */
public record SessionId(String value) {

    public SessionId {
        String problem = problemWith(value);
        if (problem != null) {
            throw new InvalidSessionIdException("Invalid session id '" + value + "': " + problem);
        }
    }

    public static SessionId of(String value) {
        return new SessionId(value);
    }

    public static boolean isValid(String value) {
        return problemWith(value) == null;
    }

    private static String problemWith(String value) {
        if (value == null || value.isBlank()) {
            return "must not be blank";
        }
        if (value.equals(".") || value.equals("..")) {
            return "must not be a relative path segment";
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '/' || c == '\\' || c == ':') {
                return "must not contain path separators";
            }
            if (Character.isISOControl(c)) {
                return "must not contain control characters";
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
