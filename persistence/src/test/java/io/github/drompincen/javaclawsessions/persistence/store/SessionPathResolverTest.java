package io.github.drompincen.javaclawsessions.persistence.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionPathResolverTest {

    @TempDir
    Path root;

    @Test
    void resolveIsDeterministic() {
        SessionPathResolver resolver = new SessionPathResolver(root);

        SessionLocation first = resolver.resolve("20240616_120000");
        SessionLocation second = resolver.resolve("20240616_120000");

        assertThat(first).isEqualTo(second);
        assertThat(first.directory()).isEqualTo(root.toAbsolutePath().normalize().resolve("20240616_120000"));
        assertThat(first.metadataFile().getFileName().toString()).isEqualTo("metadata.json");
        assertThat(first.messagesFile().getFileName().toString()).isEqualTo("messages.jsonl");
    }

    @Test
    void distinctIdsMapToDistinctDirectories() {
        SessionPathResolver resolver = new SessionPathResolver(root);

        assertThat(resolver.resolve("a").directory()).isNotEqualTo(resolver.resolve("b").directory());
    }

    @Test
    void resolveDoesNotTouchTheFileSystem() {
        SessionPathResolver resolver = new SessionPathResolver(root.resolve("missing-root"));

        SessionLocation location = resolver.resolve("s1");

        assertThat(Files.exists(location.directory())).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", ".", "..", "../escape", "a/b", "a\\b", "c:evil", "tab\there"})
    void rejectsUnsafeIds(String id) {
        SessionPathResolver resolver = new SessionPathResolver(root);

        assertThatThrownBy(() -> resolver.resolve(id))
                .isInstanceOf(InvalidSessionIdException.class);
    }

    @Test
    void rejectsNullId() {
        SessionPathResolver resolver = new SessionPathResolver(root);

        assertThatThrownBy(() -> resolver.resolve((String) null))
                .isInstanceOf(InvalidSessionIdException.class);
    }

    @Test
    void acceptsOrdinaryIds() {
        assertThat(SessionId.isValid("test-session-123")).isTrue();
        assertThat(SessionId.isValid("my session.v2")).isTrue();
        assertThat(SessionId.isValid("a/../b")).isFalse();
    }

    @Test
    void doubleDotsInsideAnIdStayBelowTheRoot() {
        SessionPathResolver resolver = new SessionPathResolver(root);

        SessionLocation location = resolver.resolve("v1..2");

        assertThat(location.directory().getParent()).isEqualTo(root.toAbsolutePath().normalize());
        assertThat(SessionId.isValid("..hidden")).isTrue();
    }
}
