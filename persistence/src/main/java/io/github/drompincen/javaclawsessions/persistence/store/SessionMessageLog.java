package io.github.drompincen.javaclawsessions.persistence.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.drompincen.javaclawsessions.protocol.api.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only message log of one session, stored as JSON lines. Every append rewrites the
 * log through a temp file and an atomic move, so a crash leaves either the old or the new log.
 */
public class SessionMessageLog {

    private static final Logger log = LoggerFactory.getLogger(SessionMessageLog.class);

    private final SessionJsonCodec codec;
    private final SessionLocks locks = new SessionLocks();

    public SessionMessageLog(SessionJsonCodec codec) {
        this.codec = codec;
    }

    public boolean exists(SessionLocation location) {
        return Files.isRegularFile(location.messagesFile());
    }

    /** Appends the messages, creating the session directory and log on first use. */
    public void append(SessionLocation location, List<Message> messages) {
        Objects.requireNonNull(messages, "messages");
        locks.run(location, () -> {
            Path file = location.messagesFile();
            try {
                ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                if (Files.exists(file)) {
                    byte[] existing = Files.readAllBytes(file);
                    buffer.write(existing);
                    if (existing.length > 0 && existing[existing.length - 1] != '\n') {
                        buffer.write('\n');
                    }
                }
                for (Message message : messages) {
                    buffer.write(codec.writeMessage(message).getBytes(StandardCharsets.UTF_8));
                    buffer.write('\n');
                }
                AtomicFiles.write(file, buffer.toByteArray());
                log.debug("Appended {} messages to session {}", messages.size(), location.id());
            } catch (IOException e) {
                throw new SessionStorageException("Failed to append messages to session " + location.id(), e);
            }
        });
    }

    public List<Message> read(SessionLocation location) {
        Path file = location.messagesFile();
        if (!Files.exists(file)) {
            throw new SessionNotFoundException(location.id().value());
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new SessionNotFoundException(location.id().value());
        } catch (CharacterCodingException e) {
            throw new CorruptSessionDataException(location.id().value(), file, "not valid UTF-8", e);
        } catch (IOException e) {
            throw new SessionStorageException("Failed to read messages of session " + location.id(), e);
        }

        List<Message> messages = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                Message message = codec.readMessage(line);
                if (message == null) {
                    throw new CorruptSessionDataException(location.id().value(), file,
                            "null message on line " + (i + 1), null);
                }
                messages.add(message);
            } catch (JsonProcessingException e) {
                throw new CorruptSessionDataException(location.id().value(), file,
                        "unparsable message on line " + (i + 1), e);
            }
        }
        return messages;
    }
}
