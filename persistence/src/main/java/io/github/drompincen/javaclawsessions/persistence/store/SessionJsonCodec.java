package io.github.drompincen.javaclawsessions.persistence.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.javaclawsessions.protocol.api.Message;
import io.github.drompincen.javaclawsessions.protocol.api.SessionMetadata;

import java.io.IOException;

/**
 * JSON encoding of the on-disk session files: pretty-printed metadata and one compact
 * message object per log line.
 */
public class SessionJsonCodec {

    private final ObjectMapper mapper;

    public SessionJsonCodec() {
        this.mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public byte[] writeMetadata(SessionMetadata metadata) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(metadata);
    }

    /** Returns null when the document is a JSON {@code null}. */
    public SessionMetadata readMetadata(byte[] content) throws IOException {
        return mapper.readValue(content, SessionMetadata.class);
    }

    public String writeMessage(Message message) throws JsonProcessingException {
        return mapper.writeValueAsString(message);
    }

    public Message readMessage(String line) throws JsonProcessingException {
        return mapper.readValue(line, Message.class);
    }
}
