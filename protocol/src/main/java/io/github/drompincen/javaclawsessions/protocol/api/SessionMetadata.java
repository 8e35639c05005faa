package io.github.drompincen.javaclawsessions.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-session metadata record. Persisted with snake_case field names; token counters are
 * nullable so that an absent value stays absent across a write/read cycle.
 */
public record SessionMetadata(
        @JsonProperty("description") String description,
        @JsonProperty("message_count") int messageCount,
        @JsonProperty("total_tokens") Integer totalTokens,
        @JsonProperty("input_tokens") Integer inputTokens,
        @JsonProperty("output_tokens") Integer outputTokens,
        @JsonProperty("accumulated_total_tokens") Integer accumulatedTotalTokens,
        @JsonProperty("accumulated_input_tokens") Integer accumulatedInputTokens,
        @JsonProperty("accumulated_output_tokens") Integer accumulatedOutputTokens,
        @JsonProperty("working_dir") String workingDir,
        @JsonProperty("schedule_id") String scheduleId,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("is_title_customized") boolean titleCustomized
) {
    public SessionMetadata {
        description = description != null ? description : "";
        workingDir = workingDir != null ? workingDir : "";
    }

    /** Metadata of a session that has nothing persisted yet. */
    public static SessionMetadata defaults(String workingDir) {
        return new SessionMetadata("", 0, null, null, null, null, null, null,
                workingDir, null, null, false);
    }

    public SessionMetadata withTitle(String title) {
        return new SessionMetadata(title, messageCount, totalTokens, inputTokens, outputTokens,
                accumulatedTotalTokens, accumulatedInputTokens, accumulatedOutputTokens,
                workingDir, scheduleId, projectId, true);
    }

    public SessionMetadata withDescription(String newDescription) {
        return new SessionMetadata(newDescription, messageCount, totalTokens, inputTokens, outputTokens,
                accumulatedTotalTokens, accumulatedInputTokens, accumulatedOutputTokens,
                workingDir, scheduleId, projectId, titleCustomized);
    }

    public SessionMetadata withMessageCount(int count) {
        return new SessionMetadata(description, count, totalTokens, inputTokens, outputTokens,
                accumulatedTotalTokens, accumulatedInputTokens, accumulatedOutputTokens,
                workingDir, scheduleId, projectId, titleCustomized);
    }

    public SessionMetadata withWorkingDir(String dir) {
        return new SessionMetadata(description, messageCount, totalTokens, inputTokens, outputTokens,
                accumulatedTotalTokens, accumulatedInputTokens, accumulatedOutputTokens,
                dir, scheduleId, projectId, titleCustomized);
    }

    public SessionMetadata withTokens(Integer total, Integer input, Integer output,
                                      Integer accumulatedTotal, Integer accumulatedInput,
                                      Integer accumulatedOutput) {
        return new SessionMetadata(description, messageCount, total, input, output,
                accumulatedTotal, accumulatedInput, accumulatedOutput,
                workingDir, scheduleId, projectId, titleCustomized);
    }
}
