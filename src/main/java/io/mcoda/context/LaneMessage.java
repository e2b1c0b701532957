package io.mcoda.context;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * One chat message kept in a lane. {@code role} is the provider role (system, user, assistant,
 * tool); {@code model} and {@code tokens} are optional provenance.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LaneMessage(
        String role,
        String content,
        String name,
        Instant ts,
        String model,
        Integer tokens
) {
    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    public LaneMessage {
        content = content == null ? "" : content;
    }

    public static LaneMessage of(String role, String content) {
        return new LaneMessage(role, content, null, null, null, null);
    }

    public static LaneMessage user(String content) {
        return of(USER, content);
    }

    public static LaneMessage assistant(String content) {
        return of(ASSISTANT, content);
    }

    public static LaneMessage system(String content) {
        return of(SYSTEM, content);
    }

    public LaneMessage withContent(String next) {
        return new LaneMessage(role, next, name, ts, model, tokens);
    }

    public LaneMessage stamped(Instant at, String usedModel, Integer tokenCount) {
        return new LaneMessage(role, content, name, at, usedModel == null ? model : usedModel,
                tokenCount == null ? tokens : tokenCount);
    }

    public long byteSize() {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }
}
