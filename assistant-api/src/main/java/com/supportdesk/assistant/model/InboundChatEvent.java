package com.supportdesk.assistant.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * A message posted to the assistant. {@code threadTs} is absent for top-level messages and equal to {@code ts}
 * for a thread's root.
 */
public record InboundChatEvent(
        String user,
        @NotBlank String channel,
        String text,
        @NotBlank String ts,
        @JsonProperty("thread_ts") String threadTs
) {

    public String threadId() {
        return threadTs == null || threadTs.isBlank() ? ts : threadTs;
    }

    public boolean isThreadReply() {
        return threadTs != null && !threadTs.isBlank() && !threadTs.equals(ts);
    }
}
