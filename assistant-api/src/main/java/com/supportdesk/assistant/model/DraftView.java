package com.supportdesk.assistant.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DraftView(
        String threadId,
        String status,
        String conversationId,
        String recipientEmail,
        List<Version> versions
) {

    public DraftView {
        versions = versions == null ? List.of() : List.copyOf(versions);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Version(String id, String text, Instant createdAt, String intent) {
    }
}
