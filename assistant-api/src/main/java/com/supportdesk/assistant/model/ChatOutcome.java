package com.supportdesk.assistant.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatOutcome(
        String threadId,
        String channel,
        ChatRoute route,
        ParsedIntent intent,
        String responseText
) {
}
