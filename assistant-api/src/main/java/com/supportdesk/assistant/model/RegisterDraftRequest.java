package com.supportdesk.assistant.model;

import jakarta.validation.constraints.NotBlank;

public record RegisterDraftRequest(
        @NotBlank String threadId,
        @NotBlank String channelId,
        @NotBlank String conversationId,
        @NotBlank String text,
        String recipientEmail,
        String customerId
) {
}
