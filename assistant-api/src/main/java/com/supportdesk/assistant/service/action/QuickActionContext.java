package com.supportdesk.assistant.service.action;

/**
 * Everything a quick action needs to run. Only {@code conversationId} is required by every handler;
 * the remaining fields are used for prompts and audit.
 */
public record QuickActionContext(
        String conversationId,
        String draftText,
        String recipientEmail,
        String threadId,
        String channel,
        String requestedBy
) {

    public boolean hasConversationId() {
        return conversationId != null && !conversationId.isBlank();
    }

    public boolean hasDraftText() {
        return draftText != null && !draftText.isBlank();
    }
}
