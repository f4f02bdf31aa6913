package com.supportdesk.assistant.service.confirmation;

import com.supportdesk.assistant.service.action.QuickAction;
import com.supportdesk.assistant.service.action.QuickActionContext;

import java.time.Instant;

public record ActionConfirmationState(
        String threadId,
        QuickAction action,
        QuickActionContext context,
        Instant createdAt
) {
}
