package com.supportdesk.assistant.service.confirmation;

import com.supportdesk.assistant.service.action.QuickAction;
import com.supportdesk.assistant.service.action.QuickActionContext;

/**
 * Outcome of matching a thread reply against a pending confirmation. {@code action} and {@code context}
 * are only set for {@link Decision#CONFIRM}.
 */
public record ConfirmationResolution(Decision decision, QuickAction action, QuickActionContext context) {

    public enum Decision {
        CONFIRM,
        CANCEL,
        IGNORE
    }

    public static ConfirmationResolution confirm(QuickAction action, QuickActionContext context) {
        return new ConfirmationResolution(Decision.CONFIRM, action, context);
    }

    public static ConfirmationResolution cancel() {
        return new ConfirmationResolution(Decision.CANCEL, null, null);
    }

    public static ConfirmationResolution ignore() {
        return new ConfirmationResolution(Decision.IGNORE, null, null);
    }
}
