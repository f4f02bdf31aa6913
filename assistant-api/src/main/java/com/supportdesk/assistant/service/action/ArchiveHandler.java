package com.supportdesk.assistant.service.action;

import com.supportdesk.assistant.service.crm.CrmClient;
import com.supportdesk.assistant.service.crm.CrmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Handles both archive and close. The CRM has no separate closed state, so both set the conversation status
 * to archived and differ only in wording.
 */
@Component
public class ArchiveHandler implements QuickActionHandler {

    private static final Logger log = LoggerFactory.getLogger(ArchiveHandler.class);

    private final CrmClient crmClient;

    public ArchiveHandler(CrmClient crmClient) {
        this.crmClient = crmClient;
    }

    @Override
    public boolean supports(QuickActionType type) {
        return type == QuickActionType.ARCHIVE || type == QuickActionType.CLOSE;
    }

    @Override
    public QuickActionResult handle(QuickAction action, QuickActionContext context) {
        String verb = action.type() == QuickActionType.CLOSE ? "close" : "archive";
        if (!context.hasConversationId()) {
            return QuickActionResult.rejected("I need a conversation id before I can " + verb + " this.");
        }
        try {
            crmClient.archive(context.conversationId());
        } catch (CrmException ex) {
            log.error("Trying to {} conversation {} failed", verb, context.conversationId(), ex);
            return QuickActionResult.failed("I couldn't " + verb + " the conversation. Please try again.");
        }
        return QuickActionResult.success(action.type() == QuickActionType.CLOSE
                ? "Conversation closed."
                : "Conversation archived.");
    }
}
