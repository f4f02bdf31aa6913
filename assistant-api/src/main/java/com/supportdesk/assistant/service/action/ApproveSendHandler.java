package com.supportdesk.assistant.service.action;

import com.supportdesk.assistant.service.crm.CrmClient;
import com.supportdesk.assistant.service.crm.CrmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Posts the current draft to the customer and archives the conversation. Nothing is archived unless the
 * message was accepted.
 */
@Component
public class ApproveSendHandler implements QuickActionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApproveSendHandler.class);

    private final CrmClient crmClient;

    public ApproveSendHandler(CrmClient crmClient) {
        this.crmClient = crmClient;
    }

    @Override
    public boolean supports(QuickActionType type) {
        return type == QuickActionType.APPROVE_SEND;
    }

    @Override
    public QuickActionResult handle(QuickAction action, QuickActionContext context) {
        if (!context.hasConversationId()) {
            return QuickActionResult.rejected("I need a conversation id before I can send this response.");
        }
        if (!context.hasDraftText()) {
            return QuickActionResult.rejected("I couldn't find a draft in this thread to send.");
        }
        try {
            crmClient.postMessage(context.conversationId(), context.draftText());
        } catch (CrmException ex) {
            log.error("Sending draft to conversation {} failed", context.conversationId(), ex);
            return QuickActionResult.failed("I couldn't send the response. Please try again.");
        }
        try {
            crmClient.archive(context.conversationId());
        } catch (CrmException ex) {
            log.warn("Draft sent but archiving conversation {} failed: {}", context.conversationId(), ex.getMessage());
            return QuickActionResult.partial("✅ Response sent, but I could not archive the conversation. Please check Front.");
        }
        return QuickActionResult.success("✅ Response sent! Conversation archived.");
    }
}
