package com.supportdesk.assistant.service.action;

import com.supportdesk.assistant.service.crm.CrmClient;
import com.supportdesk.assistant.service.crm.CrmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Leaves an internal comment on the conversation.
 */
@Component
public class AddContextHandler implements QuickActionHandler {

    private static final Logger log = LoggerFactory.getLogger(AddContextHandler.class);

    private final CrmClient crmClient;

    public AddContextHandler(CrmClient crmClient) {
        this.crmClient = crmClient;
    }

    @Override
    public boolean supports(QuickActionType type) {
        return type == QuickActionType.ADD_CONTEXT;
    }

    @Override
    public QuickActionResult handle(QuickAction action, QuickActionContext context) {
        if (!context.hasConversationId()) {
            return QuickActionResult.rejected("I need a conversation id before I can add context.");
        }
        String note = action instanceof QuickAction.AddContext addContext ? addContext.note() : null;
        if (note == null || note.isBlank()) {
            return QuickActionResult.rejected("What context should I add?");
        }
        try {
            crmClient.addComment(context.conversationId(), note);
        } catch (CrmException ex) {
            log.error("Adding context note to conversation {} failed", context.conversationId(), ex);
            return QuickActionResult.failed("I couldn't add the context note. Please try again.");
        }
        return QuickActionResult.success("Context note added.");
    }
}
