package com.supportdesk.assistant.service.action;

import com.supportdesk.assistant.service.crm.CrmClient;
import com.supportdesk.assistant.service.crm.CrmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class EscalateHandler implements QuickActionHandler {

    private static final Logger log = LoggerFactory.getLogger(EscalateHandler.class);

    private final CrmClient crmClient;
    private final Optional<AssigneeResolver> assigneeResolver;

    public EscalateHandler(CrmClient crmClient, Optional<AssigneeResolver> assigneeResolver) {
        this.crmClient = crmClient;
        this.assigneeResolver = assigneeResolver;
    }

    @Override
    public boolean supports(QuickActionType type) {
        return type == QuickActionType.ESCALATE;
    }

    @Override
    public QuickActionResult handle(QuickAction action, QuickActionContext context) {
        if (!context.hasConversationId()) {
            return QuickActionResult.rejected("I need a conversation id before I can escalate this.");
        }
        String assignee = action instanceof QuickAction.Escalate escalate ? escalate.assignee() : null;
        if (assignee == null || assignee.isBlank()) {
            return QuickActionResult.rejected("Who should I escalate this to?");
        }
        if (assigneeResolver.isEmpty()) {
            return QuickActionResult.rejected("I couldn't map " + assignee + " to a Front teammate.");
        }
        Optional<String> assigneeId = assigneeResolver.get().resolveAssigneeId(assignee);
        if (assigneeId.isEmpty()) {
            return QuickActionResult.rejected("I couldn't find a Front teammate for " + assignee + ".");
        }
        try {
            crmClient.assign(context.conversationId(), assigneeId.get());
        } catch (CrmException ex) {
            log.error("Reassigning conversation {} to {} failed", context.conversationId(), assigneeId.get(), ex);
            return QuickActionResult.failed("I couldn't reassign this conversation. Please try again.");
        }
        String mention = assigneeResolver.get().resolveChatUserId(assignee)
                .map(userId -> " (<@" + userId + ">)")
                .orElse("");
        return QuickActionResult.success("Escalated to " + assignee + mention + ".");
    }
}
