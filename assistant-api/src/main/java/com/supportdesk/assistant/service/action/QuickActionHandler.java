package com.supportdesk.assistant.service.action;

/**
 * Runs one kind of quick action against the CRM. Handlers report every failure through the returned
 * {@link QuickActionResult} and never throw.
 */
public interface QuickActionHandler {

    boolean supports(QuickActionType type);

    QuickActionResult handle(QuickAction action, QuickActionContext context);
}
