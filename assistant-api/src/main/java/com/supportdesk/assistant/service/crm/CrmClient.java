package com.supportdesk.assistant.service.crm;

import java.util.List;

/**
 * Verbs the assistant needs from the ticketing system. Every method throws
 * {@link CrmException} when the remote call fails.
 */
public interface CrmClient {

    List<CrmConversation> search(String query);

    void archive(String conversationId);

    void assign(String conversationId, String assigneeId);

    void addComment(String conversationId, String body);

    void postMessage(String conversationId, String body);
}
