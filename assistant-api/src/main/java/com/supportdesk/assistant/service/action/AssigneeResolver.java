package com.supportdesk.assistant.service.action;

import java.util.Optional;

/**
 * Maps a teammate name typed in chat to identities in the CRM and on the chat platform.
 */
public interface AssigneeResolver {

    Optional<String> resolveAssigneeId(String name);

    default Optional<String> resolveChatUserId(String name) {
        return Optional.empty();
    }
}
