package com.supportdesk.assistant.service.confirmation;

import java.util.Optional;

/**
 * Holds at most one pending confirmation per thread. {@link #put} replaces whatever was pending.
 */
public interface ActionConfirmationStore {

    Optional<ActionConfirmationState> find(String threadId);

    void put(ActionConfirmationState state);

    void delete(String threadId);
}
