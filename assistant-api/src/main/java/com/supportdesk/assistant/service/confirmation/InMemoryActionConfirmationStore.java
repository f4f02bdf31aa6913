package com.supportdesk.assistant.service.confirmation;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryActionConfirmationStore implements ActionConfirmationStore {

    private final Map<String, ActionConfirmationState> pending = new ConcurrentHashMap<>();

    @Override
    public Optional<ActionConfirmationState> find(String threadId) {
        return Optional.ofNullable(pending.get(threadId));
    }

    @Override
    public void put(ActionConfirmationState state) {
        pending.put(state.threadId(), state);
    }

    @Override
    public void delete(String threadId) {
        pending.remove(threadId);
    }
}
