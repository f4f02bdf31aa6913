package com.supportdesk.assistant.service.draft;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryDraftStore implements DraftStore {

    private final Map<String, DraftThreadState> drafts = new ConcurrentHashMap<>();

    @Override
    public Optional<DraftThreadState> find(String threadId) {
        return Optional.ofNullable(drafts.get(threadId));
    }

    @Override
    public void save(DraftThreadState state) {
        drafts.put(state.threadId(), state);
    }
}
