package com.supportdesk.assistant.service.draft;

import java.util.Optional;

public interface DraftStore {

    Optional<DraftThreadState> find(String threadId);

    void save(DraftThreadState state);
}
