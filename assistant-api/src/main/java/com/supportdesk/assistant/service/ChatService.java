package com.supportdesk.assistant.service;

import com.supportdesk.assistant.model.ChatOutcome;
import com.supportdesk.assistant.model.DraftView;
import com.supportdesk.assistant.model.InboundChatEvent;
import com.supportdesk.assistant.model.RegisterDraftRequest;

import java.util.Optional;

public interface ChatService {

    ChatOutcome handle(InboundChatEvent event);

    DraftView registerDraft(RegisterDraftRequest request);

    Optional<DraftView> findDraft(String threadId);
}
