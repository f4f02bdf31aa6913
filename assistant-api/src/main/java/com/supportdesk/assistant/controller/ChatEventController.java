package com.supportdesk.assistant.controller;

import com.supportdesk.assistant.model.ChatOutcome;
import com.supportdesk.assistant.model.InboundChatEvent;
import com.supportdesk.assistant.service.ChatService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/chat")
public class ChatEventController {

    private final ChatService chatService;

    public ChatEventController(ChatService chatService) {
        this.chatService = chatService;
    }

    /**
     * Handles one message event. Handling blocks on the CRM, LLM and chat platform clients, so it runs on
     * the bounded elastic scheduler.
     */
    @PostMapping(path = "/events", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatOutcome> handle(@Valid @RequestBody InboundChatEvent event) {
        return Mono.fromCallable(() -> chatService.handle(event))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
