package com.supportdesk.assistant.controller;

import com.supportdesk.assistant.model.DraftView;
import com.supportdesk.assistant.model.RegisterDraftRequest;
import com.supportdesk.assistant.service.ChatService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/drafts")
public class DraftController {

    private final ChatService chatService;

    public DraftController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<DraftView>> register(@Valid @RequestBody RegisterDraftRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.status(HttpStatus.CREATED).body(chatService.registerDraft(request)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(path = "/{threadId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DraftView> find(@PathVariable String threadId) {
        return chatService.findDraft(threadId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
