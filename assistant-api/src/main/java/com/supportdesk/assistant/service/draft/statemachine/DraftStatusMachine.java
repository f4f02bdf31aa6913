package com.supportdesk.assistant.service.draft.statemachine;

import com.supportdesk.assistant.service.draft.DraftStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Validates draft status changes. A short-lived machine is started in the draft's current status, the event
 * is offered to it, and the resulting status is returned only if a transition accepted the event.
 * <p>
 * Allowed: refine keeps a draft in {@code DRAFT}; a draft can be approved, rejected or sent; an approved
 * draft can still be sent. Rejected and sent drafts accept nothing.
 */
@Component
public class DraftStatusMachine {

    private static final Logger log = LoggerFactory.getLogger(DraftStatusMachine.class);

    public Optional<DraftStatus> fire(DraftStatus current, DraftEvent event) {
        StateMachine<DraftStatus, DraftEvent> machine = build(current);
        machine.startReactively().block();
        try {
            List<StateMachineEventResult<DraftStatus, DraftEvent>> results = machine
                    .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
                    .collectList()
                    .block();
            boolean accepted = results != null && results.stream()
                    .anyMatch(result -> result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED);
            if (!accepted) {
                log.debug("Draft event {} denied in status {}", event, current);
                return Optional.empty();
            }
            return Optional.of(machine.getState().getId());
        } finally {
            machine.stopReactively().block();
        }
    }

    public boolean permits(DraftStatus current, DraftEvent event) {
        return fire(current, event).isPresent();
    }

    private StateMachine<DraftStatus, DraftEvent> build(DraftStatus initial) {
        try {
            StateMachineBuilder.Builder<DraftStatus, DraftEvent> builder = StateMachineBuilder.builder();
            builder.configureConfiguration()
                    .withConfiguration()
                    .autoStartup(false);
            builder.configureStates()
                    .withStates()
                    .initial(initial)
                    .states(EnumSet.allOf(DraftStatus.class));
            builder.configureTransitions()
                    .withInternal()
                        .source(DraftStatus.DRAFT)
                        .event(DraftEvent.REFINE)
                    .and()
                    .withExternal()
                        .source(DraftStatus.DRAFT)
                        .target(DraftStatus.APPROVED)
                        .event(DraftEvent.APPROVE)
                    .and()
                    .withExternal()
                        .source(DraftStatus.DRAFT)
                        .target(DraftStatus.REJECTED)
                        .event(DraftEvent.REJECT)
                    .and()
                    .withExternal()
                        .source(DraftStatus.DRAFT)
                        .target(DraftStatus.SENT)
                        .event(DraftEvent.SEND)
                    .and()
                    .withExternal()
                        .source(DraftStatus.APPROVED)
                        .target(DraftStatus.SENT)
                        .event(DraftEvent.SEND);
            return builder.build();
        } catch (Exception ex) {
            throw new IllegalStateException("Unable to build draft status machine", ex);
        }
    }
}
