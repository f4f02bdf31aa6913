package com.supportdesk.assistant.service.draft.statemachine;

import com.supportdesk.assistant.service.draft.DraftStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DraftStatusMachineTest {

    private final DraftStatusMachine machine = new DraftStatusMachine();

    @Test
    void draftAcceptsEveryEvent() {
        assertThat(machine.fire(DraftStatus.DRAFT, DraftEvent.REFINE)).contains(DraftStatus.DRAFT);
        assertThat(machine.fire(DraftStatus.DRAFT, DraftEvent.APPROVE)).contains(DraftStatus.APPROVED);
        assertThat(machine.fire(DraftStatus.DRAFT, DraftEvent.REJECT)).contains(DraftStatus.REJECTED);
        assertThat(machine.fire(DraftStatus.DRAFT, DraftEvent.SEND)).contains(DraftStatus.SENT);
    }

    @Test
    void approvedDraftCanOnlyBeSent() {
        assertThat(machine.fire(DraftStatus.APPROVED, DraftEvent.SEND)).contains(DraftStatus.SENT);
        assertThat(machine.permits(DraftStatus.APPROVED, DraftEvent.REFINE)).isFalse();
        assertThat(machine.permits(DraftStatus.APPROVED, DraftEvent.APPROVE)).isFalse();
        assertThat(machine.permits(DraftStatus.APPROVED, DraftEvent.REJECT)).isFalse();
    }

    @Test
    void finalStatusesAcceptNothing() {
        for (DraftEvent event : DraftEvent.values()) {
            assertThat(machine.fire(DraftStatus.REJECTED, event)).as("rejected/" + event).isEmpty();
            assertThat(machine.fire(DraftStatus.SENT, event)).as("sent/" + event).isEmpty();
        }
    }
}
