package com.supportdesk.assistant.service.draft;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Draft history for one chat thread. Versions are append-only and their ids are always {@code v0..v(n-1)}.
 */
public record DraftThreadState(
        String threadId,
        List<DraftVersion> versions,
        DraftStatus status,
        Instant approvedAt,
        Instant rejectedAt,
        Instant sentAt,
        String rejectionReason,
        String conversationId,
        String recipientEmail
) {

    public DraftThreadState {
        if (versions == null || versions.isEmpty()) {
            throw new IllegalArgumentException("A draft needs at least one version");
        }
        for (int i = 0; i < versions.size(); i++) {
            if (!DraftVersion.idFor(i).equals(versions.get(i).id())) {
                throw new IllegalArgumentException("Draft version " + i + " has id " + versions.get(i).id());
            }
        }
        versions = List.copyOf(versions);
    }

    public static DraftThreadState seed(String threadId,
                                        String text,
                                        Instant createdAt,
                                        String conversationId,
                                        String recipientEmail) {
        DraftVersion original = new DraftVersion(DraftVersion.idFor(0), text, createdAt, null);
        return new DraftThreadState(threadId, List.of(original), DraftStatus.DRAFT,
                null, null, null, null, conversationId, recipientEmail);
    }

    public DraftVersion latest() {
        return versions.get(versions.size() - 1);
    }

    public String nextVersionId() {
        return DraftVersion.idFor(versions.size());
    }

    public DraftThreadState withVersion(DraftVersion version) {
        List<DraftVersion> appended = new ArrayList<>(versions);
        appended.add(version);
        return new DraftThreadState(threadId, appended, DraftStatus.DRAFT,
                approvedAt, rejectedAt, sentAt, rejectionReason, conversationId, recipientEmail);
    }

    public DraftThreadState approved(Instant at) {
        return new DraftThreadState(threadId, versions, DraftStatus.APPROVED,
                at, rejectedAt, sentAt, rejectionReason, conversationId, recipientEmail);
    }

    public DraftThreadState rejected(Instant at, String reason) {
        return new DraftThreadState(threadId, versions, DraftStatus.REJECTED,
                approvedAt, at, sentAt, reason, conversationId, recipientEmail);
    }

    public DraftThreadState sent(Instant at) {
        return new DraftThreadState(threadId, versions, DraftStatus.SENT,
                approvedAt, rejectedAt, at, rejectionReason, conversationId, recipientEmail);
    }
}
