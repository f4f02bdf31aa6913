package com.supportdesk.assistant.service.action;

/**
 * A short imperative command parsed from chat text. Instances are immutable.
 */
public sealed interface QuickAction {

    QuickActionType type();

    static QuickAction approveSend() {
        return new ApproveSend();
    }

    static QuickAction escalate(String assignee) {
        return new Escalate(assignee);
    }

    static QuickAction addContext(String note) {
        return new AddContext(note);
    }

    static QuickAction archive() {
        return new Archive();
    }

    static QuickAction close() {
        return new Close();
    }

    record ApproveSend() implements QuickAction {
        @Override
        public QuickActionType type() {
            return QuickActionType.APPROVE_SEND;
        }
    }

    record Escalate(String assignee) implements QuickAction {
        @Override
        public QuickActionType type() {
            return QuickActionType.ESCALATE;
        }
    }

    record AddContext(String note) implements QuickAction {
        @Override
        public QuickActionType type() {
            return QuickActionType.ADD_CONTEXT;
        }
    }

    record Archive() implements QuickAction {
        @Override
        public QuickActionType type() {
            return QuickActionType.ARCHIVE;
        }
    }

    record Close() implements QuickAction {
        @Override
        public QuickActionType type() {
            return QuickActionType.CLOSE;
        }
    }
}
