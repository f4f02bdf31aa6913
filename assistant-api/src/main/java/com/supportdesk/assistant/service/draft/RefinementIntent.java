package com.supportdesk.assistant.service.draft;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Operator feedback on a draft. The first five variants produce a new version; {@link Approve} and
 * {@link Reject} only change the draft status.
 */
public sealed interface RefinementIntent {

    Type type();

    enum Type {
        SIMPLIFY,
        FORMALIZE,
        SHORTEN,
        ADD_CONTENT,
        MENTION_TOPIC,
        APPROVE,
        REJECT;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        public boolean producesRevision() {
            return this != APPROVE && this != REJECT;
        }
    }

    record Simplify() implements RefinementIntent {
        @Override
        public Type type() {
            return Type.SIMPLIFY;
        }
    }

    record Formalize() implements RefinementIntent {
        @Override
        public Type type() {
            return Type.FORMALIZE;
        }
    }

    record Shorten() implements RefinementIntent {
        @Override
        public Type type() {
            return Type.SHORTEN;
        }
    }

    record AddContent(String content) implements RefinementIntent {
        @Override
        public Type type() {
            return Type.ADD_CONTENT;
        }
    }

    record MentionTopic(String topic) implements RefinementIntent {
        @Override
        public Type type() {
            return Type.MENTION_TOPIC;
        }
    }

    record Approve() implements RefinementIntent {
        @Override
        public Type type() {
            return Type.APPROVE;
        }
    }

    record Reject(String reason) implements RefinementIntent {
        @Override
        public Type type() {
            return Type.REJECT;
        }
    }
}
