package com.supportdesk.assistant.service.action;

public record QuickActionResult(Outcome outcome, String message) {

    public enum Outcome {
        /** The action ran completely. */
        SUCCESS,
        /** The primary effect happened but a follow-up step failed. */
        PARTIAL,
        /** Input was missing or unresolvable; nothing was sent to the CRM. */
        REJECTED,
        /** The CRM call failed. */
        FAILED
    }

    public static QuickActionResult success(String message) {
        return new QuickActionResult(Outcome.SUCCESS, message);
    }

    public static QuickActionResult partial(String message) {
        return new QuickActionResult(Outcome.PARTIAL, message);
    }

    public static QuickActionResult rejected(String message) {
        return new QuickActionResult(Outcome.REJECTED, message);
    }

    public static QuickActionResult failed(String message) {
        return new QuickActionResult(Outcome.FAILED, message);
    }

    public boolean ok() {
        return outcome == Outcome.SUCCESS || outcome == Outcome.PARTIAL;
    }

    public boolean partial() {
        return outcome == Outcome.PARTIAL;
    }
}
