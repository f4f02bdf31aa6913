package com.supportdesk.assistant.service.draft;

/**
 * Result of a refinement. On failure only {@code message} is set and the stored draft is unchanged.
 */
public record DraftRefinementResult(
        boolean ok,
        DraftThreadState state,
        DraftVersion revision,
        String indicator,
        int charDelta,
        String message
) {

    public static DraftRefinementResult success(DraftThreadState state, DraftVersion revision, String indicator, int charDelta) {
        String message = "Updated draft " + revision.id() + " (" + indicator + ")\n\n" + revision.text();
        return new DraftRefinementResult(true, state, revision, indicator, charDelta, message);
    }

    public static DraftRefinementResult failure(String message) {
        return new DraftRefinementResult(false, null, null, null, 0, message);
    }
}
