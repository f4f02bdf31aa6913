package com.supportdesk.assistant.service.status;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public record StatusFilters(String product, String assignee, LocalDate since) {

    public static StatusFilters none() {
        return new StatusFilters(null, null, null);
    }

    public boolean isEmpty() {
        return product == null && assignee == null && since == null;
    }

    /**
     * Stable textual form used in cache keys; two equal filter sets always produce the same string.
     */
    public String canonical() {
        List<String> parts = new ArrayList<>();
        if (product != null) {
            parts.add("product=" + product);
        }
        if (assignee != null) {
            parts.add("assignee=" + assignee);
        }
        if (since != null) {
            parts.add("since=" + since);
        }
        return "{" + String.join(",", parts) + "}";
    }

    /**
     * Appends the filters to a CRM search query.
     */
    public String applyTo(String baseQuery) {
        List<String> parts = new ArrayList<>();
        parts.add(baseQuery);
        if (product != null) {
            parts.add("tag:" + product);
        }
        if (assignee != null) {
            parts.add("assignee:" + assignee);
        }
        if (since != null) {
            parts.add("updated:>=" + since);
        }
        return String.join(" ", parts);
    }
}
