package com.supportdesk.assistant.service.crm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CrmConversation(
        String id,
        String subject,
        String status,
        List<Tag> tags,
        @JsonProperty("created_at") Double createdAt,
        @JsonProperty("waiting_since") Double waitingSince
) {

    public CrmConversation {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public long createdAtSeconds() {
        return createdAt == null ? 0L : createdAt.longValue();
    }

    /**
     * Seconds since epoch from which the customer has been waiting, falling back to creation time.
     */
    public long waitingSinceSeconds() {
        return waitingSince == null ? createdAtSeconds() : waitingSince.longValue();
    }

    public boolean hasStatus(String candidate) {
        return status != null && status.equalsIgnoreCase(candidate);
    }

    public List<String> tagNames() {
        return tags.stream()
                .map(Tag::name)
                .filter(name -> name != null && !name.isBlank())
                .map(name -> name.toLowerCase(Locale.ROOT))
                .toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Tag(String id, String name) {
    }
}
