package com.supportdesk.assistant.service.action;

import com.supportdesk.assistant.config.AssistantProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves teammates from the static directory configured under {@code assistant.directory}.
 */
@Component
public class DirectoryAssigneeResolver implements AssigneeResolver {

    private final Map<String, String> assignees;
    private final Map<String, String> chatUsers;

    public DirectoryAssigneeResolver(AssistantProperties properties) {
        this.assignees = normalize(properties.getDirectory().getAssignees());
        this.chatUsers = normalize(properties.getDirectory().getChatUsers());
    }

    @Override
    public Optional<String> resolveAssigneeId(String name) {
        return lookup(assignees, name);
    }

    @Override
    public Optional<String> resolveChatUserId(String name) {
        return lookup(chatUsers, name);
    }

    private static Optional<String> lookup(Map<String, String> directory, String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String key = name.trim().replaceFirst("^@", "").toLowerCase(Locale.ROOT);
        return Optional.ofNullable(directory.get(key)).filter(value -> !value.isBlank());
    }

    private static Map<String, String> normalize(Map<String, String> source) {
        if (source == null) {
            return Map.of();
        }
        return source.entrySet().stream()
                .filter(entry -> entry.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(
                        entry -> entry.getKey().trim().toLowerCase(Locale.ROOT),
                        Map.Entry::getValue,
                        (first, second) -> first));
    }
}
