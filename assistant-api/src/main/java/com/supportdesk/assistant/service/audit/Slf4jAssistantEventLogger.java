package com.supportdesk.assistant.service.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

@Component
public class Slf4jAssistantEventLogger implements AssistantEventLogger {

    private static final Logger log = LoggerFactory.getLogger("assistant.events");

    @Override
    public void log(Level level, String eventName, Map<String, ?> payload) {
        try {
            String fields = payload == null ? "" : payload.entrySet().stream()
                    .filter(entry -> entry.getValue() != null)
                    .map(entry -> entry.getKey() + "=" + entry.getValue())
                    .collect(Collectors.joining(" "));
            log.atLevel(level).log("EVENT name={} {}", eventName, fields);
        } catch (RuntimeException ex) {
            log.debug("Dropped event {}", eventName, ex);
        }
    }
}
