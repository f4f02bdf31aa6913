package com.supportdesk.assistant.service.intent;

import com.supportdesk.assistant.model.ParsedIntent;

public interface IntentParser {

    String HELP_TEXT = "I didn't understand that request. Try \"status\", \"lookup customer@email.com\", or \"escalate to [name]\".";

    ParsedIntent parse(String rawText);

    default String helpText() {
        return HELP_TEXT;
    }
}
