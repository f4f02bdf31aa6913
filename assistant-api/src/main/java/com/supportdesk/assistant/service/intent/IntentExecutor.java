package com.supportdesk.assistant.service.intent;

import com.supportdesk.assistant.model.ParsedIntent;
import com.supportdesk.assistant.service.audit.AssistantEventLogger;
import com.supportdesk.assistant.service.context.ThreadContextLookup;
import com.supportdesk.assistant.service.context.ThreadContextStore;
import com.supportdesk.assistant.service.crm.ConversationFormatter;
import com.supportdesk.assistant.service.crm.CrmClient;
import com.supportdesk.assistant.service.crm.CrmConversation;
import com.supportdesk.assistant.service.crm.CrmException;
import com.supportdesk.assistant.service.status.StatusQuery;
import com.supportdesk.assistant.service.status.StatusQueryParser;
import com.supportdesk.assistant.service.status.StatusQueryService;
import com.supportdesk.assistant.service.status.StatusReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handles intents that are not quick actions or draft feedback: status questions, customer lookups,
 * escalation prompts and free-text searches.
 */
@Component
public class IntentExecutor {

    private static final Logger log = LoggerFactory.getLogger(IntentExecutor.class);

    static final String SEARCH_FAILED = "I couldn't search Front right now. Please try again.";

    private final StatusQueryParser statusQueryParser;
    private final StatusQueryService statusQueryService;
    private final CrmClient crmClient;
    private final ConversationFormatter formatter;
    private final ThreadContextStore threadContextStore;
    private final AssistantEventLogger eventLogger;

    public IntentExecutor(StatusQueryParser statusQueryParser,
                          StatusQueryService statusQueryService,
                          CrmClient crmClient,
                          ConversationFormatter formatter,
                          ThreadContextStore threadContextStore,
                          AssistantEventLogger eventLogger) {
        this.statusQueryParser = statusQueryParser;
        this.statusQueryService = statusQueryService;
        this.crmClient = crmClient;
        this.formatter = formatter;
        this.threadContextStore = threadContextStore;
        this.eventLogger = eventLogger;
    }

    public IntentExecutionResult execute(ParsedIntent intent, String threadId) {
        switch (intent.category()) {
            case STATUS_QUERY:
                return status(intent);
            case CONTEXT_LOOKUP:
                return contextLookup(intent, threadId);
            case ESCALATION:
                return escalation(intent);
            case DRAFT_ACTION:
                return IntentExecutionResult.success(
                        "Draft feedback captured. Apply it by replying in the thread of a draft notification.");
            case GENERAL_QUERY:
                return generalQuery(intent);
            case QUICK_ACTION:
            case UNKNOWN:
            default:
                return IntentExecutionResult.failure(IntentParser.HELP_TEXT);
        }
    }

    private IntentExecutionResult status(ParsedIntent intent) {
        StatusQuery query = statusQueryParser.parse(intent);
        StatusReport report = statusQueryService.answer(query);
        return report.ok() ? IntentExecutionResult.success(report.text()) : IntentExecutionResult.failure(report.text());
    }

    private IntentExecutionResult contextLookup(ParsedIntent intent, String threadId) {
        String email = intent.entity("email");
        String name = intent.entity("name");
        if (email == null && name == null) {
            return IntentExecutionResult.failure("Please specify a customer email. Example: \"lookup customer@example.com\"");
        }
        String label = email != null ? email : name;
        String query = email != null ? "contact:" + email : name;

        List<CrmConversation> results;
        try {
            results = crmClient.search(query);
        } catch (CrmException ex) {
            log.error("Customer lookup for {} failed", label, ex);
            return IntentExecutionResult.failure(SEARCH_FAILED);
        }

        boolean linked = email != null && linkCustomer(threadId, email);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("threadId", threadId);
        payload.put("byEmail", email != null);
        payload.put("conversationCount", results.size());
        payload.put("contextUpdated", linked);
        eventLogger.info("assistant.context_lookup", payload);

        if (results.isEmpty()) {
            return IntentExecutionResult.success("No conversations found for \"" + label + "\".");
        }
        return IntentExecutionResult.success(formatter.list(results, label));
    }

    private boolean linkCustomer(String threadId, String email) {
        ThreadContextLookup lookup = threadContextStore.read(threadId);
        if (!lookup.isActive() || email.equals(lookup.context().customerId())) {
            return false;
        }
        return threadContextStore.write(lookup.context().withCustomerId(email)).ok();
    }

    private IntentExecutionResult escalation(ParsedIntent intent) {
        String name = intent.entity("name");
        if (name == null) {
            return IntentExecutionResult.failure("Who should I escalate this to? Try \"escalate to [name]\".");
        }
        return IntentExecutionResult.failure("To escalate to " + name + ", reply \"escalate to " + name
                + "\" in the thread of the conversation's draft.");
    }

    private IntentExecutionResult generalQuery(ParsedIntent intent) {
        String query = firstPresent(intent.entity("query"), intent.entity("product"), intent.rawText());
        if (query.isBlank()) {
            return IntentExecutionResult.failure(IntentParser.HELP_TEXT);
        }
        List<CrmConversation> results;
        try {
            results = crmClient.search(query);
        } catch (CrmException ex) {
            log.error("General search for {} failed", query, ex);
            return IntentExecutionResult.failure(SEARCH_FAILED);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("conversationCount", results.size());
        eventLogger.info("assistant.general_query", payload);

        if (results.isEmpty()) {
            return IntentExecutionResult.success("No conversations found for \"" + query + "\".");
        }
        return IntentExecutionResult.success(formatter.list(results, query));
    }

    private static String firstPresent(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return "";
    }
}
