package com.supportdesk.assistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "assistant")
public class AssistantProperties {

    private final Crm crm = new Crm();
    private final Platform platform = new Platform();
    private final ThreadContext threadContext = new ThreadContext();
    private final Confirmation confirmation = new Confirmation();
    private final Directory directory = new Directory();

    public Crm getCrm() {
        return crm;
    }

    public Platform getPlatform() {
        return platform;
    }

    public ThreadContext getThreadContext() {
        return threadContext;
    }

    public Confirmation getConfirmation() {
        return confirmation;
    }

    public Directory getDirectory() {
        return directory;
    }

    public static class Crm {

        /**
         * Base URL of the ticketing REST API.
         */
        private String baseUrl = "https://api2.frontapp.com";

        private String apiToken;

        /**
         * Prefix used to build operator links to a conversation; the conversation id is appended.
         */
        private String linkBaseUrl = "https://app.frontapp.com/open/";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiToken() {
            return apiToken;
        }

        public void setApiToken(String apiToken) {
            this.apiToken = apiToken;
        }

        public String getLinkBaseUrl() {
            return linkBaseUrl;
        }

        public void setLinkBaseUrl(String linkBaseUrl) {
            this.linkBaseUrl = linkBaseUrl;
        }
    }

    public static class Platform {

        private String baseUrl = "https://slack.com/api";

        private String botToken;

        /**
         * Emoji name added to an inbound message while it is being handled.
         */
        private String processingReaction = "eyes";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getBotToken() {
            return botToken;
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }

        public String getProcessingReaction() {
            return processingReaction;
        }

        public void setProcessingReaction(String processingReaction) {
            this.processingReaction = processingReaction;
        }
    }

    public static class ThreadContext {

        private long ttlSeconds = 3600;

        public long getTtlSeconds() {
            return ttlSeconds;
        }

        public void setTtlSeconds(long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
        }
    }

    public static class Confirmation {

        /**
         * How long a pending confirmation waits for a yes/no reply before it is discarded.
         */
        private Duration ttl = Duration.ofMinutes(10);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Directory {

        /**
         * Teammate name (lower case) to ticketing teammate id.
         */
        private Map<String, String> assignees = new LinkedHashMap<>();

        /**
         * Teammate name (lower case) to chat platform user id, used for mentions.
         */
        private Map<String, String> chatUsers = new LinkedHashMap<>();

        public Map<String, String> getAssignees() {
            return assignees;
        }

        public void setAssignees(Map<String, String> assignees) {
            this.assignees = assignees;
        }

        public Map<String, String> getChatUsers() {
            return chatUsers;
        }

        public void setChatUsers(Map<String, String> chatUsers) {
            this.chatUsers = chatUsers;
        }
    }
}
