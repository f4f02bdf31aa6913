package com.supportdesk.assistant.service.platform;

/**
 * Outbound chat operations. Every method throws {@link ChatPlatformException} on failure.
 */
public interface ChatPlatformClient {

    void postMessage(String channel, String text, String threadTs);

    void addReaction(String channel, String messageTs, String emoji);

    void removeReaction(String channel, String messageTs, String emoji);
}
