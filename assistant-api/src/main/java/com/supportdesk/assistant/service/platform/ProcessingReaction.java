package com.supportdesk.assistant.service.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * "Processing" emoji on the message being handled. Opened before the work starts and removed in
 * {@link #close()}, so use it in try-with-resources. Reaction failures are logged and never propagate.
 */
public final class ProcessingReaction implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessingReaction.class);

    private final ChatPlatformClient client;
    private final String channel;
    private final String messageTs;
    private final String emoji;
    private final boolean added;

    private ProcessingReaction(ChatPlatformClient client, String channel, String messageTs, String emoji, boolean added) {
        this.client = client;
        this.channel = channel;
        this.messageTs = messageTs;
        this.emoji = emoji;
        this.added = added;
    }

    public static ProcessingReaction open(ChatPlatformClient client, String channel, String messageTs, String emoji) {
        boolean added = false;
        try {
            client.addReaction(channel, messageTs, emoji);
            added = true;
        } catch (ChatPlatformException ex) {
            log.warn("Could not add :{}: to {} in {}: {}", emoji, messageTs, channel, ex.getMessage());
        }
        return new ProcessingReaction(client, channel, messageTs, emoji, added);
    }

    public boolean added() {
        return added;
    }

    @Override
    public void close() {
        if (!added) {
            return;
        }
        try {
            client.removeReaction(channel, messageTs, emoji);
        } catch (ChatPlatformException ex) {
            log.warn("Could not remove :{}: from {} in {}: {}", emoji, messageTs, channel, ex.getMessage());
        }
    }
}
