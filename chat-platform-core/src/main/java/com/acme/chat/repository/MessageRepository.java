package com.acme.chat.repository;

import com.acme.chat.domain.CreateMessageRequest;
import com.acme.chat.domain.Message;
import com.acme.chat.domain.MessagePage;
import com.acme.chat.pagination.HistoryFilter;
import java.time.Instant;
import java.util.Optional;

/**
 * Sharded message store. Every operation is routed by channel id, so a channel's messages are
 * always read from and written to the same shard.
 */
public interface MessageRepository {

    /**
     * Store a message, or return the message already stored under the same idempotency key.
     * Repeated and concurrent calls with one key observe a single stored row.
     *
     * @param request validated request; a null or blank key disables deduplication
     * @return the canonical stored message, with store-assigned id and timestamps
     */
    Message createMessage(CreateMessageRequest request);

    /** Point read by (id, channel). Never searches other shards. */
    Optional<Message> findMessage(String messageId, String channelId);

    /** Creation time of a message of the channel, used to position since-id reads. */
    Optional<Instant> findCreatedAt(String messageId, String channelId);

    /**
     * Read one page of channel history.
     *
     * @param limit requested page size, clamped by {@link com.acme.chat.pagination.PageLimits}
     * @throws com.acme.chat.core.NotFoundException if a since-message filter names a message that
     *     is not in the channel
     */
    MessagePage listMessages(String channelId, HistoryFilter filter, int limit);

    /** Unfiltered number of messages in the channel. */
    int countMessages(String channelId);
}
