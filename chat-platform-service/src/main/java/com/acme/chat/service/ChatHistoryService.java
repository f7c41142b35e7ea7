package com.acme.chat.service;

import com.acme.chat.core.InvalidArgumentException;
import com.acme.chat.core.NotFoundException;
import com.acme.chat.core.PermissionDeniedException;
import com.acme.chat.domain.CreateMessageRequest;
import com.acme.chat.domain.HistoryRequest;
import com.acme.chat.domain.Message;
import com.acme.chat.domain.MessagePage;
import com.acme.chat.domain.ReadReceiptRequest;
import com.acme.chat.pagination.HistoryFilter;
import com.acme.chat.repository.MessageRepository;
import com.acme.chat.spi.ChannelDirectory;
import com.acme.chat.spi.MembershipChecker;
import com.acme.chat.spi.MessageEventPublisher;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Entry point for sending messages and reading channel history.
 *
 * <p>Every read runs its checks in a fixed order and stops at the first failure: argument
 * validation, channel existence, membership, filter resolution (cursor decoding, since id
 * lookup), then the page read. A caller who
 * is not a member therefore learns whether the channel exists ({@link NotFoundException} versus
 * {@link PermissionDeniedException}).
 */
@Singleton
public class ChatHistoryService {
    private static final Logger LOG = LoggerFactory.getLogger(ChatHistoryService.class);

    private final MessageRepository messages;
    private final ChannelDirectory channels;
    private final MembershipChecker membership;
    private final MessageEventPublisher events;

    public ChatHistoryService(
            MessageRepository messages,
            ChannelDirectory channels,
            MembershipChecker membership,
            MessageEventPublisher events) {
        this.messages = messages;
        this.channels = channels;
        this.membership = membership;
        this.events = events;
    }

    /**
     * Store a message for a channel member and announce it. A retried idempotency key returns the
     * originally stored message and announces it again.
     */
    public Message sendMessage(CreateMessageRequest request) {
        if (request == null) {
            throw new InvalidArgumentException("request is required");
        }
        requireText(request.channelId(), "channel_id");
        requireText(request.userId(), "user_id");
        requireText(request.content(), "content");
        requireText(request.idempotencyKey(), "idempotency_key");

        requireMember(request.channelId(), request.userId());

        Message message = messages.createMessage(request);
        LOG.debug("Message {} stored in channel {}", message.id(), message.channelId());

        try {
            events.publishMessageCreated(message);
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish message event for {}: {}", message.id(), e.getMessage());
        }
        return message;
    }

    public MessagePage getMessageHistory(HistoryRequest request) {
        if (request == null) {
            throw new InvalidArgumentException("request is required");
        }
        requireText(request.channelId(), "channel_id");
        requireText(request.userId(), "user_id");
        request.validateFilters();

        requireChannel(request.channelId());
        requireMember(request.channelId(), request.userId());
        HistoryFilter filter = request.toFilter();

        // sinceId must name a message of this channel; the repository reports NotFound otherwise
        return messages.listMessages(request.channelId(), filter, request.limit());
    }

    public MessagePage getMessagesSince(String channelId, String userId, Instant since, int limit) {
        if (since == null) {
            throw new InvalidArgumentException("since is required");
        }
        return getMessageHistory(HistoryRequest.since(channelId, userId, since, limit));
    }

    public MessagePage getMessagesSinceId(String channelId, String userId, String sinceId, int limit) {
        requireText(sinceId, "since_id");
        return getMessageHistory(HistoryRequest.sinceMessage(channelId, userId, sinceId, limit));
    }

    public MessagePage getMessagesWithCursor(String channelId, String userId, String cursor, int limit) {
        return getMessageHistory(HistoryRequest.withCursor(channelId, userId, cursor, limit));
    }

    /** Point read of one message for a channel member. */
    public Message getMessage(String channelId, String userId, String messageId) {
        requireText(channelId, "channel_id");
        requireText(userId, "user_id");
        requireText(messageId, "message_id");

        requireMember(channelId, userId);
        return messages.findMessage(messageId, channelId)
                .orElseThrow(() -> new NotFoundException("message " + messageId + " not found in channel " + channelId));
    }

    /**
     * Acknowledge that a member has read a message. Only validates membership and that the message
     * exists; receipts are not stored.
     */
    public void markMessageRead(ReadReceiptRequest request) {
        if (request == null) {
            throw new InvalidArgumentException("request is required");
        }
        getMessage(request.channelId(), request.userId(), request.messageId());
        LOG.debug("User {} read message {} in channel {}", request.userId(), request.messageId(), request.channelId());
    }

    private void requireChannel(String channelId) {
        if (channels.findChannel(channelId).isEmpty()) {
            throw new NotFoundException("channel " + channelId + " not found");
        }
    }

    private void requireMember(String channelId, String userId) {
        boolean member;
        try {
            member = membership.isMember(channelId, userId);
        } catch (RuntimeException e) {
            throw new PermissionDeniedException("failed to check channel membership", e);
        }
        if (!member) {
            throw new PermissionDeniedException("user " + userId + " is not a member of channel " + channelId);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new InvalidArgumentException(field + " is required");
        }
    }
}
