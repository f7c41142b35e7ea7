package com.acme.chat.spi;

import com.acme.chat.domain.Message;

/**
 * Fire-and-forget notification of stored messages. Implementations must not throw: the message is
 * already durable when this is called.
 */
public interface MessageEventPublisher {
    void publishMessageCreated(Message message);
}
