package com.acme.chat.service.events;

import com.acme.chat.config.EventsConfig;
import com.acme.chat.domain.Message;
import com.acme.chat.spi.MessageEventPublisher;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fallback publisher used when no Redis address is configured: events are only logged. */
@Singleton
@Requires(missingProperty = "chat.redis.address")
public class LoggingMessageEventPublisher implements MessageEventPublisher {
  private static final Logger LOG = LoggerFactory.getLogger(LoggingMessageEventPublisher.class);

  private final EventsConfig eventsConfig;

  public LoggingMessageEventPublisher(EventsConfig eventsConfig) {
    this.eventsConfig = eventsConfig;
  }

  @Override
  public void publishMessageCreated(Message message) {
    LOG.info("Message {} created on {} (no Redis configured, event not delivered)",
        message.id(), eventsConfig.buildChannelTopic(message.channelId()));
  }
}
