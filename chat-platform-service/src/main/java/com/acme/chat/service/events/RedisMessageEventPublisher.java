package com.acme.chat.service.events;

import com.acme.chat.config.EventsConfig;
import com.acme.chat.core.Jsons;
import com.acme.chat.domain.Message;
import com.acme.chat.domain.MessageEvent;
import com.acme.chat.spi.MessageEventPublisher;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Instant;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes stored messages to the channel's Redis pub/sub topic as JSON. Delivery is best effort:
 * the message is already durable, so a Redis failure is logged and dropped.
 */
@Singleton
@Requires(beans = RedissonClient.class)
public class RedisMessageEventPublisher implements MessageEventPublisher {
  private static final Logger LOG = LoggerFactory.getLogger(RedisMessageEventPublisher.class);

  private final RedissonClient redisson;
  private final EventsConfig eventsConfig;

  public RedisMessageEventPublisher(RedissonClient redisson, EventsConfig eventsConfig) {
    this.redisson = redisson;
    this.eventsConfig = eventsConfig;
  }

  @Override
  public void publishMessageCreated(Message message) {
    String topic = eventsConfig.buildChannelTopic(message.channelId());
    try {
      String payload = Jsons.toJson(MessageEvent.messageCreated(message, Instant.now()));
      long receivers = redisson.getTopic(topic, StringCodec.INSTANCE).publish(payload);
      LOG.debug("Published message {} to {} ({} receiver(s))", message.id(), topic, receivers);
    } catch (Exception e) {
      LOG.warn("Failed to publish message {} to {}: {}", message.id(), topic, e.getMessage());
    }
  }
}
