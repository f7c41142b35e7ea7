package com.acme.chat.config;

/** Naming of the per-channel notification topics. Pure POJO - no framework dependencies. */
public class EventsConfig {

  private String channelTopicPrefix = "channel:";
  private String channelTopicSuffix = ":events";

  public String getChannelTopicPrefix() {
    return channelTopicPrefix;
  }

  public void setChannelTopicPrefix(String channelTopicPrefix) {
    this.channelTopicPrefix = channelTopicPrefix;
  }

  public String getChannelTopicSuffix() {
    return channelTopicSuffix;
  }

  public void setChannelTopicSuffix(String channelTopicSuffix) {
    this.channelTopicSuffix = channelTopicSuffix;
  }

  /** Build the notification topic of a channel. Example: general -> channel:general:events */
  public String buildChannelTopic(String channelId) {
    return channelTopicPrefix + channelId + channelTopicSuffix;
  }
}
