package com.acme.chat.spi;

import com.acme.chat.domain.Channel;
import java.util.Optional;

public interface ChannelDirectory {
    Optional<Channel> findChannel(String channelId);
}
