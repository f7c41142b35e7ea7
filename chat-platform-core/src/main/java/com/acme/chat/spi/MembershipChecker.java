package com.acme.chat.spi;

public interface MembershipChecker {
    /**
     * @return true if {@code userId} belongs to {@code channelId}; implementations throw rather than
     *     answer true when membership cannot be determined
     */
    boolean isMember(String channelId, String userId);
}
