package com.chatrelay.server.store;

import com.chatrelay.server.model.UserDetails;

import java.util.List;
import java.util.Optional;

public interface UserDirectory {

    Optional<UserDetails> findUserDetails(String userId);

    void setOnlineStatus(String userId, boolean online);

    boolean isOnline(String userId);

    List<String> findContactIds(String userId);
}
