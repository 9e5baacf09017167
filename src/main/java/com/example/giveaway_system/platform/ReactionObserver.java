package com.example.giveaway_system.platform;

import java.util.Set;

@FunctionalInterface
public interface ReactionObserver {

    void onReactionAdded(PlatformUser user, Set<String> roleIds);
}
