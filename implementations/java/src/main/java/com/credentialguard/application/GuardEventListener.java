package com.credentialguard.application;

/**
 * Observer for guard events. Default implementation logs; hosts may forward to
 * their own audit pipeline.
 */
public interface GuardEventListener {

    void onEvent(GuardEvent event);
}
