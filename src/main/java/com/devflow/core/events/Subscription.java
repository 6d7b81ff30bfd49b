package com.devflow.core.events;

/**
 * Handle for cancelling a subscription.
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
