package com.questrail.testkit;

/**
 * Optional settings for an {@link Actions#call} action.
 */
@FunctionalInterface
public interface CallOption
{
    void applyTo(CallOptions.Builder builder);
}
