package com.questrail.testkit.api;

/**
 * A message-driven application composed of handlers.
 */
public interface Application
{
    void configure(ApplicationConfigurer configurer);
}
