package com.questrail.testkit.api;

/**
 * The state of a single process instance.
 */
public interface ProcessRoot
{
}
