package com.statusbridge.statuspage;

/**
 * A component group as stored by the backend.
 */
public record ComponentGroup(long id, String name) {}
