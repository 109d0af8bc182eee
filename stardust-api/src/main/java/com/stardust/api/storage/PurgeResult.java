package com.stardust.api.storage;

/**
 * Outcome of an expiry purge.
 */
public record PurgeResult(int deleted, int errors) {}
