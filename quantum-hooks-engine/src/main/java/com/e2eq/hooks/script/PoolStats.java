package com.e2eq.hooks.script;

/**
 * Point-in-time view of the interpreter pool.
 */
public record PoolStats(int active, int waiting, int idle, int maxSize, long created, long discarded) {
}
