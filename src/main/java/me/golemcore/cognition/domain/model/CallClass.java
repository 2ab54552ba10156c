package me.golemcore.cognition.domain.model;

/**
 * Caching class of a model call. Each class maps to its own TTL.
 */
public enum CallClass {
    /** Per-cycle decisions. Short TTL. */
    EPHEMERAL,
    /** Pattern mining and other generative analysis. Long TTL. */
    CREATIVE,
    /** Never cached. */
    UNCACHED
}
