package com.incoresoft.blePresence.domain.registry;

/**
 * Outcome of a registry mutation: the value the change produced and whether the
 * document reached the store afterwards.
 */
public record WriteResult<T>(T value, boolean persisted) {
}
