package com.kawari.proxy.core.rotation;

/**
 * Consistent backend counts taken under the registry lock.
 */
public record RegistrySnapshot(int total, int healthy) {
}
