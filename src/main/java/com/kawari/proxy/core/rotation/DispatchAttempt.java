package com.kawari.proxy.core.rotation;

/**
 * One failed attempt of a dispatch.
 *
 * @param number   1-based attempt number.
 * @param identity identity presented.
 * @param backend  backend used, {@code null} when direct.
 * @param error    transport error message.
 */
public record DispatchAttempt(int number, String identity, BackendDescriptor backend, String error) {
}
