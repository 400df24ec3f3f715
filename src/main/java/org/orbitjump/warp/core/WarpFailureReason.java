package org.orbitjump.warp.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Stable rejection reasons of a warp commit.
 */
@Getter
@Accessors(fluent = true)
public enum WarpFailureReason {
    LOCKED("W_LOCKED", "Warp drive not unlocked"),
    UNDISCOVERED("W_UNDISCOVERED", "Destination not discovered"),
    INSUFFICIENT_ENERGY("W_INSUFFICIENT_ENERGY", "Insufficient energy"),
    ALREADY_WARPING("W_ALREADY_WARPING", "Warp already in progress");

    private final String code;
    private final String message;

    WarpFailureReason(String code, String message) {
        this.code = code;
        this.message = message;
    }
}
