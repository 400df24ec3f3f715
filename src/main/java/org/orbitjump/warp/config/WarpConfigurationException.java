package org.orbitjump.warp.config;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Rejects a {@link WarpRuntimeConfig} setting that lies outside its domain.
 *
 * <p>The message reads {@code [reasonCode] setting must be <requirement>, got <value>} so a bad
 * balance file can be traced to the exact tunable.</p>
 */
@Getter
@Accessors(fluent = true)
public final class WarpConfigurationException extends RuntimeException {
    private final String reasonCode;
    private final String setting;
    private final String rejectedValue;

    /**
     * @param reasonCode one of the {@code W_CFG_*} codes of {@link WarpRuntimeConfig}.
     * @param setting name of the offending builder property.
     * @param requirement the domain the value must satisfy, e.g. {@code "finite and > 0"}.
     * @param rejected the offending value.
     */
    public WarpConfigurationException(String reasonCode, String setting, String requirement, Object rejected) {
        super("[" + requireCode(reasonCode) + "] "
                + Objects.requireNonNull(setting, "setting") + " must be "
                + Objects.requireNonNull(requirement, "requirement") + ", got " + rejected);
        this.reasonCode = reasonCode;
        this.setting = setting;
        this.rejectedValue = String.valueOf(rejected);
    }

    private static String requireCode(String reasonCode) {
        if (reasonCode == null || !reasonCode.startsWith("W_CFG_")) {
            throw new IllegalArgumentException("reasonCode must be a W_CFG_* code, got " + reasonCode);
        }
        return reasonCode;
    }
}
