package org.orbitjump.core.time;

/**
 * Deterministic session clock driven by frame deltas.
 *
 * <p>The clock never reads wall time. It only moves when the game loop calls
 * {@link #advance(double)}, which keeps every time-dependent learning signal
 * (warp chains, panic windows, visit timestamps) reproducible in tests.</p>
 */
public final class FrameClock {

    private double nowSeconds;

    /**
     * Creates a clock starting at session time {@code 0.0}.
     */
    public FrameClock() {
        this(0.0d);
    }

    /**
     * Creates a clock starting at an explicit session time.
     *
     * @param startSeconds initial session time; must be finite and {@code >= 0}.
     */
    public FrameClock(double startSeconds) {
        if (!Double.isFinite(startSeconds) || startSeconds < 0.0d) {
            throw new IllegalArgumentException("startSeconds must be finite and >= 0, got " + startSeconds);
        }
        this.nowSeconds = startSeconds;
    }

    /**
     * Advances the clock by one frame delta.
     *
     * @param dtSeconds frame delta; must be finite and {@code >= 0}.
     * @return session time after the advance.
     */
    public double advance(double dtSeconds) {
        if (!Double.isFinite(dtSeconds) || dtSeconds < 0.0d) {
            throw new IllegalArgumentException("dtSeconds must be finite and >= 0, got " + dtSeconds);
        }
        nowSeconds += dtSeconds;
        return nowSeconds;
    }

    /**
     * Returns current session time in seconds.
     */
    public double nowSeconds() {
        return nowSeconds;
    }
}
