package org.orbitjump.core.id;

import java.util.Objects;

/**
 * Stable identity of a warp destination.
 *
 * <p>Equality is structural so ids can key typed maps directly. Destinations that carry no
 * explicit id are identified by their coordinates, see {@link #fromCoordinates(double, double)}.</p>
 *
 * @param value non-blank external identifier.
 */
public record DestinationId(String value) {

    /**
     * Validates identifier contract.
     */
    public DestinationId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("destination id must be non-blank");
        }
    }

    /**
     * Creates an id from an explicit external identifier.
     *
     * @param value non-blank identifier.
     * @return destination id.
     */
    public static DestinationId of(String value) {
        return new DestinationId(value);
    }

    /**
     * Derives an id from destination coordinates ({@code "x,y"}).
     *
     * <p>Integral coordinates are written without a fractional part so that
     * {@code (300.0, -40.0)} and {@code (300, -40)} map to the same id.</p>
     *
     * @param x world x coordinate.
     * @param y world y coordinate.
     * @return coordinate-derived id.
     */
    public static DestinationId fromCoordinates(double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("coordinates must be finite, got (" + x + ", " + y + ")");
        }
        return new DestinationId(formatCoordinate(x) + "," + formatCoordinate(y));
    }

    private static String formatCoordinate(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
