package org.orbitjump.warp.memory;

import org.orbitjump.core.id.DestinationId;
import org.orbitjump.warp.context.Position;

import java.util.Objects;
import java.util.Optional;

/**
 * Identity of a learned route: the quantized cell the warp started in plus its destination.
 *
 * @param cellX source x divided by the cell size, floored.
 * @param cellY source y divided by the cell size, floored.
 * @param destination destination id.
 */
public record RouteKey(int cellX, int cellY, DestinationId destination) {

    private static final String CELL_SEPARATOR = ",";
    private static final String ARROW = "->";

    /**
     * Validates key contract.
     */
    public RouteKey {
        Objects.requireNonNull(destination, "destination");
    }

    /**
     * Quantizes {@code source} into a grid cell of pitch {@code cellSize}.
     */
    public static RouteKey of(Position source, DestinationId destination, double cellSize) {
        Objects.requireNonNull(source, "source");
        if (!Double.isFinite(cellSize) || cellSize <= 0.0d) {
            throw new IllegalArgumentException("cellSize must be finite and > 0, got " + cellSize);
        }
        return new RouteKey(
                (int) Math.floor(source.x() / cellSize),
                (int) Math.floor(source.y() / cellSize),
                destination
        );
    }

    /**
     * Storage form {@code "cellX,cellY->destination"}.
     */
    public String toStorageKey() {
        return cellX + CELL_SEPARATOR + cellY + ARROW + destination.value();
    }

    /**
     * Parses the storage form; empty when the text is not a route key.
     */
    public static Optional<RouteKey> parse(String storageKey) {
        if (storageKey == null) {
            return Optional.empty();
        }
        int arrow = storageKey.indexOf(ARROW);
        if (arrow <= 0) {
            return Optional.empty();
        }
        String cell = storageKey.substring(0, arrow);
        String destination = storageKey.substring(arrow + ARROW.length());
        int comma = cell.indexOf(CELL_SEPARATOR);
        if (comma <= 0 || comma == cell.length() - 1 || destination.isBlank()) {
            return Optional.empty();
        }
        try {
            int cellX = Integer.parseInt(cell.substring(0, comma).trim());
            int cellY = Integer.parseInt(cell.substring(comma + 1).trim());
            return Optional.of(new RouteKey(cellX, cellY, DestinationId.of(destination)));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return toStorageKey();
    }
}
