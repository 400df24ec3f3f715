package org.orbitjump.app;

import org.orbitjump.warp.config.WarpRuntimeConfig;
import org.orbitjump.warp.context.Danger;
import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.context.WarpTraveler;
import org.orbitjump.warp.core.CommitResult;
import org.orbitjump.warp.core.WarpState;
import org.orbitjump.warp.core.WarpSubsystem;
import org.orbitjump.warp.memory.MemoryStats;

import java.util.List;

/**
 * Minimal application entry point used for local smoke runs.
 */
public class Main {

    private static final double FRAME_SECONDS = 0.1d;

    /**
     * Warps back and forth between two planets and prints quotes and memory stats.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        DemoShip ship = new DemoShip();
        WarpSubsystem warp = WarpSubsystem.builder()
                .config(WarpRuntimeConfig.builder().startUnlocked(true).build())
                .player(ship)
                .build();
        List<Destination> planets = List.of(
                Destination.discovered("home", 0.0d, 0.0d, 40.0d),
                Destination.discovered("outpost", 6000.0d, 0.0d, 60.0d)
        );

        System.out.println("Warp drive ready");
        for (int i = 1; i <= 4; i++) {
            Destination target = planets.get(i % 2);
            CommitResult result = warp.commit(target);
            System.out.println("warp " + i + " -> " + target.id() + " cost = " + result.getCost());
            while (warp.status().getState() != WarpState.IDLE) {
                warp.update(FRAME_SECONDS);
            }
            // idle long enough to refill and to stay out of the panic window
            for (int f = 0; f < 200; f++) {
                warp.update(FRAME_SECONDS);
            }
        }
        MemoryStats stats = warp.memoryStats();
        System.out.println("total warps = " + stats.getTotalWarps());
        System.out.println("known routes = " + stats.getKnownRoutes());
        System.out.printf("skill = %.2f%n", stats.getSkillLevel());
    }

    private static final class DemoShip implements WarpTraveler {
        private double x;
        private double y;

        @Override
        public double x() {
            return x;
        }

        @Override
        public double y() {
            return y;
        }

        @Override
        public double health() {
            return MAX_HEALTH;
        }

        @Override
        public List<Danger> nearbyDangers() {
            return List.of();
        }

        @Override
        public void placeAt(double x, double y) {
            this.x = x;
            this.y = y;
        }
    }
}
