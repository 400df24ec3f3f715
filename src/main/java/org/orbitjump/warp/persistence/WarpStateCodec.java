package org.orbitjump.warp.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import lombok.extern.slf4j.Slf4j;
import org.orbitjump.core.id.DestinationId;
import org.orbitjump.warp.energy.EnergySnapshot;
import org.orbitjump.warp.memory.LearningSample;
import org.orbitjump.warp.memory.MemorySnapshot;
import org.orbitjump.warp.memory.RouteKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON form of {@link WarpSaveState}.
 *
 * <pre>
 * {
 *   "schemaVersion": 1,
 *   "unlocked": true,
 *   "energy": {"current", "max", "regenPerSecond"},
 *   "routes": {"cellX,cellY->destination": {"uses", "totalCostPaid"}},
 *   "behaviorProfile": {...},
 *   "planetAffinity": {"destination": {"visits", "lastVisit", "affinity"}},
 *   "efficiencyMetrics": {..., "learningCurve": [{"time", "cost", "optimal"}]},
 *   "emergencyPatterns": {...}
 * }
 * </pre>
 *
 * <p>Decoding is tolerant: every field falls back to its default when absent or mistyped, and
 * malformed entries are skipped. Older saves are accepted too: a bare number under
 * {@code "energy"} is the charge level, and a route's {@code "totalCost"} stands in for
 * {@code "totalCostPaid"}.</p>
 *
 * <p>Encoding merges into the previously loaded document so fields this version does not know
 * survive a save, including unknown fields inside each route and affinity entry. Routes and
 * affinities no longer held in memory are dropped.</p>
 */
@Slf4j
public final class WarpStateCodec {

    public static final int SCHEMA_VERSION = 1;

    static final String SCHEMA_VERSION_KEY = "schemaVersion";
    static final String UNLOCKED_KEY = "unlocked";
    static final String ENERGY_KEY = "energy";
    static final String ROUTES_KEY = "routes";
    static final String BEHAVIOR_KEY = "behaviorProfile";
    static final String AFFINITY_KEY = "planetAffinity";
    static final String EFFICIENCY_KEY = "efficiencyMetrics";
    static final String EMERGENCY_KEY = "emergencyPatterns";
    static final String LEGACY_TOTAL_COST_KEY = "totalCost";

    private final Gson gson = new GsonBuilder().serializeSpecialFloatingPointValues().create();

    /**
     * Encodes a fresh document.
     */
    public String encode(WarpSaveState state) {
        return encode(state, null);
    }

    /**
     * Encodes {@code state} on top of {@code previous}, keeping its unknown fields.
     *
     * @param state state to write.
     * @param previous last document read or written, or {@code null}.
     * @return JSON text.
     */
    public String encode(WarpSaveState state, JsonObject previous) {
        return write(toJson(state, previous));
    }

    /**
     * Serializes a document tree.
     */
    public String write(JsonObject document) {
        return gson.toJson(document);
    }

    /**
     * Builds the document tree for {@code state} on top of {@code previous}.
     */
    public JsonObject toJson(WarpSaveState state, JsonObject previous) {
        JsonObject root = previous == null ? new JsonObject() : previous.deepCopy();
        MemorySnapshot memory = state.memory();

        root.addProperty(SCHEMA_VERSION_KEY, SCHEMA_VERSION);
        root.addProperty(UNLOCKED_KEY, state.unlocked());
        if (state.energy() != null) {
            JsonObject energy = section(root, ENERGY_KEY);
            energy.addProperty("current", state.energy().current());
            energy.addProperty("max", state.energy().max());
            energy.addProperty("regenPerSecond", state.energy().regenPerSecond());
        }

        JsonObject previousRoutes = getObject(root, ROUTES_KEY).orElse(null);
        JsonObject routes = new JsonObject();
        for (MemorySnapshot.RouteEntry entry : memory.routes()) {
            String key = entry.key().toStorageKey();
            JsonObject route = previousEntry(previousRoutes, key);
            route.addProperty("uses", entry.uses());
            route.addProperty("totalCostPaid", entry.totalCostPaid());
            routes.add(key, route);
        }
        root.add(ROUTES_KEY, routes);

        MemorySnapshot.BehaviorSnapshot b = memory.behavior();
        JsonObject behavior = section(root, BEHAVIOR_KEY);
        behavior.addProperty("totalWarps", b.totalWarps());
        behavior.addProperty("emergencyWarps", b.emergencyWarps());
        behavior.addProperty("explorationWarps", b.explorationWarps());
        behavior.addProperty("returnWarps", b.returnWarps());
        behavior.addProperty("warpChains", b.warpChains());
        behavior.addProperty("lastWarpTime", b.lastWarpTime());
        behavior.addProperty("averageWarpDistance", b.averageWarpDistance());
        behavior.addProperty("skillLevel", b.skillLevel());

        JsonObject previousAffinities = getObject(root, AFFINITY_KEY).orElse(null);
        JsonObject affinities = new JsonObject();
        for (MemorySnapshot.AffinityEntry entry : memory.affinities()) {
            JsonObject affinity = previousEntry(previousAffinities, entry.destination().value());
            affinity.addProperty("visits", entry.visits());
            affinity.addProperty("lastVisit", entry.lastVisitTime());
            affinity.addProperty("affinity", entry.affinity());
            affinities.add(entry.destination().value(), affinity);
        }
        root.add(AFFINITY_KEY, affinities);

        MemorySnapshot.EfficiencySnapshot e = memory.efficiency();
        JsonObject efficiency = section(root, EFFICIENCY_KEY);
        efficiency.addProperty("wastedEnergy", e.wastedEnergy());
        efficiency.addProperty("optimalRoutes", e.optimalRoutes());
        efficiency.addProperty("adaptationLevel", e.adaptationLevel());
        JsonArray curve = new JsonArray();
        for (LearningSample sample : e.learningCurve()) {
            JsonObject point = new JsonObject();
            point.addProperty("time", sample.time());
            point.addProperty("cost", sample.cost());
            point.addProperty("optimal", sample.optimal());
            curve.add(point);
        }
        efficiency.add("learningCurve", curve);

        MemorySnapshot.EmergencySnapshot em = memory.emergency();
        JsonObject emergency = section(root, EMERGENCY_KEY);
        emergency.addProperty("lowHealthWarps", em.lowHealthWarps());
        emergency.addProperty("panicWarps", em.panicWarps());
        emergency.addProperty("rescueWarps", em.rescueWarps());
        emergency.addProperty("lastEmergencyTime", em.lastEmergencyTime());
        return root;
    }

    /**
     * Parses JSON text into a document tree.
     *
     * @throws JsonParseException when the text is not a JSON object.
     */
    public JsonObject parse(String json) {
        JsonElement element = JsonParser.parseString(json);
        if (element == null || !element.isJsonObject()) {
            throw new JsonParseException("warp save must be a JSON object");
        }
        return element.getAsJsonObject();
    }

    /**
     * Decodes JSON text.
     *
     * @throws JsonParseException when the text is not a JSON object.
     */
    public WarpSaveState decode(String json) {
        return fromJson(parse(json));
    }

    /**
     * Decodes a document tree, defaulting every absent or mistyped field.
     */
    public WarpSaveState fromJson(JsonObject root) {
        int version = getInt(root, SCHEMA_VERSION_KEY, SCHEMA_VERSION);
        if (version > SCHEMA_VERSION) {
            log.warn("warp save schema {} is newer than {}; reading known fields only", version, SCHEMA_VERSION);
        }
        boolean unlocked = getBoolean(root, UNLOCKED_KEY, false);

        EnergySnapshot energy = readEnergy(root);

        List<MemorySnapshot.RouteEntry> routes = new ArrayList<>();
        getObject(root, ROUTES_KEY).ifPresent(obj -> {
            for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
                Optional<RouteKey> key = RouteKey.parse(entry.getKey());
                if (key.isEmpty() || !entry.getValue().isJsonObject()) {
                    log.warn("skipping malformed route entry '{}'", entry.getKey());
                    continue;
                }
                JsonObject route = entry.getValue().getAsJsonObject();
                routes.add(new MemorySnapshot.RouteEntry(
                        key.get(),
                        getInt(route, "uses", 0),
                        route.has("totalCostPaid")
                                ? getDouble(route, "totalCostPaid", 0.0d)
                                : getDouble(route, LEGACY_TOTAL_COST_KEY, 0.0d)
                ));
            }
        });

        MemorySnapshot.BehaviorSnapshot behavior = getObject(root, BEHAVIOR_KEY)
                .map(obj -> new MemorySnapshot.BehaviorSnapshot(
                        getInt(obj, "totalWarps", 0),
                        getInt(obj, "emergencyWarps", 0),
                        getInt(obj, "explorationWarps", 0),
                        getInt(obj, "returnWarps", 0),
                        getInt(obj, "warpChains", 0),
                        getDouble(obj, "lastWarpTime", 0.0d),
                        getDouble(obj, "averageWarpDistance", 0.0d),
                        getDouble(obj, "skillLevel", 0.0d)
                ))
                .orElse(null);

        List<MemorySnapshot.AffinityEntry> affinities = new ArrayList<>();
        getObject(root, AFFINITY_KEY).ifPresent(obj -> {
            for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
                if (entry.getKey().isBlank() || !entry.getValue().isJsonObject()) {
                    log.warn("skipping malformed affinity entry '{}'", entry.getKey());
                    continue;
                }
                JsonObject affinity = entry.getValue().getAsJsonObject();
                affinities.add(new MemorySnapshot.AffinityEntry(
                        DestinationId.of(entry.getKey()),
                        getInt(affinity, "visits", 0),
                        getDouble(affinity, "lastVisit", 0.0d),
                        getDouble(affinity, "affinity", 0.0d)
                ));
            }
        });

        MemorySnapshot.EfficiencySnapshot efficiency = getObject(root, EFFICIENCY_KEY)
                .map(obj -> new MemorySnapshot.EfficiencySnapshot(
                        getDouble(obj, "wastedEnergy", 0.0d),
                        getInt(obj, "optimalRoutes", 0),
                        getDouble(obj, "adaptationLevel", 0.0d),
                        readCurve(obj)
                ))
                .orElse(null);

        MemorySnapshot.EmergencySnapshot emergency = getObject(root, EMERGENCY_KEY)
                .map(obj -> new MemorySnapshot.EmergencySnapshot(
                        getInt(obj, "lowHealthWarps", 0),
                        getInt(obj, "panicWarps", 0),
                        getInt(obj, "rescueWarps", 0),
                        getDouble(obj, "lastEmergencyTime", 0.0d)
                ))
                .orElse(null);

        return new WarpSaveState(
                new MemorySnapshot(routes, behavior, affinities, efficiency, emergency),
                energy,
                unlocked
        );
    }

    private static EnergySnapshot readEnergy(JsonObject root) {
        JsonElement element = root.get(ENERGY_KEY);
        if (element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
            // older saves kept only the charge level
            return new EnergySnapshot(element.getAsDouble(), Double.NaN, Double.NaN);
        }
        return getObject(root, ENERGY_KEY)
                .map(obj -> new EnergySnapshot(
                        getDouble(obj, "current", Double.NaN),
                        getDouble(obj, "max", Double.NaN),
                        getDouble(obj, "regenPerSecond", Double.NaN)
                ))
                .orElse(null);
    }

    private static JsonObject previousEntry(JsonObject previousSection, String key) {
        if (previousSection == null) {
            return new JsonObject();
        }
        JsonElement element = previousSection.get(key);
        return element != null && element.isJsonObject() ? element.getAsJsonObject().deepCopy() : new JsonObject();
    }

    private static List<LearningSample> readCurve(JsonObject efficiency) {
        JsonElement element = efficiency.get("learningCurve");
        List<LearningSample> samples = new ArrayList<>();
        if (element == null) {
            return samples;
        }
        if (!element.isJsonArray()) {
            log.warn("field 'learningCurve' is not an array; using empty curve");
            return samples;
        }
        for (JsonElement point : element.getAsJsonArray()) {
            if (!point.isJsonObject()) {
                continue;
            }
            JsonObject obj = point.getAsJsonObject();
            samples.add(new LearningSample(
                    getDouble(obj, "time", 0.0d),
                    getDouble(obj, "cost", 0.0d),
                    getBoolean(obj, "optimal", false)
            ));
        }
        return samples;
    }

    private static JsonObject section(JsonObject root, String key) {
        JsonElement element = root.get(key);
        if (element != null && element.isJsonObject()) {
            return element.getAsJsonObject();
        }
        JsonObject section = new JsonObject();
        root.add(key, section);
        return section;
    }

    private static Optional<JsonObject> getObject(JsonObject json, String key) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            return Optional.empty();
        }
        if (!element.isJsonObject()) {
            log.warn("field '{}' is not an object; using defaults", key);
            return Optional.empty();
        }
        return Optional.of(element.getAsJsonObject());
    }

    private static int getInt(JsonObject json, String key, int fallback) {
        JsonPrimitive number = numberOrNull(json, key);
        return number == null ? fallback : number.getAsNumber().intValue();
    }

    private static double getDouble(JsonObject json, String key, double fallback) {
        JsonPrimitive number = numberOrNull(json, key);
        return number == null ? fallback : number.getAsDouble();
    }

    private static boolean getBoolean(JsonObject json, String key, boolean fallback) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            return fallback;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            log.warn("field '{}' is not a boolean; using {}", key, fallback);
            return fallback;
        }
        return element.getAsBoolean();
    }

    private static JsonPrimitive numberOrNull(JsonObject json, String key) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            log.warn("field '{}' is not a number; using default", key);
            return null;
        }
        return element.getAsJsonPrimitive();
    }
}
