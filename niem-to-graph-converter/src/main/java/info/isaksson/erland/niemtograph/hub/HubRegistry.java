package info.isaksson.erland.niemtograph.hub;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Raw identity to hub node id, filled as hubs are created. */
public final class HubRegistry {

    private final Map<String, String> hubs = new LinkedHashMap<>();

    void register(String rawId, String hubId) {
        hubs.putIfAbsent(rawId, hubId);
    }

    public Optional<String> hubFor(String rawId) {
        return Optional.ofNullable(hubs.get(rawId));
    }

    public Map<String, String> hubs() {
        return Collections.unmodifiableMap(hubs);
    }

    public int size() {
        return hubs.size();
    }
}
