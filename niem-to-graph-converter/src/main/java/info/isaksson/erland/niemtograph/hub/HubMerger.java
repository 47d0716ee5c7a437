package info.isaksson.erland.niemtograph.hub;

import info.isaksson.erland.niemtograph.build.GraphAssembly;
import info.isaksson.erland.niemtograph.build.NodeDraft;
import info.isaksson.erland.niemtograph.build.RoleClaim;
import info.isaksson.erland.niemtograph.graph.GraphEdgeKind;
import info.isaksson.erland.niemtograph.graph.NodeFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Creates one hub node per identity claimed by two or more distinct role nodes.
 *
 * <p>The hub carries the role type names and a role count, never the roles' own properties. Each
 * contributing role gets exactly one REPRESENTS edge to the hub. An identity with a single role gets
 * no hub; the role node stands for the entity.</p>
 */
public final class HubMerger {

    private static final Logger log = LoggerFactory.getLogger(HubMerger.class);

    public static final String ROLE_COUNT = "roleCount";

    private final String hubLabel;

    public HubMerger(String hubLabel) {
        this.hubLabel = Objects.requireNonNull(hubLabel, "hubLabel");
    }

    /**
     * @param hubIds maps a raw identity to its hub id (per-document or shared)
     * @return raw ids that received a hub, with their hub ids
     */
    public HubRegistry merge(GraphAssembly assembly, List<RoleClaim> claims, Function<String, String> hubIds) {
        HubRegistry registry = new HubRegistry();
        for (Map.Entry<String, List<RoleClaim>> group : groupByIdentity(claims).entrySet()) {
            List<RoleClaim> roles = group.getValue();
            if (roles.size() < 2) continue;

            String rawId = group.getKey();
            String hubId = hubIds.apply(rawId);
            NodeDraft hub = new NodeDraft(hubId, hubLabel);
            hub.addFlag(NodeFlag.HUB);
            for (RoleClaim r : roles) hub.addRoleType(r.roleType);
            hub.putProperty(ROLE_COUNT, roles.size());
            assembly.addNode(hub);

            for (RoleClaim r : roles) {
                assembly.edge(GraphEdgeKind.REPRESENTS, r.nodeId, hubId, null);
            }
            registry.register(rawId, hubId);
        }
        log.debug("Created {} hub node(s) from {} role claim(s)", registry.size(), claims.size());
        return registry;
    }

    /** Claims grouped by identity in first-claim order, one claim per distinct role node. */
    static Map<String, List<RoleClaim>> groupByIdentity(List<RoleClaim> claims) {
        Map<String, List<RoleClaim>> out = new LinkedHashMap<>();
        Map<String, Set<String>> seenNodes = new LinkedHashMap<>();
        for (RoleClaim c : claims) {
            if (seenNodes.computeIfAbsent(c.rawId, k -> new LinkedHashSet<>()).add(c.nodeId)) {
                out.computeIfAbsent(c.rawId, k -> new ArrayList<>()).add(c);
            }
        }
        return out;
    }
}
