package info.isaksson.erland.niemtograph.build;

import info.isaksson.erland.niemtograph.graph.GraphEdge;
import info.isaksson.erland.niemtograph.graph.GraphEdgeKind;
import info.isaksson.erland.niemtograph.graph.GraphModel;
import info.isaksson.erland.niemtograph.graph.GraphNode;
import info.isaksson.erland.niemtograph.resolve.IdStrategy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Working state shared by the conversion phases of one document: node and edge drafts in creation
 * order plus the work items later phases consume.
 *
 * <p>Not thread safe; each document gets its own assembly.</p>
 */
public final class GraphAssembly {

    public final String sourceName;
    public final String fingerprint;

    private final Map<String, NodeDraft> nodes = new LinkedHashMap<>();
    private final Map<String, EdgeDraft> edges = new LinkedHashMap<>();

    final List<RoleClaim> roleClaims = new ArrayList<>();
    final List<PendingAssociation> associations = new ArrayList<>();
    final List<AugmentationSite> augmentations = new ArrayList<>();
    final List<MetadataSite> metadataSites = new ArrayList<>();
    final List<DeferredReference> deferredReferences = new ArrayList<>();

    public GraphAssembly(String sourceName, String fingerprint) {
        this.sourceName = sourceName;
        this.fingerprint = fingerprint;
    }

    /**
     * Adds a node, or folds it into the node already registered under the same id.
     *
     * @return the draft that is now registered under the id
     */
    public NodeDraft addNode(NodeDraft draft) {
        NodeDraft existing = nodes.get(draft.id);
        if (existing == null) {
            nodes.put(draft.id, draft);
            return draft;
        }
        existing.absorb(draft);
        return existing;
    }

    public Optional<NodeDraft> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public NodeDraft requireNode(String id) {
        NodeDraft n = nodes.get(id);
        if (n == null) throw new IllegalStateException("No node with id " + id);
        return n;
    }

    public Collection<NodeDraft> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /**
     * Returns the edge for (kind, source, target, discriminator), creating it on first use, so the
     * same logical edge is never emitted twice.
     */
    public EdgeDraft edge(GraphEdgeKind kind, String sourceId, String targetId, String discriminator) {
        String id = IdStrategy.edgeId(kind, sourceId, targetId, discriminator);
        return edges.computeIfAbsent(id, k -> new EdgeDraft(k, kind, sourceId, targetId, discriminator));
    }

    public boolean hasEdge(GraphEdgeKind kind, String sourceId, String targetId, String discriminator) {
        return edges.containsKey(IdStrategy.edgeId(kind, sourceId, targetId, discriminator));
    }

    public Optional<EdgeDraft> edgeById(String id) {
        return Optional.ofNullable(edges.get(id));
    }

    public Collection<EdgeDraft> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    /** Removes edges of one kind from {@code sourceId} to any of {@code targetIds}; returns the number removed. */
    public int removeEdges(GraphEdgeKind kind, String sourceId, Collection<String> targetIds) {
        int removed = 0;
        Iterator<EdgeDraft> it = edges.values().iterator();
        while (it.hasNext()) {
            EdgeDraft e = it.next();
            if (e.kind == kind && e.sourceId.equals(sourceId) && targetIds.contains(e.targetId)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Turns the {@code from} edges leaving {@code sourceId} into {@code to} edges in place, keeping
     * their properties. Returns the number of edges changed.
     */
    public int rekindEdges(String sourceId, GraphEdgeKind from, GraphEdgeKind to) {
        List<EdgeDraft> all = new ArrayList<>(edges.values());
        edges.clear();
        int changed = 0;
        for (EdgeDraft e : all) {
            if (e.kind != from || !e.sourceId.equals(sourceId)) {
                put(e);
                continue;
            }
            String id = IdStrategy.edgeId(to, e.sourceId, e.targetId, e.discriminator);
            EdgeDraft rekinded = new EdgeDraft(id, to, e.sourceId, e.targetId, e.discriminator);
            e.properties().forEach(rekinded::putIfAbsent);
            put(rekinded);
            changed++;
        }
        return changed;
    }

    private void put(EdgeDraft e) {
        EdgeDraft existing = edges.putIfAbsent(e.id, e);
        if (existing != null) e.properties().forEach(existing::putIfAbsent);
    }

    /**
     * Copies the nodes, edges and role claims of another assembly into this one. Nodes sharing an id
     * are folded together; an edge already present keeps its properties.
     */
    public void mergeFrom(GraphAssembly other) {
        for (NodeDraft n : other.nodes.values()) {
            NodeDraft copy = new NodeDraft(n.id, n.type());
            copy.absorb(n);
            addNode(copy);
        }
        for (EdgeDraft e : other.edges.values()) {
            EdgeDraft copy = edges.computeIfAbsent(e.id, k -> new EdgeDraft(k, e.kind, e.sourceId, e.targetId, e.discriminator));
            e.properties().forEach(copy::putIfAbsent);
        }
        roleClaims.addAll(other.roleClaims);
    }

    public List<RoleClaim> roleClaims() {
        return Collections.unmodifiableList(roleClaims);
    }

    public List<PendingAssociation> associations() {
        return Collections.unmodifiableList(associations);
    }

    public List<AugmentationSite> augmentations() {
        return Collections.unmodifiableList(augmentations);
    }

    public List<MetadataSite> metadataSites() {
        return Collections.unmodifiableList(metadataSites);
    }

    public void addMetadataSite(MetadataSite site) {
        metadataSites.add(Objects.requireNonNull(site, "site"));
    }

    public List<DeferredReference> deferredReferences() {
        return Collections.unmodifiableList(deferredReferences);
    }

    public void addDeferredReference(DeferredReference ref) {
        deferredReferences.add(Objects.requireNonNull(ref, "ref"));
    }

    /**
     * Freezes the drafts into an immutable {@link GraphModel} in creation order.
     *
     * @throws IllegalStateException if an edge points at a node that was never created
     */
    public GraphModel freeze() {
        List<GraphNode> outNodes = new ArrayList<>(nodes.size());
        for (NodeDraft n : nodes.values()) outNodes.add(n.freeze());
        List<GraphEdge> outEdges = new ArrayList<>(edges.size());
        for (EdgeDraft e : edges.values()) {
            if (!nodes.containsKey(e.sourceId) || !nodes.containsKey(e.targetId)) {
                throw new IllegalStateException("Edge " + e + " has a missing endpoint");
            }
            outEdges.add(e.freeze());
        }
        return new GraphModel(sourceName, fingerprint, outNodes, outEdges);
    }
}
