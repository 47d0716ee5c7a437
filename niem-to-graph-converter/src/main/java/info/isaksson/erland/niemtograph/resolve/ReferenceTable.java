package info.isaksson.erland.niemtograph.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw declared id to node id, scoped to one document, plus the reference attempts that failed.
 */
public final class ReferenceTable {

    /** A declared id and the node it names. */
    public static final class Declaration {
        public final String rawId;
        public final String nodeId;
        /** Qualified name of the first declaring element. */
        public final String type;
        public final String path;
        /** Pre-order position of the first declaring element. */
        public final int order;

        Declaration(String rawId, String nodeId, String type, String path, int order) {
            this.rawId = rawId;
            this.nodeId = nodeId;
            this.type = type;
            this.path = path;
            this.order = order;
        }
    }

    /** A reference that did not resolve inside the document. */
    public static final class Unresolved {
        public final String rawId;
        public final String path;
        public final boolean forward;
        public final boolean deferred;

        Unresolved(String rawId, String path, boolean forward, boolean deferred) {
            this.rawId = rawId;
            this.path = path;
            this.forward = forward;
            this.deferred = deferred;
        }
    }

    private final Map<String, Declaration> declarations = new LinkedHashMap<>();
    private final List<Unresolved> unresolved = new ArrayList<>();

    void declare(String rawId, String nodeId, String type, String path, int order) {
        declarations.putIfAbsent(rawId, new Declaration(rawId, nodeId, type, path, order));
    }

    void unresolved(String rawId, String path, boolean forward, boolean deferred) {
        unresolved.add(new Unresolved(rawId, path, forward, deferred));
    }

    public Optional<Declaration> declaration(String rawId) {
        return Optional.ofNullable(declarations.get(rawId));
    }

    public Optional<String> resolve(String rawId) {
        Declaration d = declarations.get(rawId);
        return d == null ? Optional.empty() : Optional.of(d.nodeId);
    }

    /** Declarations in document order. */
    public Map<String, Declaration> declarations() {
        return Collections.unmodifiableMap(declarations);
    }

    public List<Unresolved> unresolved() {
        return Collections.unmodifiableList(unresolved);
    }

    public int size() {
        return declarations.size();
    }
}
