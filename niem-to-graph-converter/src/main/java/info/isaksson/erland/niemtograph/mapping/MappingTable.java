package info.isaksson.erland.niemtograph.mapping;

import info.isaksson.erland.niemtograph.document.QualifiedName;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Type name to {@link TypeRule} table consulted in mapping mode.
 *
 * <p>Keys are {@code prefix:local} names as they appear in documents. A table may be partial; types
 * without an entry fall back to structural classification unless strict mapping is enabled.</p>
 */
public final class MappingTable {

    private static final MappingTable EMPTY = new MappingTable(Map.of());

    private final Map<String, TypeRule> rules;

    public MappingTable(Map<String, TypeRule> rules) {
        this.rules = rules == null || rules.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(rules));
    }

    public static MappingTable empty() {
        return EMPTY;
    }

    public Optional<TypeRule> rule(QualifiedName name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(rules.get(name.prefixed()));
    }

    public Map<String, TypeRule> rules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public int size() {
        return rules.size();
    }

    /** Builder-style copy with one more rule; existing entries for the same name are replaced. */
    public MappingTable with(String typeName, TypeRule rule) {
        Map<String, TypeRule> copy = new TreeMap<>(rules);
        copy.put(QualifiedName.parse(typeName).prefixed(), rule);
        return new MappingTable(copy);
    }
}
