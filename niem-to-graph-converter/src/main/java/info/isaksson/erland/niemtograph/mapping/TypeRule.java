package info.isaksson.erland.niemtograph.mapping;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Mapping entry for one qualified type name. */
@JsonPropertyOrder({"kind","label"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TypeRule {
    public final RuleKind kind;
    /** Node type to use instead of the qualified name; null keeps the qualified name. */
    public final String label;

    @JsonCreator
    public TypeRule(@JsonProperty("kind") RuleKind kind, @JsonProperty("label") String label) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.label = label == null || label.isBlank() ? null : label.trim();
    }

    public static TypeRule of(RuleKind kind) {
        return new TypeRule(kind, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeRule)) return false;
        TypeRule that = (TypeRule) o;
        return kind == that.kind && Objects.equals(label, that.label);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, label);
    }

    @Override public String toString() {
        return kind + (label == null ? "" : "(" + label + ")");
    }
}
