package info.isaksson.erland.niemtograph.convert;

import info.isaksson.erland.niemtograph.mapping.MappingTable;

import java.util.Objects;

/**
 * Immutable conversion configuration. Use {@link #builder()}; {@link #defaults()} is dynamic mode with
 * strict references.
 */
public final class ConversionConfig {

    public static final String DEFAULT_HUB_LABEL = "Entity";
    public static final String DEFAULT_AUGMENTATION_SUFFIX = "Augmentation";

    private static final ConversionConfig DEFAULTS = builder().build();

    public final ConversionMode mode;
    /** Unresolved references abort the conversion instead of becoming warnings. */
    public final boolean strictReferences;
    /** Mapping mode only: an entity type without a mapping rule aborts the conversion. */
    public final boolean strictMapping;
    public final MappingTable mappingTable;
    public final String hubLabel;
    /** References may name ids declared later in the document. */
    public final boolean forwardReferences;
    /** Unresolved nil reference-only elements are warnings even with strict references. */
    public final boolean tolerateNilReferences;
    /** Local-name suffix that marks an augmentation container. */
    public final String augmentationSuffix;

    private ConversionConfig(Builder b) {
        this.mode = b.mode;
        this.strictReferences = b.strictReferences;
        this.strictMapping = b.strictMapping;
        this.mappingTable = b.mappingTable == null ? MappingTable.empty() : b.mappingTable;
        this.hubLabel = b.hubLabel;
        this.forwardReferences = b.forwardReferences;
        this.tolerateNilReferences = b.tolerateNilReferences;
        this.augmentationSuffix = b.augmentationSuffix;
    }

    public static ConversionConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.mode = mode;
        b.strictReferences = strictReferences;
        b.strictMapping = strictMapping;
        b.mappingTable = mappingTable;
        b.hubLabel = hubLabel;
        b.forwardReferences = forwardReferences;
        b.tolerateNilReferences = tolerateNilReferences;
        b.augmentationSuffix = augmentationSuffix;
        return b;
    }

    public boolean isMappingMode() {
        return mode == ConversionMode.MAPPING;
    }

    @Override public String toString() {
        return "ConversionConfig{mode=" + mode
                + ", strictReferences=" + strictReferences
                + ", strictMapping=" + strictMapping
                + ", mappingRules=" + mappingTable.size()
                + ", hubLabel=" + hubLabel
                + ", forwardReferences=" + forwardReferences
                + ", tolerateNilReferences=" + tolerateNilReferences
                + ", augmentationSuffix=" + augmentationSuffix
                + '}';
    }

    public static final class Builder {
        private ConversionMode mode = ConversionMode.DYNAMIC;
        private boolean strictReferences = true;
        private boolean strictMapping = false;
        private MappingTable mappingTable = MappingTable.empty();
        private String hubLabel = DEFAULT_HUB_LABEL;
        private boolean forwardReferences = true;
        private boolean tolerateNilReferences = false;
        private String augmentationSuffix = DEFAULT_AUGMENTATION_SUFFIX;

        private Builder() {}

        public Builder mode(ConversionMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder strictReferences(boolean v) {
            this.strictReferences = v;
            return this;
        }

        public Builder strictMapping(boolean v) {
            this.strictMapping = v;
            return this;
        }

        public Builder mappingTable(MappingTable table) {
            this.mappingTable = table;
            return this;
        }

        public Builder hubLabel(String label) {
            if (label == null || label.isBlank()) throw new IllegalArgumentException("hubLabel must not be blank");
            this.hubLabel = label.trim();
            return this;
        }

        public Builder forwardReferences(boolean v) {
            this.forwardReferences = v;
            return this;
        }

        public Builder tolerateNilReferences(boolean v) {
            this.tolerateNilReferences = v;
            return this;
        }

        public Builder augmentationSuffix(String suffix) {
            if (suffix == null || suffix.isBlank()) throw new IllegalArgumentException("augmentationSuffix must not be blank");
            this.augmentationSuffix = suffix.trim();
            return this;
        }

        public ConversionConfig build() {
            if (strictMapping && mode != ConversionMode.MAPPING) {
                throw new IllegalArgumentException("strictMapping requires mapping mode");
            }
            return new ConversionConfig(this);
        }
    }
}
