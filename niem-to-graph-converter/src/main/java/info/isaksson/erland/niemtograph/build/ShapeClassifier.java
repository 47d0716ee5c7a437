package info.isaksson.erland.niemtograph.build;

import info.isaksson.erland.niemtograph.convert.ConversionConfig;
import info.isaksson.erland.niemtograph.convert.ConversionWarnings;
import info.isaksson.erland.niemtograph.convert.WarningCode;
import info.isaksson.erland.niemtograph.document.ElementNode;
import info.isaksson.erland.niemtograph.error.MissingMappingException;
import info.isaksson.erland.niemtograph.mapping.TypeRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Decides the {@link ElementShape} of every element.
 *
 * <p>Order of precedence:</p>
 * <ol>
 *   <li>the document root is always an entity</li>
 *   <li>an element with reference targets is reference-only</li>
 *   <li>in mapping mode, the element's mapping rule</li>
 *   <li>complex content whose local name ends with the augmentation suffix is an augmentation</li>
 *   <li>complex content with at least two reference-only children and no other complex children is an association</li>
 *   <li>a declared id, a role claim or metadata references make an entity, even for scalar content</li>
 *   <li>complex content is an entity, except below an augmentation or a flattened element, where it is flattened too</li>
 *   <li>everything else is a leaf</li>
 * </ol>
 *
 * <p>One instance serves one conversion; it remembers which unmapped types were already reported.</p>
 */
public final class ShapeClassifier {

    private static final Logger log = LoggerFactory.getLogger(ShapeClassifier.class);

    /** Shape plus the mapping rule that produced it, if any. */
    public static final class Classification {
        public final ElementShape shape;
        public final TypeRule rule;

        Classification(ElementShape shape, TypeRule rule) {
            this.shape = shape;
            this.rule = rule;
        }
    }

    private final ConversionConfig config;
    private final ConversionWarnings warnings;
    private final Set<String> reportedUnmapped = new HashSet<>();

    public ShapeClassifier(ConversionConfig config, ConversionWarnings warnings) {
        this.config = Objects.requireNonNull(config, "config");
        this.warnings = Objects.requireNonNull(warnings, "warnings");
    }

    /**
     * @param flattening true below an augmentation container or a flattened element
     * @throws MissingMappingException in strict mapping mode, for an unmapped entity-like type
     */
    public Classification classify(ElementNode e, boolean root, boolean flattening, String path) {
        TypeRule rule = config.isMappingMode() ? config.mappingTable.rule(e.name).orElse(null) : null;

        if (root) return new Classification(ElementShape.COMPLEX_ENTITY, rule);
        if (e.hasReference()) return new Classification(ElementShape.REFERENCE_ONLY, null);

        if (rule != null) return new Classification(fromRule(rule), rule);

        ElementShape structural = structuralShape(e, flattening);
        if (config.isMappingMode() && structural != ElementShape.LEAF) {
            unmapped(e, path);
        }
        return new Classification(structural, null);
    }

    ElementShape structuralShape(ElementNode e, boolean flattening) {
        if (e.isComplex() && e.name.localName.endsWith(config.augmentationSuffix)) {
            return ElementShape.AUGMENTATION;
        }
        if (e.isComplex() && looksLikeAssociation(e)) {
            return ElementShape.ASSOCIATION;
        }
        if (e.declaredId != null || e.roleOf != null || e.hasMetadataRefs()) {
            return ElementShape.COMPLEX_ENTITY;
        }
        if (e.isComplex()) {
            return flattening ? ElementShape.LEAF : ElementShape.COMPLEX_ENTITY;
        }
        return ElementShape.LEAF;
    }

    private static boolean looksLikeAssociation(ElementNode e) {
        int refs = 0;
        for (ElementNode c : e.children) {
            if (c.hasReference()) {
                refs++;
            } else if (c.isComplex()) {
                return false;
            }
        }
        return refs >= 2;
    }

    private static ElementShape fromRule(TypeRule rule) {
        switch (rule.kind) {
            case NODE:
                return ElementShape.COMPLEX_ENTITY;
            case FLATTEN:
                return ElementShape.LEAF;
            case ASSOCIATION:
                return ElementShape.ASSOCIATION;
            case AUGMENTATION:
                return ElementShape.AUGMENTATION;
            default:
                throw new IllegalStateException("Unhandled rule kind: " + rule.kind);
        }
    }

    private void unmapped(ElementNode e, String path) {
        String type = e.name.prefixed();
        if (config.strictMapping) {
            throw new MissingMappingException(type, path);
        }
        if (reportedUnmapped.add(type)) {
            log.warn("No mapping rule for {}; using structural classification", type);
            warnings.warn(WarningCode.MISSING_MAPPING,
                    "No mapping rule for " + type + "; using structural classification", path, "type", type);
        }
    }
}
