package info.isaksson.erland.niemtograph.build;

import info.isaksson.erland.niemtograph.document.ElementNode;
import info.isaksson.erland.niemtograph.resolve.ElementInfo;

/**
 * Writes leaf content onto a node draft.
 *
 * <p>Keys are qualified names; nested flattened content and leaf attributes get path keys such as
 * {@code nc:PersonName/nc:PersonGivenName} and {@code nc:Measure/@nc:unitText}. Empty and nil leaves
 * write nothing. Elements below a leaf that have a shape of their own are left to the builder.</p>
 */
public final class PropertyWriter {

    private PropertyWriter() {}

    /** Writes every {@link ElementShape#LEAF} child of {@code parent} with the given key prefix. */
    public static void writeLeafChildren(NodeDraft target, ElementInfo parent, String prefix) {
        for (ElementInfo child : parent.children()) {
            if (child.shape == ElementShape.LEAF) {
                writeLeaf(target, child, prefix);
            }
        }
    }

    static void writeLeaf(NodeDraft target, ElementInfo leaf, String prefix) {
        String key = prefix + leaf.qname();
        ElementNode el = leaf.element;
        writeAttributes(target, el, key + "/@");
        if (el.isComplex()) {
            writeLeafChildren(target, leaf, key + "/");
        } else if (el.text != null && !el.nil) {
            target.addProperty(key, el.text);
        }
    }

    /** Plain attributes of {@code el} with each key prefixed. */
    public static void writeAttributes(NodeDraft target, ElementNode el, String prefix) {
        for (ElementNode attribute : el.attributeNodes()) {
            target.addProperty(prefix + attribute.name.prefixed(), attribute.text);
        }
    }
}
