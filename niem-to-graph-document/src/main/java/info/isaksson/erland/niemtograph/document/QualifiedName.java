package info.isaksson.erland.niemtograph.document;

import java.util.Objects;

/**
 * Namespace-qualified element or attribute name.
 *
 * <p>Identity is (namespaceUri, localName); the prefix is kept for display and for property keys,
 * which use the {@code prefix:local} form.</p>
 */
public final class QualifiedName implements Comparable<QualifiedName> {
    public final String namespaceUri;
    public final String prefix;
    public final String localName;

    public QualifiedName(String namespaceUri, String prefix, String localName) {
        if (localName == null || localName.isBlank()) {
            throw new IllegalArgumentException("localName must not be blank");
        }
        this.namespaceUri = namespaceUri == null || namespaceUri.isEmpty() ? null : namespaceUri;
        this.prefix = prefix == null ? "" : prefix;
        this.localName = localName;
    }

    /** Unqualified name (no namespace). */
    public static QualifiedName local(String localName) {
        return new QualifiedName(null, "", localName);
    }

    /**
     * Parse {@code prefix:local} without namespace information.
     * Used for caller supplied names such as the declared root or mapping table keys.
     */
    public static QualifiedName parse(String prefixed) {
        if (prefixed == null || prefixed.isBlank()) {
            throw new IllegalArgumentException("qualified name must not be blank");
        }
        String s = prefixed.trim();
        int idx = s.indexOf(':');
        if (idx < 0) return local(s);
        return new QualifiedName(null, s.substring(0, idx), s.substring(idx + 1));
    }

    /** {@code prefix:local}, or just {@code local} for unprefixed names. */
    public String prefixed() {
        return prefix.isEmpty() ? localName : prefix + ":" + localName;
    }

    /** True when {@code prefixed()} equals the given string; ignores namespace URIs. */
    public boolean matches(String prefixedName) {
        return prefixed().equals(prefixedName);
    }

    public boolean localNameStartsLowerCase() {
        return Character.isLowerCase(localName.charAt(0));
    }

    @Override public int compareTo(QualifiedName o) {
        return prefixed().compareTo(o.prefixed());
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QualifiedName)) return false;
        QualifiedName that = (QualifiedName) o;
        if (namespaceUri == null && that.namespaceUri == null) {
            return prefix.equals(that.prefix) && localName.equals(that.localName);
        }
        return Objects.equals(namespaceUri, that.namespaceUri) && localName.equals(that.localName);
    }

    @Override public int hashCode() {
        return namespaceUri == null ? Objects.hash(prefix, localName) : Objects.hash(namespaceUri, localName);
    }

    @Override public String toString() {
        return prefixed();
    }
}
