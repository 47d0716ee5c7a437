package info.isaksson.erland.niemtograph.convert;

import java.util.Locale;

public enum ConversionMode {
    /** Node or property is decided from document structure alone. */
    DYNAMIC,
    /** A {@link info.isaksson.erland.niemtograph.mapping.MappingTable} overrides the structural default. */
    MAPPING;

    public static ConversionMode parseCli(String v) {
        if (v == null) throw new IllegalArgumentException("mode is null");
        String s = v.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "dynamic":
                return DYNAMIC;
            case "mapping":
                return MAPPING;
            default:
                throw new IllegalArgumentException("Invalid mode: " + v + " (expected dynamic|mapping)");
        }
    }
}
