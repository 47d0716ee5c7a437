package info.isaksson.erland.niemtograph.document;

import java.util.Locale;

public enum DocumentFormat {
    XML,
    JSON;

    /**
     * Sniff the format from the first non-whitespace character (after an optional UTF-8 BOM).
     *
     * @return the detected format, or null when the content looks like neither
     */
    public static DocumentFormat detect(byte[] content) {
        if (content == null) return null;
        int i = 0;
        if (content.length >= 3 && (content[0] & 0xFF) == 0xEF && (content[1] & 0xFF) == 0xBB && (content[2] & 0xFF) == 0xBF) {
            i = 3;
        }
        for (; i < content.length; i++) {
            char c = (char) (content[i] & 0xFF);
            if (Character.isWhitespace(c)) continue;
            if (c == '<') return XML;
            if (c == '{' || c == '[') return JSON;
            return null;
        }
        return null;
    }

    public static DocumentFormat fromFileName(String fileName) {
        if (fileName == null) return null;
        String s = fileName.toLowerCase(Locale.ROOT);
        if (s.endsWith(".xml")) return XML;
        if (s.endsWith(".json") || s.endsWith(".jsonld")) return JSON;
        return null;
    }

    /** CLI parsing: {@code xml | json}. {@code auto} is handled by callers as null. */
    public static DocumentFormat parseCli(String v) {
        if (v == null) throw new IllegalArgumentException("format is null");
        String s = v.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "xml":
                return XML;
            case "json":
                return JSON;
            case "auto":
                return null;
            default:
                throw new IllegalArgumentException("Invalid format: " + v + " (expected auto|xml|json)");
        }
    }
}
