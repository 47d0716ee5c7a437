package info.isaksson.erland.niemtograph.convert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collects warnings during one conversion.
 *
 * <p>Warnings are deterministic: final output is sorted by (code, elementPath, message, contextString).
 * Not thread safe; each conversion owns its collector.</p>
 */
public final class ConversionWarnings {

    private final List<ConversionWarning> warnings = new ArrayList<>();

    public void warn(WarningCode code, String message, String elementPath) {
        warn(code, message, elementPath, null);
    }

    public void warn(WarningCode code, String message, String elementPath, Map<String, String> context) {
        warnings.add(new ConversionWarning(code, message, elementPath, context));
    }

    public void warn(WarningCode code, String message, String elementPath, String k1, String v1) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        warn(code, message, elementPath, ctx);
    }

    public void addAll(List<ConversionWarning> other) {
        if (other != null) warnings.addAll(other);
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public int size() {
        return warnings.size();
    }

    public boolean contains(WarningCode code) {
        for (ConversionWarning w : warnings) {
            if (w.code == code) return true;
        }
        return false;
    }

    public List<ConversionWarning> toDeterministicList() {
        List<ConversionWarning> out = new ArrayList<>(warnings);
        out.sort(Comparator
                .comparing((ConversionWarning w) -> w.code.name())
                .thenComparing(w -> Objects.toString(w.elementPath, ""))
                .thenComparing(w -> w.message)
                .thenComparing(w -> contextString(w.context)));
        return Collections.unmodifiableList(out);
    }

    private static String contextString(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        // context maps are already key-sorted
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : ctx.entrySet()) {
            sb.append(e.getKey()).append('=').append(e.getValue()).append(';');
        }
        return sb.toString();
    }
}
