package info.isaksson.erland.niemtograph.convert;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** A non-fatal deterministic warning produced during conversion. */
@JsonPropertyOrder({"code","message","elementPath","context"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ConversionWarning {

    public final WarningCode code;

    /** Human-readable message. */
    public final String message;

    /** Path of the element the warning is about; may be null. */
    public final String elementPath;

    /** Structured context with key-sorted entries. */
    public final Map<String, String> context;

    public ConversionWarning(WarningCode code, String message, String elementPath, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.elementPath = elementPath;
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new TreeMap<>(context));
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionWarning)) return false;
        ConversionWarning that = (ConversionWarning) o;
        return code == that.code
                && message.equals(that.message)
                && Objects.equals(elementPath, that.elementPath)
                && context.equals(that.context);
    }

    @Override public int hashCode() {
        return Objects.hash(code, message, elementPath, context);
    }

    @Override public String toString() {
        return code + ": " + message + (elementPath == null ? "" : " at " + elementPath);
    }
}
