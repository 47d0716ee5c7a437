package info.isaksson.erland.niemtograph.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for fatal conversion failures, with a stable {@link ConversionErrorCode},
 * the path of the offending element and optional structured context.
 */
public class ConversionException extends RuntimeException {
    private final ConversionErrorCode code;
    private final String elementPath;
    private final Map<String, Object> context;

    public ConversionException(ConversionErrorCode code, String message, String elementPath) {
        this(code, message, elementPath, null, null);
    }

    public ConversionException(ConversionErrorCode code, String message, String elementPath, Map<String, ?> context) {
        this(code, message, elementPath, context, null);
    }

    public ConversionException(ConversionErrorCode code, String message, String elementPath, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.elementPath = elementPath;
        this.context = copy(context);
    }

    public ConversionErrorCode getCode() {
        return code;
    }

    /** Slash separated path of the offending element (e.g. {@code /exch:Msg/j:Crash[2]}), or null. */
    public String getElementPath() {
        return elementPath;
    }

    /** Additional key/value details that help diagnosing the error. */
    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) return Collections.emptyMap();
        Map<String, Object> m = new LinkedHashMap<>();
        input.forEach(m::put);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{code=" + code
                + ", message=" + getMessage()
                + (elementPath == null ? "" : ", path=" + elementPath)
                + (context.isEmpty() ? "" : ", context=" + context)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
