package info.isaksson.erland.niemtograph.error;

import java.util.Map;

public class DanglingReferenceException extends ConversionException {
    private final String rawId;

    public DanglingReferenceException(String rawId, String elementPath) {
        super(ConversionErrorCode.DANGLING_REFERENCE,
                "Reference to undeclared id '" + rawId + "' at " + elementPath,
                elementPath,
                Map.of("rawId", rawId));
        this.rawId = rawId;
    }

    /** The unresolved identifier as written in the document. */
    public String getRawId() {
        return rawId;
    }
}
