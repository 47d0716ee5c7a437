package info.isaksson.erland.niemtograph.error;

import java.util.Map;

public class MissingMappingException extends ConversionException {
    private final String typeName;

    public MissingMappingException(String typeName, String elementPath) {
        super(ConversionErrorCode.MISSING_MAPPING,
                "No mapping rule for type '" + typeName + "' at " + elementPath,
                elementPath,
                Map.of("type", typeName));
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
