package info.isaksson.erland.niemtograph.error;

import java.util.LinkedHashMap;
import java.util.Map;

/** The same raw id is declared by elements of different qualified names within one document. */
public class IdCollisionException extends ConversionException {
    private final String rawId;

    public IdCollisionException(String rawId, String firstType, String secondType, String elementPath) {
        super(ConversionErrorCode.ID_COLLISION,
                "Id '" + rawId + "' declared by both " + firstType + " and " + secondType,
                elementPath,
                context(rawId, firstType, secondType));
        this.rawId = rawId;
    }

    public String getRawId() {
        return rawId;
    }

    private static Map<String, Object> context(String rawId, String firstType, String secondType) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("rawId", rawId);
        ctx.put("firstType", firstType);
        ctx.put("secondType", secondType);
        return ctx;
    }
}
