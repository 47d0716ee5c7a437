package info.isaksson.erland.niemtograph.error;

/** Malformed input document. */
public class DocumentParseException extends ConversionException {

    public DocumentParseException(String message, String elementPath) {
        super(ConversionErrorCode.PARSE_ERROR, message, elementPath);
    }

    public DocumentParseException(String message, String elementPath, Throwable cause) {
        super(ConversionErrorCode.PARSE_ERROR, message, elementPath, null, cause);
    }
}
