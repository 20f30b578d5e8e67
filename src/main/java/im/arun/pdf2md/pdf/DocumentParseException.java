package im.arun.pdf2md.pdf;

import java.io.IOException;

/**
 * The byte stream is not a readable PDF: malformed, truncated, or encrypted without a usable password.
 */
public class DocumentParseException extends IOException {

    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
