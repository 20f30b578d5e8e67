package im.arun.pdf2md.ocr;

/**
 * The OCR engine is missing or misconfigured, so every image in every document would fail.
 */
public class OcrEngineUnavailableException extends RuntimeException {

    public OcrEngineUnavailableException(String message) {
        super(message);
    }

    public OcrEngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
