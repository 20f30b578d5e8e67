package im.arun.pdf2md.ocr;

/**
 * Recognition failed for a single image. Never fatal for the document.
 */
public class ImageRecognitionException extends Exception {

    public ImageRecognitionException(String message) {
        super(message);
    }

    public ImageRecognitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
