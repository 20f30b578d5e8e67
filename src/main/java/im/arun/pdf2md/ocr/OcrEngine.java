package im.arun.pdf2md.ocr;

import java.awt.image.BufferedImage;

/**
 * A recognition engine that turns an image into text. Implementations must be safe to call
 * from several worker threads at once.
 */
public interface OcrEngine {

    String doOcr(BufferedImage image) throws ImageRecognitionException;

    /**
     * Check once, before any document is processed, that the engine and its language data
     * are installed.
     *
     * @throws OcrEngineUnavailableException if recognition cannot work at all
     */
    void verifyAvailable();
}
