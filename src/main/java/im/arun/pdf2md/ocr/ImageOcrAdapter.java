package im.arun.pdf2md.ocr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Runs OCR on extracted images and names their artifact files. Recognition failures for a single
 * image degrade to empty text; only an unavailable engine propagates.
 */
public class ImageOcrAdapter {
    private static final Logger logger = LoggerFactory.getLogger(ImageOcrAdapter.class);

    private final OcrEngine engine;

    public ImageOcrAdapter(OcrEngine engine) {
        this.engine = engine;
    }

    /**
     * @throws OcrEngineUnavailableException if the engine cannot run at all
     */
    public void verifyEngine() {
        engine.verifyAvailable();
    }

    /**
     * Recognize the text in an encoded image.
     *
     * @return trimmed text, or an empty string when nothing was recognized or recognition failed
     * @throws OcrEngineUnavailableException if the engine turns out to be missing mid-run
     */
    public String recognize(byte[] imageBytes) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            logger.warn("OCR skipped, image could not be decoded: {}", e.getMessage());
            return "";
        }
        if (image == null) {
            logger.warn("OCR skipped, unsupported image format");
            return "";
        }
        try {
            String text = engine.doOcr(image);
            return text == null ? "" : text.strip();
        } catch (ImageRecognitionException e) {
            logger.warn("OCR failed for an image: {}", e.getMessage());
            return "";
        }
    }

    /**
     * Deterministic artifact file name, so converting the same document again overwrites
     * the previous images.
     */
    public static String artifactFileName(int pageNumber, int sequenceIndex) {
        return String.format("image_p%d_%d.png", pageNumber, sequenceIndex);
    }
}
