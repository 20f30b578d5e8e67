package im.arun.pdf2md.ocr;

import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;

/**
 * Tesseract through Tess4J. A Tesseract handle is not thread-safe, so each worker thread gets its own.
 */
public class TesseractEngine implements OcrEngine {
    private static final Logger logger = LoggerFactory.getLogger(TesseractEngine.class);

    private final String datapath;
    private final String language;
    private final ThreadLocal<Tesseract> tesseract;

    public TesseractEngine(String configuredDatapath, String language) {
        this.datapath = resolveDatapath(configuredDatapath);
        this.language = language;
        this.tesseract = ThreadLocal.withInitial(this::newTesseract);
    }

    private static String resolveDatapath(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String fromEnv = System.getenv("TESSDATA_PREFIX");
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        if (new File("tessdata").exists()) {
            return new File("tessdata").getAbsolutePath();
        }
        return null;
    }

    private Tesseract newTesseract() {
        Tesseract instance = new Tesseract();
        if (datapath != null) {
            instance.setDatapath(datapath);
        }
        instance.setLanguage(language);
        return instance;
    }

    @Override
    public String doOcr(BufferedImage image) throws ImageRecognitionException {
        try {
            return tesseract.get().doOCR(image);
        } catch (TesseractException e) {
            throw new ImageRecognitionException("Tesseract failed: " + e.getMessage(), e);
        } catch (LinkageError e) {
            throw new OcrEngineUnavailableException("Tesseract native library could not be loaded: "
                    + e.getMessage(), e);
        }
    }

    @Override
    public void verifyAvailable() {
        if (datapath != null) {
            for (String lang : language.split("\\+")) {
                File trainedData = new File(datapath, lang + ".traineddata");
                if (!trainedData.isFile()) {
                    throw new OcrEngineUnavailableException("Tesseract language data not found: " + trainedData);
                }
            }
        }
        BufferedImage blank = new BufferedImage(64, 32, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = blank.createGraphics();
        graphics.setColor(Color.WHITE);
        graphics.fillRect(0, 0, blank.getWidth(), blank.getHeight());
        graphics.dispose();
        try {
            tesseract.get().doOCR(blank);
        } catch (TesseractException e) {
            throw new OcrEngineUnavailableException("Tesseract is not usable: " + e.getMessage(), e);
        } catch (LinkageError e) {
            throw new OcrEngineUnavailableException("Tesseract is not installed: " + e.getMessage(), e);
        }
        logger.info("Tesseract ready (language={}, datapath={})", language, datapath == null ? "<default>" : datapath);
    }
}
