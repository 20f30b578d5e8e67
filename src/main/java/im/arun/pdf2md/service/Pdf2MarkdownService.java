package im.arun.pdf2md.service;

import im.arun.pdf2md.config.ConverterConfig;
import im.arun.pdf2md.layout.LayoutClassifier;
import im.arun.pdf2md.markdown.MarkdownAssembler;
import im.arun.pdf2md.model.BatchReport;
import im.arun.pdf2md.model.PdfSource;
import im.arun.pdf2md.ocr.ImageOcrAdapter;
import im.arun.pdf2md.ocr.OcrEngine;
import im.arun.pdf2md.ocr.TesseractEngine;
import im.arun.pdf2md.pdf.PdfElementExtractor;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Wires the conversion pipeline from a {@link ConverterConfig}. The OCR engine is injected so
 * tests and embedders can swap Tesseract out.
 */
public class Pdf2MarkdownService {

    private final ConverterConfig config;
    private final DocumentConverter documentConverter;
    private final BatchScheduler batchScheduler;

    public Pdf2MarkdownService(ConverterConfig config) {
        this(config, new TesseractEngine(config.getTessdataPath(), config.getOcrLanguage()));
    }

    public Pdf2MarkdownService(ConverterConfig config, OcrEngine ocrEngine) {
        this.config = config;
        ImageOcrAdapter ocrAdapter = new ImageOcrAdapter(ocrEngine);
        this.documentConverter = new DocumentConverter(
                new PdfElementExtractor(),
                new LayoutClassifier(config),
                ocrAdapter,
                new MarkdownAssembler(config));
        this.batchScheduler = new BatchScheduler(documentConverter, ocrAdapter);
    }

    /**
     * Convert a batch into the configured output directory with the configured concurrency.
     */
    public BatchReport convertAll(List<PdfSource> documents, BatchProgressListener listener) {
        return batchScheduler.run(documents, config.getConcurrencyLimit(), getOutputRoot(), listener);
    }

    public Path getOutputRoot() {
        return Paths.get(config.getOutputDir());
    }

    public DocumentConverter getDocumentConverter() {
        return documentConverter;
    }

    public BatchScheduler getBatchScheduler() {
        return batchScheduler;
    }
}
