package im.arun.pdf2md.service;

import im.arun.pdf2md.layout.LayoutClassifier;
import im.arun.pdf2md.markdown.MarkdownAssembler;
import im.arun.pdf2md.model.ClassifiedText;
import im.arun.pdf2md.model.ConversionResult;
import im.arun.pdf2md.model.ErrorKind;
import im.arun.pdf2md.model.ImageArtifact;
import im.arun.pdf2md.model.ImageBlock;
import im.arun.pdf2md.model.PageElements;
import im.arun.pdf2md.ocr.ImageOcrAdapter;
import im.arun.pdf2md.ocr.OcrEngineUnavailableException;
import im.arun.pdf2md.pdf.DocumentParseException;
import im.arun.pdf2md.pdf.PdfElementExtractor;
import im.arun.pdf2md.pdf.PdfElementExtractor.ExtractedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Converts a single PDF to Markdown: extraction, classification, OCR of images and assembly.
 * <p>
 * Images are written under {@code <outputRoot>/<stem>/} before the page that references them is
 * rendered. {@link #convert} never throws; every failure is reported in the returned result.
 * Instances hold no per-document state and can be shared between worker threads.
 */
public class DocumentConverter {
    private static final Logger logger = LoggerFactory.getLogger(DocumentConverter.class);

    private final PdfElementExtractor extractor;
    private final LayoutClassifier classifier;
    private final ImageOcrAdapter ocrAdapter;
    private final MarkdownAssembler assembler;

    public DocumentConverter(PdfElementExtractor extractor, LayoutClassifier classifier,
                             ImageOcrAdapter ocrAdapter, MarkdownAssembler assembler) {
        this.extractor = extractor;
        this.classifier = classifier;
        this.ocrAdapter = ocrAdapter;
        this.assembler = assembler;
    }

    public ConversionResult convert(byte[] pdfBytes, String sourceName, Path outputRoot) {
        String stem = documentStem(sourceName);
        Path documentDir = outputRoot.resolve(stem);
        List<ImageArtifact> artifacts = new ArrayList<>();
        long start = System.currentTimeMillis();

        try (ExtractedDocument document = extractor.open(pdfBytes, sourceName)) {
            List<String> pages = new ArrayList<>(document.getPageCount());
            for (int pageNumber = 1; pageNumber <= document.getPageCount(); pageNumber++) {
                PageElements page = document.readPage(pageNumber);

                List<ClassifiedText> classified = page.getTextSpans().stream()
                        .map(classifier::classify)
                        .flatMap(Optional::stream)
                        .collect(Collectors.toList());

                List<ImageArtifact> pageArtifacts = new ArrayList<>();
                for (ImageBlock image : page.getImageBlocks()) {
                    pageArtifacts.add(saveAndRecognize(image, stem, documentDir));
                }
                artifacts.addAll(pageArtifacts);

                pages.add(assembler.renderPage(page, classified, pageArtifacts));
            }
            String markdown = assembler.assembleDocument(pages);
            logger.info("Converted {} ({} pages, {} images) in {} ms", sourceName, pages.size(),
                    artifacts.size(), System.currentTimeMillis() - start);
            return ConversionResult.success(sourceName, markdown, artifacts);
        } catch (DocumentParseException e) {
            logger.error("Cannot parse {}: {}", sourceName, e.getMessage());
            return ConversionResult.failure(sourceName, ErrorKind.DOCUMENT_PARSE, e.getMessage(), artifacts);
        } catch (ArtifactWriteException e) {
            logger.error("Cannot save images of {}: {}", sourceName, e.getMessage());
            return ConversionResult.failure(sourceName, ErrorKind.ARTIFACT_WRITE, e.getMessage(), artifacts);
        } catch (IOException e) {
            logger.error("I/O error while converting {}: {}", sourceName, e.getMessage());
            return ConversionResult.failure(sourceName, ErrorKind.DOCUMENT_PARSE, e.getMessage(), artifacts);
        } catch (OcrEngineUnavailableException e) {
            logger.error("OCR engine unavailable while converting {}: {}", sourceName, e.getMessage());
            return ConversionResult.failure(sourceName, ErrorKind.OCR_ENGINE_UNAVAILABLE, e.getMessage(), artifacts);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure converting {}", sourceName, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ConversionResult.failure(sourceName, ErrorKind.UNEXPECTED, message, artifacts);
        }
    }

    private ImageArtifact saveAndRecognize(ImageBlock image, String stem, Path documentDir)
            throws ArtifactWriteException {
        String fileName = ImageOcrAdapter.artifactFileName(image.getPageNumber(), image.getSequenceIndexOnPage());
        Path target = documentDir.resolve(fileName);
        try {
            Files.createDirectories(documentDir);
            Files.write(target, image.getImageBytes());
        } catch (IOException e) {
            throw new ArtifactWriteException("Failed to write " + target + ": " + e.getMessage(), e);
        }
        String recognized = ocrAdapter.recognize(image.getImageBytes());
        return new ImageArtifact(image.getPageNumber(), image.getSequenceIndexOnPage(),
                stem + "/" + fileName, recognized);
    }

    /**
     * File name without directories and without a trailing {@code .pdf}; {@code document} when nothing is left.
     */
    public static String documentStem(String sourceName) {
        if (sourceName == null) {
            return "document";
        }
        String name = sourceName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        if (name.toLowerCase().endsWith(".pdf")) {
            name = name.substring(0, name.length() - 4);
        }
        name = name.replaceAll("[:*?\"<>|]", "-").strip();
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            return "document";
        }
        return name;
    }
}
