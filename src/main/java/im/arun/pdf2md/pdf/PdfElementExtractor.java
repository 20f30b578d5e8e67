package im.arun.pdf2md.pdf;

import im.arun.pdf2md.model.PageElements;
import im.arun.pdf2md.model.PositionedElement;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Opens PDFs with Apache PDFBox and pulls positioned text and image elements out of them,
 * one page at a time.
 */
public class PdfElementExtractor {
    private static final Logger logger = LoggerFactory.getLogger(PdfElementExtractor.class);

    /**
     * Parse a PDF held in memory.
     *
     * @param pdfBytes   raw PDF bytes
     * @param sourceName name used in log and error messages
     * @return an open document; the caller must close it
     * @throws DocumentParseException if the bytes are not a PDF or the PDF is password protected
     */
    public ExtractedDocument open(byte[] pdfBytes, String sourceName) throws DocumentParseException {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new DocumentParseException(sourceName + " is empty");
        }
        PDDocument document;
        try {
            document = Loader.loadPDF(pdfBytes);
        } catch (InvalidPasswordException e) {
            throw new DocumentParseException(sourceName + " is encrypted and cannot be opened without a password", e);
        } catch (IOException e) {
            throw new DocumentParseException(sourceName + " is not a valid PDF: " + e.getMessage(), e);
        }
        logger.debug("Opened {} with {} pages", sourceName, document.getNumberOfPages());
        return new ExtractedDocument(document, sourceName);
    }

    /**
     * An open PDF. Pages are extracted on demand so only one page's elements are held at a time.
     * Not thread-safe: PDFBox documents must stay on one thread.
     */
    public static class ExtractedDocument implements Closeable {
        private final PDDocument document;
        private final String sourceName;

        ExtractedDocument(PDDocument document, String sourceName) {
            this.document = document;
            this.sourceName = sourceName;
        }

        public int getPageCount() {
            return document.getNumberOfPages();
        }

        /**
         * Extract the elements of one page: text blocks in content-stream order followed by images
         * in drawing order.
         *
         * @param pageNumber 1-based page number
         */
        public PageElements readPage(int pageNumber) throws DocumentParseException {
            if (pageNumber < 1 || pageNumber > getPageCount()) {
                throw new IllegalArgumentException("Page " + pageNumber + " out of range 1.." + getPageCount());
            }
            try {
                PositionedContentStripper stripper = new PositionedContentStripper(pageNumber);
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                stripper.getText(document);

                List<PositionedElement> elements = new ArrayList<>(stripper.getTextSpans());
                elements.addAll(stripper.getImageBlocks());
                logger.debug("{} page {}: {} text spans, {} images", sourceName, pageNumber,
                        stripper.getTextSpans().size(), stripper.getImageBlocks().size());
                return new PageElements(pageNumber, elements);
            } catch (IOException e) {
                throw new DocumentParseException("Failed to read page " + pageNumber + " of " + sourceName
                        + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void close() throws IOException {
            document.close();
        }
    }
}
