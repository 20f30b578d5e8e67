package im.arun.pdf2md.service;

import im.arun.pdf2md.model.BatchReport;
import im.arun.pdf2md.model.ConversionResult;
import im.arun.pdf2md.model.ErrorKind;
import im.arun.pdf2md.model.PdfSource;
import im.arun.pdf2md.ocr.ImageOcrAdapter;
import im.arun.pdf2md.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Converts a batch of PDFs on a bounded worker pool.
 * <p>
 * Workers only return results; the calling thread records each one into the {@link BatchReport}
 * at the document's input index as it completes, so results keep input order whatever the
 * completion order. A failed document never stops the others.
 */
public class BatchScheduler {
    private static final Logger logger = LoggerFactory.getLogger(BatchScheduler.class);

    public static final int DEFAULT_CONCURRENCY = 4;

    private final DocumentConverter converter;
    private final ImageOcrAdapter ocrAdapter;

    public BatchScheduler(DocumentConverter converter, ImageOcrAdapter ocrAdapter) {
        this.converter = converter;
        this.ocrAdapter = ocrAdapter;
    }

    public BatchReport run(List<PdfSource> documents, Path outputRoot) {
        return run(documents, DEFAULT_CONCURRENCY, outputRoot, null);
    }

    public BatchReport run(List<PdfSource> documents, int concurrencyLimit, Path outputRoot) {
        return run(documents, concurrencyLimit, outputRoot, null);
    }

    /**
     * Convert every document and block until all of them have a result.
     *
     * @param listener optional, called after each document finishes
     * @throws im.arun.pdf2md.ocr.OcrEngineUnavailableException before any document starts, if OCR cannot run
     */
    public BatchReport run(List<PdfSource> documents, int concurrencyLimit, Path outputRoot,
                           BatchProgressListener listener) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1, got " + concurrencyLimit);
        }

        // every document would fail the same way, so check once up front
        ocrAdapter.verifyEngine();

        BatchReport report = new BatchReport(documents.size());
        if (documents.isEmpty()) {
            return report;
        }

        int poolSize = Math.min(concurrencyLimit, documents.size());
        logger.info("Converting {} documents with {} workers into {}", documents.size(), poolSize, outputRoot);
        ExecutorService executor = ExecutorProvider.newWorkerPool(poolSize);
        try {
            CompletionService<ConversionResult> completionService = new ExecutorCompletionService<>(executor);
            Map<Future<ConversionResult>, Integer> indexByFuture = new HashMap<>();
            for (int i = 0; i < documents.size(); i++) {
                PdfSource source = documents.get(i);
                Future<ConversionResult> future = completionService.submit(
                        () -> converter.convert(source.getBytes(), source.getName(), outputRoot));
                indexByFuture.put(future, i);
            }

            for (int done = 0; done < documents.size(); done++) {
                Future<ConversionResult> future = completionService.take();
                int index = indexByFuture.get(future);
                ConversionResult result = resultOf(future, documents.get(index).getName());
                report.record(index, result);
                notifyListener(listener, result, report);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for conversions", e);
        } finally {
            executor.shutdown();
        }

        logger.info("Batch finished: {} succeeded, {} failed", report.getSuccessCount(), report.getFailureCount());
        return report;
    }

    private ConversionResult resultOf(Future<ConversionResult> future, String sourceName)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Worker failed on {}", sourceName, cause);
            return ConversionResult.failure(sourceName, ErrorKind.UNEXPECTED, String.valueOf(cause), List.of());
        }
    }

    private void notifyListener(BatchProgressListener listener, ConversionResult result, BatchReport report) {
        if (listener == null) {
            return;
        }
        try {
            listener.onDocumentCompleted(result, report.getCompletedCount(), report.getTotalCount());
        } catch (RuntimeException e) {
            logger.warn("Progress listener failed: {}", e.getMessage());
        }
    }
}
