package im.arun.pdf2md.service;

import im.arun.pdf2md.model.ConversionResult;

/**
 * Notified on the scheduler's coordinating thread each time a document finishes, successfully or not.
 */
@FunctionalInterface
public interface BatchProgressListener {

    void onDocumentCompleted(ConversionResult result, int completedCount, int totalCount);
}
