package im.arun.pdf2md.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Results of one batch, indexed by input position. Only the scheduler records results;
 * progress readers may poll from any thread.
 */
public class BatchReport {
    private final ConversionResult[] results;
    private int completedCount;

    public BatchReport(int totalCount) {
        this.results = new ConversionResult[totalCount];
    }

    public synchronized void record(int index, ConversionResult result) {
        if (results[index] != null) {
            throw new IllegalStateException("Result for document " + index + " already recorded");
        }
        results[index] = result;
        completedCount++;
    }

    /**
     * Results in input order. Entries for documents still running are {@code null}.
     */
    public synchronized List<ConversionResult> getResults() {
        return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(results)));
    }

    public synchronized ConversionResult getResult(int index) {
        return results[index];
    }

    public synchronized int getCompletedCount() {
        return completedCount;
    }

    public int getTotalCount() {
        return results.length;
    }

    public synchronized boolean isComplete() {
        return completedCount == results.length;
    }

    public synchronized long getSuccessCount() {
        return Arrays.stream(results).filter(r -> r != null && r.isSuccess()).count();
    }

    public synchronized long getFailureCount() {
        return Arrays.stream(results).filter(r -> r != null && !r.isSuccess()).count();
    }
}
