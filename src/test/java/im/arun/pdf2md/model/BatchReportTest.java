package im.arun.pdf2md.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchReportTest {

    @Test
    void tracksProgressByIndex() {
        BatchReport report = new BatchReport(3);

        report.record(2, ConversionResult.success("c.pdf", "# c\n", List.of()));

        assertEquals(1, report.getCompletedCount());
        assertFalse(report.isComplete());
        assertNull(report.getResults().get(0));
        assertEquals("c.pdf", report.getResult(2).getSourceName());

        report.record(0, ConversionResult.failure("a.pdf", ErrorKind.DOCUMENT_PARSE, "bad", List.of()));
        report.record(1, ConversionResult.success("b.pdf", "# b\n", List.of()));

        assertTrue(report.isComplete());
        assertEquals(2, report.getSuccessCount());
        assertEquals(1, report.getFailureCount());
    }

    @Test
    void resultCannotBeRecordedTwice() {
        BatchReport report = new BatchReport(1);
        report.record(0, ConversionResult.success("a.pdf", "# a\n", List.of()));

        assertThrows(IllegalStateException.class,
                () -> report.record(0, ConversionResult.success("a.pdf", "# a\n", List.of())));
    }

    @Test
    void resultsViewIsReadOnly() {
        BatchReport report = new BatchReport(1);

        assertThrows(UnsupportedOperationException.class, () -> report.getResults().clear());
    }
}
