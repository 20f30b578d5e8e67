package im.arun.pdf2md.service;

import im.arun.pdf2md.PdfFixtures;
import im.arun.pdf2md.config.ConverterConfig;
import im.arun.pdf2md.model.BatchReport;
import im.arun.pdf2md.model.PdfSource;
import im.arun.pdf2md.ocr.OcrEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class Pdf2MarkdownServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void convertsIntoConfiguredOutputDirectory() throws Exception {
        OcrEngine engine = mock(OcrEngine.class);
        when(engine.doOcr(any())).thenReturn("LEGEND");
        ConverterConfig config = new ConverterConfig();
        config.setOutputDir(tempDir.resolve("out").toString());
        config.setConcurrencyLimit(2);
        config.setDocumentTitle("Converted");
        config.setEndMarker("<!-- end -->");

        Pdf2MarkdownService service = new Pdf2MarkdownService(config, engine);
        List<Integer> progress = new ArrayList<>();
        BatchReport report = service.convertAll(List.of(
                new PdfSource("chart.pdf", PdfFixtures.document().page()
                        .text("QUARTERLY RESULTS", 18, true, 72, 740)
                        .image(72, 400, 200, 100)
                        .build())),
                (result, completed, total) -> progress.add(completed));

        assertEquals(List.of(1), progress);
        String markdown = report.getResult(0).getMarkdownText();
        assertTrue(markdown.startsWith("# Converted\n\n## Page 1\n\n# QUARTERLY RESULTS\n\n"));
        assertTrue(markdown.contains("![Image](chart/image_p1_1.png)\n\n*Image text (OCR):* LEGEND\n\n"));
        assertTrue(markdown.endsWith("---\n\n<!-- end -->\n"));
        assertTrue(Files.isRegularFile(service.getOutputRoot().resolve("chart/image_p1_1.png")));
    }
}
