package im.arun.pdf2md.output;

import im.arun.pdf2md.model.BatchReport;
import im.arun.pdf2md.model.ConversionResult;
import im.arun.pdf2md.model.ErrorKind;
import im.arun.pdf2md.model.ImageArtifact;
import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.model.FileHeader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownBundleWriterTest {

    @TempDir
    Path outputRoot;

    private final MarkdownBundleWriter writer = new MarkdownBundleWriter();
    private BatchReport report;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(outputRoot.resolve("guide"));
        Files.write(outputRoot.resolve("guide/image_p1_1.png"), new byte[]{(byte) 0x89, 'P', 'N', 'G'});

        report = new BatchReport(2);
        report.record(0, ConversionResult.success("guide.pdf", "# Guide\n\n![Image](guide/image_p1_1.png)\n",
                List.of(new ImageArtifact(1, 1, "guide/image_p1_1.png", ""))));
        report.record(1, ConversionResult.failure("broken.pdf", ErrorKind.DOCUMENT_PARSE, "not a PDF", List.of()));
    }

    @Test
    void writesMarkdownForSuccessfulDocumentsOnly() throws Exception {
        List<Path> written = writer.writeMarkdownFiles(report, outputRoot);

        assertEquals(List.of(outputRoot.resolve("guide.md")), written);
        assertEquals("# Guide\n\n![Image](guide/image_p1_1.png)\n", Files.readString(outputRoot.resolve("guide.md")));
        assertFalse(Files.exists(outputRoot.resolve("broken.md")));
    }

    @Test
    void zipContainsMarkdownAndImages() throws Exception {
        Path zip = outputRoot.resolve("bundle/all.zip");

        int bundled = writer.writeZip(report, outputRoot, zip);

        assertEquals(1, bundled);
        List<String> names = new ArrayList<>();
        String markdown;
        try (ZipFile zipFile = new ZipFile(zip.toFile())) {
            for (FileHeader header : zipFile.getFileHeaders()) {
                names.add(header.getFileName());
            }
            try (InputStream in = zipFile.getInputStream(zipFile.getFileHeader("guide.md"))) {
                markdown = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        assertEquals(List.of("guide.md", "guide/image_p1_1.png"), names);
        assertTrue(markdown.contains("![Image](guide/image_p1_1.png)"));
    }

    @Test
    void rewritingZipReplacesPreviousArchive() throws Exception {
        Path zip = outputRoot.resolve("all.zip");

        writer.writeZip(report, outputRoot, zip);
        writer.writeZip(report, outputRoot, zip);

        try (ZipFile zipFile = new ZipFile(zip.toFile())) {
            assertEquals(2, zipFile.getFileHeaders().size());
        }
    }
}
