package im.arun.pdf2md.output;

import im.arun.pdf2md.model.BatchReport;
import im.arun.pdf2md.model.ConversionResult;
import im.arun.pdf2md.model.ImageArtifact;
import im.arun.pdf2md.service.DocumentConverter;
import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.model.ZipParameters;
import net.lingala.zip4j.model.enums.CompressionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Packages successful conversions: one {@code <stem>.md} per document at the output root, optionally
 * bundled into a ZIP together with each document's image folder. Failed documents are skipped.
 */
public class MarkdownBundleWriter {
    private static final Logger logger = LoggerFactory.getLogger(MarkdownBundleWriter.class);

    /**
     * @return paths of the Markdown files written
     */
    public List<Path> writeMarkdownFiles(BatchReport report, Path outputRoot) throws IOException {
        Files.createDirectories(outputRoot);
        List<Path> written = new ArrayList<>();
        for (ConversionResult result : report.getResults()) {
            if (result == null || !result.isSuccess()) {
                continue;
            }
            Path target = outputRoot.resolve(markdownFileName(result));
            Files.writeString(target, result.getMarkdownText(), StandardCharsets.UTF_8);
            written.add(target);
        }
        logger.info("Wrote {} Markdown files to {}", written.size(), outputRoot);
        return written;
    }

    /**
     * Write a ZIP with {@code <stem>.md} and {@code <stem>/image_*.png} entries for each successful document.
     * An existing file at {@code zipPath} is replaced.
     *
     * @return number of documents bundled
     */
    public int writeZip(BatchReport report, Path outputRoot, Path zipPath) throws IOException {
        if (zipPath.getParent() != null) {
            Files.createDirectories(zipPath.getParent());
        }
        // zip4j appends to an existing archive
        Files.deleteIfExists(zipPath);

        int bundled = 0;
        try (ZipFile zipFile = new ZipFile(zipPath.toFile())) {
            for (ConversionResult result : report.getResults()) {
                if (result == null || !result.isSuccess()) {
                    continue;
                }
                byte[] markdown = result.getMarkdownText().getBytes(StandardCharsets.UTF_8);
                try (InputStream in = new ByteArrayInputStream(markdown)) {
                    zipFile.addStream(in, deflated(markdownFileName(result)));
                }

                for (ImageArtifact artifact : result.getArtifacts()) {
                    zipFile.addFile(outputRoot.resolve(artifact.getRelativePath()).toFile(),
                            deflated(artifact.getRelativePath()));
                }
                bundled++;
            }
        }
        logger.info("Bundled {} documents into {}", bundled, zipPath);
        return bundled;
    }

    private static ZipParameters deflated(String fileNameInZip) {
        ZipParameters parameters = new ZipParameters();
        parameters.setCompressionMethod(CompressionMethod.DEFLATE);
        parameters.setFileNameInZip(fileNameInZip);
        return parameters;
    }

    static String markdownFileName(ConversionResult result) {
        return DocumentConverter.documentStem(result.getSourceName()) + ".md";
    }
}
