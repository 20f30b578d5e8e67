package im.arun.pdf2md.cli;

import im.arun.pdf2md.config.ConfigLoader;
import im.arun.pdf2md.config.ConverterConfig;
import im.arun.pdf2md.model.BatchReport;
import im.arun.pdf2md.model.ConversionResult;
import im.arun.pdf2md.model.PdfSource;
import im.arun.pdf2md.ocr.OcrEngineUnavailableException;
import im.arun.pdf2md.output.MarkdownBundleWriter;
import im.arun.pdf2md.service.Pdf2MarkdownService;
import im.arun.pdf2md.util.JsonLogger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command-line interface: converts PDF files (or every PDF in the given directories) to Markdown.
 * Exit code 0 when every document converted, 1 when any failed, 2 when OCR is unavailable.
 */
@Command(
    name = "pdf2md",
    description = "Convert PDF documents to Markdown, running OCR only on embedded images",
    mixinStandardHelpOptions = true,
    version = "pdf2md 1.0"
)
public class Pdf2MarkdownCLI implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "PDF", description = "PDF files or directories containing PDFs")
    private List<File> inputs = new ArrayList<>();

    @Option(names = {"-o", "--output-dir"}, description = "Directory for Markdown files and images (default: from config)")
    private String outputDir;

    @Option(names = {"-c", "--concurrency"}, description = "Number of documents converted in parallel (default: from config)")
    private Integer concurrency;

    @Option(names = {"--language"}, description = "Tesseract language, e.g. eng or eng+deu")
    private String language;

    @Option(names = {"--tessdata"}, description = "Tesseract tessdata directory (or set TESSDATA_PREFIX)")
    private String tessdata;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--zip"}, description = "Also bundle all Markdown files and images into this ZIP file")
    private File zipFile;

    @Option(names = {"--no-markdown-files"}, description = "Do not write <name>.md files to the output directory")
    private boolean noMarkdownFiles;

    @Override
    public Integer call() throws Exception {
        List<Path> pdfPaths = collectPdfs();
        if (pdfPaths.isEmpty()) {
            System.err.println("Error: no PDF files found in " + inputs);
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        overrides.put("outputDir", outputDir);
        overrides.put("concurrencyLimit", concurrency);
        overrides.put("ocrLanguage", language);
        overrides.put("tessdataPath", tessdata);
        ConverterConfig config = new ConfigLoader(configPath).load(overrides);

        List<PdfSource> documents = new ArrayList<>();
        for (Path pdfPath : pdfPaths) {
            documents.add(PdfSource.fromFile(pdfPath));
        }

        System.out.println("pdf2md - PDF to Markdown with image OCR");
        System.out.println("=".repeat(50));
        System.out.println("Documents: " + documents.size());
        System.out.println("Output:    " + config.getOutputDir());
        System.out.println("Workers:   " + config.getConcurrencyLimit());
        System.out.println();

        Pdf2MarkdownService service = new Pdf2MarkdownService(config);
        JsonLogger journal = new JsonLogger(service.getOutputRoot().resolve("logs"), "batch");

        BatchReport report;
        try {
            report = service.convertAll(documents, (result, completed, total) -> {
                journal.result(result);
                System.out.printf("Processing: %d/%d files completed%n", completed, total);
            });
        } catch (OcrEngineUnavailableException e) {
            journal.error("OCR engine unavailable", Map.of("reason", String.valueOf(e.getMessage())));
            System.err.println("Error: OCR engine unavailable: " + e.getMessage());
            return 2;
        }

        printSummary(report);
        writeOutputs(report, service.getOutputRoot());

        return report.getFailureCount() == 0 ? 0 : 1;
    }

    private List<Path> collectPdfs() throws IOException {
        List<Path> pdfs = new ArrayList<>();
        for (File input : inputs) {
            Path path = input.toPath();
            if (Files.isDirectory(path)) {
                try (Stream<Path> children = Files.list(path)) {
                    pdfs.addAll(children
                            .filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().toLowerCase().endsWith(".pdf"))
                            .sorted()
                            .collect(Collectors.toList()));
                }
            } else if (Files.isRegularFile(path)) {
                pdfs.add(path);
            } else {
                System.err.println("Warning: skipping missing input " + path);
            }
        }
        return pdfs;
    }

    private void printSummary(BatchReport report) {
        System.out.println();
        if (report.getSuccessCount() > 0) {
            System.out.println("Successfully converted " + report.getSuccessCount() + " file(s)");
        }
        if (report.getFailureCount() > 0) {
            System.out.println("Failed to convert " + report.getFailureCount() + " file(s)");
        }
        for (ConversionResult result : report.getResults()) {
            if (result.isSuccess()) {
                System.out.printf("  OK    %s (%d images)%n", result.getSourceName(), result.getArtifacts().size());
            } else {
                System.out.printf("  FAIL  %s: %s%n", result.getSourceName(), result.getError().getMessage());
            }
        }
    }

    private void writeOutputs(BatchReport report, Path outputRoot) throws IOException {
        MarkdownBundleWriter writer = new MarkdownBundleWriter();
        if (!noMarkdownFiles) {
            writer.writeMarkdownFiles(report, outputRoot);
        }
        if (zipFile != null && report.getSuccessCount() > 0) {
            int bundled = writer.writeZip(report, outputRoot, zipFile.toPath());
            System.out.println("\nZIP written to: " + zipFile + " (" + bundled + " documents)");
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Pdf2MarkdownCLI()).execute(args);
        System.exit(exitCode);
    }
}
