package im.arun.pdf2md.config;

import lombok.Data;

@Data
public class ConverterConfig {
    private int shortTextThreshold = 60;
    private int mediumTextThreshold = 100;
    private int concurrencyLimit = 4;
    private String outputDir = "output";
    private String ocrLanguage = "eng";
    private String tessdataPath;
    private String documentTitle = "PDF Document Conversion";
    private String endMarker = "*End of document*";
}
