package im.arun.pdf2md.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of converting one document. A successful result carries Markdown and no error;
 * a failed one carries an error and no Markdown. Artifacts written before a failure are kept
 * so callers can report what was produced.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversionResult {
    private String sourceName;
    private String markdownText;
    private List<ImageArtifact> artifacts = new ArrayList<>();
    private ErrorRecord error;

    public static ConversionResult success(String sourceName, String markdownText, List<ImageArtifact> artifacts) {
        return new ConversionResult(sourceName, markdownText, new ArrayList<>(artifacts), null);
    }

    public static ConversionResult failure(String sourceName, ErrorKind kind, String message,
                                           List<ImageArtifact> artifacts) {
        return new ConversionResult(sourceName, null, new ArrayList<>(artifacts), new ErrorRecord(kind, message));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
