package im.arun.pdf2md.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An image that has been written to disk, with the text OCR found in it.
 * {@code relativePath} is relative to the output root, e.g. {@code report/image_p2_1.png}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageArtifact {

    @JsonProperty("page")
    private int pageNumber;

    @JsonProperty("sequence")
    private int sequenceIndex;

    @JsonProperty("relative_path")
    private String relativePath;

    @JsonProperty("recognized_text")
    private String recognizedText;

    @JsonIgnore
    public boolean hasCaption() {
        return recognizedText != null && !recognizedText.isEmpty();
    }
}
