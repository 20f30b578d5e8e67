package im.arun.pdf2md.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An embedded raster image, already re-encoded as PNG.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageBlock implements PositionedElement {
    private int pageNumber;
    private float verticalOffset;
    private byte[] imageBytes;
    /** 1-based index among the images of the same page, in drawing order. */
    private int sequenceIndexOnPage;
    private int extractionOrder;
}
