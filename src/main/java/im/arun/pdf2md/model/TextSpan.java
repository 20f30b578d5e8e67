package im.arun.pdf2md.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A block of native PDF text. Multi-line blocks keep their line breaks in {@code content}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TextSpan implements PositionedElement {
    private int pageNumber;
    private float verticalOffset;
    private float horizontalOffset;
    private String content;
    private float fontSize;
    private boolean bold;
    private int extractionOrder;
}
