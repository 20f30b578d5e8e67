package im.arun.pdf2md.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A text span with its heading level: 0 for a paragraph, 1 or 2 for headings.
 */
@Data
@AllArgsConstructor
public class ClassifiedText {
    private TextSpan span;
    private int headingLevel;

    public boolean isHeading() {
        return headingLevel > 0;
    }
}
