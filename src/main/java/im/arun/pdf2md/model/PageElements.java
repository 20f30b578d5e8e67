package im.arun.pdf2md.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything extracted from one page, in extraction order (not reading order).
 */
@Data
@AllArgsConstructor
public class PageElements {
    private int pageNumber;
    private List<PositionedElement> elements;

    public List<TextSpan> getTextSpans() {
        return elements.stream()
                .filter(TextSpan.class::isInstance)
                .map(TextSpan.class::cast)
                .collect(Collectors.toList());
    }

    public List<ImageBlock> getImageBlocks() {
        return elements.stream()
                .filter(ImageBlock.class::isInstance)
                .map(ImageBlock.class::cast)
                .collect(Collectors.toList());
    }
}
