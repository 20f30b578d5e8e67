package im.arun.pdf2md.markdown;

import im.arun.pdf2md.config.ConverterConfig;
import im.arun.pdf2md.model.ClassifiedText;
import im.arun.pdf2md.model.ImageArtifact;
import im.arun.pdf2md.model.ImageBlock;
import im.arun.pdf2md.model.PageElements;
import im.arun.pdf2md.model.PositionedElement;
import im.arun.pdf2md.model.TextSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Puts a page's elements into reading order and renders them as Markdown.
 * <p>
 * Reading order is top to bottom by vertical offset only; elements at the same offset keep
 * their extraction order. Output is a pure function of the input, so the same page always
 * renders to the same bytes.
 */
public class MarkdownAssembler {

    static final String PAGE_SEPARATOR = "---";
    static final String IMAGE_CAPTION_PREFIX = "*Image text (OCR):* ";

    private final String documentTitle;
    private final String endMarker;

    public MarkdownAssembler(String documentTitle, String endMarker) {
        this.documentTitle = documentTitle;
        this.endMarker = endMarker;
    }

    public MarkdownAssembler(ConverterConfig config) {
        this(config.getDocumentTitle(), config.getEndMarker());
    }

    /**
     * Render one page, starting with its {@code ## Page N} heading.
     *
     * @param page       the page's elements in extraction order
     * @param classified classification of the page's text spans; spans without an entry are omitted
     * @param artifacts  saved images of the page; images without an artifact are omitted
     */
    public String renderPage(PageElements page, List<ClassifiedText> classified, List<ImageArtifact> artifacts) {
        Map<TextSpan, ClassifiedText> textBySpan = new IdentityHashMap<>();
        for (ClassifiedText text : classified) {
            textBySpan.put(text.getSpan(), text);
        }
        Map<Integer, ImageArtifact> artifactBySequence = new HashMap<>();
        for (ImageArtifact artifact : artifacts) {
            artifactBySequence.put(artifact.getSequenceIndex(), artifact);
        }

        List<PositionedElement> ordered = new ArrayList<>(page.getElements());
        ordered.sort(Comparator.comparingInt(PositionedElement::getExtractionOrder));
        // List.sort is stable, so equal offsets stay in extraction order
        ordered.sort(Comparator.comparingDouble(PositionedElement::getVerticalOffset));

        StringBuilder markdown = new StringBuilder();
        markdown.append("## Page ").append(page.getPageNumber()).append("\n\n");
        for (PositionedElement element : ordered) {
            if (element instanceof TextSpan) {
                ClassifiedText text = textBySpan.get(element);
                if (text != null) {
                    appendText(markdown, text);
                }
            } else if (element instanceof ImageBlock) {
                ImageArtifact artifact = artifactBySequence.get(((ImageBlock) element).getSequenceIndexOnPage());
                if (artifact != null) {
                    appendImage(markdown, artifact);
                }
            }
        }
        return markdown.toString();
    }

    private void appendText(StringBuilder markdown, ClassifiedText text) {
        String content = text.getSpan().getContent().strip();
        if (text.isHeading()) {
            markdown.append("#".repeat(text.getHeadingLevel()))
                    .append(' ')
                    .append(content.replaceAll("\\s*\\n\\s*", " "))
                    .append("\n\n");
        } else {
            markdown.append(content).append("\n\n");
        }
    }

    private void appendImage(StringBuilder markdown, ImageArtifact artifact) {
        markdown.append("![Image](").append(artifact.getRelativePath()).append(")\n\n");
        if (artifact.hasCaption()) {
            markdown.append(IMAGE_CAPTION_PREFIX).append(artifact.getRecognizedText()).append("\n\n");
        }
    }

    /**
     * Join rendered pages into a full document: title, pages separated by rules, a closing rule
     * and the end marker.
     */
    public String assembleDocument(List<String> renderedPages) {
        StringBuilder markdown = new StringBuilder();
        markdown.append("# ").append(documentTitle).append("\n\n");
        for (int i = 0; i < renderedPages.size(); i++) {
            if (i > 0) {
                markdown.append(PAGE_SEPARATOR).append("\n\n");
            }
            markdown.append(renderedPages.get(i));
        }
        markdown.append(PAGE_SEPARATOR).append("\n\n");
        markdown.append(endMarker).append('\n');
        return markdown.toString();
    }
}
