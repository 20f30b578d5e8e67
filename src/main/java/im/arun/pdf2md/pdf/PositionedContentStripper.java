package im.arun.pdf2md.pdf;

import im.arun.pdf2md.model.ImageBlock;
import im.arun.pdf2md.model.TextSpan;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.apache.pdfbox.util.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Text stripper for a single page that keeps geometry instead of writing plain text.
 * Lines are grouped into blocks on paragraph breaks, on font size changes and on large
 * vertical gaps; image draw operators are intercepted to capture embedded rasters with
 * their placement. An image drawn more than once on the page is captured at its first placement only.
 */
class PositionedContentStripper extends PDFTextStripper {
    private static final Logger logger = LoggerFactory.getLogger(PositionedContentStripper.class);

    private static final float FONT_SIZE_TOLERANCE = 1.0f;
    private static final float MAX_LINE_GAP_FACTOR = 2.0f;

    private final int pageNumber;
    private final List<TextSpan> textSpans = new ArrayList<>();
    private final List<PendingImage> pendingImages = new ArrayList<>();
    private final Set<COSBase> capturedImages = Collections.newSetFromMap(new IdentityHashMap<>());

    // current line
    private final StringBuilder lineText = new StringBuilder();
    private float lineTop;
    private float lineLeft;
    private float lineFontSize;
    private boolean lineBold;

    // current block
    private final StringBuilder blockText = new StringBuilder();
    private float blockTop;
    private float blockLeft;
    private float blockFontSize;
    private boolean blockBold;
    private float blockLastLineTop;

    PositionedContentStripper(int pageNumber) throws IOException {
        super();
        this.pageNumber = pageNumber;
        setSortByPosition(false);
    }

    List<TextSpan> getTextSpans() {
        return textSpans;
    }

    /**
     * Images come after all text spans in extraction order.
     */
    List<ImageBlock> getImageBlocks() {
        List<ImageBlock> blocks = new ArrayList<>(pendingImages.size());
        int order = textSpans.size();
        for (int i = 0; i < pendingImages.size(); i++) {
            PendingImage image = pendingImages.get(i);
            blocks.add(new ImageBlock(pageNumber, image.top, image.pngBytes, i + 1, order++));
        }
        return blocks;
    }

    @Override
    protected void processOperator(Operator operator, List<COSBase> operands) throws IOException {
        if (OperatorName.DRAW_OBJECT.equals(operator.getName()) && !operands.isEmpty()
                && operands.get(0) instanceof COSName) {
            PDResources resources = getResources();
            PDXObject xobject = resources == null ? null : resources.getXObject((COSName) operands.get(0));
            if (xobject instanceof PDImageXObject) {
                captureImage((PDImageXObject) xobject, (COSName) operands.get(0));
                return;
            }
        }
        super.processOperator(operator, operands);
    }

    private void captureImage(PDImageXObject image, COSName name) {
        if (!capturedImages.add(image.getCOSObject())) {
            logger.debug("Page {}: image {} already captured, ignoring repeated draw", pageNumber, name.getName());
            return;
        }
        Matrix ctm = getGraphicsState().getCurrentTransformationMatrix();
        PDRectangle cropBox = getCurrentPage().getCropBox();
        float top = cropBox.getUpperRightY() - (ctm.getTranslateY() + ctm.getScalingFactorY());
        try {
            BufferedImage bufferedImage = image.getImage();
            if (bufferedImage == null) {
                logger.warn("Page {}: image {} could not be decoded, skipping", pageNumber, name.getName());
                return;
            }
            byte[] png = encodePng(bufferedImage);
            if (png == null) {
                logger.warn("Page {}: image {} has no PNG encoding, skipping", pageNumber, name.getName());
                return;
            }
            pendingImages.add(new PendingImage(top, png));
        } catch (IOException e) {
            logger.warn("Page {}: image {} could not be decoded, skipping: {}", pageNumber, name.getName(),
                    e.getMessage());
        }
    }

    /**
     * @return PNG bytes, or {@code null} when no PNG writer accepts the image's sample layout
     */
    static byte[] encodePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", png)) {
            return null;
        }
        return png.toByteArray();
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) {
        if (textPositions == null || textPositions.isEmpty()) {
            return;
        }
        if (lineText.length() == 0) {
            TextPosition first = textPositions.get(0);
            lineTop = first.getYDirAdj() - first.getHeightDir();
            lineLeft = first.getXDirAdj();
            lineFontSize = 0;
            lineBold = false;
        }
        lineText.append(text);
        for (TextPosition position : textPositions) {
            lineFontSize = Math.max(lineFontSize, position.getFontSizeInPt());
            if (!lineBold && isBold(position)) {
                lineBold = true;
            }
        }
    }

    private static boolean isBold(TextPosition position) {
        if (position.getFont() == null || position.getFont().getName() == null) {
            return false;
        }
        String fontName = position.getFont().getName().toLowerCase();
        return fontName.contains("bold") || fontName.contains("black");
    }

    @Override
    protected void writeWordSeparator() {
        if (lineText.length() > 0) {
            lineText.append(' ');
        }
    }

    @Override
    protected void writeLineSeparator() {
        finishLine();
    }

    @Override
    protected void writeParagraphStart() {
        finishLine();
        flushBlock();
    }

    @Override
    protected void writeParagraphEnd() {
        finishLine();
        flushBlock();
    }

    @Override
    protected void writePageEnd() {
        finishLine();
        flushBlock();
    }

    private void finishLine() {
        String line = lineText.toString().replaceAll("[ \\t]+", " ").strip();
        lineText.setLength(0);
        if (line.isEmpty()) {
            return;
        }
        if (blockText.length() > 0 && startsNewBlock()) {
            flushBlock();
        }
        if (blockText.length() == 0) {
            blockTop = lineTop;
            blockLeft = lineLeft;
            blockFontSize = lineFontSize;
            blockBold = lineBold;
        } else {
            blockText.append('\n');
            blockLeft = Math.min(blockLeft, lineLeft);
        }
        blockText.append(line);
        blockLastLineTop = lineTop;
    }

    private boolean startsNewBlock() {
        if (Math.abs(lineFontSize - blockFontSize) > FONT_SIZE_TOLERANCE) {
            return true;
        }
        if (lineBold != blockBold) {
            return true;
        }
        float gap = lineTop - blockLastLineTop;
        return gap < 0 || gap > Math.max(blockFontSize, 1f) * MAX_LINE_GAP_FACTOR;
    }

    private void flushBlock() {
        String content = blockText.toString().strip();
        blockText.setLength(0);
        if (content.isEmpty()) {
            return;
        }
        textSpans.add(new TextSpan(pageNumber, blockTop, blockLeft, content, blockFontSize, blockBold,
                textSpans.size()));
    }

    private static class PendingImage {
        final float top;
        final byte[] pngBytes;

        PendingImage(float top, byte[] pngBytes) {
            this.top = top;
            this.pngBytes = pngBytes;
        }
    }
}
