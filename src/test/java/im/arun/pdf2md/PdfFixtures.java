package im.arun.pdf2md;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds small PDFs in memory for tests. Coordinates are PDF user space (origin bottom-left, US Letter).
 */
public class PdfFixtures {
    public static final float PAGE_HEIGHT = PDRectangle.LETTER.getHeight();

    private final List<List<Op>> pages = new ArrayList<>();

    public static PdfFixtures document() {
        return new PdfFixtures();
    }

    public PdfFixtures page() {
        pages.add(new ArrayList<>());
        return this;
    }

    public PdfFixtures text(String text, float fontSize, boolean bold, float x, float y) {
        current().add((doc, stream) -> {
            PDType1Font font = new PDType1Font(bold
                    ? Standard14Fonts.FontName.HELVETICA_BOLD
                    : Standard14Fonts.FontName.HELVETICA);
            stream.beginText();
            stream.setFont(font, fontSize);
            stream.newLineAtOffset(x, y);
            stream.showText(text);
            stream.endText();
        });
        return this;
    }

    public PdfFixtures image(float x, float y, float width, float height) {
        current().add((doc, stream) -> {
            PDImageXObject image = LosslessFactory.createFromImage(doc, sampleImage());
            stream.drawImage(image, x, y, width, height);
        });
        return this;
    }

    /**
     * Draws one image XObject {@code times} times, each placement {@code step} points below the previous one.
     */
    public PdfFixtures repeatedImage(float x, float y, float width, float height, int times, float step) {
        current().add((doc, stream) -> {
            PDImageXObject image = LosslessFactory.createFromImage(doc, sampleImage());
            for (int i = 0; i < times; i++) {
                stream.drawImage(image, x, y - i * step, width, height);
            }
        });
        return this;
    }

    public byte[] build() throws IOException {
        return build(null);
    }

    public byte[] buildEncrypted(String userPassword) throws IOException {
        return build(userPassword);
    }

    private byte[] build(String userPassword) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (List<Op> ops : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                    for (Op op : ops) {
                        op.apply(document, stream);
                    }
                }
            }
            if (userPassword != null) {
                StandardProtectionPolicy policy =
                        new StandardProtectionPolicy("owner-secret", userPassword, new AccessPermission());
                policy.setEncryptionKeyLength(128);
                document.protect(policy);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    public static byte[] notAPdf() {
        return "this is definitely not a PDF document".getBytes(StandardCharsets.US_ASCII);
    }

    public static BufferedImage sampleImage() {
        BufferedImage image = new BufferedImage(40, 20, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        graphics.setColor(Color.WHITE);
        graphics.fillRect(0, 0, 40, 20);
        graphics.setColor(Color.BLACK);
        graphics.fillRect(5, 5, 30, 10);
        graphics.dispose();
        return image;
    }

    private List<Op> current() {
        if (pages.isEmpty()) {
            page();
        }
        return pages.get(pages.size() - 1);
    }

    @FunctionalInterface
    private interface Op {
        void apply(PDDocument document, PDPageContentStream stream) throws IOException;
    }
}
