package im.arun.pdf2md.ocr;

import im.arun.pdf2md.PdfFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.imageio.ImageIO;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImageOcrAdapterTest {

    @Mock
    private OcrEngine engine;

    private ImageOcrAdapter adapter;
    private byte[] png;

    @BeforeEach
    void setUp() throws IOException {
        adapter = new ImageOcrAdapter(engine);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(PdfFixtures.sampleImage(), "png", out);
        png = out.toByteArray();
    }

    @Test
    void trimsRecognizedText() throws Exception {
        when(engine.doOcr(any())).thenReturn("  Hello\nWorld \n\n");

        assertEquals("Hello\nWorld", adapter.recognize(png));
    }

    @Test
    void whitespaceOnlyBecomesEmpty() throws Exception {
        when(engine.doOcr(any())).thenReturn(" \n\t ");

        assertEquals("", adapter.recognize(png));
    }

    @Test
    void nullResultBecomesEmpty() throws Exception {
        when(engine.doOcr(any())).thenReturn(null);

        assertEquals("", adapter.recognize(png));
    }

    @Test
    void recognitionFailureDegradesToEmpty() throws Exception {
        when(engine.doOcr(any())).thenThrow(new ImageRecognitionException("corrupt image"));

        assertEquals("", adapter.recognize(png));
    }

    @Test
    void undecodableBytesSkipTheEngine() throws Exception {
        assertEquals("", adapter.recognize(new byte[]{1, 2, 3, 4}));
        verify(engine, never()).doOcr(any());
    }

    @Test
    void unavailableEnginePropagates() throws Exception {
        when(engine.doOcr(any())).thenThrow(new OcrEngineUnavailableException("no native library"));

        assertThrows(OcrEngineUnavailableException.class, () -> adapter.recognize(png));
    }

    @Test
    void sameImageGivesSameCaption() throws Exception {
        when(engine.doOcr(any())).thenReturn("EXIT");

        assertEquals(adapter.recognize(png), adapter.recognize(png));
    }

    @Test
    void verifyEngineDelegates() {
        doThrow(new OcrEngineUnavailableException("missing eng.traineddata")).when(engine).verifyAvailable();

        assertThrows(OcrEngineUnavailableException.class, () -> adapter.verifyEngine());
    }

    @Test
    void artifactNamesAreDeterministic() {
        assertEquals("image_p3_2.png", ImageOcrAdapter.artifactFileName(3, 2));
        assertEquals(ImageOcrAdapter.artifactFileName(1, 1), ImageOcrAdapter.artifactFileName(1, 1));
    }
}
