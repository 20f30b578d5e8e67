package im.arun.pdf2md.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A named PDF byte stream handed to the converter.
 */
@Data
@AllArgsConstructor
public class PdfSource {
    private String name;
    private byte[] bytes;

    public static PdfSource fromFile(Path path) throws IOException {
        return new PdfSource(path.getFileName().toString(), Files.readAllBytes(path));
    }
}
