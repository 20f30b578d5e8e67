package im.arun.pdf2md.service;

import java.io.IOException;

/**
 * An extracted image could not be saved. Fatal for its document, since the Markdown would
 * otherwise reference a missing file.
 */
public class ArtifactWriteException extends IOException {

    public ArtifactWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
