package im.arun.pdf2md.model;

public enum ErrorKind {
    DOCUMENT_PARSE,
    OCR_ENGINE_UNAVAILABLE,
    ARTIFACT_WRITE,
    UNEXPECTED
}
