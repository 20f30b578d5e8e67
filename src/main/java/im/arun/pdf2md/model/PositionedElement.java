package im.arun.pdf2md.model;

/**
 * Content placed on a PDF page. The vertical offset is the top of the element's
 * bounding box measured downwards from the top of the page, and is the only key
 * used to put a page into reading order. Columns are not detected, so multi-column
 * pages interleave.
 */
public interface PositionedElement {

    /** 1-based page the element was found on. */
    int getPageNumber();

    float getVerticalOffset();

    /** Position in the page's extraction sequence, used to break vertical ties. */
    int getExtractionOrder();
}
