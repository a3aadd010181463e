package com.mypodcasts.exceptions;

/**
 * Thrown when a footnote pointer has no matching definition line.
 */
public class DanglingFootnoteException extends EmailProcessingException {

    /**
     * Missing footnote number.
     */
    private final String footnoteId;

    /**
     * Constructs a new DanglingFootnoteException.
     *
     * @param footnoteId Missing footnote number.
     */
    public DanglingFootnoteException(String footnoteId) {
        super("Footnote " + footnoteId + " not found.");
        this.footnoteId = footnoteId;
    }

    /**
     * Gets the missing footnote number.
     *
     * @return Digit string, e.g. <i>3</i>.
     */
    public String getFootnoteId() {
        return footnoteId;
    }
}
