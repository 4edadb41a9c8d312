package com.gamewright.core.model;

/**
 * The part an input document plays in a generation request.
 */
public enum DocumentRole {
    SOURCE("Source Document"),
    GUIDELINE("Prompting Document"),
    SPECIFICATION("Game Specification");

    private final String label;

    DocumentRole(String label) {
        this.label = label;
    }

    /** Heading label used when the document is rendered into a prompt. */
    public String label() {
        return label;
    }
}
