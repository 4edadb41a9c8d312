package com.gamewright.core.model;

/**
 * A labeled block rendered into a prompt as {@code ### <Kind>: <name>} followed by the
 * content. A {@code null} content means the document travels as an attached file.
 */
public record PromptDocument(DocumentRole role, String name, String content) {

    public static PromptDocument inline(DocumentRole role, String name, String content) {
        return new PromptDocument(role, name, content == null ? "" : content);
    }

    public static PromptDocument attached(DocumentRole role, String name) {
        return new PromptDocument(role, name, null);
    }

    public String heading() {
        return "### " + role.label() + ": " + name;
    }

    public boolean isAttached() {
        return content == null;
    }
}
