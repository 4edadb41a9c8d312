package com.gamewright.core.model;

/**
 * What a generation request produces.
 */
public enum TaskKind {
    SPEC_GENERATION("spec", "md"),
    IMPLEMENTATION_GENERATION("game", "txt");

    private final String fileTag;
    private final String extension;

    TaskKind(String fileTag, String extension) {
        this.fileTag = fileTag;
        this.extension = extension;
    }

    public String fileTag() {
        return fileTag;
    }

    public String extension() {
        return extension;
    }

    public boolean accepts(DocumentRole role) {
        return switch (this) {
            case SPEC_GENERATION -> role == DocumentRole.SOURCE || role == DocumentRole.GUIDELINE;
            case IMPLEMENTATION_GENERATION -> role == DocumentRole.SPECIFICATION;
        };
    }
}
