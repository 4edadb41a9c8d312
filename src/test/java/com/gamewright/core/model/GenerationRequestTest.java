package com.gamewright.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenerationRequestTest {

    private static InputDocument doc(String name, DocumentRole role) {
        return new InputDocument(Path.of("docs", name), null, null, role);
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("generates a request id when none is given")
        void generatesRequestId() {
            var request = new GenerationRequest(List.of(doc("a.md", DocumentRole.SOURCE)),
                    TaskKind.SPEC_GENERATION, "Chem", Path.of("out"));
            assertNotNull(request.requestId());
            assertFalse(request.requestId().isBlank());
        }

        @Test
        @DisplayName("two requests get distinct ids")
        void distinctIds() {
            var docs = List.of(doc("a.md", DocumentRole.SOURCE));
            var first = new GenerationRequest(docs, TaskKind.SPEC_GENERATION, "Chem", Path.of("out"));
            var second = new GenerationRequest(docs, TaskKind.SPEC_GENERATION, "Chem", Path.of("out"));
            assertNotEquals(first.requestId(), second.requestId());
        }

        @Test
        @DisplayName("copies the document list")
        void copiesDocuments() {
            var docs = new ArrayList<InputDocument>();
            docs.add(doc("a.md", DocumentRole.SOURCE));
            var request = new GenerationRequest("r1", docs, TaskKind.SPEC_GENERATION, "Chem", Path.of("out"));
            docs.add(doc("b.md", DocumentRole.SOURCE));

            assertEquals(1, request.documents().size());
            assertThrows(UnsupportedOperationException.class,
                    () -> request.documents().add(doc("c.md", DocumentRole.SOURCE)));
        }

        @Test
        @DisplayName("defaults display name and content type")
        void documentDefaults() {
            var document = doc("notes.pdf", DocumentRole.SOURCE);
            assertEquals("notes.pdf", document.displayName());
            assertEquals("application/octet-stream", document.contentType());
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("spec generation needs at least one source")
        void specNeedsSource() {
            var docs = List.of(doc("guide.md", DocumentRole.GUIDELINE));
            assertThrows(IllegalArgumentException.class,
                    () -> new GenerationRequest(docs, TaskKind.SPEC_GENERATION, "Chem", Path.of("out")));
        }

        @Test
        @DisplayName("implementation rejects source documents")
        void implementationRejectsSources() {
            var docs = List.of(doc("a.md", DocumentRole.SOURCE));
            assertThrows(IllegalArgumentException.class,
                    () -> new GenerationRequest(docs, TaskKind.IMPLEMENTATION_GENERATION, "Chem", Path.of("out")));
        }

        @Test
        @DisplayName("empty documents, blank project and missing directory are rejected")
        void requiredFields() {
            var docs = List.of(doc("a.md", DocumentRole.SOURCE));
            assertThrows(IllegalArgumentException.class,
                    () -> new GenerationRequest(List.of(), TaskKind.SPEC_GENERATION, "Chem", Path.of("out")));
            assertThrows(IllegalArgumentException.class,
                    () -> new GenerationRequest(docs, TaskKind.SPEC_GENERATION, " ", Path.of("out")));
            assertThrows(IllegalArgumentException.class,
                    () -> new GenerationRequest(docs, TaskKind.SPEC_GENERATION, "Chem", null));
        }
    }

    @Test
    @DisplayName("documentsWithRole keeps input order")
    void documentsWithRole() {
        var request = new GenerationRequest(List.of(
                doc("s1.md", DocumentRole.SOURCE),
                doc("g1.md", DocumentRole.GUIDELINE),
                doc("s2.md", DocumentRole.SOURCE)),
                TaskKind.SPEC_GENERATION, "Chem", Path.of("out"));

        var sources = request.documentsWithRole(DocumentRole.SOURCE);
        assertEquals(List.of("s1.md", "s2.md"), sources.stream().map(InputDocument::displayName).toList());
    }
}
