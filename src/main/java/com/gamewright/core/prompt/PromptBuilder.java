package com.gamewright.core.prompt;

import com.gamewright.core.model.DocumentRole;
import com.gamewright.core.model.PromptDocument;
import com.gamewright.core.model.TaskKind;

import java.util.List;

/**
 * Renders the generation prompt for a task kind from an ordered list of documents.
 * Pure function with no I/O and no clock. Identical inputs give
 * byte-identical output.
 */
public final class PromptBuilder {

    static final String BLOCK_SEPARATOR = "\n\n---\n\n";

    static final String DESIGNER_INSTRUCTION =
            "You are an expert game designer specializing in educational gamification. "
            + "You create engaging, pedagogically sound game specifications that transform "
            + "academic content into interactive learning experiences.";

    static final String DEVELOPER_INSTRUCTION =
            "You are an expert SOLUZION game developer. You create complete, functional game "
            + "implementations based on specifications, with clean code and clear documentation.";

    private static final String SPEC_TASK = """
            # Task

            Based on the source documents and following the guidelines in the prompting documents, \
            create a detailed game specification in Markdown format. The specification should include:

            1. **Game Overview**: Summary of the game concept and learning objectives
            2. **Game Mechanics**: Detailed description of how the game works
            3. **Content Integration**: How source document content is integrated into gameplay
            4. **Player Experience**: Expected player interactions and progression
            5. **Technical Requirements**: Any technical specifications needed for implementation
            6. **Success Criteria**: How to measure if the game achieves its objectives

            Please provide a complete, well-structured game specification document.""";

    private static final String IMPLEMENTATION_TASK = """
            # Task

            Based on the game specification(s) above, create a complete SOLUZION game implementation.

            Please provide all necessary files for a working SOLUZION game, including:
            1. Main game logic files
            2. Content/data files
            3. Configuration files
            4. Any supporting assets or resources
            5. README with setup and usage instructions

            Format your response as a structured set of files that can be packaged into a zip archive.""";

    private PromptBuilder() {}

    public static BuiltPrompt build(List<PromptDocument> documents, TaskKind taskKind, String projectName) {
        return switch (taskKind) {
            case SPEC_GENERATION -> new BuiltPrompt(
                    buildSpecificationPrompt(documents, projectName), DESIGNER_INSTRUCTION);
            case IMPLEMENTATION_GENERATION -> new BuiltPrompt(
                    buildImplementationPrompt(documents, projectName), DEVELOPER_INSTRUCTION);
        };
    }

    static String buildSpecificationPrompt(List<PromptDocument> documents, String projectName) {
        var sources = withRole(documents, DocumentRole.SOURCE);
        var guidelines = withRole(documents, DocumentRole.GUIDELINE);

        var sb = new StringBuilder();
        sb.append("You are tasked with creating a game specification for the project \"")
                .append(projectName).append("\".\n\n");

        if (anyAttached(documents)) {
            sb.append("The files attached to this request include:\n");
            sb.append("- Source documents (").append(sources.size())
                    .append(" files): These provide the context and content for the game\n");
            sb.append("- Prompting/Guideline documents (").append(guidelines.size())
                    .append(" files): These provide guidelines and instructions\n\n");
        }

        sb.append("# Source Documents\n\n");
        sb.append("The following source documents provide the context and content for the game:\n\n");
        sb.append(renderGroup(sources)).append("\n\n");

        sb.append("# Prompting/Guideline Documents\n\n");
        sb.append("The following documents provide guidelines and instructions for creating the game specification:\n\n");
        sb.append(renderGroup(guidelines)).append("\n\n");

        sb.append(SPEC_TASK);
        return sb.toString();
    }

    static String buildImplementationPrompt(List<PromptDocument> documents, String projectName) {
        var specifications = withRole(documents, DocumentRole.SPECIFICATION);

        var sb = new StringBuilder();
        sb.append("You are tasked with implementing a SOLUZION game for the project \"")
                .append(projectName).append("\".\n\n");

        if (anyAttached(documents)) {
            sb.append("The attached files contain game specification(s) that describe the game to be implemented.\n\n");
        }

        sb.append("# Game Specifications\n\n");
        sb.append(renderGroup(specifications)).append("\n\n");

        sb.append(IMPLEMENTATION_TASK);
        return sb.toString();
    }

    private static String renderGroup(List<PromptDocument> group) {
        if (group.isEmpty()) {
            return "_None provided._";
        }
        var blocks = group.stream().map(PromptBuilder::renderBlock).toList();
        return String.join(BLOCK_SEPARATOR, blocks);
    }

    private static String renderBlock(PromptDocument doc) {
        if (doc.isAttached()) {
            return doc.heading() + "\n\n_Provided as an attached file._";
        }
        return doc.heading() + "\n\n" + doc.content();
    }

    // input order is preserved; never resorted
    private static List<PromptDocument> withRole(List<PromptDocument> documents, DocumentRole role) {
        return documents.stream().filter(d -> d.role() == role).toList();
    }

    private static boolean anyAttached(List<PromptDocument> documents) {
        return documents.stream().anyMatch(PromptDocument::isAttached);
    }
}
