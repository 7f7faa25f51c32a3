package com.specharvest.core.renderer.impl;

import com.specharvest.core.model.Requirement;
import com.specharvest.core.model.Section;
import com.specharvest.core.model.SpecNode;
import com.specharvest.core.model.SpecNodeVisitor;
import com.specharvest.core.model.Specification;
import com.specharvest.core.model.TestCase;
import com.specharvest.core.renderer.RecordField;
import com.specharvest.core.renderer.RecordFields;
import com.specharvest.core.renderer.SpecificationRenderer;

import java.util.List;

/**
 * Renders a specification as Markdown for human review.
 *
 * <p>The document name is the top heading; each section is a heading one deeper than its
 * parent (capped at {@code ######}). Records are bold names followed by a bullet per
 * present field, with multi-line values indented under their bullet.
 */
public class MarkdownSpecificationRenderer implements SpecificationRenderer {

    private static final int MAX_HEADING_DEPTH = 6;
    private static final String CONTINUATION_INDENT = "  ";

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Renderer";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public String getContentType() {
        return "text/markdown";
    }

    @Override
    public String render(Specification specification) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(specification.name()).append("\n\n");
        writeChildren(sb, 1, specification.children());
        return sb.toString();
    }

    private void writeChildren(StringBuilder sb, int depth, List<SpecNode> children) {
        BlockWriter writer = new BlockWriter(sb, depth);
        for (SpecNode child : children) {
            child.accept(writer);
        }
    }

    /**
     * Writes one node as a Markdown block at a fixed heading depth.
     */
    private final class BlockWriter implements SpecNodeVisitor<Void> {

        private final StringBuilder sb;
        private final int depth;

        BlockWriter(StringBuilder sb, int depth) {
            this.sb = sb;
            this.depth = depth;
        }

        @Override
        public Void visitSection(Section section) {
            int headingDepth = Math.min(depth + 1, MAX_HEADING_DEPTH);
            sb.append("#".repeat(headingDepth)).append(' ').append(section.title()).append("\n\n");
            writeChildren(sb, depth + 1, section.children());
            return null;
        }

        @Override
        public Void visitRequirement(Requirement requirement) {
            writeRecord("Requirement", requirement.name(), RecordFields.of(requirement));
            return null;
        }

        @Override
        public Void visitTestCase(TestCase testCase) {
            writeRecord("Test Case", testCase.name(), RecordFields.of(testCase));
            return null;
        }

        private void writeRecord(String kind, String name, List<RecordField> fields) {
            sb.append("**").append(kind).append(":** ").append(name).append("\n\n");
            for (RecordField field : fields) {
                sb.append("- **").append(field.displayName()).append(":** ");
                sb.append(field.value().replace("\n", "\n" + CONTINUATION_INDENT)).append('\n');
            }
            if (!fields.isEmpty()) {
                sb.append('\n');
            }
        }
    }
}
