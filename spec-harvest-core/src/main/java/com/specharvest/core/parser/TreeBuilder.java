package com.specharvest.core.parser;

import com.specharvest.core.model.Requirement;
import com.specharvest.core.model.Section;
import com.specharvest.core.model.SpecNode;
import com.specharvest.core.model.Specification;
import com.specharvest.core.model.TestCase;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Owns the mutable nodes of a tree under construction and freezes them into the
 * immutable model once the stream ends.
 *
 * <p>Callers hold {@link Container} and {@link RecordDraft} handles returned by the
 * {@code add*} methods; nothing else references the drafts.
 */
public final class TreeBuilder {

    private final String documentName;
    private final Container root;

    /**
     * Creates a builder for one document.
     *
     * @param documentName root label
     */
    public TreeBuilder(String documentName) {
        this.documentName = Objects.requireNonNull(documentName, "documentName must not be null");
        this.root = new Container(documentName, 0);
    }

    /**
     * Returns the root container (level 0).
     *
     * @return root
     */
    public Container root() {
        return root;
    }

    /**
     * Appends a new section to a container.
     *
     * @param parent container receiving the section
     * @param title heading text
     * @param level heading level
     * @return the new section's container
     */
    public Container addSection(Container parent, String title, int level) {
        Container section = new Container(title, level);
        parent.children.add(section);
        return section;
    }

    /**
     * Appends a new requirement to a container.
     *
     * @param parent container receiving the requirement
     * @param name requirement name
     * @return the open requirement
     */
    public RecordDraft addRequirement(Container parent, String name) {
        RecordDraft draft = new RecordDraft(RecordScope.REQUIREMENT, name);
        parent.children.add(draft);
        return draft;
    }

    /**
     * Appends a new test case to a container.
     *
     * @param parent container receiving the test case
     * @param name test name
     * @return the open test case
     */
    public RecordDraft addTestCase(Container parent, String name) {
        RecordDraft draft = new RecordDraft(RecordScope.TEST_CASE, name);
        parent.children.add(draft);
        return draft;
    }

    /**
     * Freezes the tree.
     *
     * @return immutable specification
     */
    public Specification build() {
        return new Specification(documentName, root.buildChildren());
    }

    /**
     * Draft node: either a container or a record.
     */
    private interface Draft {
        SpecNode build();
    }

    /**
     * The root or a section under construction.
     */
    public static final class Container implements Draft {

        private final String title;
        private final int level;
        private final List<Draft> children = new ArrayList<>();

        private Container(String title, int level) {
            this.title = title;
            this.level = level;
        }

        public String title() {
            return title;
        }

        public int level() {
            return level;
        }

        private List<SpecNode> buildChildren() {
            List<SpecNode> built = new ArrayList<>(children.size());
            for (Draft child : children) {
                built.add(child.build());
            }
            return built;
        }

        @Override
        public SpecNode build() {
            return new Section(title, level, buildChildren());
        }
    }

    /**
     * A requirement or test case under construction.
     */
    public static final class RecordDraft implements Draft {

        private final RecordScope kind;
        private final String name;
        private final Map<FieldKind, String> fields = new EnumMap<>(FieldKind.class);

        private RecordDraft(RecordScope kind, String name) {
            this.kind = kind;
            this.name = name;
        }

        public RecordScope kind() {
            return kind;
        }

        public String name() {
            return name;
        }

        /**
         * Sets a field, replacing any earlier value.
         *
         * @param field field to set
         * @param value initial value
         */
        public void set(FieldKind field, String value) {
            requireOwnField(field);
            fields.put(field, value);
        }

        /**
         * Appends a continuation line to a field.
         *
         * <p>An empty field takes the line as its value; otherwise the line is joined
         * with a line feed.
         *
         * @param field field to extend
         * @param line continuation text
         */
        public void append(FieldKind field, String line) {
            requireOwnField(field);
            fields.merge(field, line, (current, next) -> current.isEmpty() ? next : current + "\n" + next);
        }

        /**
         * Returns whether a field has been opened.
         *
         * @param field field to check
         * @return true once {@link #set} or {@link #append} was called for it
         */
        public boolean has(FieldKind field) {
            return fields.containsKey(field);
        }

        /**
         * Returns a field's current value.
         *
         * @param field field to read
         * @return value, or null if never opened
         */
        public String get(FieldKind field) {
            return fields.get(field);
        }

        private void requireOwnField(FieldKind field) {
            if (field.scope() != kind || field.role() == FieldKind.Role.OPENS_RECORD) {
                throw new IllegalArgumentException(field + " is not a field of " + kind);
            }
        }

        @Override
        public SpecNode build() {
            if (kind == RecordScope.REQUIREMENT) {
                return new Requirement(
                    name,
                    fields.get(FieldKind.REQUIREMENT_REFERENCE),
                    fields.get(FieldKind.REQUIREMENT_DESCRIPTION),
                    fields.get(FieldKind.THREAT_REFERENCES)
                );
            }
            return new TestCase(
                name,
                fields.get(FieldKind.PURPOSE),
                fields.get(FieldKind.PRE_CONDITIONS),
                fields.get(FieldKind.EXECUTION_STEPS),
                fields.get(FieldKind.EXPECTED_RESULTS),
                fields.get(FieldKind.EVIDENCE_FORMAT)
            );
        }
    }
}
