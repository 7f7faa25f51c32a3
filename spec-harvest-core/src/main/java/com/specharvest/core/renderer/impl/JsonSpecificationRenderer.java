package com.specharvest.core.renderer.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
 * Renders a specification as pretty-printed JSON using Jackson.
 *
 * <p>Every node carries a {@code type} discriminator ({@code section}, {@code requirement},
 * {@code testCase}). Record fields use the camel-cased element names of the XML output;
 * absent fields are omitted.
 */
public class JsonSpecificationRenderer implements SpecificationRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Renderer";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String getContentType() {
        return "application/json";
    }

    @Override
    public String render(Specification specification) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("name", specification.name());
        addChildren(root, specification.children());
        try {
            return MAPPER.writeValueAsString(root) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize specification: " + specification.name(), e);
        }
    }

    private void addChildren(ObjectNode parent, List<SpecNode> children) {
        ArrayNode array = parent.putArray("children");
        NodeConverter converter = new NodeConverter();
        for (SpecNode child : children) {
            array.add(child.accept(converter));
        }
    }

    private static String propertyName(RecordField field) {
        String element = field.elementName();
        return Character.toLowerCase(element.charAt(0)) + element.substring(1);
    }

    /**
     * Converts one node into a JSON object.
     */
    private final class NodeConverter implements SpecNodeVisitor<ObjectNode> {

        @Override
        public ObjectNode visitSection(Section section) {
            ObjectNode node = MAPPER.createObjectNode();
            node.put("type", "section");
            node.put("title", section.title());
            node.put("level", section.level());
            addChildren(node, section.children());
            return node;
        }

        @Override
        public ObjectNode visitRequirement(Requirement requirement) {
            return record("requirement", requirement.name(), RecordFields.of(requirement));
        }

        @Override
        public ObjectNode visitTestCase(TestCase testCase) {
            return record("testCase", testCase.name(), RecordFields.of(testCase));
        }

        private ObjectNode record(String type, String name, List<RecordField> fields) {
            ObjectNode node = MAPPER.createObjectNode();
            node.put("type", type);
            node.put("name", name);
            for (RecordField field : fields) {
                node.put(propertyName(field), field.value());
            }
            return node;
        }
    }
}
