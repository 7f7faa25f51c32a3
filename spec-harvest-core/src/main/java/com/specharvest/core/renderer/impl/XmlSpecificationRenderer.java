package com.specharvest.core.renderer.impl;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.fasterxml.jackson.dataformat.xml.util.DefaultXmlPrettyPrinter;
import com.specharvest.core.model.Requirement;
import com.specharvest.core.model.Section;
import com.specharvest.core.model.SpecNode;
import com.specharvest.core.model.SpecNodeVisitor;
import com.specharvest.core.model.Specification;
import com.specharvest.core.model.TestCase;
import com.specharvest.core.renderer.RecordField;
import com.specharvest.core.renderer.RecordFields;
import com.specharvest.core.renderer.SpecificationRenderer;

import javax.xml.namespace.QName;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Renders a specification as indented XML, the reference output format.
 *
 * <p>Sections become {@code <Section title=".." level="..">} elements; records become
 * {@code <Requirement>} or {@code <TestCase>} elements with one child element per present
 * field. Multi-line values are written as-is inside their element. The document is
 * streamed through Jackson's {@link ToXmlGenerator}, which takes care of escaping.
 *
 * <p>Characters outside the XML 1.0 {@code Char} production (U+FFFE, U+FFFF, unpaired
 * surrogates) are dropped from names, titles and field values so the output always parses.
 *
 * <p><b>Example Output:</b>
 * <pre>{@code
 * <?xml version='1.0' encoding='UTF-8'?>
 * <Specification name="3GPP TS 33.117">
 *   <Section title="4.2.3 Logging" level="3">
 *     <Requirement>
 *       <Name>Security event logging</Name>
 *       <Reference>TS33.117-4.2.3.1.2</Reference>
 *     </Requirement>
 *   </Section>
 * </Specification>
 * }</pre>
 */
public class XmlSpecificationRenderer implements SpecificationRenderer {

    private static final XmlMapper MAPPER = XmlMapper.builder()
        .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
        .build();

    @Override
    public String getId() {
        return "xml";
    }

    @Override
    public String getDisplayName() {
        return "XML Renderer";
    }

    @Override
    public String getFileExtension() {
        return "xml";
    }

    @Override
    public String getContentType() {
        return "application/xml";
    }

    @Override
    public String render(Specification specification) {
        StringWriter out = new StringWriter();
        try (ToXmlGenerator generator = MAPPER.getFactory().createGenerator(out)) {
            generator.setPrettyPrinter(new DefaultXmlPrettyPrinter());
            generator.setNextName(new QName("Specification"));
            generator.initGenerator();
            generator.writeStartObject();
            writeAttribute(generator, "name", specification.name());
            writeChildren(generator, specification.children());
            generator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write XML for specification: " + specification.name(), e);
        }
        String xml = out.toString();
        return xml.endsWith("\n") ? xml : xml + "\n";
    }

    private static void writeChildren(ToXmlGenerator generator, List<SpecNode> children) throws IOException {
        ElementWriter writer = new ElementWriter(generator);
        for (SpecNode child : children) {
            child.accept(writer);
            if (writer.failure != null) {
                throw writer.failure;
            }
        }
    }

    private static void writeAttribute(ToXmlGenerator generator, String name, String value) throws IOException {
        generator.setNextIsAttribute(true);
        generator.writeFieldName(name);
        generator.writeString(xmlSafe(value));
        generator.setNextIsAttribute(false);
    }

    private static void writeElement(ToXmlGenerator generator, String name, String value) throws IOException {
        generator.writeFieldName(name);
        generator.writeString(xmlSafe(value));
    }

    /**
     * Removes code points that XML 1.0 documents cannot contain.
     *
     * @param text raw text
     * @return text restricted to the XML 1.0 character range
     */
    static String xmlSafe(String text) {
        StringBuilder safe = null;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            int width = Character.charCount(cp);
            if (!isXmlChar(cp)) {
                if (safe == null) {
                    safe = new StringBuilder(text.length()).append(text, 0, i);
                }
            } else if (safe != null) {
                safe.appendCodePoint(cp);
            }
            i += width;
        }
        return safe == null ? text : safe.toString();
    }

    private static boolean isXmlChar(int cp) {
        return cp == 0x9 || cp == 0xA || cp == 0xD
            || (cp >= 0x20 && cp <= 0xD7FF)
            || (cp >= 0xE000 && cp <= 0xFFFD)
            || (cp >= 0x10000 && cp <= 0x10FFFF);
    }

    /**
     * Writes one node as a field of the enclosing element. The visitor cannot throw checked
     * exceptions, so the first I/O failure is kept and rethrown by the caller.
     */
    private static final class ElementWriter implements SpecNodeVisitor<Void> {

        private final ToXmlGenerator generator;
        private IOException failure;

        ElementWriter(ToXmlGenerator generator) {
            this.generator = generator;
        }

        @Override
        public Void visitSection(Section section) {
            try {
                generator.writeFieldName("Section");
                generator.writeStartObject();
                writeAttribute(generator, "title", section.title());
                generator.setNextIsAttribute(true);
                generator.writeFieldName("level");
                generator.writeNumber(section.level());
                generator.setNextIsAttribute(false);
                writeChildren(generator, section.children());
                generator.writeEndObject();
            } catch (IOException e) {
                failure = e;
            }
            return null;
        }

        @Override
        public Void visitRequirement(Requirement requirement) {
            writeRecord("Requirement", requirement.name(), RecordFields.of(requirement));
            return null;
        }

        @Override
        public Void visitTestCase(TestCase testCase) {
            writeRecord("TestCase", testCase.name(), RecordFields.of(testCase));
            return null;
        }

        private void writeRecord(String element, String name, List<RecordField> fields) {
            try {
                generator.writeFieldName(element);
                generator.writeStartObject();
                writeElement(generator, "Name", name);
                for (RecordField field : fields) {
                    writeElement(generator, field.elementName(), field.value());
                }
                generator.writeEndObject();
            } catch (IOException e) {
                failure = e;
            }
        }
    }
}
