package com.specharvest.core.renderer.impl;

import com.specharvest.core.model.Requirement;
import com.specharvest.core.model.Section;
import com.specharvest.core.model.SpecNode;
import com.specharvest.core.model.Specification;
import com.specharvest.core.model.TestCase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MarkdownSpecificationRendererTest {

    private final MarkdownSpecificationRenderer renderer = new MarkdownSpecificationRenderer();

    @Test
    void render_tree_writesHeadingsAndFieldLists() {
        Specification spec = new Specification("3GPP TS 33.117", List.of(
            new Section("Clause", 1, List.of(
                new Requirement("Logging", "REF", "a\nb", null),
                new TestCase("TC", "Verify", null, null, null, null)
            ))
        ));

        String markdown = renderer.render(spec);

        assertThat(markdown).isEqualTo("""
            # 3GPP TS 33.117

            ## Clause

            **Requirement:** Logging

            - **Requirement Reference:** REF
            - **Requirement Description:** a
              b

            **Test Case:** TC

            - **Purpose:** Verify

            """);
    }

    @Test
    void render_deepSections_capHeadingDepth() {
        SpecNode node = new Section("L7", 7, List.of());
        for (int level = 6; level >= 1; level--) {
            node = new Section("L" + level, level, List.of(node));
        }

        String markdown = renderer.render(new Specification("doc", List.of(node)));

        assertThat(markdown)
            .contains("\n## L1\n")
            .contains("\n###### L5\n")
            .contains("\n###### L6\n")
            .contains("\n###### L7\n")
            .doesNotContain("#######");
    }

    @Test
    void render_recordWithoutFields_writesNameOnly() {
        String markdown = renderer.render(new Specification("doc", List.of(
            new Requirement("Bare", null, null, null))));

        assertThat(markdown).isEqualTo("# doc\n\n**Requirement:** Bare\n\n");
    }
}
