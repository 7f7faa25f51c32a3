package com.specharvest.core.fetch;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;

import static org.assertj.core.api.Assertions.*;

class ArchiveIndexTest {

    private static final URI LISTING = URI.create("https://www.3gpp.org/ftp/Specs/archive/33_series/33.117/");

    private static final String LISTING_HTML = """
        <html><body>
          <a href="../">Parent Directory</a>
          <a href="33117-f00.zip">33117-f00.zip</a>
          <a href="https://www.3gpp.org/ftp/Specs/archive/33_series/33.117/33117-j20.zip">33117-j20.zip</a>
          <a href="33117-h10.ZIP">33117-h10.ZIP</a>
          <a href="readme.txt">readme.txt</a>
        </body></html>
        """;

    @Test
    void archives_collectsZipLinksAsAbsoluteUris() {
        assertThat(ArchiveIndex.archives(LISTING_HTML, LISTING)).containsExactly(
            URI.create("https://www.3gpp.org/ftp/Specs/archive/33_series/33.117/33117-f00.zip"),
            URI.create("https://www.3gpp.org/ftp/Specs/archive/33_series/33.117/33117-j20.zip"),
            URI.create("https://www.3gpp.org/ftp/Specs/archive/33_series/33.117/33117-h10.ZIP"));
    }

    @Test
    void latestArchive_picksGreatestFileName() throws IOException {
        assertThat(ArchiveIndex.latestArchive(LISTING_HTML, LISTING))
            .isEqualTo(URI.create("https://www.3gpp.org/ftp/Specs/archive/33_series/33.117/33117-j20.zip"));
    }

    @Test
    void latestArchive_withoutZips_throws() {
        assertThatThrownBy(() -> ArchiveIndex.latestArchive("<a href=\"x.pdf\">x</a>", LISTING))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("No ZIPs found");
    }

    @Test
    void fileName_returnsLastSegment() {
        assertThat(ArchiveIndex.fileName(URI.create("https://host/a/b/33117-j20.zip"))).isEqualTo("33117-j20.zip");
    }
}
