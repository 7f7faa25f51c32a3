package com.specharvest.core.fetch;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Reads the HTML directory listing of a specification's archive folder.
 *
 * <p>Archive names encode the version ({@code 33117-i40.zip}, {@code 33117-j20.zip}) so that
 * the lexicographically greatest file name is the latest version.
 */
public final class ArchiveIndex {

    private ArchiveIndex() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Lists the archive links of a listing page.
     *
     * @param html listing page HTML
     * @param listingUri URI the page was fetched from, for resolving relative links
     * @return absolute archive URIs in page order
     */
    public static List<URI> archives(String html, URI listingUri) {
        Document document = Jsoup.parse(html, listingUri.toString());
        List<URI> archives = new ArrayList<>();
        for (Element link : document.select("a[href]")) {
            String href = link.attr("abs:href");
            if (href.isEmpty()) {
                href = link.attr("href");
            }
            if (href.toLowerCase(Locale.ROOT).endsWith(".zip")) {
                archives.add(URI.create(href.replace(" ", "%20")));
            }
        }
        return archives;
    }

    /**
     * Picks the latest archive of a listing page.
     *
     * @param html listing page HTML
     * @param listingUri URI the page was fetched from
     * @return URI of the archive with the greatest file name
     * @throws IOException if the page lists no archives
     */
    public static URI latestArchive(String html, URI listingUri) throws IOException {
        return archives(html, listingUri).stream()
            .max(Comparator.comparing(ArchiveIndex::fileName))
            .orElseThrow(() -> new IOException("No ZIPs found at " + listingUri));
    }

    /**
     * Returns the last path segment of a URI.
     *
     * @param uri archive URI
     * @return file name
     */
    public static String fileName(URI uri) {
        String path = uri.getPath();
        if (path == null || path.isEmpty()) {
            return uri.toString();
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
