package com.specharvest.core.fetch;

import com.specharvest.core.config.HarvestConfig;
import com.specharvest.core.model.SpecificationId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Downloads the latest archive of a specification from the 3GPP FTP mirror and extracts
 * its documents.
 *
 * <p>For specification {@code 33.117} the listing at {@code <baseUrl>/33.117/} is read, the
 * greatest archive name is downloaded into {@code <workspace>/TS 33.117 - <title>/},
 * extracted in place (keeping the archive's internal folder, e.g. {@code 33117-j20/}) and
 * the archive is deleted.
 */
public class ArchiveFetcher implements DocumentSource {

    private static final Logger log = LoggerFactory.getLogger(ArchiveFetcher.class);

    private static final String USER_AGENT = "SpecHarvest/1.0";

    private final HttpClient httpClient;
    private final HarvestConfig.ArchiveSettings settings;

    /**
     * Creates a fetcher with its own HTTP client.
     *
     * @param settings archive location and timeouts
     */
    public ArchiveFetcher(HarvestConfig.ArchiveSettings settings) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(settings.connectTimeout())
                .build(),
            settings);
    }

    /**
     * Creates a fetcher sharing an HTTP client.
     *
     * @param httpClient client used for listing and download requests
     * @param settings archive location and timeouts
     */
    public ArchiveFetcher(HttpClient httpClient, HarvestConfig.ArchiveSettings settings) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public List<Path> fetch(SpecificationId id, Path workspace) throws IOException {
        URI listingUri = listingUri(id);
        String html = fetchListing(listingUri);
        URI archiveUri = ArchiveIndex.latestArchive(html, listingUri);

        Path folder = workspace.resolve(id.folderName());
        Files.createDirectories(folder);
        Path archive = folder.resolve(ArchiveIndex.fileName(archiveUri));

        log.info("Downloading {} for {}", archiveUri, id);
        download(archiveUri, archive);

        List<Path> extracted = ZipExtractor.extract(archive, folder);
        Files.delete(archive);
        log.debug("Extracted {} file(s) from {}", extracted.size(), archive.getFileName());

        return extracted.stream()
            .filter(ArchiveFetcher::isWordDocument)
            .toList();
    }

    /**
     * Returns the listing URI of a specification.
     *
     * @param id specification
     * @return {@code <baseUrl>/<number>/}
     */
    URI listingUri(SpecificationId id) {
        String base = settings.baseUrl().endsWith("/") ? settings.baseUrl() : settings.baseUrl() + "/";
        return URI.create(base + id.number() + "/");
    }

    private String fetchListing(URI listingUri) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(listingUri)
            .GET()
            .timeout(settings.listingTimeout())
            .header("User-Agent", USER_AGENT)
            .header("Accept", "text/html,application/xhtml+xml")
            .build();

        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        requireSuccess(response, listingUri);
        return response.body();
    }

    private void download(URI archiveUri, Path target) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(archiveUri)
            .GET()
            .timeout(settings.downloadTimeout())
            .header("User-Agent", USER_AGENT)
            .build();

        Path partial = target.resolveSibling(target.getFileName() + ".part");
        try {
            HttpResponse<Path> response = send(request, HttpResponse.BodyHandlers.ofFile(partial));
            requireSuccess(response, archiveUri);
            if (Files.size(partial) == 0) {
                throw new IOException("Download returned empty content for " + archiveUri);
            }
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(partial);
        }
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) throws IOException {
        try {
            return httpClient.send(request, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while requesting " + request.uri(), e);
        }
    }

    private static void requireSuccess(HttpResponse<?> response, URI uri) throws IOException {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Request to " + uri + " failed with HTTP status " + status);
        }
    }

    private static boolean isWordDocument(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".doc") || name.endsWith(".docx");
    }
}
