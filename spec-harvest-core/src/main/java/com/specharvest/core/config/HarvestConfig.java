package com.specharvest.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.specharvest.core.model.SpecificationId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration for SpecHarvest.
 *
 * <p>Loaded from {@code spec-harvest.yaml}. Every section is optional; missing sections and
 * values take the defaults shown below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * archive:
 *   baseUrl: "https://www.3gpp.org/ftp/Specs/archive/33_series"
 *   connectTimeoutSeconds: 30
 *   listingTimeoutSeconds: 30
 *   downloadTimeoutSeconds: 60
 *
 * specifications:
 *   "33.117": "General Requirements"
 *   "33.511": "gNodeB"
 *
 * converter:
 *   executables:
 *     - /usr/bin/soffice
 *     - soffice
 *   timeoutSeconds: 60
 *
 * output:
 *   workspace: "."
 *   formats: [xml]
 *   threads: 4
 * }</pre>
 *
 * @param archive archive location and HTTP timeouts
 * @param specifications specification number to title, in processing order
 * @param converter legacy document conversion settings
 * @param output workspace, formats and parallelism
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HarvestConfig(
    @JsonProperty("archive") ArchiveSettings archive,
    @JsonProperty("specifications") Map<String, String> specifications,
    @JsonProperty("converter") ConverterSettings converter,
    @JsonProperty("output") OutputSettings output
) {
    /** The SCAS specifications of the 33 series. */
    public static final Map<String, String> DEFAULT_SPECIFICATIONS = defaultSpecifications();

    /**
     * Compact constructor filling in defaults.
     */
    public HarvestConfig {
        if (archive == null) {
            archive = ArchiveSettings.defaults();
        }
        specifications = specifications == null || specifications.isEmpty()
            ? DEFAULT_SPECIFICATIONS
            : Collections.unmodifiableMap(new LinkedHashMap<>(specifications));
        if (converter == null) {
            converter = ConverterSettings.defaults();
        }
        if (output == null) {
            output = OutputSettings.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static HarvestConfig defaults() {
        return new HarvestConfig(null, null, null, null);
    }

    private static Map<String, String> defaultSpecifications() {
        Map<String, String> specs = new LinkedHashMap<>();
        specs.put("33.116", "MME");
        specs.put("33.117", "General Requirements");
        specs.put("33.216", "eNB");
        specs.put("33.226", "IMS");
        specs.put("33.250", "PGW");
        specs.put("33.326", "NSSAAF");
        specs.put("33.511", "gNodeB");
        specs.put("33.512", "AMF");
        specs.put("33.513", "UPF");
        specs.put("33.514", "UDM");
        specs.put("33.515", "SMF");
        specs.put("33.516", "AUSF");
        specs.put("33.517", "SEPP");
        specs.put("33.518", "NRF");
        specs.put("33.519", "NEF");
        specs.put("33.520", "N3IWF");
        specs.put("33.521", "NWDAF");
        specs.put("33.522", "SCP");
        specs.put("33.523", "Split gNB");
        specs.put("33.526", "Management Function");
        specs.put("33.527", "Virtualized network products");
        specs.put("33.528", "PCF");
        specs.put("33.530", "UDR");
        specs.put("33.537", "AKMA Anchor Function (AAnF)");
        return Collections.unmodifiableMap(specs);
    }

    /**
     * Returns every configured specification in configuration order.
     *
     * @return configured identifiers
     */
    public List<SpecificationId> specificationIds() {
        List<SpecificationId> ids = new ArrayList<>();
        specifications.forEach((number, title) -> ids.add(new SpecificationId(number, title)));
        return ids;
    }

    /**
     * Resolves specification numbers to identifiers.
     *
     * <p>Numbers missing from the configuration resolve to an identifier without a title.
     * An empty collection selects every configured specification.
     *
     * @param numbers specification numbers (e.g. "33.117")
     * @return identifiers in the order given
     */
    public List<SpecificationId> resolve(Collection<String> numbers) {
        if (numbers == null || numbers.isEmpty()) {
            return specificationIds();
        }
        List<SpecificationId> ids = new ArrayList<>(numbers.size());
        for (String number : numbers) {
            ids.add(new SpecificationId(number, specifications.getOrDefault(number, "")));
        }
        return ids;
    }

    /**
     * Archive location and HTTP timeouts.
     *
     * @param baseUrl URL of the series folder; each specification lives in {@code <baseUrl>/<number>/}
     * @param connectTimeoutSeconds connection timeout
     * @param listingTimeoutSeconds request timeout for listing pages
     * @param downloadTimeoutSeconds request timeout for archive downloads
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ArchiveSettings(
        @JsonProperty("baseUrl") String baseUrl,
        @JsonProperty("connectTimeoutSeconds") Integer connectTimeoutSeconds,
        @JsonProperty("listingTimeoutSeconds") Integer listingTimeoutSeconds,
        @JsonProperty("downloadTimeoutSeconds") Integer downloadTimeoutSeconds
    ) {
        public static final String DEFAULT_BASE_URL = "https://www.3gpp.org/ftp/Specs/archive/33_series";

        /**
         * Compact constructor filling in defaults.
         */
        public ArchiveSettings {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = DEFAULT_BASE_URL;
            }
            connectTimeoutSeconds = positiveOr(connectTimeoutSeconds, 30);
            listingTimeoutSeconds = positiveOr(listingTimeoutSeconds, 30);
            downloadTimeoutSeconds = positiveOr(downloadTimeoutSeconds, 60);
        }

        public static ArchiveSettings defaults() {
            return new ArchiveSettings(null, null, null, null);
        }

        public Duration connectTimeout() {
            return Duration.ofSeconds(connectTimeoutSeconds);
        }

        public Duration listingTimeout() {
            return Duration.ofSeconds(listingTimeoutSeconds);
        }

        public Duration downloadTimeout() {
            return Duration.ofSeconds(downloadTimeoutSeconds);
        }
    }

    /**
     * Legacy document conversion settings.
     *
     * @param executables candidate {@code soffice} locations in preference order
     * @param timeoutSeconds maximum conversion time per document
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConverterSettings(
        @JsonProperty("executables") List<String> executables,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds
    ) {
        /** Candidates covering macOS, Linux package installs and {@code PATH}. */
        public static final List<String> DEFAULT_EXECUTABLES = List.of(
            "/Applications/LibreOffice.app/Contents/MacOS/soffice",
            "/usr/bin/soffice",
            "/usr/local/bin/soffice",
            "soffice"
        );

        /**
         * Compact constructor filling in defaults.
         */
        public ConverterSettings {
            executables = executables == null || executables.isEmpty()
                ? DEFAULT_EXECUTABLES
                : List.copyOf(executables);
            timeoutSeconds = positiveOr(timeoutSeconds, 60);
        }

        public static ConverterSettings defaults() {
            return new ConverterSettings(null, null);
        }

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }

    /**
     * Workspace, output formats and parallelism.
     *
     * @param workspace directory holding the per-specification folders
     * @param formats renderer ids to write for every document
     * @param threads number of specifications processed in parallel
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("workspace") String workspace,
        @JsonProperty("formats") List<String> formats,
        @JsonProperty("threads") Integer threads
    ) {
        /**
         * Compact constructor filling in defaults.
         */
        public OutputSettings {
            if (workspace == null || workspace.isBlank()) {
                workspace = ".";
            }
            formats = formats == null || formats.isEmpty() ? List.of("xml") : List.copyOf(formats);
            threads = positiveOr(threads, 4);
        }

        public static OutputSettings defaults() {
            return new OutputSettings(null, null, null);
        }
    }

    private static Integer positiveOr(Integer value, int fallback) {
        return value == null || value < 1 ? fallback : value;
    }
}
