package com.libragraph.folio.core.config;

import com.libragraph.folio.core.filter.FailurePolicy;
import com.libragraph.folio.core.filter.FilterSpec;
import com.libragraph.folio.core.layout.LayoutPlatform;
import com.libragraph.folio.core.layout.LayoutTransform;
import com.libragraph.folio.core.protect.ProtectionAlgorithm;
import com.libragraph.folio.core.protect.ProtectionOptions;
import com.libragraph.folio.core.protect.ProtectionTarget;
import com.libragraph.folio.core.standardize.MetadataNormalizeFilter;
import com.libragraph.folio.store.StoreBackend;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Merges three property layers into a {@link FolioConfig}: built-in defaults
 * (ordinal 100), the contents of a configuration file (200) and call-time overrides
 * (300). The resolver performs no file or environment lookups; environment variables
 * and system properties are not consulted.
 */
public class FolioConfigResolver {

    private static final Logger log = Logger.getLogger(FolioConfigResolver.class);

    public static final String FILTERS = "folio.filters";
    public static final String FAILURE_POLICY = "folio.filters.failure-policy";
    public static final String FILTER_OPTION_PREFIX = "folio.filter.";
    public static final String PLATFORM = "folio.platform";
    public static final String STORE_BACKEND = "folio.store.backend";
    public static final String XML_CACHE = "folio.xml-cache";
    public static final String PROTECTION_ALGORITHM = "folio.protection.algorithm";
    public static final String PROTECTION_TARGETS = "folio.protection.targets";
    public static final String PROTECTION_KEY = "folio.protection.key";
    public static final String BATCH_WIDTH = "folio.batch.width";
    public static final String BATCH_TIMEOUT = "folio.batch.timeout";
    public static final String DEFAULT_LANGUAGE = "folio.standardize.default-language";

    static final int DEFAULTS_ORDINAL = 100;
    static final int FILE_ORDINAL = 200;
    static final int OVERRIDES_ORDINAL = 300;

    private static final Map<String, String> DEFAULTS = Map.of(
            FAILURE_POLICY, "fail-fast",
            PLATFORM, "generic",
            STORE_BACKEND, "archive",
            XML_CACHE, "true",
            PROTECTION_ALGORITHM, "basic",
            PROTECTION_TARGETS, "font",
            BATCH_WIDTH, "4",
            DEFAULT_LANGUAGE, "und");

    private Map<String, String> file = Map.of();
    private String fileName = "file";
    private Map<String, String> overrides = Map.of();

    public FolioConfigResolver file(Map<String, String> properties) {
        return file("file", properties);
    }

    /**
     * Uses already loaded properties as the file layer. {@code name} identifies the
     * source in diagnostics; the resolver never reads files itself.
     */
    public FolioConfigResolver file(String name, Map<String, String> properties) {
        this.fileName = name;
        this.file = Map.copyOf(properties);
        return this;
    }

    public FolioConfigResolver overrides(Map<String, String> properties) {
        this.overrides = Map.copyOf(properties);
        return this;
    }

    /**
     * @throws IllegalArgumentException naming the key of the first invalid value
     */
    public FolioConfig resolve() {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(DEFAULTS, "defaults", DEFAULTS_ORDINAL))
                .withSources(new PropertiesConfigSource(file, fileName, FILE_ORDINAL))
                .withSources(new PropertiesConfigSource(overrides, "overrides", OVERRIDES_ORDINAL))
                .build();

        LayoutPlatform platform = value(config, PLATFORM, LayoutPlatform::fromLabel);
        String defaultLanguage = required(config, DEFAULT_LANGUAGE);
        ProtectionOptions protection = new ProtectionOptions(
                value(config, PROTECTION_ALGORITHM, ProtectionAlgorithm::fromLabel),
                value(config, PROTECTION_TARGETS, ProtectionTarget::parseList));

        FolioConfig resolved = new FolioConfig(
                filterSpecs(config, platform, defaultLanguage),
                value(config, FAILURE_POLICY, FolioConfigResolver::parsePolicy),
                platform,
                value(config, STORE_BACKEND, StoreBackend::fromLabel),
                value(config, XML_CACHE, FolioConfigResolver::parseBoolean),
                protection,
                config.getOptionalValue(PROTECTION_KEY, String.class),
                value(config, BATCH_WIDTH, FolioConfigResolver::parseWidth),
                config.getOptionalValue(BATCH_TIMEOUT, String.class)
                        .map(v -> convert(BATCH_TIMEOUT, v, FolioConfigResolver::parseDuration)),
                defaultLanguage);
        log.debugf("Resolved configuration: filters=%s platform=%s backend=%s width=%d",
                resolved.filters(), platform.label(), resolved.backend().label(), resolved.batchWidth());
        return resolved;
    }

    private static List<FilterSpec> filterSpecs(SmallRyeConfig config, LayoutPlatform platform,
                                                String defaultLanguage) {
        List<String> names = new ArrayList<>();
        config.getOptionalValue(FILTERS, String.class).ifPresent(v -> {
            for (String name : v.split(",")) {
                if (!name.isBlank()) {
                    names.add(name.trim());
                }
            }
        });

        Map<String, Map<String, String>> options = new TreeMap<>();
        for (String property : config.getPropertyNames()) {
            if (!property.startsWith(FILTER_OPTION_PREFIX)) {
                continue;
            }
            String rest = property.substring(FILTER_OPTION_PREFIX.length());
            int dot = rest.indexOf('.');
            if (dot <= 0 || dot == rest.length() - 1) {
                throw new IllegalArgumentException("Filter option key must be folio.filter.<name>.<option>: " + property);
            }
            config.getOptionalValue(property, String.class).ifPresent(v ->
                    options.computeIfAbsent(rest.substring(0, dot), k -> new LinkedHashMap<>())
                            .put(rest.substring(dot + 1), v));
        }

        List<FilterSpec> specs = new ArrayList<>();
        for (String name : names) {
            Map<String, String> filterOptions = new LinkedHashMap<>(options.getOrDefault(name, Map.of()));
            if (name.equals(LayoutTransform.NAME)) {
                filterOptions.putIfAbsent("platform", platform.label());
            } else if (name.equals(MetadataNormalizeFilter.NAME)) {
                filterOptions.putIfAbsent("default-language", defaultLanguage);
            }
            specs.add(new FilterSpec(name, filterOptions));
        }
        return specs;
    }

    private static String required(SmallRyeConfig config, String key) {
        return config.getOptionalValue(key, String.class)
                .orElseThrow(() -> new IllegalArgumentException("Missing configuration value: " + key));
    }

    private static <T> T value(SmallRyeConfig config, String key, Function<String, T> parser) {
        return convert(key, required(config, key), parser);
    }

    private static <T> T convert(String key, String raw, Function<String, T> parser) {
        try {
            return parser.apply(raw.trim());
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + raw + "' (" + e.getMessage() + ")", e);
        }
    }

    private static boolean parseBoolean(String raw) {
        if (raw.equalsIgnoreCase("true")) return true;
        if (raw.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException("expected true or false");
    }

    private static int parseWidth(String raw) {
        int width = Integer.parseInt(raw);
        if (width < 1) {
            throw new IllegalArgumentException("must be at least 1");
        }
        return width;
    }

    private static Duration parseDuration(String raw) {
        Duration duration = Duration.parse(raw);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("must be positive");
        }
        return duration;
    }

    private static FailurePolicy parsePolicy(String raw) {
        switch (raw.toLowerCase()) {
            case "fail-fast":
                return FailurePolicy.FAIL_FAST;
            case "continue":
                return FailurePolicy.CONTINUE;
            default:
                throw new IllegalArgumentException("expected fail-fast or continue");
        }
    }
}
