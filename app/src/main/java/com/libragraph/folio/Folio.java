package com.libragraph.folio;

import com.libragraph.folio.core.BuiltinFilters;
import com.libragraph.folio.core.batch.BatchJob;
import com.libragraph.folio.core.batch.BatchOrchestrator;
import com.libragraph.folio.core.batch.JobPipeline;
import com.libragraph.folio.core.batch.JobStep;
import com.libragraph.folio.core.config.FolioConfig;
import com.libragraph.folio.core.config.FolioConfigResolver;
import com.libragraph.folio.core.filter.FilterChain;
import com.libragraph.folio.core.filter.FilterRegistry;
import com.libragraph.folio.core.protect.ProtectionCodec;
import com.libragraph.folio.markup.DocumentCache;
import com.libragraph.folio.store.PackageIOException;
import com.libragraph.folio.store.PackageStore;
import com.libragraph.folio.store.PackageStores;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Entry point wiring the engine from one resolved {@link FolioConfig}.
 *
 * <p>The configured filter chain is resolved at construction, so an unknown filter
 * name or an invalid option fails here rather than halfway through a package.
 * Protection, when a key is configured, always runs after the chain.
 */
public class Folio {

    private static final Logger log = Logger.getLogger(Folio.class);

    private final FolioConfig config;
    private final FilterChain chain;

    public Folio(FolioConfig config) {
        this(config, BuiltinFilters.registry());
    }

    /**
     * @throws com.libragraph.folio.core.filter.UnknownFilterException if a configured
     *                                                                 filter is not registered
     */
    public Folio(FolioConfig config, FilterRegistry registry) {
        this.config = config;
        this.chain = registry.chain(config.filters(), config.failurePolicy());
        log.debugf("Folio ready: chain=%s protection=%s", chain.names(),
                config.protectionKey().isPresent() ? config.protection().algorithm().label() : "off");
    }

    /**
     * Resolves a configuration from a {@code .properties} file with {@code overrides}
     * applied on top.
     *
     * @throws PackageIOException if the file cannot be read
     */
    public static FolioConfig configure(Path file, Map<String, String> overrides) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new PackageIOException("Cannot read configuration " + file, e);
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (String name : properties.stringPropertyNames()) {
            values.put(name, properties.getProperty(name));
        }
        log.debugf("Loaded %d settings from %s", values.size(), file);
        return new FolioConfigResolver()
                .file(file.toString(), values)
                .overrides(overrides)
                .resolve();
    }

    public FolioConfig config() {
        return config;
    }

    /**
     * Opens a package with the configured backend. The caller closes the store.
     */
    public PackageStore open(Path input) {
        return PackageStores.open(input, config.backend());
    }

    public void export(PackageStore store, Path target) {
        PackageStores.export(store, target);
    }

    public FilterChain filterChain() {
        return chain;
    }

    public ProtectionCodec protectionCodec() {
        return new ProtectionCodec(config.protection());
    }

    /**
     * The configured chain followed by protection when a key is set.
     */
    public JobPipeline pipeline() {
        JobPipeline pipeline = chain.isEmpty() ? JobPipeline.empty() : JobPipeline.of(JobStep.runChain(chain));
        if (config.protectionKey().isPresent()) {
            pipeline = pipeline.then(JobStep.protect(config.protectionKey().get(), config.protection()));
        }
        return pipeline;
    }

    /**
     * Runs {@link #pipeline()} on {@code input} and writes the result to {@code output}.
     * The input is never modified.
     *
     * @throws com.libragraph.folio.core.filter.FilterFailureException if a filter fails;
     *                                                                 nothing is written
     */
    public void process(Path input, Path output) {
        try (PackageStore store = PackageStores.openIsolated(input, config.backend());
             DocumentCache cache = new DocumentCache(store, config.xmlCache())) {
            pipeline().run(store, cache);
            PackageStores.export(store, output);
        }
        log.infof("Processed %s into %s", input, output);
    }

    /**
     * A fresh orchestrator with the configured width, timeout and cache setting.
     */
    public BatchOrchestrator batch() {
        return new BatchOrchestrator(config.batchWidth(), config.batchTimeout(), config.xmlCache());
    }

    public BatchJob job(Path input, Path output) {
        return new BatchJob(input, output, pipeline(), config.backend());
    }
}
