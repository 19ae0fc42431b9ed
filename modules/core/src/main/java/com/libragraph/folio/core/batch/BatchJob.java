package com.libragraph.folio.core.batch;

import com.libragraph.folio.store.StoreBackend;

import java.nio.file.Path;

/**
 * Open {@code input}, run {@code pipeline}, export an archive to {@code output}.
 */
public record BatchJob(Path input, Path output, JobPipeline pipeline, StoreBackend backend) {

    public BatchJob(Path input, Path output, JobPipeline pipeline) {
        this(input, output, pipeline, StoreBackend.ARCHIVE);
    }
}
