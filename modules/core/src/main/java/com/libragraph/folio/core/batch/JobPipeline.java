package com.libragraph.folio.core.batch;

import com.libragraph.folio.core.protect.ProtectionCodec;
import com.libragraph.folio.core.protect.ProtectionOptions;
import com.libragraph.folio.markup.DocumentCache;
import com.libragraph.folio.store.PackageStore;

import java.util.ArrayList;
import java.util.List;

public record JobPipeline(List<JobStep> steps) {

    public JobPipeline {
        steps = List.copyOf(steps);
    }

    public static JobPipeline of(JobStep... steps) {
        return new JobPipeline(List.of(steps));
    }

    public static JobPipeline empty() {
        return new JobPipeline(List.of());
    }

    public JobPipeline then(JobStep step) {
        List<JobStep> next = new ArrayList<>(steps);
        next.add(step);
        return new JobPipeline(next);
    }

    /**
     * Runs every step against {@code store}, stopping at the first failure.
     *
     * @throws com.libragraph.folio.core.filter.FilterFailureException if a chain fails
     */
    public void run(PackageStore store, DocumentCache cache) {
        for (JobStep step : steps) {
            if (step instanceof JobStep.RunChain runChain) {
                runChain.chain().run(store, cache).orThrow();
            } else if (step instanceof JobStep.Protect protect) {
                new ProtectionCodec(protect.options()).protect(store, protect.key());
            } else if (step instanceof JobStep.Unprotect unprotect) {
                new ProtectionCodec(ProtectionOptions.defaults()).unprotect(store, unprotect.key());
            }
        }
    }
}
