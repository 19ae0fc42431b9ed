/**
 * Bounded-concurrency batch runs: jobs, pipelines of steps, per-job results and the
 * JSON report.
 */
package com.libragraph.folio.core.batch;
