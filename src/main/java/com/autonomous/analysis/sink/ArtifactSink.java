package com.autonomous.analysis.sink;

import com.autonomous.analysis.model.RunSummary;

/**
 * Destination for the artifacts of a finished run.
 */
public interface ArtifactSink {

    /**
     * @throws java.io.UncheckedIOException when the artifacts cannot be written
     */
    void emit(RunSummary summary);
}
