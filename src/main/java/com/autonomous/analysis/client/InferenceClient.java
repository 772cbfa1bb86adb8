package com.autonomous.analysis.client;

import com.autonomous.analysis.model.InferenceParams;
import com.autonomous.analysis.model.InferenceResponse;

/**
 * Blocking call to a language model backend.
 *
 * <p>Implementations signal failures with
 * {@link com.autonomous.analysis.exception.TransientInferenceException} (worth retrying) or
 * {@link com.autonomous.analysis.exception.PermanentInferenceException} (not worth retrying).
 * A call may be interrupted when the orchestrator abandons it.</p>
 */
public interface InferenceClient {

    InferenceResponse infer(String role, String prompt, InferenceParams params);
}
