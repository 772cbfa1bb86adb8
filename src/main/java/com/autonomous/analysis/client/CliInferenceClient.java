package com.autonomous.analysis.client;

import com.autonomous.analysis.exception.PermanentInferenceException;
import com.autonomous.analysis.exception.TransientInferenceException;
import com.autonomous.analysis.model.InferenceParams;
import com.autonomous.analysis.model.InferenceResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
public class CliInferenceClient implements InferenceClient {

    private final String executable;
    private final Duration processTimeout;

    public CliInferenceClient(String executable, Duration processTimeout) {
        this.executable = executable;
        this.processTimeout = processTimeout;
    }

    @Override
    public InferenceResponse infer(String role, String prompt, InferenceParams params) {
        List<String> command = buildCommand(prompt, params);

        Path outputFile;
        Process process;
        try {
            outputFile = Files.createTempFile("inference-" + role + "-", ".out");
        } catch (IOException e) {
            throw new TransientInferenceException("Cannot create output file: " + e.getMessage(), e);
        }
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.redirectOutput(outputFile.toFile());
            process = pb.start();
        } catch (IOException e) {
            deleteQuietly(outputFile);
            throw new PermanentInferenceException("Cannot start " + executable + ": " + e.getMessage(), e);
        }

        try {
            boolean finished = process.waitFor(processTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                throw new TransientInferenceException(
                    executable + " timed out after " + processTimeout.toSeconds() + "s for role '" + role + "'");
            }
            String output = Files.readString(outputFile, StandardCharsets.UTF_8).trim();
            if (process.exitValue() != 0) {
                throw new TransientInferenceException(
                    executable + " exited with " + process.exitValue() + " for role '" + role + "': " + output);
            }
            return InferenceResponse.builder()
                .text(output)
                .model(params.getModel())
                .inputTokens(estimateTokens(prompt))
                .outputTokens(estimateTokens(output))
                .build();
        } catch (IOException e) {
            throw new TransientInferenceException("Lost output of " + executable + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInferenceException(executable + " call interrupted for role '" + role + "'", e);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(outputFile);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", file, e.getMessage());
        }
    }

    List<String> buildCommand(String prompt, InferenceParams params) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--print");
        if (params.getModel() != null && !params.getModel().isBlank()) {
            command.add("--model");
            command.add(params.getModel());
        }
        if (params.getSystemPrompt() != null && !params.getSystemPrompt().isBlank()) {
            command.add("--system-prompt");
            command.add(params.getSystemPrompt());
        }
        command.add(prompt);
        return command;
    }

    // The CLI reports no usage, roughly four characters per token.
    static long estimateTokens(CharSequence text) {
        return (text.length() + 3) / 4;
    }
}
