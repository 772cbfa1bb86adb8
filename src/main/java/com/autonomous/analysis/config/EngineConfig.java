package com.autonomous.analysis.config;

import com.autonomous.analysis.client.InferenceClient;
import com.autonomous.analysis.data.CsvDataProvider;
import com.autonomous.analysis.data.RawDataProvider;
import com.autonomous.analysis.orchestration.AnalysisEngine;
import com.autonomous.analysis.orchestration.FailureClassifier;
import com.autonomous.analysis.orchestration.ResultParser;
import com.autonomous.analysis.service.RoleCatalogService;
import com.autonomous.analysis.sink.ArtifactSink;
import com.autonomous.analysis.sink.FileArtifactSink;
import com.autonomous.analysis.sink.InsightExtractor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

@Configuration
public class EngineConfig {

    @Bean
    RawDataProvider rawDataProvider(AnalysisProperties properties, RoleCatalogService roleCatalog) {
        return new CsvDataProvider(
            Paths.get(properties.getData().getRoot()),
            properties.getData().getSummaryMaxLength(),
            roleCatalog::dataFilesOf);
    }

    @Bean
    AnalysisEngine analysisEngine(InferenceClient inferenceClient, RawDataProvider rawDataProvider,
                                  ObjectMapper objectMapper) {
        return new AnalysisEngine(inferenceClient, rawDataProvider, new ResultParser(objectMapper), new FailureClassifier());
    }

    @Bean
    ArtifactSink artifactSink(AnalysisProperties properties, RoleCatalogService roleCatalog) {
        return new FileArtifactSink(Paths.get(properties.getOutput().getPath()), roleCatalog::displayNameOf, new InsightExtractor());
    }
}
