package com.bireporting.anomaly.controller;

import com.bireporting.anomaly.model.AnomalyDetectionResult;
import com.bireporting.anomaly.model.AnomalyModelMetadata;
import com.bireporting.anomaly.model.AnomalyTrendAnalysis;
import com.bireporting.anomaly.model.DetectionRequest;
import com.bireporting.anomaly.model.TrainingRequest;
import com.bireporting.anomaly.service.AnomalyDetectionService;
import com.bireporting.anomaly.service.AnomalyTrendService;
import com.bireporting.anomaly.service.ModelTrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Detect anomalies in query results, analyse trends and train detectors")
public class AnomalyDetectionController {

    private static final int MAX_TREND_DAYS = 365;

    private final AnomalyDetectionService detectionService;
    private final AnomalyTrendService trendService;
    private final ModelTrainingService trainingService;

    public AnomalyDetectionController(AnomalyDetectionService detectionService,
                                      AnomalyTrendService trendService,
                                      ModelTrainingService trainingService) {
        this.detectionService = detectionService;
        this.trendService = trendService;
        this.trainingService = trainingService;
    }

    @Operation(summary = "Detect anomalies in a query result",
            description = "Runs all enabled detectors over the result, merges overlapping findings, " +
                    "escalates severity by business context and ranks the anomalies. HIGH and CRITICAL " +
                    "anomalies raise alerts, de-duplicated per (type, column, user). A failed run returns " +
                    "an empty result with metadata.error=true.")
    @PostMapping("/detect")
    public ResponseEntity<?> detect(@RequestBody DetectionRequest request) {
        if (request.getQueryResult() == null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "queryResult is required",
                    "field", "queryResult"));
        }

        AnomalyDetectionResult result = detectionService.detectAnomalies(
                request.getQueryResult(), request.getSemanticAnalysis(), request.getUserId());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Get anomaly trends",
            description = "Aggregates anomalies recorded over the last periodDays days by day, type and severity, " +
                    "and compares the last 7 days with the rest of the period.")
    @GetMapping("/trends")
    public ResponseEntity<?> getTrends(
            @Parameter(description = "Length of the analysed period in days", example = "30")
            @RequestParam(defaultValue = "30") int periodDays,
            @Parameter(description = "Restrict to one user's detection runs", example = "analyst-42")
            @RequestParam(required = false) String userId) {
        if (periodDays < 1 || periodDays > MAX_TREND_DAYS) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "periodDays must be between 1 and " + MAX_TREND_DAYS,
                    "field", "periodDays"));
        }

        AnomalyTrendAnalysis trends = trendService.getAnomalyTrends(Duration.ofDays(periodDays), userId);
        return ResponseEntity.ok(trends);
    }

    @Operation(summary = "Train detectors on historical query results",
            description = "Passes the historical results to every detector and records training metadata.")
    @PostMapping("/train")
    public ResponseEntity<?> train(@RequestBody TrainingRequest request) {
        if (request.getHistoricalData() == null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "historicalData is required",
                    "field", "historicalData"));
        }

        AnomalyModelMetadata metadata = trainingService.trainDetectionModels(
                request.getHistoricalData(), request.getUserId());
        return ResponseEntity.ok(metadata);
    }

    @Operation(summary = "Get metadata of the last training run")
    @GetMapping("/model")
    public ResponseEntity<AnomalyModelMetadata> getModelMetadata() {
        return trainingService.getModelMetadata()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
