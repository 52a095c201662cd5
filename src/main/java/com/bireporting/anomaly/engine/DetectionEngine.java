package com.bireporting.anomaly.engine;

import com.bireporting.anomaly.config.AnomalyConfiguration;
import com.bireporting.anomaly.config.MetricsConfig;
import com.bireporting.anomaly.model.Anomaly;
import com.bireporting.anomaly.model.QueryResult;
import com.bireporting.anomaly.model.SemanticAnalysis;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the active detectors concurrently against a query result.
 * Uses the Strategy pattern: each DetectorType is handled by a registered AnomalyDetector.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final Map<DetectorType, AnomalyDetector> detectorMap;
    private final AtomicReference<List<AnomalyDetector>> activeDetectors =
            new AtomicReference<>(Collections.emptyList());
    private final ExecutorService executor;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public DetectionEngine(List<AnomalyDetector> detectors,
                           @Qualifier("detectionExecutor") ExecutorService executor,
                           Tracer tracer, MetricsConfig metricsConfig,
                           AnomalyConfiguration startupConfig) {
        this.detectorMap = new EnumMap<>(DetectorType.class);
        this.executor = executor;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all detector implementations
        for (AnomalyDetector detector : detectors) {
            detectorMap.put(detector.getDetectorType(), detector);
            log.info("Registered anomaly detector: {} -> {}",
                    detector.getDetectorType(), detector.getClass().getSimpleName());
        }

        activate(startupConfig);
    }

    /**
     * Select the detectors enabled by the given configuration. Takes effect for runs
     * started afterwards; runs in flight keep the list they started with.
     *
     * @return the detector types now active, in execution order
     */
    public List<DetectorType> activate(AnomalyConfiguration config) {
        List<AnomalyDetector> selected = new ArrayList<>();
        for (Map.Entry<DetectorType, AnomalyDetector> entry : detectorMap.entrySet()) {
            if (isEnabled(entry.getKey(), config)) {
                selected.add(entry.getValue());
            }
        }
        activeDetectors.set(List.copyOf(selected));

        List<DetectorType> types = selected.stream().map(AnomalyDetector::getDetectorType).toList();
        log.info("Active anomaly detectors: {}", types);
        return types;
    }

    public List<DetectorType> getActiveDetectorTypes() {
        return activeDetectors.get().stream().map(AnomalyDetector::getDetectorType).toList();
    }

    public Collection<AnomalyDetector> getRegisteredDetectors() {
        return Collections.unmodifiableCollection(detectorMap.values());
    }

    /**
     * Run every active detector and wait for all of them, at most {@code timeout}.
     * Detectors still running at the deadline are cancelled and contribute nothing,
     * as do detectors that throw.
     */
    @Observed(name = "detection.detect_all", contextualName = "detect-all")
    public DetectionOutcome detectAll(QueryResult queryResult, SemanticAnalysis semanticAnalysis,
                                      Duration timeout) {
        List<AnomalyDetector> detectors = activeDetectors.get();
        List<DetectorType> invoked = detectors.stream().map(AnomalyDetector::getDetectorType).toList();
        if (detectors.isEmpty()) {
            return new DetectionOutcome(Collections.emptyList(), invoked, Collections.emptyList());
        }

        // Spans are opened on the calling thread so they nest under the request span
        List<Span> spans = new ArrayList<>();
        List<Callable<List<Anomaly>>> tasks = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            Span span = tracer.nextSpan()
                    .name("detector.detect." + detector.getDetectorType())
                    .tag("detector.type", detector.getDetectorType().name())
                    .tag("query.rows", String.valueOf(queryResult.rowCount()))
                    .start();
            spans.add(span);
            tasks.add(() -> runDetector(detector, span, queryResult, semanticAnalysis));
        }

        List<Future<List<Anomaly>>> futures;
        try {
            futures = executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Detection interrupted before detectors completed");
            spans.forEach(Span::end);
            List<String> failed = detectors.stream().map(d -> d.getDetectorType().getLabel()).toList();
            return new DetectionOutcome(Collections.emptyList(), invoked, failed);
        }

        List<Anomaly> anomalies = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            AnomalyDetector detector = detectors.get(i);
            String label = detector.getDetectorType().getLabel();
            try {
                List<Anomaly> found = futures.get(i).get();
                if (found != null) {
                    anomalies.addAll(found);
                }
                log.debug("{} detector found {} anomalies", label, found == null ? 0 : found.size());
            } catch (CancellationException e) {
                // Cancelled by invokeAll at the deadline. The task may not have reached its finally.
                spans.get(i).tag("detector.timeout", "true").end();
                metricsConfig.recordDetectorFailure(label, "timeout");
                log.warn("{} detector did not finish within {} and was cancelled", label, timeout);
                failed.add(label);
            } catch (ExecutionException e) {
                metricsConfig.recordDetectorFailure(label, "error");
                log.error("{} detector failed: {}", label, e.getCause().getMessage(), e.getCause());
                failed.add(label);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed.add(label);
            }
        }

        return new DetectionOutcome(anomalies, invoked, failed);
    }

    private List<Anomaly> runDetector(AnomalyDetector detector, Span span,
                                      QueryResult queryResult, SemanticAnalysis semanticAnalysis) {
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<Anomaly> found = detector.detect(queryResult, semanticAnalysis);
            span.tag("detector.anomalies", String.valueOf(found == null ? 0 : found.size()));
            return found;
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static boolean isEnabled(DetectorType type, AnomalyConfiguration config) {
        return switch (type) {
            case STATISTICAL -> config.isEnableStatisticalDetection();
            case TEMPORAL -> config.isEnableTemporalDetection();
            case PATTERN -> config.isEnablePatternDetection();
            case BUSINESS_RULE -> config.isEnableBusinessRuleDetection();
        };
    }
}
