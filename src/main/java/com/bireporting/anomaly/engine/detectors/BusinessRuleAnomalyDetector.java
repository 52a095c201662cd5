package com.bireporting.anomaly.engine.detectors;

import com.bireporting.anomaly.engine.AnomalyDetector;
import com.bireporting.anomaly.engine.DetectorType;
import com.bireporting.anomaly.engine.condition.CompiledCondition;
import com.bireporting.anomaly.model.Anomaly;
import com.bireporting.anomaly.model.AnomalySeverity;
import com.bireporting.anomaly.model.AnomalyType;
import com.bireporting.anomaly.model.BusinessRule;
import com.bireporting.anomaly.model.QueryResult;
import com.bireporting.anomaly.model.SemanticAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Evaluates the configured business rules against every row. A matching row is a violation
 * and yields one BUSINESS_RULE anomaly with the rule's severity.
 *
 * Rules are compiled when set, so a bad condition is rejected at update time and never
 * reaches detection. A rule whose columns are absent from a result is skipped for that result.
 */
@Component
public class BusinessRuleAnomalyDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(BusinessRuleAnomalyDetector.class);

    static final double VIOLATION_CONFIDENCE = 0.9;

    private record CompiledRule(BusinessRule rule, CompiledCondition condition) {}

    private final AtomicReference<List<CompiledRule>> rules = new AtomicReference<>(List.of());

    public BusinessRuleAnomalyDetector() {
        updateRules(defaultRules());
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.BUSINESS_RULE;
    }

    @Override
    public List<Anomaly> detect(QueryResult queryResult, SemanticAnalysis semanticAnalysis) {
        List<Anomaly> anomalies = new ArrayList<>();

        for (CompiledRule compiled : rules.get()) {
            BusinessRule rule = compiled.rule();
            if (!rule.isEnabled()) continue;

            try {
                anomalies.addAll(evaluateRule(compiled, queryResult));
            } catch (Exception e) {
                log.error("Error evaluating business rule {} ({}): {}",
                        rule.getId(), rule.getName(), e.getMessage(), e);
                // Don't let one bad rule block the other rules
            }
        }

        log.debug("Business rule detector found {} anomalies", anomalies.size());
        return anomalies;
    }

    @Override
    public void train(List<QueryResult> historicalData) {
        log.debug("Training business rule detector with {} samples", historicalData.size());
    }

    /**
     * Replace the rule set. Every condition is compiled before anything is swapped in.
     *
     * @throws com.bireporting.anomaly.exception.ConditionSyntaxException if any condition
     *         fails to compile; the current rules stay in effect
     */
    public void updateRules(List<BusinessRule> newRules) {
        List<CompiledRule> compiled = new ArrayList<>();
        for (BusinessRule rule : newRules) {
            compiled.add(new CompiledRule(rule.toBuilder().build(), CompiledCondition.compile(rule.getCondition())));
        }
        rules.set(List.copyOf(compiled));
        log.info("Updated business rules: {} rules", compiled.size());
    }

    public List<BusinessRule> getRules() {
        return rules.get().stream()
                .map(c -> c.rule().toBuilder().build())
                .toList();
    }

    private List<Anomaly> evaluateRule(CompiledRule compiled, QueryResult queryResult) {
        BusinessRule rule = compiled.rule();
        Optional<CompiledCondition.Bound> bound = compiled.condition().bind(queryResult.getColumns());
        if (bound.isEmpty()) {
            log.debug("Business rule {} not applicable: columns {} not in result",
                    rule.getName(), compiled.condition().getIdentifiers());
            return List.of();
        }

        CompiledCondition.Bound condition = bound.get();
        List<Anomaly> anomalies = new ArrayList<>();
        for (int row = 0; row < queryResult.rowCount(); row++) {
            if (!condition.matches(queryResult.getData().get(row))) continue;

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("rule_id", rule.getId());
            metadata.put("rule_name", rule.getName());
            metadata.put("condition", rule.getCondition());

            String column = condition.getPrimaryColumn();
            int columnIndex = column == null ? -1 : indexOf(queryResult, column);

            anomalies.add(Anomaly.builder()
                    .type(AnomalyType.BUSINESS_RULE)
                    .severity(rule.getSeverity() != null ? rule.getSeverity() : AnomalySeverity.MEDIUM)
                    .confidence(VIOLATION_CONFIDENCE)
                    .description("Business rule '" + rule.getName() + "' violated: " + rule.getDescription())
                    .affectedColumn(column)
                    .affectedRows(new ArrayList<>(List.of(row)))
                    .expectedValue(rule.getCondition())
                    .actualValue(columnIndex < 0 ? null : queryResult.cell(row, columnIndex))
                    .detectionMethod("BusinessRule")
                    .metadata(metadata)
                    .build());
        }
        return anomalies;
    }

    private static int indexOf(QueryResult queryResult, String columnName) {
        for (int i = 0; i < queryResult.columnCount(); i++) {
            if (columnName.equals(queryResult.getColumns().get(i).getName())) return i;
        }
        return -1;
    }

    static List<BusinessRule> defaultRules() {
        return List.of(
                BusinessRule.builder()
                        .id("RULE-NEGATIVE-REVENUE")
                        .name("Negative Revenue")
                        .description("Revenue values should not be negative")
                        .condition("revenue < 0")
                        .severity(AnomalySeverity.HIGH)
                        .build(),
                BusinessRule.builder()
                        .id("RULE-EXCESSIVE-DEPOSIT")
                        .name("Excessive Deposit Amount")
                        .description("Single deposit amounts over $10,000 require review")
                        .condition("deposit > 10000")
                        .severity(AnomalySeverity.MEDIUM)
                        .build());
    }
}
