package com.bireporting.anomaly.engine.condition;

import com.bireporting.anomaly.model.ColumnMetadata;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed rule condition, independent of any particular result. Thread-safe; compile once
 * and bind per query result.
 */
public final class CompiledCondition {

    private final String source;
    private final ConditionNode root;
    private final List<String> identifiers;

    private CompiledCondition(String source, ConditionNode root, List<String> identifiers) {
        this.source = source;
        this.root = root;
        this.identifiers = identifiers;
    }

    /**
     * @throws com.bireporting.anomaly.exception.ConditionSyntaxException if the text is not
     *         a valid condition
     */
    public static CompiledCondition compile(String condition) {
        String text = condition == null ? "" : condition;
        ConditionParser parser = new ConditionParser(text);
        ConditionNode root = parser.parse();
        return new CompiledCondition(text, root, List.copyOf(parser.identifiers()));
    }

    public String getSource() {
        return source;
    }

    /** Column identifiers referenced, in order of first appearance. */
    public List<String> getIdentifiers() {
        return identifiers;
    }

    /**
     * Resolve every identifier against the result's columns.
     *
     * @return empty if any identifier has no matching column
     */
    public Optional<Bound> bind(List<ColumnMetadata> columns) {
        Map<String, Integer> binding = new HashMap<>();
        for (String identifier : identifiers) {
            int index = ColumnResolver.resolve(identifier, columns);
            if (index < 0) return Optional.empty();
            binding.put(identifier, index);
        }

        String primaryColumn = identifiers.isEmpty()
                ? null
                : columns.get(binding.get(identifiers.get(0))).getName();
        return Optional.of(new Bound(binding, primaryColumn));
    }

    /**
     * Condition bound to one result's column layout.
     */
    public final class Bound {

        private final Map<String, Integer> binding;
        private final String primaryColumn;

        private Bound(Map<String, Integer> binding, String primaryColumn) {
            this.binding = binding;
            this.primaryColumn = primaryColumn;
        }

        public boolean matches(List<Object> row) {
            return root.test(row, binding);
        }

        /** Resolved name of the first referenced column, or null for a constant condition. */
        public String getPrimaryColumn() {
            return primaryColumn;
        }
    }
}
