package com.bireporting.anomaly.engine.condition;

import com.bireporting.anomaly.engine.CellValues;

import java.util.List;
import java.util.Map;

/**
 * Node of a compiled condition tree. Evaluated per row against a column binding that
 * maps every referenced identifier to a column index.
 */
interface ConditionNode {

    boolean test(List<Object> row, Map<String, Integer> binding);

    record Or(ConditionNode left, ConditionNode right) implements ConditionNode {
        @Override
        public boolean test(List<Object> row, Map<String, Integer> binding) {
            return left.test(row, binding) || right.test(row, binding);
        }
    }

    record And(ConditionNode left, ConditionNode right) implements ConditionNode {
        @Override
        public boolean test(List<Object> row, Map<String, Integer> binding) {
            return left.test(row, binding) && right.test(row, binding);
        }
    }

    record Not(ConditionNode operand) implements ConditionNode {
        @Override
        public boolean test(List<Object> row, Map<String, Integer> binding) {
            return !operand.test(row, binding);
        }
    }

    record NullCheck(Operand operand, boolean negated) implements ConditionNode {
        @Override
        public boolean test(List<Object> row, Map<String, Integer> binding) {
            boolean isNull = operand.value(row, binding) == null;
            return negated != isNull;
        }
    }

    record Comparison(Operand left, ComparisonOperator operator, Operand right) implements ConditionNode {
        @Override
        public boolean test(List<Object> row, Map<String, Integer> binding) {
            Object l = left.value(row, binding);
            Object r = right.value(row, binding);

            if (l == null || r == null) {
                return switch (operator) {
                    case EQ -> l == null && r == null;
                    case NE -> !(l == null && r == null);
                    default -> false;
                };
            }

            int cmp;
            Double ln = CellValues.toDouble(l);
            Double rn = CellValues.toDouble(r);
            if (ln != null && rn != null) {
                cmp = Double.compare(ln, rn);
            } else if ((ln != null || rn != null) && operator.isOrdering()) {
                // text such as "N/A" has no place on a numeric scale
                return false;
            } else {
                cmp = String.CASE_INSENSITIVE_ORDER.compare(l.toString(), r.toString());
            }
            return operator.holds(cmp);
        }
    }

    /** Value source inside a comparison. */
    interface Operand {
        Object value(List<Object> row, Map<String, Integer> binding);
    }

    record ColumnRef(String identifier) implements Operand {
        @Override
        public Object value(List<Object> row, Map<String, Integer> binding) {
            Integer index = binding.get(identifier);
            if (index == null || row == null || index >= row.size()) return null;
            return row.get(index);
        }
    }

    record Literal(Object constant) implements Operand {
        @Override
        public Object value(List<Object> row, Map<String, Integer> binding) {
            return constant;
        }
    }

    enum ComparisonOperator {
        LT, LE, GT, GE, EQ, NE;

        static ComparisonOperator fromSymbol(String symbol) {
            return switch (symbol) {
                case "<" -> LT;
                case "<=" -> LE;
                case ">" -> GT;
                case ">=" -> GE;
                case "=", "==" -> EQ;
                case "!=", "<>" -> NE;
                default -> throw new IllegalArgumentException("Unknown operator " + symbol);
            };
        }

        boolean isOrdering() {
            return this != EQ && this != NE;
        }

        boolean holds(int cmp) {
            return switch (this) {
                case LT -> cmp < 0;
                case LE -> cmp <= 0;
                case GT -> cmp > 0;
                case GE -> cmp >= 0;
                case EQ -> cmp == 0;
                case NE -> cmp != 0;
            };
        }
    }
}
