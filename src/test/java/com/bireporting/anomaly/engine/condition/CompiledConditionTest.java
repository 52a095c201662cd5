package com.bireporting.anomaly.engine.condition;

import com.bireporting.anomaly.exception.ConditionSyntaxException;
import com.bireporting.anomaly.model.ColumnMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.bireporting.anomaly.testutil.TestDataFactory.column;
import static com.bireporting.anomaly.testutil.TestDataFactory.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompiledConditionTest {

    private static final List<ColumnMetadata> COLUMNS = List.of(
            column("Region", "nvarchar(50)"),
            column("TotalRevenue", "decimal(18,2)"),
            column("DepositAmount", "money"));

    private static CompiledCondition.Bound bind(String condition) {
        return CompiledCondition.compile(condition).bind(COLUMNS).orElseThrow();
    }

    @Test
    void simpleComparison_resolvesByContainment() {
        CompiledCondition.Bound bound = bind("revenue < 0");

        assertThat(bound.getPrimaryColumn()).isEqualTo("TotalRevenue");
        assertThat(bound.matches(row("North", -5.0, 10))).isTrue();
        assertThat(bound.matches(row("North", 5.0, 10))).isFalse();
    }

    @Test
    void andWithStringInequality() {
        CompiledCondition.Bound bound = bind("revenue < 0 AND region != 'TEST'");

        assertThat(bound.matches(row("North", -1, 0))).isTrue();
        assertThat(bound.matches(row("TEST", -1, 0))).isFalse();
        assertThat(bound.matches(row("test", -1, 0))).isFalse();
    }

    @Test
    void andBindsTighterThanOr() {
        CompiledCondition.Bound bound = bind("region = 'North' OR revenue > 100 AND deposit > 100");

        assertThat(bound.matches(row("North", 0, 0))).isTrue();
        assertThat(bound.matches(row("South", 500, 0))).isFalse();
        assertThat(bound.matches(row("South", 500, 500))).isTrue();
    }

    @Test
    void parenthesesAndNot() {
        CompiledCondition.Bound bound = bind("NOT (revenue > 5 OR deposit > 5)");

        assertThat(bound.matches(row("x", 1, 1))).isTrue();
        assertThat(bound.matches(row("x", 10, 1))).isFalse();
    }

    @Test
    void symbolicOperators() {
        CompiledCondition.Bound bound = bind("!(revenue >= 10) && (deposit == 3 || deposit <> 3)");

        assertThat(bound.matches(row("x", 9, 3))).isTrue();
        assertThat(bound.matches(row("x", 10, 3))).isFalse();
    }

    @Test
    void keywordsAreCaseInsensitive() {
        CompiledCondition.Bound bound = bind("revenue < 0 and not deposit > 5");

        assertThat(bound.matches(row("x", -1, 1))).isTrue();
        assertThat(bound.matches(row("x", -1, 6))).isFalse();
    }

    @Test
    void nullChecks() {
        CompiledCondition.Bound isNull = bind("revenue IS NULL");
        CompiledCondition.Bound isNotNull = bind("revenue is not null");
        CompiledCondition.Bound equalsNull = bind("revenue = NULL");

        assertThat(isNull.matches(row("x", null, 1))).isTrue();
        assertThat(isNull.matches(row("x", 3, 1))).isFalse();
        assertThat(isNotNull.matches(row("x", 3, 1))).isTrue();
        assertThat(equalsNull.matches(row("x", null, 1))).isTrue();
    }

    @Test
    void orderingAgainstNull_isFalse() {
        CompiledCondition.Bound bound = bind("revenue < 0");

        assertThat(bound.matches(row("x", null, 1))).isFalse();
    }

    @Test
    void orderingAgainstNonNumericText_isFalse() {
        CompiledCondition.Bound negative = bind("revenue < 0");
        CompiledCondition.Bound large = bind("deposit > 10000");

        assertThat(negative.matches(row("x", "", 0))).isFalse();
        assertThat(negative.matches(row("x", "(n/a)", 0))).isFalse();
        assertThat(large.matches(row("x", 0, "N/A"))).isFalse();
        assertThat(large.matches(row("x", 0, "pending"))).isFalse();
        assertThat(large.matches(row("x", 0, "20000"))).isTrue();
    }

    @Test
    void equalityAgainstNonNumericText_usesStringComparison() {
        assertThat(bind("deposit != 0").matches(row("x", 0, "N/A"))).isTrue();
        assertThat(bind("deposit = 0").matches(row("x", 0, "N/A"))).isFalse();
    }

    @Test
    void missingTrailingCell_isTreatedAsNull() {
        CompiledCondition.Bound bound = bind("deposit IS NULL");

        assertThat(bound.matches(row("x", 1))).isTrue();
    }

    @Test
    void numericStrings_compareNumerically() {
        CompiledCondition.Bound bound = bind("revenue > 9");

        // "15" > "9" is false lexically, true numerically
        assertThat(bound.matches(row("x", "15", 0))).isTrue();
    }

    @Test
    void stringEquality_isCaseInsensitive() {
        CompiledCondition.Bound bound = bind("region = \"north\"");

        assertThat(bound.matches(row("North", 0, 0))).isTrue();
    }

    @Test
    void doubledQuoteInsideLiteral() {
        List<ColumnMetadata> columns = List.of(column("Name", "varchar"));
        CompiledCondition.Bound bound = CompiledCondition.compile("name = 'O''Brien'")
                .bind(columns).orElseThrow();

        assertThat(bound.matches(row("O'Brien"))).isTrue();
    }

    @Test
    void bracketedIdentifier_allowsSpaces() {
        List<ColumnMetadata> columns = List.of(column("Total Revenue", "decimal"));
        CompiledCondition.Bound bound = CompiledCondition.compile("[Total Revenue] < 0")
                .bind(columns).orElseThrow();

        assertThat(bound.getPrimaryColumn()).isEqualTo("Total Revenue");
        assertThat(bound.matches(row(-3))).isTrue();
    }

    @Test
    void exactNameWinsOverContainment() {
        List<ColumnMetadata> columns = List.of(column("RevenueGrowth", "float"), column("revenue", "float"));

        assertThat(ColumnResolver.resolve("Revenue", columns)).isEqualTo(1);
        assertThat(ColumnResolver.resolve("growth", columns)).isEqualTo(0);
        assertThat(ColumnResolver.resolve("margin", columns)).isEqualTo(-1);
    }

    @Test
    void unresolvedIdentifier_bindIsEmpty() {
        CompiledCondition condition = CompiledCondition.compile("margin < 0 OR revenue < 0");

        assertThat(condition.getIdentifiers()).containsExactly("margin", "revenue");
        assertThat(condition.bind(COLUMNS)).isEmpty();
    }

    @Test
    void constantCondition_hasNoPrimaryColumn() {
        CompiledCondition.Bound bound = bind("1 = 1");

        assertThat(bound.getPrimaryColumn()).isNull();
        assertThat(bound.matches(row("x", 0, 0))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "", "   ", "revenue <", "revenue 0", "(revenue > 1", "revenue > 'open",
            "revenue > 1 deposit", "revenue IS 5", "revenue & 1", "revenue > [unclosed", "revenue # 1"
    })
    void malformedConditions_areRejected(String condition) {
        assertThatThrownBy(() -> CompiledCondition.compile(condition))
                .isInstanceOf(ConditionSyntaxException.class);
    }

    @Test
    void syntaxError_reportsPosition() {
        assertThatThrownBy(() -> CompiledCondition.compile("revenue < "))
                .isInstanceOf(ConditionSyntaxException.class)
                .hasMessageContaining("Unexpected end of condition")
                .satisfies(e -> {
                    ConditionSyntaxException ex = (ConditionSyntaxException) e;
                    assertThat(ex.getPosition()).isEqualTo(10);
                    assertThat(ex.getCondition()).isEqualTo("revenue < ");
                });
    }

    @Test
    void nullCondition_isRejectedAsEmpty() {
        assertThatThrownBy(() -> CompiledCondition.compile(null))
                .isInstanceOf(ConditionSyntaxException.class)
                .hasMessageContaining("Empty condition");
    }
}
