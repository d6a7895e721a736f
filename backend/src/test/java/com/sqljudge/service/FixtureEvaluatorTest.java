package com.sqljudge.service;

import com.sqljudge.dto.ColumnSpec;
import com.sqljudge.dto.Fixture;
import com.sqljudge.dto.FixtureVerdict;
import com.sqljudge.dto.SchemaDefinition;
import com.sqljudge.dto.TableSpec;
import com.sqljudge.exception.SchemaException;
import com.sqljudge.store.EphemeralStore;
import com.sqljudge.store.StoreFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.sqljudge.service.EngineHarness.fixture;
import static com.sqljudge.service.EngineHarness.row;
import static com.sqljudge.service.EngineHarness.rows;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class FixtureEvaluatorTest {

    private static final String QUERY = "SELECT id, v FROM t WHERE v > 1.0";

    private final EngineHarness harness = new EngineHarness();
    private final SchemaDefinition schema = EngineHarness.idValueSchema();

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void matchingResultPasses() {
        Fixture fixture = fixture("filters small values", "t",
                rows(row("id", 1, "v", 0.5), row("id", 2, "v", 2.0)),
                rows(row("id", 2, "v", 2.0)));

        FixtureVerdict verdict = harness.fixtureEvaluator.evaluate(QUERY, schema, fixture);

        assertThat(verdict.isPassed()).isTrue();
        assertThat(verdict.getError()).isNull();
        assertThat(verdict.getFixtureName()).isEqualTo("filters small values");
        assertThat(verdict.getActual()).containsExactly(row("id", 2L, "v", 2L));
        assertThat(verdict.getExpected()).isSameAs(fixture.getExpectedOutput());
    }

    @Test
    void emptyInputAndEmptyExpectationPasses() {
        FixtureVerdict verdict = harness.fixtureEvaluator.evaluate(QUERY, schema,
                fixture("empty", "t", rows(), rows()));

        assertThat(verdict.isPassed()).isTrue();
        assertThat(verdict.getActual()).isEmpty();
    }

    @Test
    void extraRowFails() {
        FixtureVerdict verdict = harness.fixtureEvaluator.evaluate("SELECT id FROM t", schema,
                fixture("extra row", "t", rows(row("id", 1, "v", 1.0), row("id", 2, "v", 1.0)), rows(row("id", 1))));

        assertThat(verdict.isPassed()).isFalse();
        assertThat(verdict.getError()).isNull();
        assertThat(verdict.getActual()).hasSize(2);
    }

    @Test
    void queryErrorBecomesErrorVerdict() {
        FixtureVerdict verdict = harness.fixtureEvaluator.evaluate("SELECT missing_column FROM t", schema,
                fixture("bad column", "t", rows(row("id", 1, "v", 1.0)), rows(row("id", 1))));

        assertThat(verdict.isPassed()).isFalse();
        assertThat(verdict.getActual()).isNull();
        assertThat(verdict.getError()).isNotBlank().contains("missing_column");
    }

    @Test
    void loadErrorBecomesErrorVerdict() {
        FixtureVerdict verdict = harness.fixtureEvaluator.evaluate(QUERY, schema,
                fixture("bad value", "t", rows(row("id", "abc", "v", 1.0)), rows()));

        assertThat(verdict.isPassed()).isFalse();
        assertThat(verdict.getActual()).isNull();
        assertThat(verdict.getError()).contains("abc");
    }

    @Test
    void schemaFailurePropagates() {
        SchemaDefinition broken = SchemaDefinition.of(TableSpec.of("t", ColumnSpec.of("id", "NOPE")));

        assertThatThrownBy(() -> harness.fixtureEvaluator.evaluate(QUERY, broken, fixture("any", "t", rows(), rows())))
                .isInstanceOf(SchemaException.class);
    }

    @Test
    void storeIsClosedWhetherTheFixturePassesOrNot() {
        List<EphemeralStore> opened = new ArrayList<>();
        StoreFactory tracking = spy(harness.storeFactory);
        doAnswer(invocation -> {
            EphemeralStore store = harness.storeFactory.open();
            opened.add(store);
            return store;
        }).when(tracking).open();
        FixtureEvaluator evaluator = new FixtureEvaluator(tracking, harness.schemaMaterializer,
                harness.fixtureLoader, harness.queryRunner, harness.normalizer, harness.comparator);

        evaluator.evaluate(QUERY, schema, fixture("ok", "t", rows(), rows()));
        evaluator.evaluate("SELECT broken FROM t", schema, fixture("error", "t", rows(), rows()));

        assertThat(opened).hasSize(2).allMatch(EphemeralStore::isClosed);
    }

    @Test
    void unexpectedFailureBecomesErrorVerdict() {
        StoreFactory failing = spy(harness.storeFactory);
        doThrow(new IllegalStateException()).when(failing).open();
        FixtureEvaluator evaluator = new FixtureEvaluator(failing, harness.schemaMaterializer,
                harness.fixtureLoader, harness.queryRunner, harness.normalizer, harness.comparator);

        FixtureVerdict verdict = evaluator.evaluate(QUERY, schema, fixture("boom", "t", rows(), rows()));

        assertThat(verdict.isPassed()).isFalse();
        assertThat(verdict.getError()).isEqualTo(IllegalStateException.class.getName());
    }
}
