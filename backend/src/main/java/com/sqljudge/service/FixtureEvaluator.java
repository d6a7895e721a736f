package com.sqljudge.service;

import com.sqljudge.dto.Fixture;
import com.sqljudge.dto.FixtureVerdict;
import com.sqljudge.dto.SchemaDefinition;
import com.sqljudge.exception.SchemaException;
import com.sqljudge.store.EphemeralStore;
import com.sqljudge.store.StoreFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Judges one fixture inside its own store. Apart from a schema failure, which belongs to
 * the whole batch, every failure becomes an error verdict for this fixture.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FixtureEvaluator {

    private final StoreFactory storeFactory;
    private final SchemaMaterializer schemaMaterializer;
    private final FixtureLoader fixtureLoader;
    private final QueryRunner queryRunner;
    private final ResultNormalizer normalizer;
    private final ResultComparator comparator;

    public FixtureVerdict evaluate(String query, SchemaDefinition schema, Fixture fixture) {
        long start = System.currentTimeMillis();

        try (EphemeralStore store = storeFactory.open()) {
            // 1. Create the declared tables
            schemaMaterializer.materialize(store, schema);

            // 2. Load this fixture's rows
            fixtureLoader.load(store, fixture.getInputData());

            // 3. Run the candidate query
            List<Map<String, Object>> actual = normalizer.normalize(queryRunner.run(store, query));

            // 4. Compare against the expected rows
            boolean passed = comparator.matches(fixture.getExpectedOutput(), actual);

            log.debug("Fixture '{}' {} in {} ms", fixture.getName(),
                    passed ? "passed" : "failed", System.currentTimeMillis() - start);
            return FixtureVerdict.compared(fixture, passed, actual);
        } catch (SchemaException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Fixture '{}' errored: {}", fixture.getName(), e.getMessage());
            return FixtureVerdict.errored(fixture, describe(e));
        }
    }

    static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
