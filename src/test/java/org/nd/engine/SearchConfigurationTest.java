package org.nd.engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.Test;
import org.nd.rules.RuleCatalogue;
import org.nd.rules.RuleName;

public class SearchConfigurationTest {

    @Test
    public void testDefaults() {
        SearchConfiguration configuration = SearchConfiguration.defaults();
        assertEquals(50_000, configuration.getMaxSteps());
        assertEquals(4, configuration.getMaxScopeDepth());
        assertEquals(RuleCatalogue.DEFAULT_PRIORITY, configuration.getRulePriority());
        assertFalse(configuration.getTimeLimit().isPresent());
        assertFalse(configuration.getMaxProofLength().isPresent());
    }

    @Test
    public void testBuilderOverridesAndCopies() {
        SearchConfiguration configuration = SearchConfiguration.builder()
                .maxSteps(10)
                .maxScopeDepth(2)
                .timeLimit(Duration.ofSeconds(3))
                .rulePriority(List.of(RuleName.MODUS_PONENS))
                .maxProofLength(15)
                .build();

        assertEquals(10, configuration.getMaxSteps());
        assertEquals(2, configuration.getMaxScopeDepth());
        assertEquals(Duration.ofSeconds(3), configuration.getTimeLimit().orElseThrow());
        assertEquals(Integer.valueOf(15), configuration.getMaxProofLength().orElseThrow());
        assertEquals(configuration, configuration.toBuilder().build());
        assertTrue(configuration.toString().contains("MPP"));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testZeroStepBudget() {
        SearchConfiguration.builder().maxSteps(0).build();
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testNegativeStepBudget() {
        SearchConfiguration.builder().maxSteps(-5).build();
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testEmptyRulePriority() {
        SearchConfiguration.builder().rulePriority(List.of()).build();
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testDuplicateRule() {
        SearchConfiguration.builder().rulePriority(List.of(RuleName.MODUS_PONENS, RuleName.MODUS_PONENS)).build();
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testAssumptionIsNotARule() {
        SearchConfiguration.builder().rulePriority(List.of(RuleName.ASSUMPTION)).build();
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testNegativeScopeDepth() {
        SearchConfiguration.builder().maxScopeDepth(-1).build();
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testZeroProofLength() {
        SearchConfiguration.builder().maxProofLength(0).build();
    }

    @Test(expected = InvalidConfigurationException.class)
    public void testZeroTimeLimit() {
        SearchConfiguration.builder().timeLimit(Duration.ZERO).build();
    }

    @Test
    public void testInvalidConfigurationIsAnIllegalArgument() {
        assertTrue(new InvalidConfigurationException("x") instanceof IllegalArgumentException);
    }
}
