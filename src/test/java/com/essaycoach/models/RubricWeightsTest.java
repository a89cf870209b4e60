package com.essaycoach.models;

import com.essaycoach.TestData;
import com.essaycoach.errors.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RubricWeightsTest {

    @Test
    void testWeightsMustSumToOne() {
        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> new RubricWeights(0.3, 0.3, 0.3, 20, 500));
        assertTrue(error.getMessage().contains("sum to 1.0"));
    }

    @Test
    void testNegativeWeightRejected() {
        assertThrows(ConfigurationException.class, () -> new RubricWeights(-0.1, 0.7, 0.4, 20, 500));
        assertThrows(ConfigurationException.class, () -> new RubricWeights(Double.NaN, 0.6, 0.4, 20, 500));
    }

    @Test
    void testWordBoundsValidated() {
        assertThrows(ConfigurationException.class, () -> new RubricWeights(0.3, 0.3, 0.4, -1, 500));
        assertThrows(ConfigurationException.class, () -> new RubricWeights(0.3, 0.3, 0.4, 100, 50));
    }

    @Test
    void testDefaults() {
        RubricWeights weights = RubricWeights.defaults();
        assertEquals(0.3, weights.weightFor(Dimension.GRAMMAR));
        assertEquals(0.3, weights.weightFor(Dimension.VOCABULARY));
        assertEquals(0.4, weights.weightFor(Dimension.CONTENT));
        assertTrue(weights.acceptsWordCount(20));
        assertTrue(weights.acceptsWordCount(500));
        assertFalse(weights.acceptsWordCount(19));
        assertFalse(weights.acceptsWordCount(501));
    }

    @Test
    void testForPromptUsesTierWordRange() {
        RubricWeights weights = RubricWeights.defaults().forPrompt(TestData.familyPrompt());
        assertEquals(GradeTier.PRIMARY_SCHOOL.getMinWords(), weights.minWords());
        assertEquals(GradeTier.PRIMARY_SCHOOL.getMaxWords(), weights.maxWords());
        assertEquals(0.4, weights.content());
    }
}
