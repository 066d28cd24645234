package com.devflow.core.batch;

import com.devflow.core.model.OutputType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutputContentRulesTest {

    @Nested
    @DisplayName("isContentValid")
    class ValidityTests {

        @Test
        void jestOutputNeedsATestMarker() {
            assertTrue(OutputContentRules.isContentValid(OutputType.JEST_OUTPUT, "Tests: 4 passed"));
            assertTrue(OutputContentRules.isContentValid(OutputType.JEST_OUTPUT, "SKIP slow"));
            assertFalse(OutputContentRules.isContentValid(OutputType.JEST_OUTPUT, "hello"));
        }

        @Test
        void emptyDiffIsValid() {
            assertTrue(OutputContentRules.isContentValid(OutputType.DIFF, ""));
            assertTrue(OutputContentRules.isContentValid(OutputType.DIFF, "No changes detected"));
            assertTrue(OutputContentRules.isContentValid(OutputType.DIFF, "@@ -1 +1 @@"));
            assertFalse(OutputContentRules.isContentValid(OutputType.DIFF, "random text"));
        }

        @Test
        void aiContextNeedsHeaderOrLength() {
            assertTrue(OutputContentRules.isContentValid(OutputType.AI_DEBUG_CONTEXT, "AI DEBUG CONTEXT"));
            assertTrue(OutputContentRules.isContentValid(OutputType.AI_DEBUG_CONTEXT, "x".repeat(101)));
            assertFalse(OutputContentRules.isContentValid(OutputType.AI_DEBUG_CONTEXT, "x".repeat(100)));
        }

        @Test
        void prDescriptionNeedsASection() {
            assertTrue(OutputContentRules.isContentValid(OutputType.PR_DESCRIPTION, "## Solution"));
            assertFalse(OutputContentRules.isContentValid(OutputType.PR_DESCRIPTION, "todo"));
            assertFalse(OutputContentRules.isContentValid(OutputType.PR_DESCRIPTION, null));
        }
    }

    @Test
    @DisplayName("write warnings are looser than validity")
    void writeWarnings() {
        assertTrue(OutputContentRules.writeWarning(OutputType.DIFF, "").isEmpty());
        assertEquals("Content may not be valid diff output",
                OutputContentRules.writeWarning(OutputType.DIFF, "hello").orElseThrow());
        assertEquals("Content seems incomplete",
                OutputContentRules.writeWarning(OutputType.PR_DESCRIPTION, "short").orElseThrow());
        assertTrue(OutputContentRules.writeWarning(OutputType.PR_DESCRIPTION, "y".repeat(60)).isEmpty());
        assertTrue(OutputContentRules.writeWarning(OutputType.JEST_OUTPUT, "FAIL app").isEmpty());
    }
}
