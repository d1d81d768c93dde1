package org.logic.grading;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GradingResultTest {

    @Test
    void factoriesSetVerdictAndScore() {
        GradingResult correct = GradingResult.correct("ok", "perché sì", Map.of("k", 1));
        assertTrue(correct.isCorrect());
        assertEquals(1.0, correct.getScore());
        assertEquals(Map.of("k", 1), correct.getDetails());

        GradingResult partial = GradingResult.partial(0.25, "quasi", null, null);
        assertFalse(partial.isCorrect());
        assertEquals(0.25, partial.getScore());
        assertTrue(partial.getDetails().isEmpty());

        GradingResult failure = GradingResult.failure("errore");
        assertFalse(failure.isCorrect());
        assertEquals(0.0, failure.getScore());
        assertNull(failure.getExplanation());
    }

    @Test
    void blankExplanationIsDropped() {
        assertNull(GradingResult.incorrect("no", "  ", null).getExplanation());
    }

    @Test
    void rejectsInconsistentResults() {
        assertThrows(IllegalArgumentException.class, () -> new GradingResult(false, 1.5, "x", null, null));
        assertThrows(IllegalArgumentException.class, () -> new GradingResult(false, -0.1, "x", null, null));
        assertThrows(IllegalArgumentException.class, () -> new GradingResult(true, 0.5, "x", null, null));
        assertThrows(IllegalArgumentException.class, () -> new GradingResult(false, 0.0, " ", null, null));
    }

    @Test
    void exerciseTypesCarryMetadata() {
        assertEquals(9, ExerciseType.values().length);
        assertTrue(ExerciseType.MULTIPLE_CHOICE.supportsPartialCredit());
        assertFalse(ExerciseType.EQUIVALENCE.supportsPartialCredit());
        assertTrue(ExerciseType.TRUTH_TABLE.isInteractive());
        assertEquals(ExerciseDifficulty.EASY, ExerciseType.MULTIPLE_CHOICE.getDifficulty());
    }
}
