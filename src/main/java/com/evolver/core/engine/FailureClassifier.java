package com.evolver.core.engine;

import com.evolver.sandbox.PromotionManager;

import java.util.Set;

import static com.evolver.core.patch.PatchReasons.*;
import static com.evolver.core.validation.ValidationReasons.*;

/**
 * Decides which failures get a correction objective. Anything not listed is terminal
 * for the current attempt.
 */
public final class FailureClassifier {

    private static final Set<String> CORRECTABLE = Set.of(
            BLOCK_NOT_FOUND,
            INVALID_PATCH_PATH,
            INVALID_PATCH_INSTRUCTION,
            INVALID_MATCH_PATTERN,
            PATCH_IO_ERROR,
            UNKNOWN_VALIDATION_STEP,
            SYNTAX_VALIDATION_FAILED,
            SYNTAX_VALIDATION_FAILED + "_IN_SANDBOX",
            JSON_SYNTAX_VALIDATION_FAILED,
            JSON_SYNTAX_VALIDATION_FAILED + "_IN_SANDBOX",
            PYTEST_FAILURE,
            PYTEST_FAILURE + "_IN_SANDBOX",
            PYTEST_NEW_FILE_FAILED,
            NO_NEW_TEST_FILE_PATCH,
            TEST_FILE_NOT_FOUND,
            FILE_EXISTENCE_CHECK_FAILED,
            PromotionManager.PROMOTION_FAILED,
            CycleReasons.COMMIT_FAILED_POST_SANITY
    );

    private FailureClassifier() {}

    public static boolean isCorrectable(String reasonCode) {
        if (reasonCode == null) {
            return false;
        }
        return CORRECTABLE.contains(reasonCode) || reasonCode.startsWith(CycleReasons.REGRESSION_PREFIX);
    }

    /** Test-related failures get the test-fix flag in their correction objective. */
    public static boolean isTestFailure(String reasonCode) {
        return reasonCode != null
                && (reasonCode.startsWith(PYTEST_FAILURE)
                || reasonCode.startsWith("PYTEST_NEW_FILE")
                || reasonCode.startsWith(CycleReasons.REGRESSION_PREFIX));
    }
}
