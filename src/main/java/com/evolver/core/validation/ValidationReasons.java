package com.evolver.core.validation;

/**
 * Reason codes produced by the validation pipeline and its steps.
 */
public final class ValidationReasons {

    public static final String STRATEGY_SUCCEEDED = "STRATEGY_SUCCEEDED";
    public static final String VALIDATION_SUCCESS_NO_CHANGES = "VALIDATION_SUCCESS_NO_CHANGES";
    public static final String NO_CHANGES_TO_PROMOTE = "NO_CHANGES_TO_PROMOTE";
    public static final String DISCARDED = "DISCARDED";
    public static final String UNKNOWN_VALIDATION_STEP = "UNKNOWN_VALIDATION_STEP";
    public static final String UNKNOWN_STRATEGY = "UNKNOWN_STRATEGY";
    public static final String INVALID_SANITY_CHECK_STEP = "INVALID_SANITY_CHECK_STEP";
    public static final String UNEXPECTED_ERROR_SUFFIX = "_UNEXPECTED_ERROR";

    public static final String SYNTAX_VALIDATION_SUCCESS = "SYNTAX_VALIDATION_SUCCESS";
    public static final String SYNTAX_VALIDATION_FAILED = "SYNTAX_VALIDATION_FAILED";
    public static final String SYNTAX_VALIDATION_SKIPPED = "SYNTAX_VALIDATION_SKIPPED";
    public static final String JSON_SYNTAX_VALIDATION_SUCCESS = "JSON_SYNTAX_VALIDATION_SUCCESS";
    public static final String JSON_SYNTAX_VALIDATION_FAILED = "JSON_SYNTAX_VALIDATION_FAILED";
    public static final String JSON_SYNTAX_VALIDATION_SKIPPED = "JSON_SYNTAX_VALIDATION_SKIPPED";

    public static final String PYTEST_SUCCESS = "PYTEST_SUCCESS";
    public static final String PYTEST_FAILURE = "PYTEST_FAILURE";
    public static final String PYTEST_NEW_FILE_PASSED = "PYTEST_NEW_FILE_PASSED";
    public static final String PYTEST_NEW_FILE_FAILED = "PYTEST_NEW_FILE_FAILED";
    public static final String NO_NEW_TEST_FILE_PATCH = "NO_NEW_TEST_FILE_PATCH";
    public static final String TEST_FILE_NOT_FOUND = "TEST_FILE_NOT_FOUND";

    public static final String FILE_EXISTENCE_CHECK_PASSED = "FILE_EXISTENCE_CHECK_PASSED";
    public static final String FILE_EXISTENCE_CHECK_FAILED = "FILE_EXISTENCE_CHECK_FAILED";

    private ValidationReasons() {}
}
