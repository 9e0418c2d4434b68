package io.github.galkahana.testrunner.results;

/**
 * Outcome of one executed test, as it appears in the JSON artifacts.
 */
public enum ResultType {
    PASS("PASS"),
    FAILURE("FAIL"),
    SKIP("SKIP");

    private final String label;

    ResultType(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
