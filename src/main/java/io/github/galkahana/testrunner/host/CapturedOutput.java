package io.github.galkahana.testrunner.host;

/**
 * Text written to stdout and stderr while a capture was active.
 *
 * @param out captured standard output
 * @param err captured standard error
 */
public record CapturedOutput(String out, String err) {

    public static final CapturedOutput EMPTY = new CapturedOutput("", "");
}
