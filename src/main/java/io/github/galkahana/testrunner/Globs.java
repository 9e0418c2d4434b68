package io.github.galkahana.testrunner;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Shell-style glob matching against whole names.
 * <p>
 * Supports {@code *} (any run of characters, dots included), {@code ?} (one character) and
 * bracket classes {@code [abc]}, {@code [a-z]}, {@code [!abc]}. An unterminated {@code [} is
 * taken literally.
 */
public final class Globs {

    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private Globs() {
    }

    public static boolean matches(String name, String glob) {
        return CACHE.computeIfAbsent(glob, g -> Pattern.compile(translate(g), Pattern.DOTALL))
                .matcher(name)
                .matches();
    }

    public static boolean matchesAny(String name, Collection<String> globs) {
        for (String glob : globs) {
            if (matches(name, glob)) return true;
        }
        return false;
    }

    static String translate(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') j++;
                if (j < n && glob.charAt(j) == ']') j++;
                while (j < n && glob.charAt(j) != ']') j++;
                if (j >= n) {
                    regex.append("\\[");
                } else {
                    String body = glob.substring(i, j).replace("\\", "\\\\");
                    i = j + 1;
                    if (body.startsWith("!")) {
                        body = "^" + body.substring(1);
                    } else if (body.startsWith("^")) {
                        body = "\\" + body;
                    }
                    body = body.replace("[", "\\[").replace("]", "\\]").replace("&", "\\&");
                    regex.append('[').append(body).append(']');
                }
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }
}
