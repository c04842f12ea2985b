package com.dpmfinder.common.selection;

import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A single label condition: {@code key=value} (exact) or {@code key=~regex}.
 *
 * <p>Regexes are fully anchored, as in PromQL matchers. A label the metric does not
 * carry is matched as the empty string.
 */
public final class LabelMatcher {

    private final String key;
    private final String value;
    private final Pattern pattern;

    private LabelMatcher(String key, String value, Pattern pattern) {
        this.key     = key;
        this.value   = value;
        this.pattern = pattern;
    }

    public static LabelMatcher parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("label filter must not be blank");
        }
        String expr = expression.trim();
        int eq = expr.indexOf('=');
        if (eq <= 0) {
            throw new IllegalArgumentException(
                "Invalid label filter '" + expression + "', expected key=value or key=~regex");
        }
        String key = expr.substring(0, eq).trim();
        if (eq + 1 < expr.length() && expr.charAt(eq + 1) == '~') {
            String regex = stripQuotes(expr.substring(eq + 2).trim());
            try {
                return new LabelMatcher(key, regex, Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid regex in label filter '" + expression + "'", e);
            }
        }
        return new LabelMatcher(key, stripQuotes(expr.substring(eq + 1).trim()), null);
    }

    public boolean matches(Map<String, String> labels) {
        String actual = labels.getOrDefault(key, "");
        return pattern != null ? pattern.matcher(actual).matches() : value.equals(actual);
    }

    public String key() { return key; }

    public boolean isRegex() { return pattern != null; }

    @Override
    public String toString() {
        return key + (pattern != null ? "=~" : "=") + value;
    }

    private static String stripQuotes(String s) {
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }
}
