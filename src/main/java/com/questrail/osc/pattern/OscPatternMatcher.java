package com.questrail.osc.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * OscPatternMatcher
 * -----------------------------------------------------------------------------
 * Direct recursive matcher for OSC address patterns.
 *
 * <h2>Syntax</h2>
 * <ul>
 *   <li>{@code ?} matches exactly one character other than {@code '/'}</li>
 *   <li>{@code *} matches zero or more characters, none of them {@code '/'}</li>
 *   <li>{@code [abc]}, {@code [a-z]} match one character from the class;
 *       a leading {@code !} or {@code ^} negates it. {@code '/'} never
 *       matches a class and {@code []} matches nothing.</li>
 *   <li>{@code {foo,bar}} matches any one alternative; alternatives may be
 *       empty and may nest</li>
 *   <li>every other character matches itself, case-sensitively</li>
 * </ul>
 *
 * <p>A match requires both pattern and path to be consumed completely. An
 * unterminated {@code [} or {@code {} never matches.</p>
 *
 * <h2>Cost</h2>
 * <p>Backtracking over {@code *} and {@code {}} is exponential in the worst
 * case. OSC addresses are short, so this is accepted; recursion is bounded
 * and a pattern that exceeds the bound simply does not match.</p>
 */
public final class OscPatternMatcher
{
    public static final int DEFAULT_MAX_DEPTH = 256;

    private OscPatternMatcher() {}

    public static boolean matches(String pattern, String path)
    {
        return matches(pattern, path, DEFAULT_MAX_DEPTH);
    }

    public static boolean matches(String pattern, String path, int maxDepth)
    {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(path, "path");
        return match(pattern, 0, path, 0, 0, maxDepth);
    }

    private static boolean match(String p, int pi, String s, int si, int depth, int maxDepth)
    {
        if (depth > maxDepth) {
            return false;
        }

        while (pi < p.length()) {
            char c = p.charAt(pi);
            switch (c) {
                case '?':
                    if (si >= s.length() || s.charAt(si) == '/') {
                        return false;
                    }
                    pi++;
                    si++;
                    break;

                case '*': {
                    while (pi < p.length() && p.charAt(pi) == '*') {
                        pi++;
                    }
                    if (pi == p.length()) {
                        return s.indexOf('/', si) < 0;
                    }
                    for (int k = si; ; k++) {
                        if (match(p, pi, s, k, depth + 1, maxDepth)) {
                            return true;
                        }
                        if (k >= s.length() || s.charAt(k) == '/') {
                            return false;
                        }
                    }
                }

                case '[': {
                    int close = classEnd(p, pi);
                    if (close < 0 || si >= s.length()) {
                        return false;
                    }
                    char ch = s.charAt(si);
                    if (ch == '/' || !classMatches(p, pi + 1, close, ch)) {
                        return false;
                    }
                    pi = close + 1;
                    si++;
                    break;
                }

                case '{': {
                    int close = braceEnd(p, pi);
                    if (close < 0) {
                        return false;
                    }
                    String rest = p.substring(close + 1);
                    for (String alternative : alternatives(p, pi + 1, close)) {
                        if (match(alternative + rest, 0, s, si, depth + 1, maxDepth)) {
                            return true;
                        }
                    }
                    return false;
                }

                default:
                    if (si >= s.length() || s.charAt(si) != c) {
                        return false;
                    }
                    pi++;
                    si++;
            }
        }

        return si == s.length();
    }

    /**
     * Index of the {@code ']'} closing the class opened at {@code open}, or -1.
     * A {@code ']'} directly after {@code '['} closes an empty class.
     */
    static int classEnd(String p, int open)
    {
        return p.indexOf(']', open + 1);
    }

    /**
     * Index of the {@code '}'} closing the list opened at {@code open}, or -1.
     * Nested braces count; brackets inside classes are skipped.
     */
    static int braceEnd(String p, int open)
    {
        int depth = 0;
        for (int i = open; i < p.length(); i++) {
            char c = p.charAt(i);
            if (c == '[') {
                int close = classEnd(p, i);
                if (close < 0) {
                    return -1;
                }
                i = close;
            }
            else if (c == '{') {
                depth++;
            }
            else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static boolean classMatches(String p, int from, int to, char ch)
    {
        boolean negate = false;
        if (from < to && (p.charAt(from) == '!' || p.charAt(from) == '^')) {
            negate = true;
            from++;
        }

        boolean found = false;
        for (int i = from; i < to && !found; i++) {
            char c = p.charAt(i);
            if (i + 2 < to && p.charAt(i + 1) == '-') {
                char hi = p.charAt(i + 2);
                found = ch >= c && ch <= hi;
                i += 2;
            }
            else {
                found = ch == c;
            }
        }
        return found != negate;
    }

    /** Splits {@code p[from, to)} on commas that are not nested in braces or classes. */
    private static List<String> alternatives(String p, int from, int to)
    {
        List<String> out = new ArrayList<>();
        int depth = 0;
        int start = from;
        for (int i = from; i < to; i++) {
            char c = p.charAt(i);
            if (c == '[') {
                i = classEnd(p, i);
            }
            else if (c == '{') {
                depth++;
            }
            else if (c == '}') {
                depth--;
            }
            else if (c == ',' && depth == 0) {
                out.add(p.substring(start, i));
                start = i + 1;
            }
        }
        out.add(p.substring(start, to));
        return out;
    }
}
