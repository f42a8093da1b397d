package com.questrail.osc.pattern;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;

import java.util.Objects;

/**
 * A validated OSC address pattern.
 *
 * <p>{@link #compile(String)} checks syntax up front so that registration
 * fails fast instead of a pattern silently never matching:</p>
 * <ul>
 *   <li>every {@code [} and {@code {} is closed, and no closer is unmatched</li>
 *   <li>no {@code '/'} appears inside a class or an alternative list</li>
 *   <li>classes do not nest inside classes</li>
 * </ul>
 *
 * <p>Literal patterns (no wildcard characters) are matched by string equality.</p>
 */
public final class OscAddressPattern
{
    private final String pattern;
    private final boolean literal;

    private OscAddressPattern(String pattern) {
        this.pattern = pattern;
        this.literal = isLiteral(pattern);
    }

    /**
     * @throws OscException {@link OscErrorCode#PATTERN_ERROR} on invalid syntax
     */
    public static OscAddressPattern compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        validate(pattern);
        return new OscAddressPattern(pattern);
    }

    public boolean matches(String path) {
        Objects.requireNonNull(path, "path");
        return literal ? pattern.equals(path) : OscPatternMatcher.matches(pattern, path);
    }

    public boolean isLiteral() {
        return literal;
    }

    public String pattern() {
        return pattern;
    }

    private static boolean isLiteral(String p) {
        for (int i = 0; i < p.length(); i++) {
            switch (p.charAt(i)) {
                case '?', '*', '[', ']', '{', '}':
                    return false;
                default:
                    break;
            }
        }
        return true;
    }

    private static void validate(String p) {
        int braceDepth = 0;
        for (int i = 0; i < p.length(); i++) {
            char c = p.charAt(i);
            switch (c) {
                case '[': {
                    int close = OscPatternMatcher.classEnd(p, i);
                    if (close < 0) {
                        throw error(p, "unterminated '[' at index " + i);
                    }
                    for (int j = i + 1; j < close; j++) {
                        if (p.charAt(j) == '/') {
                            throw error(p, "'/' inside character class at index " + j);
                        }
                        if (p.charAt(j) == '[') {
                            throw error(p, "nested '[' at index " + j);
                        }
                    }
                    i = close;
                    break;
                }
                case ']':
                    throw error(p, "unmatched ']' at index " + i);
                case '{':
                    braceDepth++;
                    break;
                case '}':
                    if (braceDepth == 0) {
                        throw error(p, "unmatched '}' at index " + i);
                    }
                    braceDepth--;
                    break;
                case '/':
                    if (braceDepth > 0) {
                        throw error(p, "'/' inside alternative list at index " + i);
                    }
                    break;
                default:
                    break;
            }
        }
        if (braceDepth > 0) {
            throw error(p, "unterminated '{'");
        }
    }

    private static OscException error(String pattern, String detail) {
        return new OscException(OscErrorCode.PATTERN_ERROR,
                "Invalid OSC address pattern '" + pattern + "': " + detail);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OscAddressPattern other && pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
