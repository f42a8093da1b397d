package com.questrail.osc.pattern;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OscPatternMatcherTest
 * -----------------------------------------------------------------------------
 * Wildcard semantics of OSC address patterns, most importantly that no
 * wildcard ever consumes a {@code '/'}.
 */
final class OscPatternMatcherTest
{
    @Test
    void literalPatternsMatchExactly()
    {
        assertTrue(OscPatternMatcher.matches("/test", "/test"));
        assertFalse(OscPatternMatcher.matches("/test", "/tests"));
        assertFalse(OscPatternMatcher.matches("/Test", "/test"));
        assertTrue(OscPatternMatcher.matches("", ""));
        assertFalse(OscPatternMatcher.matches("", "/"));
    }

    @Test
    void questionMarkMatchesOneNonSlashCharacter()
    {
        assertTrue(OscPatternMatcher.matches("/te?t", "/text"));
        assertFalse(OscPatternMatcher.matches("/te?t", "/te/t"));
        assertFalse(OscPatternMatcher.matches("/te?t", "/tet"));
    }

    @Test
    void starMatchesAnyRunWithinOneSegment()
    {
        assertTrue(OscPatternMatcher.matches("/test*", "/testABC"));
        assertTrue(OscPatternMatcher.matches("/test*", "/test"));
        assertTrue(OscPatternMatcher.matches("/*", "/anything"));
        assertFalse(OscPatternMatcher.matches("/*", "/a/b"));
        assertTrue(OscPatternMatcher.matches("/a/*/c", "/a/bbb/c"));
        assertFalse(OscPatternMatcher.matches("/a/*/c", "/a/b/b/c"));
        assertTrue(OscPatternMatcher.matches("/*b*d", "/abcd"));
        assertTrue(OscPatternMatcher.matches("/a**b", "/axxb"));
        assertFalse(OscPatternMatcher.matches("/test*", "/test/x"));
    }

    @Test
    void characterClassesAndRanges()
    {
        assertFalse(OscPatternMatcher.matches("/t[a-z]st", "/t9st"));
        assertTrue(OscPatternMatcher.matches("/t[a-z]st", "/test"));
        assertTrue(OscPatternMatcher.matches("/t[!a-z]st", "/t9st"));
        assertTrue(OscPatternMatcher.matches("/t[^a-z]st", "/t9st"));
        assertFalse(OscPatternMatcher.matches("/t[!a-z]st", "/test"));
        assertTrue(OscPatternMatcher.matches("/ch[123]", "/ch2"));
        assertFalse(OscPatternMatcher.matches("/ch[123]", "/ch4"));
        assertTrue(OscPatternMatcher.matches("/t[e*?]st", "/t*st"));
        assertTrue(OscPatternMatcher.matches("/[a-z]*/[0-9]/{on,off}", "/abc/1/on"));
    }

    @Test
    void classesNeverMatchSlash()
    {
        assertFalse(OscPatternMatcher.matches("/a[!b]c", "/a/c"));
        assertFalse(OscPatternMatcher.matches("/a[!b]c", "/ac"));
    }

    @Test
    void emptyClassMatchesNothing()
    {
        assertFalse(OscPatternMatcher.matches("/t[]st", "/test"));
    }

    @Test
    void unterminatedClassIsANonMatch()
    {
        assertFalse(OscPatternMatcher.matches("/test/[abc", "/test/a"));
        assertFalse(OscPatternMatcher.matches("/test/[abc", "/test/[abc"));
    }

    @Test
    void alternativesMatchAnyListedSegmentPart()
    {
        assertTrue(OscPatternMatcher.matches("/{foo,bar}", "/bar"));
        assertTrue(OscPatternMatcher.matches("/{foo,bar}", "/foo"));
        assertFalse(OscPatternMatcher.matches("/{foo,bar}", "/baz"));
        assertTrue(OscPatternMatcher.matches("/mix{er,}/gain", "/mix/gain"));
        assertTrue(OscPatternMatcher.matches("/mix{er,}/gain", "/mixer/gain"));
        assertTrue(OscPatternMatcher.matches("/{a{b,c},d}", "/ac"));
        assertTrue(OscPatternMatcher.matches("/{a*,z}x", "/abcx"));
        assertTrue(OscPatternMatcher.matches("/{[0-9],x}", "/7"));
        assertFalse(OscPatternMatcher.matches("/{foo,bar", "/foo"));
    }

    @Test
    void recursionIsBounded()
    {
        assertTrue(OscPatternMatcher.matches("/*x", "/aax"));
        assertFalse(OscPatternMatcher.matches("/*x", "/aax", 0));
        assertFalse(OscPatternMatcher.matches("/*a*a*a*a*a*a*b", "/aaaaaaaaaaaaaaaaaaaaaaaaaaaaaa", 4));
    }

    @Test
    void classEndAndBraceEndLocateClosers()
    {
        assertEquals(4, OscPatternMatcher.classEnd("/[ab]", 1));
        assertEquals(-1, OscPatternMatcher.classEnd("/[ab", 1));
        assertEquals(8, OscPatternMatcher.braceEnd("/{a,{b}}", 1) + 1);
        assertEquals(-1, OscPatternMatcher.braceEnd("/{a,[}]", 1));
    }
}
