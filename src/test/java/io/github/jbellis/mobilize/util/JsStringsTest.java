package io.github.jbellis.mobilize.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsStringsTest {

    @Test
    void testPlainValueUnchanged() {
        assertEquals("'/beacon?a=b'", JsStrings.singleQuoted("/beacon?a=b"));
    }

    @Test
    void testQuotesAndBackslashes() {
        assertEquals("\\'experiment2\\'", JsStrings.escape("'experiment2'"));
        assertEquals("a\\\\b\\\"c", JsStrings.escape("a\\b\"c"));
    }

    @Test
    void testLineTerminators() {
        assertEquals("a\\nb\\rc\\td", JsStrings.escape("a\nb\rc\td"));
        assertEquals("\\u2028\\u2029", JsStrings.escape("\u2028\u2029"));
    }

    @Test
    void testScriptCloseTag() {
        assertEquals("\\u003c/script>", JsStrings.escape("</script>"));
    }
}
