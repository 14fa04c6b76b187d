package org.bpmnbridge.converter.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class XmlTextTest {

    @Test
    void shouldEscapeAllFiveReservedCharacters() {
        assertEquals("&amp;&lt;&gt;&quot;&apos;", XmlText.escape("&<>\"'"));
        assertEquals("", XmlText.escape(null));
    }

    @Test
    void shouldUnescapeEntitiesInOnePass() {
        assertEquals("a < b & c", XmlText.unescape("a &lt; b &amp; c"));
        assertEquals("&lt;", XmlText.unescape("&amp;lt;"));
        assertEquals("line\nbreak", XmlText.unescape("line&#10;break"));
        assertEquals("A", XmlText.unescape("&#x41;"));
    }

    @Test
    void shouldLeaveUnknownReferencesAlone() {
        assertEquals("&nbsp; & &#xFFFFFFF;", XmlText.unescape("&nbsp; & &#xFFFFFFF;"));
    }

    @Test
    void shouldLeaveReferencesToDisallowedCharactersAlone() {
        assertEquals("&#0;", XmlText.unescape("&#0;"));
        assertEquals("&#x1;", XmlText.unescape("&#x1;"));
        assertEquals("&#xD800;", XmlText.unescape("&#xD800;"));
        assertEquals("&#xFFFE;", XmlText.unescape("&#xFFFE;"));
        assertEquals("a\tb", XmlText.unescape("a&#9;b"));
        assertEquals("\uD83D\uDE00", XmlText.unescape("&#x1F600;"));
    }
}
