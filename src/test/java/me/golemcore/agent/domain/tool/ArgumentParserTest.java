package me.golemcore.agent.domain.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    void setUp() {
        parser = new ArgumentParser(new ObjectMapper());
    }

    @Test
    void shouldParseFlatObject() {
        Map<String, Object> args = parser.parse("{\"filePath\":\"src/A.java\",\"limit\":20}");

        assertEquals("src/A.java", args.get("filePath"));
        assertEquals(20, args.get("limit"));
    }

    @Test
    void shouldReturnEmptyMapForBlankInput() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("  ").isEmpty());
    }

    @Test
    void shouldUnwrapDoubleEncodedObject() {
        Map<String, Object> args = parser.parse("\"{\\\"command\\\":\\\"ls\\\"}\"");

        assertEquals("ls", args.get("command"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldParseNestedJsonStrings() {
        Map<String, Object> args = parser.parse("{\"options\":\"{\\\"recursive\\\":true}\",\"paths\":\"[\\\"a\\\",\\\"b\\\"]\"}");

        assertEquals(Map.of("recursive", true), args.get("options"));
        assertEquals(List.of("a", "b"), args.get("paths"));
    }

    @Test
    void shouldKeepStringThatOnlyLooksLikeJson() {
        Map<String, Object> args = parser.parse("{\"pattern\":\"{not json}\"}");

        assertEquals("{not json}", args.get("pattern"));
    }

    @Test
    void shouldRejectMalformedJson() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"a\":"));

        assertTrue(ex.getMessage().startsWith("Invalid JSON arguments"));
    }

    @Test
    void shouldRejectNonObjectTopLevel() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("[1,2]"));
    }
}
