package com.eisenscript.xml.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DebugFlagsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(DebugFlags.TOKENS_PROPERTY);
        System.clearProperty(DebugFlags.PARSER_PROPERTY);
        DebugFlags.drainCapturedTokens();
        DebugFlags.drainCapturedDiagnostics();
    }

    @Test
    void systemPropertyEnablesTokenDump() throws Exception {
        System.setProperty(DebugFlags.TOKENS_PROPERTY, "true");
        assertTrue(DebugFlags.isTokenDebugEnabled());

        new EisenScriptAstBuilder().parse("debug.es", "3 * { x 1 } box");

        List<String> tokens = DebugFlags.drainCapturedTokens();
        assertFalse(tokens.isEmpty());
        assertTrue(tokens.get(0).startsWith("NUMBER"), tokens.get(0));
        assertTrue(tokens.get(tokens.size() - 2).contains("-> box"), tokens.toString());
        assertEquals(List.of(), DebugFlags.drainCapturedTokens());
    }

    @Test
    void falsePropertyOverridesEnvironment() {
        System.setProperty(DebugFlags.PARSER_PROPERTY, "false");
        assertFalse(DebugFlags.isParserTraceEnabled());
    }
}
