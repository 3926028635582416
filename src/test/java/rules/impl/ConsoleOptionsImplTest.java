package rules.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class ConsoleOptionsImplTest {

    @Test
    void builtInDefaults() {
        ConsoleOptionsImpl opts = new ConsoleOptionsImpl();
        assertFalse(opts.unicodeGlyphs());
        assertTrue(opts.coordinates());
        assertTrue(opts.autoBoard());
        assertEquals("ascii", opts.getOptionValue(ConsoleOptionsImpl.GLYPHS));
    }

    @Test
    void classpathResourceIsLoaded() {
        ConsoleOptionsImpl opts = ConsoleOptionsImpl.load();
        assertEquals("ascii", opts.getOptionValue("Glyphs"));
        assertEquals("true", opts.getOptionValue("Coordinates"));
        assertEquals("true", opts.getOptionValue("AutoBoard"));
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty("console.glyphs", "unicode");
        props.setProperty("console.autoBoard", "false");
        ConsoleOptionsImpl opts = new ConsoleOptionsImpl(props);
        assertTrue(opts.unicodeGlyphs());
        assertFalse(opts.autoBoard());
        assertTrue(opts.coordinates());
    }

    @Test
    void invalidPropertyKeepsDefault() {
        Properties props = new Properties();
        props.setProperty("console.coordinates", "sometimes");
        assertTrue(new ConsoleOptionsImpl(props).coordinates());
    }

    @Test
    void setOptionValidatesNameAndValue() {
        ConsoleOptionsImpl opts = new ConsoleOptionsImpl();
        assertTrue(opts.setOption("Glyphs", "UNICODE"));
        assertTrue(opts.unicodeGlyphs());

        assertFalse(opts.setOption("Glyphs", "emoji"));
        assertTrue(opts.unicodeGlyphs(), "rejected value must not change the option");

        assertFalse(opts.setOption("Hash", "64"));
        assertNull(opts.getOptionValue("Hash"));
    }

    @Test
    void printOptionsListsEveryOption() {
        ConsoleOptionsImpl opts = new ConsoleOptionsImpl();
        opts.setOption("AutoBoard", "false");
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        opts.printOptions(new PrintStream(buf, true, StandardCharsets.UTF_8));
        String text = buf.toString(StandardCharsets.UTF_8);

        assertTrue(text.contains("option name Glyphs type combo default ascii var ascii var unicode value ascii"));
        assertTrue(text.contains("option name Coordinates type check default true value true"));
        assertTrue(text.contains("option name AutoBoard type check default true value false"));
    }
}
