package rules.impl;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rules.contracts.ConsoleOptions;

/**
 * Option registry for the console. Defaults come from {@code /console.properties} on the
 * classpath when present, otherwise from the built-in values below.
 */
public final class ConsoleOptionsImpl implements ConsoleOptions {

    private static final Logger log = LoggerFactory.getLogger(ConsoleOptionsImpl.class);

    public static final String RESOURCE = "/console.properties";

    public static final String GLYPHS = "Glyphs";
    public static final String COORDINATES = "Coordinates";
    public static final String AUTO_BOARD = "AutoBoard";

    private static final List<String> BOOLEANS = List.of("true", "false");

    private record ConsoleOption(String type, String property, String defaultValue, List<String> allowed) {
        boolean accepts(String value) {
            return allowed.contains(value);
        }
    }

    private final Map<String, ConsoleOption> options = new LinkedHashMap<>();
    private final Map<String, String> values = new LinkedHashMap<>();

    public ConsoleOptionsImpl() {
        this(new Properties());
    }

    public ConsoleOptionsImpl(Properties defaults) {
        options.put(GLYPHS, new ConsoleOption("combo", "console.glyphs", "ascii", List.of("ascii", "unicode")));
        options.put(COORDINATES, new ConsoleOption("check", "console.coordinates", "true", BOOLEANS));
        options.put(AUTO_BOARD, new ConsoleOption("check", "console.autoBoard", "true", BOOLEANS));

        for (Map.Entry<String, ConsoleOption> e : options.entrySet()) {
            ConsoleOption o = e.getValue();
            values.put(e.getKey(), o.defaultValue());
            String configured = defaults.getProperty(o.property());
            if (configured != null && !setOption(e.getKey(), configured.trim())) {
                log.warn("Ignoring {}={} – keeping default {}", o.property(), configured, o.defaultValue());
            }
        }
    }

    /** Builds options from {@link #RESOURCE}, falling back to built-in defaults if it is missing. */
    public static ConsoleOptionsImpl load() {
        Properties props = new Properties();
        try (InputStream in = ConsoleOptionsImpl.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
                log.debug("Loaded console options from {}", RESOURCE);
            } else {
                log.debug("{} not on classpath, using built-in defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        return new ConsoleOptionsImpl(props);
    }

    @Override
    public boolean setOption(String name, String value) {
        ConsoleOption option = options.get(name);
        if (option == null) {
            log.warn("Unknown option: {}", name);
            return false;
        }
        String v = value == null ? "" : value.toLowerCase();
        if (!option.accepts(v)) {
            log.warn("Invalid value '{}' for option {} – allowed {}", value, name, option.allowed());
            return false;
        }
        values.put(name, v);
        return true;
    }

    @Override
    public void printOptions(PrintStream out) {
        for (Map.Entry<String, ConsoleOption> e : options.entrySet()) {
            ConsoleOption o = e.getValue();
            out.print("option name " + e.getKey() + " type " + o.type());
            out.print(" default " + o.defaultValue());
            if (o.type().equals("combo")) {
                for (String a : o.allowed()) out.print(" var " + a);
            }
            out.println(" value " + values.get(e.getKey()));
        }
    }

    @Override
    public String getOptionValue(String name) {
        return values.get(name);
    }

    @Override
    public boolean unicodeGlyphs() {
        return "unicode".equals(values.get(GLYPHS));
    }

    @Override
    public boolean coordinates() {
        return Boolean.parseBoolean(values.get(COORDINATES));
    }

    @Override
    public boolean autoBoard() {
        return Boolean.parseBoolean(values.get(AUTO_BOARD));
    }
}
