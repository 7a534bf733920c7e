package com.viffx.Pda.Utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Runtime options of the driver.
 *
 * @param traceWidth   minimum width the stack column of a trace line is padded to
 * @param traceEnabled whether the trace is printed at all
 */
public record PdaSettings(int traceWidth, boolean traceEnabled) {
    public static final String RESOURCE = "pda.properties";
    public static final String TRACE_WIDTH = "pda.trace.width";
    public static final String TRACE_ENABLED = "pda.trace.enabled";
    public static final PdaSettings DEFAULTS = new PdaSettings(20, true);

    public PdaSettings {
        if (traceWidth <= 0) throw new IllegalArgumentException(TRACE_WIDTH + " must be positive, got " + traceWidth);
    }

    /**
     * Loads {@value #RESOURCE} from the classpath, then lets system properties of the same name override it.
     */
    public static PdaSettings load() {
        Properties properties = new Properties();
        try (InputStream stream = PdaSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (stream != null) properties.load(stream);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
        for (String key : new String[]{TRACE_WIDTH, TRACE_ENABLED}) {
            String override = System.getProperty(key);
            if (override != null) properties.setProperty(key, override);
        }
        return fromProperties(properties);
    }

    public static PdaSettings fromProperties(Properties properties) {
        String width = properties.getProperty(TRACE_WIDTH);
        String enabled = properties.getProperty(TRACE_ENABLED);

        int traceWidth = DEFAULTS.traceWidth;
        if (width != null) {
            try {
                traceWidth = Integer.parseInt(width.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(TRACE_WIDTH + " is not a number: " + width, e);
            }
        }
        boolean traceEnabled = enabled == null ? DEFAULTS.traceEnabled : Boolean.parseBoolean(enabled.trim());
        return new PdaSettings(traceWidth, traceEnabled);
    }

    public PdaSettings withTraceEnabled(boolean traceEnabled) {
        return new PdaSettings(traceWidth, traceEnabled);
    }
}
