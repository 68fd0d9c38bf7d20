package init;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class Config {

    public static final String RESOURCE_NAME = "validity.properties";
    public static final String PREFIX = "validity.";

    // Basic Config
    public static String logLevel = "INFO";
    public static String resultPath = "";

    // Solver Config
    public static int solverTimeoutMs = 60 * 1000;
    public static boolean trackAssertions = true;
    public static int parallelTimeoutSeconds = 120;

    // Output Config
    public static int prettyPrintWidth = 50;

    /**
     * Classpath resource first, then -Dvalidity.* system properties.
     */
    public static void load() {
        Properties props = new Properties();
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + RESOURCE_NAME, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        apply(props);
    }

    static void apply(Properties props) {
        logLevel = props.getProperty(PREFIX + "logLevel", logLevel);
        resultPath = props.getProperty(PREFIX + "resultPath", resultPath);
        solverTimeoutMs = intValue(props, "solverTimeoutMs", solverTimeoutMs);
        trackAssertions = Boolean.parseBoolean(props.getProperty(PREFIX + "trackAssertions", String.valueOf(trackAssertions)));
        parallelTimeoutSeconds = intValue(props, "parallelTimeoutSeconds", parallelTimeoutSeconds);
        prettyPrintWidth = intValue(props, "prettyPrintWidth", prettyPrintWidth);
    }

    private static int intValue(Properties props, String key, int current) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return current;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad integer for " + PREFIX + key + ": " + raw, e);
        }
    }
}
