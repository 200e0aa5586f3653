package org.polyfront.core;

import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.schema.CoreSchema;

import java.io.InputStream;
import java.util.Map;

/**
 * FrontendOptions holds the configuration surface of the pipeline plus the
 * unit being processed.
 * <p>
 * The flags are read once when a run starts: {@link FrontendContext} keeps a
 * clone, so changing an options object afterwards does not affect units that
 * are already being processed.
 */
public class FrontendOptions implements Cloneable {
    public boolean errorRecovery = false;
    public boolean transpileXml = false;
    public boolean debugEnabled = false;
    public boolean traceTokens = false;
    public boolean showParsingError = true;
    public String code = null;
    public String fileName = null;

    /**
     * Reads options from a YAML mapping, for example:
     * <pre>
     * error-recovery: true
     * transpile-xml: false
     * debug: false
     * trace-tokens: false
     * show-parsing-error: true
     * </pre>
     *
     * @param yaml the YAML text
     * @return the options, defaults for absent keys
     * @throws IllegalArgumentException for unknown keys or non-boolean values
     */
    public static FrontendOptions fromYaml(String yaml) {
        return fromDocument(loader().loadFromString(yaml));
    }

    public static FrontendOptions fromYaml(InputStream input) {
        return fromDocument(loader().loadFromInputStream(input));
    }

    private static Load loader() {
        LoadSettings loadSettings = LoadSettings.builder()
                .setLabel("polyfront options")
                .setSchema(new CoreSchema())
                .build();
        return new Load(loadSettings);
    }

    private static FrontendOptions fromDocument(Object document) {
        FrontendOptions options = new FrontendOptions();
        if (document == null) {
            return options;
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Options must be a YAML mapping, got " + document.getClass().getSimpleName());
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            boolean value = asBoolean(key, entry.getValue());
            switch (key) {
                case "error-recovery" -> options.errorRecovery = value;
                case "transpile-xml" -> options.transpileXml = value;
                case "debug" -> options.debugEnabled = value;
                case "trace-tokens" -> options.traceTokens = value;
                case "show-parsing-error" -> options.showParsingError = value;
                default -> throw new IllegalArgumentException("Unknown option: " + key);
            }
        }
        return options;
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("Option " + key + " must be true or false, got " + value);
    }

    @Override
    public FrontendOptions clone() {
        try {
            // Use super.clone() to create a shallow copy
            return (FrontendOptions) super.clone();
        } catch (CloneNotSupportedException e) {
            // This shouldn't happen, since we're implementing Cloneable
            throw new AssertionError();
        }
    }

    @Override
    public String toString() {
        return "FrontendOptions{\n" +
                "    errorRecovery=" + errorRecovery + ",\n" +
                "    transpileXml=" + transpileXml + ",\n" +
                "    debugEnabled=" + debugEnabled + ",\n" +
                "    traceTokens=" + traceTokens + ",\n" +
                "    showParsingError=" + showParsingError + ",\n" +
                "    fileName='" + fileName + "'\n" +
                "}";
    }
}
