package io.docmirror.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link MirrorConfig} from a YAML file with an optional environment
 * variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code doc-mirror.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Every configuration key can be overridden via an environment variable.
 * Env vars take precedence over YAML values. An env var is considered "set"
 * if and only if it is defined AND its trimmed value is non-empty; empty or
 * whitespace-only values are treated as "unset" and the YAML value is used.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "doc-mirror.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link MirrorConfig} from the given YAML file path, applying
     * environment variable overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return a fully constructed {@link MirrorConfig} with defaults applied
     * @throws ConfigLoadException if the file is missing, contains invalid YAML,
     *                             or lacks a required value
     */
    public static MirrorConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link MirrorConfig} from the given YAML file path, applying
     * environment variable overrides from the supplied lookup function.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup; {@code null} means undefined
     * @throws ConfigLoadException if the file is missing, contains invalid YAML,
     *                             or lacks a required value
     */
    public static MirrorConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid numeric value in configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static MirrorConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        MirrorConfig.Builder builder = MirrorConfig.builder();

        // --- YAML mapping ---

        if (root.has("schema")) builder.schemaPath(root.get("schema").asText());

        JsonNode input = root.path("input");
        if (input.has("path")) builder.inputPath(input.get("path").asText());
        if (input.has("format")) builder.inputFormat(input.get("format").asText());

        JsonNode output = root.path("output");
        if (output.has("path")) builder.outputPath(output.get("path").asText());

        JsonNode notifier = root.path("notifier");
        if (notifier.has("enabled")) builder.notifierEnabled(notifier.get("enabled").asBoolean());
        if (notifier.has("webhook-url"))
            builder.notifierWebhookUrl(notifier.get("webhook-url").asText());
        if (notifier.has("connect-timeout-ms"))
            builder.notifierConnectTimeoutMs(notifier.get("connect-timeout-ms").asInt());
        if (notifier.has("read-timeout-ms"))
            builder.notifierReadTimeoutMs(notifier.get("read-timeout-ms").asInt());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "MIRROR_SCHEMA", builder::schemaPath);
        envString(envLookup, "MIRROR_INPUT", builder::inputPath);
        envString(envLookup, "MIRROR_INPUT_FORMAT", builder::inputFormat);
        envString(envLookup, "MIRROR_OUTPUT", builder::outputPath);
        envString(envLookup, "NOTIFIER_WEBHOOK_URL", builder::notifierWebhookUrl);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "NOTIFIER_CONNECT_TIMEOUT_MS", builder::notifierConnectTimeoutMs);
        envInt(envLookup, "NOTIFIER_READ_TIMEOUT_MS", builder::notifierReadTimeoutMs);

        envBool(envLookup, "NOTIFIER_ENABLED", builder::notifierEnabled);

        return builder.build();
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Integer.parseInt(envLookup.apply(envVar).trim()));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
