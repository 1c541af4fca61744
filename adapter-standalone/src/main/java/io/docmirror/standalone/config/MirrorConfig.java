package io.docmirror.standalone.config;

/**
 * Root configuration for a mirror run.
 *
 * <p>
 * All fields provide defaults except {@code inputPath}, which is required.
 * Use {@link #builder()} to construct instances.
 *
 * @param schemaPath                path to the schema file (YAML or JSON)
 * @param inputPath                 NDJSON input file, one document per line; REQUIRED
 * @param inputFormat               {@code firestore} (REST typed values) or {@code json} (plain objects)
 * @param outputPath                output NDJSON file, or {@code -} for stdout
 * @param notifierEnabled           send lifecycle notifications to the webhook
 * @param notifierWebhookUrl        webhook URL; required when the notifier is enabled
 * @param notifierConnectTimeoutMs  webhook TCP connect timeout in ms
 * @param notifierReadTimeoutMs     webhook response timeout in ms
 * @param loggingFormat             json or text
 * @param loggingLevel              root log level
 */
public record MirrorConfig(
        String schemaPath,
        String inputPath,
        String inputFormat,
        String outputPath,
        boolean notifierEnabled,
        String notifierWebhookUrl,
        int notifierConnectTimeoutMs,
        int notifierReadTimeoutMs,
        String loggingFormat,
        String loggingLevel) {

    /** Input formats understood by the runner. */
    public static final String FORMAT_FIRESTORE = "firestore";

    public static final String FORMAT_JSON = "json";

    /** Output path meaning standard output. */
    public static final String STDOUT = "-";

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Whether rows are written to standard output. */
    public boolean writesToStdout() {
        return STDOUT.equals(outputPath);
    }

    /** Builder for {@link MirrorConfig}. All fields have defaults except {@code inputPath}. */
    public static final class Builder {
        private String schemaPath = "./schema.yaml";
        private String inputPath;
        private String inputFormat = FORMAT_FIRESTORE;
        private String outputPath = STDOUT;
        private boolean notifierEnabled = false;
        private String notifierWebhookUrl;
        private int notifierConnectTimeoutMs = 5000;
        private int notifierReadTimeoutMs = 10000;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder schemaPath(String schemaPath) {
            this.schemaPath = schemaPath;
            return this;
        }

        public Builder inputPath(String inputPath) {
            this.inputPath = inputPath;
            return this;
        }

        public Builder inputFormat(String inputFormat) {
            this.inputFormat = inputFormat;
            return this;
        }

        public Builder outputPath(String outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder notifierEnabled(boolean notifierEnabled) {
            this.notifierEnabled = notifierEnabled;
            return this;
        }

        public Builder notifierWebhookUrl(String notifierWebhookUrl) {
            this.notifierWebhookUrl = notifierWebhookUrl;
            return this;
        }

        public Builder notifierConnectTimeoutMs(int notifierConnectTimeoutMs) {
            this.notifierConnectTimeoutMs = notifierConnectTimeoutMs;
            return this;
        }

        public Builder notifierReadTimeoutMs(int notifierReadTimeoutMs) {
            this.notifierReadTimeoutMs = notifierReadTimeoutMs;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if a required field is missing or a value is out of range
         */
        public MirrorConfig build() {
            if (inputPath == null || inputPath.isBlank()) {
                throw new ConfigLoadException("Missing required configuration: input.path (or MIRROR_INPUT)");
            }
            if (!FORMAT_FIRESTORE.equals(inputFormat) && !FORMAT_JSON.equals(inputFormat)) {
                throw new ConfigLoadException("Unknown input.format '" + inputFormat + "', expected one of ["
                        + FORMAT_FIRESTORE + ", " + FORMAT_JSON + "]");
            }
            if (notifierEnabled && (notifierWebhookUrl == null || notifierWebhookUrl.isBlank())) {
                throw new ConfigLoadException(
                        "notifier.enabled is true but notifier.webhook-url (or NOTIFIER_WEBHOOK_URL) is not set");
            }
            if (notifierConnectTimeoutMs <= 0 || notifierReadTimeoutMs <= 0) {
                throw new ConfigLoadException("Notifier timeouts must be positive");
            }
            return new MirrorConfig(
                    schemaPath,
                    inputPath,
                    inputFormat,
                    outputPath,
                    notifierEnabled,
                    notifierWebhookUrl,
                    notifierConnectTimeoutMs,
                    notifierReadTimeoutMs,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
