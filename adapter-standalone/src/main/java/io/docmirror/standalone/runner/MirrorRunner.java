package io.docmirror.standalone.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.docmirror.core.decode.DocumentDecoder;
import io.docmirror.core.decode.FirestoreDocumentDecoder;
import io.docmirror.core.decode.JsonRecordDecoder;
import io.docmirror.core.engine.RecordExtractor;
import io.docmirror.core.error.DocumentDecodeException;
import io.docmirror.core.model.FieldDescriptor;
import io.docmirror.core.model.StoreDocument;
import io.docmirror.core.schema.SchemaParser;
import io.docmirror.standalone.config.MirrorConfig;
import io.docmirror.standalone.notify.LifecycleNotifier;
import io.docmirror.standalone.notify.NoopNotifier;
import io.docmirror.standalone.notify.NotificationException;
import io.docmirror.standalone.notify.WebhookNotifier;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one mirror pass: parses the schema, reads the NDJSON input, extracts every document and
 * writes one compact JSON row per document.
 *
 * <p>
 * Lines that cannot be decoded are logged with their line number, counted as rejected and
 * skipped. Schema errors (unreadable schema file, malformed or unrecognized field definitions)
 * and I/O failures abort the run after an error notification. Notification failures are
 * logged and never fail a run.
 */
public final class MirrorRunner {

    private static final Logger LOG = LoggerFactory.getLogger(MirrorRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final MirrorConfig config;
    private final LifecycleNotifier notifier;
    private final SchemaParser schemaParser;
    private final OutputStream stdout;

    /**
     * Creates a runner whose notifier follows {@code notifier.enabled}.
     *
     * @param config mirror configuration
     */
    public MirrorRunner(MirrorConfig config) {
        this(config, config.notifierEnabled() ? new WebhookNotifier(config) : NoopNotifier.INSTANCE, System.out);
    }

    /**
     * Creates a runner with an explicit notifier and standard output stream.
     *
     * @param config   mirror configuration
     * @param notifier lifecycle notifier
     * @param stdout   stream used when the output path is {@code -}; never closed by the runner
     */
    public MirrorRunner(MirrorConfig config, LifecycleNotifier notifier, OutputStream stdout) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.stdout = Objects.requireNonNull(stdout, "stdout must not be null");
        this.schemaParser = new SchemaParser();
    }

    /**
     * Executes the run.
     *
     * @return counts for the run
     * @throws IOException if the input cannot be read or the output cannot be written
     * @throws io.docmirror.core.error.MirrorException if the schema cannot be loaded or declares an
     *         unrecognized type
     */
    public RunSummary run() throws IOException {
        String description = "schema=" + config.schemaPath() + " input=" + config.inputPath() + " format="
                + config.inputFormat();
        LOG.info("mirror.start {}", description);
        notify(() -> notifier.start(description));

        try {
            RunSummary summary = execute();
            LOG.info("mirror.complete {}", summary.describe());
            notify(() -> notifier.complete(summary));
            return summary;
        } catch (IOException | RuntimeException e) {
            LOG.error("mirror.failed: {}", e.getMessage(), e);
            notify(() -> notifier.error(e.getMessage()));
            throw e;
        }
    }

    private RunSummary execute() throws IOException {
        List<FieldDescriptor> schema = schemaParser.parse(Path.of(config.schemaPath()));
        LOG.info("schema.loaded path={} fields={}", config.schemaPath(), schema.size());

        WarningCounter warnings = new WarningCounter();
        RecordExtractor extractor = new RecordExtractor(warnings);
        DocumentDecoder decoder = decoderFor(config.inputFormat());
        Path inputPath = Path.of(config.inputPath());

        long records = 0;
        long rows = 0;
        long rejected = 0;
        try (BufferedReader reader = Files.newBufferedReader(inputPath, StandardCharsets.UTF_8);
                Writer writer = openOutput()) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                records++;
                StoreDocument document;
                try {
                    document = decoder.decode(line, inputPath + ":" + lineNumber);
                } catch (DocumentDecodeException e) {
                    LOG.warn("record.rejected line={}: {}", lineNumber, e.getMessage());
                    rejected++;
                    continue;
                }
                ObjectNode row = extractor.extractDocument(document, schema);
                writer.write(JSON.writeValueAsString(row));
                writer.write('\n');
                rows++;
            }
        }
        return new RunSummary(records, rows, rejected, warnings.total());
    }

    private Writer openOutput() throws IOException {
        OutputStream out;
        if (config.writesToStdout()) {
            out = new FilterOutputStream(stdout) {
                @Override
                public void write(byte[] b, int off, int len) throws IOException {
                    this.out.write(b, off, len);
                }

                @Override
                public void close() throws IOException {
                    flush();
                }
            };
        } else {
            out = Files.newOutputStream(Path.of(config.outputPath()));
        }
        return new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    static DocumentDecoder decoderFor(String inputFormat) {
        if (MirrorConfig.FORMAT_JSON.equals(inputFormat)) {
            return new JsonRecordDecoder();
        }
        return new FirestoreDocumentDecoder();
    }

    private void notify(Notification notification) {
        try {
            notification.send();
        } catch (NotificationException e) {
            LOG.error("Error sending message to webhook: {}", e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while sending message to webhook");
        }
    }

    @FunctionalInterface
    private interface Notification {
        void send() throws NotificationException, InterruptedException;
    }
}
