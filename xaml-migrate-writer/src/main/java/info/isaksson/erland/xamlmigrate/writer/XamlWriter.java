package info.isaksson.erland.xamlmigrate.writer;

import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a unified document back to XAML text.
 *
 * <p>Failures never escape {@link #serializeToText}: they are recorded on the document as
 * {@code SERIALIZATION_ERROR} and the method returns null.</p>
 */
public final class XamlWriter {

    private static final Logger LOG = LoggerFactory.getLogger(XamlWriter.class);

    private final XamlWriterOptions options;

    public XamlWriter() {
        this(new XamlWriterOptions());
    }

    public XamlWriter(XamlWriterOptions options) {
        this.options = options == null ? new XamlWriterOptions() : options;
    }

    public XamlWriterOptions getOptions() {
        return options;
    }

    public OutputDocument serialize(XamlDocument document) {
        return new XamlSerializer(options).serialize(document);
    }

    public String serializeToText(XamlDocument document) {
        return serializeToText(document, List.of());
    }

    /**
     * @param notes transformation notes listed in the diagnostic banner
     * @return the XAML text, or null when serialization failed
     */
    public String serializeToText(XamlDocument document, List<String> notes) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        try {
            OutputDocument out = new XamlSerializer(options).serialize(document, notes);
            return XamlTextRenderer.render(out);
        } catch (RuntimeException e) {
            LOG.warn("Serialization of {} failed: {}", document.getFilePath(), e.getMessage());
            document.getDiagnostics().addError(DiagnosticCodes.SERIALIZATION_ERROR,
                    "Serialization failed: " + e.getMessage(), document.getFilePath(), null, null);
            return null;
        }
    }

    /** Serialize and write to {@code out} as UTF-8, creating parent directories. */
    public void write(XamlDocument document, Path out) throws IOException {
        if (out == null) throw new IllegalArgumentException("out must not be null");
        String text = serializeToText(document);
        if (text == null) {
            throw new IOException("Could not serialize " + document.getFilePath());
        }
        if (out.getParent() != null) {
            Files.createDirectories(out.getParent());
        }
        Files.writeString(out, text, StandardCharsets.UTF_8);
        LOG.debug("Wrote {}", out);
    }
}
