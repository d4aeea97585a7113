package info.isaksson.erland.xamlmigrate.core;

import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.companion.CompanionLinkValidator;
import info.isaksson.erland.xamlmigrate.companion.CompanionUnit;
import info.isaksson.erland.xamlmigrate.diagnostics.ConcurrentDiagnosticBag;
import info.isaksson.erland.xamlmigrate.mapping.MappingJson;
import info.isaksson.erland.xamlmigrate.mapping.MappingRepository;
import info.isaksson.erland.xamlmigrate.parse.HybridParseResult;
import info.isaksson.erland.xamlmigrate.parse.HybridXamlParser;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;
import info.isaksson.erland.xamlmigrate.transform.TransformationEngine;
import info.isaksson.erland.xamlmigrate.transform.TransformationRecord;
import info.isaksson.erland.xamlmigrate.transform.rules.BuiltInRules;
import info.isaksson.erland.xamlmigrate.writer.XamlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Core API for migrating XAML documents.
 *
 * <p>Pipeline per document: hybrid parse, optional companion linkage check, rule passes, serialization.
 * Every stage reports into the document's diagnostics; only loading the default mappings can throw.
 * Wrappers (tools, servers) should use this class instead of re-assembling the pipeline.</p>
 */
public final class XamlMigrationService {

    private static final Logger LOG = LoggerFactory.getLogger(XamlMigrationService.class);

    /** Migrate one document. */
    public XamlMigrationResult migrate(String text, String filePath, XamlMigrationOptions options) throws IOException {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        if (options == null) options = new XamlMigrationOptions();
        return migrate(text, filePath, options, repository(options), engine(options));
    }

    /**
     * Migrate independent documents. Results keep the iteration order of {@code sources}; the batch
     * diagnostics are the union of all document diagnostics.
     *
     * @param sources file path to XAML text
     */
    public XamlBatchResult migrateBatch(Map<String, String> sources, XamlMigrationOptions options) throws IOException {
        if (sources == null) throw new IllegalArgumentException("sources must not be null");
        if (options == null) options = new XamlMigrationOptions();
        MappingRepository repository = repository(options);
        TransformationEngine engine = engine(options);
        ConcurrentDiagnosticBag diagnostics = new ConcurrentDiagnosticBag();

        List<XamlMigrationResult> results;
        if (options.parallel && sources.size() > 1) {
            results = migrateParallel(sources, options, repository, engine, diagnostics);
        } else {
            results = new ArrayList<>(sources.size());
            for (Map.Entry<String, String> e : sources.entrySet()) {
                XamlMigrationResult r = migrate(nz(e.getValue()), e.getKey(), options, repository, engine);
                diagnostics.mergeFrom(r.diagnostics);
                results.add(r);
            }
        }
        LOG.debug("Migrated {} documents", results.size());
        return new XamlBatchResult(results, diagnostics);
    }

    private List<XamlMigrationResult> migrateParallel(Map<String, String> sources, XamlMigrationOptions options,
                                                      MappingRepository repository, TransformationEngine engine,
                                                      ConcurrentDiagnosticBag diagnostics) {
        int threads = options.threads > 0 ? options.threads : Runtime.getRuntime().availableProcessors();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, sources.size()));
        try {
            List<String> paths = new ArrayList<>();
            List<Future<XamlMigrationResult>> futures = new ArrayList<>();
            for (Map.Entry<String, String> e : sources.entrySet()) {
                String path = e.getKey();
                String text = nz(e.getValue());
                paths.add(path);
                futures.add(pool.submit(() -> {
                    XamlMigrationResult r = migrate(text, path, options, repository, engine);
                    diagnostics.mergeFrom(r.diagnostics);
                    return r;
                }));
            }
            List<XamlMigrationResult> results = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException ex) {
                    throw new IllegalStateException("Migration of " + paths.get(i) + " failed", ex.getCause());
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while migrating " + paths.get(i), ex);
                }
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private XamlMigrationResult migrate(String text, String filePath, XamlMigrationOptions options,
                                        MappingRepository repository, TransformationEngine engine) {
        // 1) parse
        HybridParseResult parsed = new HybridXamlParser(options.parser).parse(text, filePath);
        XamlDocument doc = parsed.document;
        if (doc == null) {
            LOG.debug("{}: structural parse failed", filePath);
            return new XamlMigrationResult(filePath, null, null, parsed.state, parsed.diagnostics, List.of(), null);
        }

        // 2) companion linkage, checked against the source names
        CompanionUnit unit = null;
        if (options.companionIndex != null) {
            unit = new CompanionLinkValidator().validate(doc, options.companionIndex);
        }

        // 3) rule passes
        List<TransformationRecord> trace = List.of();
        if (options.transform) {
            TransformationContext ctx = engine.transform(doc, repository);
            trace = ctx.getTrace();
        }

        // 4) serialize
        List<String> notes = new ArrayList<>();
        if (options.includeTraceComments) {
            for (TransformationRecord r : trace) {
                notes.add(r.toString());
            }
        }
        String output = new XamlWriter(options.writer).serializeToText(doc, notes);

        LOG.debug("{}: parse {}, {} transformations, {} diagnostics", filePath, parsed.state, trace.size(),
                doc.getDiagnostics().all().size());
        return new XamlMigrationResult(filePath, output, doc, parsed.state, doc.getDiagnostics(), trace, unit);
    }

    private static MappingRepository repository(XamlMigrationOptions options) throws IOException {
        return options.repository != null ? options.repository : MappingJson.loadDefaults();
    }

    private static TransformationEngine engine(XamlMigrationOptions options) {
        return options.engine != null ? options.engine : BuiltInRules.defaultEngine();
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
