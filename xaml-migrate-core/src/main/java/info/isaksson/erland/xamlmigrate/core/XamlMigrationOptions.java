package info.isaksson.erland.xamlmigrate.core;

import info.isaksson.erland.xamlmigrate.companion.CompanionCodeIndex;
import info.isaksson.erland.xamlmigrate.mapping.MappingRepository;
import info.isaksson.erland.xamlmigrate.parse.HybridParserOptions;
import info.isaksson.erland.xamlmigrate.transform.TransformationEngine;
import info.isaksson.erland.xamlmigrate.writer.XamlWriterOptions;

/**
 * Options for {@link XamlMigrationService}.
 *
 * <p>Groups the per-stage option objects; null members fall back to their defaults.</p>
 */
public final class XamlMigrationOptions {

    public HybridParserOptions parser = new HybridParserOptions();

    public XamlWriterOptions writer = new XamlWriterOptions();

    /** Mapping data; null loads the bundled default mappings. */
    public MappingRepository repository;

    /** Rule passes to run; null uses the built-in rule set. */
    public TransformationEngine engine;

    /** When set, x:Class, x:Name and event handlers are checked against this index. */
    public CompanionCodeIndex companionIndex;

    /** Skip the rule passes and write the parsed document back as is. */
    public boolean transform = true;

    /**
     * List the transformation trace in the review banner. Only visible when
     * {@link XamlWriterOptions#includeDiagnosticComments} is on.
     */
    public boolean includeTraceComments = false;

    /** Batch mode: migrate documents on a worker pool. */
    public boolean parallel = false;

    /** Worker count for parallel batches; 0 or less means one per available processor. */
    public int threads = 0;
}
