package com.schemaid.identity;

import com.schemaid.behavior.BehaviorFingerprintResolver;
import com.schemaid.behavior.BehaviorResolutionListener;
import com.schemaid.behavior.Slf4jBehaviorResolutionListener;
import com.schemaid.canonical.Canonicalizer;
import com.schemaid.describe.ModelDescriptionProvider;
import com.schemaid.describe.ReflectiveModelDescriptionProvider;
import com.schemaid.extract.SchemaGraphExtractor;
import com.schemaid.hash.SchemaHasher;
import com.schemaid.model.AlgorithmVersion;
import com.schemaid.model.CanonicalForm;
import com.schemaid.model.Identifier;
import com.schemaid.model.IdentitySettings;
import com.schemaid.model.SchemaComparison;
import com.schemaid.model.SchemaGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Computes and caches schema identifiers: extract, resolve behaviors, canonicalize, hash.
 *
 * Thread-safe. Each engine owns its caches, so engines with different settings never share
 * results. Failures propagate to the caller and leave nothing cached.
 */
public class SchemaIdentityEngine {

    private static final Logger log = LoggerFactory.getLogger(SchemaIdentityEngine.class);

    private static final Instant PROCESS_START = ProcessHandle.current().info().startInstant().orElseGet(Instant::now);

    private final IdentitySettings settings;
    private final SchemaGraphExtractor extractor;
    private final BehaviorFingerprintResolver resolver;
    private final Canonicalizer canonicalizer;
    private final SchemaHasher hasher;

    private final IdentityCache<Identifier> identifiers = new IdentityCache<>();
    private final IdentityCache<SchemaIdentityReport> reports = new IdentityCache<>();

    public SchemaIdentityEngine() {
        this(IdentitySettings.defaults());
    }

    public SchemaIdentityEngine(IdentitySettings settings) {
        this(settings, new ReflectiveModelDescriptionProvider(), new Slf4jBehaviorResolutionListener());
    }

    public SchemaIdentityEngine(IdentitySettings settings, ModelDescriptionProvider provider,
                                BehaviorResolutionListener listener) {
        this.settings = Objects.requireNonNull(settings, "settings").validate();
        this.extractor = new SchemaGraphExtractor(provider, settings.getMaxNodes());
        this.resolver = new BehaviorFingerprintResolver(listener);
        this.canonicalizer = new Canonicalizer(settings, AlgorithmVersion.current());
        this.hasher = new SchemaHasher(AlgorithmVersion.current(), settings.getDigestLength());
    }

    public IdentitySettings getSettings() {
        return settings;
    }

    public Identifier identifierFor(Class<?> model) {
        return identifiers.getOrCompute(model, m -> fingerprint(m).getIdentifier());
    }

    public boolean sameSchema(Class<?> a, Class<?> b) {
        return identifierFor(a).equals(identifierFor(b));
    }

    public SchemaComparison compare(Class<?> a, Class<?> b) {
        return identifierFor(a).compare(identifierFor(b));
    }

    /**
     * The exact bytes that are hashed for the model. Always recomputed.
     */
    public CanonicalForm canonicalForm(Class<?> model) {
        return fingerprint(model).getCanonicalForm();
    }

    public SchemaIdentityReport reportFor(Class<?> model) {
        return reports.getOrCompute(model, m -> {
            FingerprintResult result = fingerprint(m);
            identifiers.getOrCompute(m, ignored -> result.getIdentifier());
            return report(result);
        });
    }

    /**
     * Recomputes the model's identifier and report, replacing cached values. Needed after
     * behaviors were registered for an already fingerprinted model.
     */
    public Identifier rebuild(Class<?> model) {
        FingerprintResult result = fingerprint(model);
        identifiers.put(model, result.getIdentifier());
        reports.put(model, report(result));
        log.info("Rebuilt identifier for {}: {}", model.getName(), result.getIdentifier());
        return result.getIdentifier();
    }

    /**
     * Runs the whole pipeline without touching the caches.
     */
    public FingerprintResult fingerprint(Class<?> model) {
        Objects.requireNonNull(model, "model");
        SchemaGraph graph = extractor.extract(model);
        int degraded = resolver.annotate(graph);
        CanonicalForm form = canonicalizer.canonicalize(graph);
        Identifier identifier = hasher.hash(form);
        log.debug("Identifier for {}: {} ({} nodes, {} table entries, {} degraded behaviors)",
                model.getName(), identifier, form.getNodeCount(), form.getTableSize(), degraded);
        return new FingerprintResult(model, identifier, form, degraded);
    }

    private SchemaIdentityReport report(FingerprintResult result) {
        return SchemaIdentityReport.builder()
                .modelName(result.getModel().getName())
                .identifier(result.getIdentifier().toString())
                .computedAt(PROCESS_START)
                .settings(settings)
                .nodeCount(result.getCanonicalForm().getNodeCount())
                .tableSize(result.getCanonicalForm().getTableSize())
                .canonicalLength(result.getCanonicalForm().length())
                .degradedBehaviors(result.getDegradedBehaviors())
                .build();
    }
}
