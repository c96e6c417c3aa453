package org.calista.credence.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.credence.calibration.CalibrationTracker;
import org.calista.credence.calibration.ConfidenceAdjuster;
import org.calista.credence.calibration.LedgerOutcomeStore;
import org.calista.credence.calibration.OutcomeStore;
import org.calista.credence.confidence.ConfidenceCodec;
import org.calista.credence.confidence.DerivationProofBuilder;
import org.calista.credence.defeat.ClaimStatusUpdater;
import org.calista.credence.defeat.DefeatPropagator;
import org.calista.credence.defeat.GroundedResolver;
import org.calista.credence.io.FileIO;
import org.calista.credence.ledger.EvidenceChains;
import org.calista.credence.ledger.EvidenceLedger;
import org.calista.credence.ledger.InMemoryEvidenceLedger;
import org.calista.credence.ledger.JsonlEvidenceLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * CredenceKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) builder().build(configFile) -> load or create config, open the ledger, wire components
 *   2) use                         -> assessor(), ledger(), calibration(), ...
 *   3) close()                     -> close the ledger
 *
 * No static singletons: two kernels never share a ledger or calibration history.
 */
public final class CredenceKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CredenceKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final CredenceConfig cfg;

    private final EvidenceLedger ledger;
    private final DerivationProofBuilder proofs;
    private final GroundedResolver resolver;
    private final ClaimStatusUpdater statuses;
    private final CalibrationTracker calibration;
    private final ConfidenceAdjuster adjuster;
    private final ClaimAssessor assessor;

    private CredenceKernel(FileIO io,
                           ObjectMapper mapper,
                           CredenceConfig cfg,
                           EvidenceLedger ledger,
                           OutcomeStore outcomes,
                           Clock clock) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.ledger = Objects.requireNonNull(ledger, "ledger");

        this.proofs = new DerivationProofBuilder(cfg.derivation.maxFormulaDepth);
        this.resolver = new GroundedResolver(cfg.defeat.maxIterations);
        this.statuses = new ClaimStatusUpdater(cfg.defeatStrength());
        this.calibration = new CalibrationTracker(outcomes, cfg.calibrationSettings(), clock);
        this.adjuster = new ConfidenceAdjuster(cfg.calibration.adjustMinSamples, cfg.calibration.adjustFullWeightSamples);
        this.assessor = new ClaimAssessor(ledger, proofs, resolver, statuses, calibration, clock);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /** Where the config lives; a relative baseDir in the config is resolved against it. */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private EvidenceLedger ledger;
        private OutcomeStore outcomeStore;
        private Clock clock = Clock.systemUTC();

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Overrides the ledger the config would open. The kernel closes it on close(). */
        public Builder ledger(EvidenceLedger ledger) {
            this.ledger = Objects.requireNonNull(ledger, "ledger");
            return this;
        }

        /** Defaults to outcomes kept in the ledger. */
        public Builder outcomeStore(OutcomeStore store) {
            this.outcomeStore = Objects.requireNonNull(store, "outcomeStore");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public CredenceKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            FileIO external = new FileIO(configRoot, FileIO.Options.builder().charset(charset).build());
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            CredenceConfig cfg = CredenceConfig.loadOrCreate(external, cfgPath, om);

            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base, FileIO.Options.builder()
                    .charset(charset)
                    .fsyncOnAppend(cfg.ledger.fsyncOnAppend)
                    .build());

            EvidenceLedger l = this.ledger;
            if (l == null) {
                l = "memory".equals(cfg.ledger.store)
                        ? new InMemoryEvidenceLedger(clock)
                        : JsonlEvidenceLedger.open(io, om, io.resolve(cfg.ledger.file), clock);
            }
            OutcomeStore outcomes = (this.outcomeStore != null) ? this.outcomeStore : new LedgerOutcomeStore(l);

            CredenceKernel k = new CredenceKernel(io, om, cfg, l, outcomes, clock);
            if (log.isInfoEnabled()) {
                log.info("CredenceKernel created: config={}, baseDir={}, ledger={}, maxIterations={}",
                        cfgPath, io.baseDir(), l.getClass().getSimpleName(), cfg.defeat.maxIterations);
            }
            return k;
        }

        static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            om.registerModule(ConfidenceCodec.module());
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public CredenceConfig config() { return cfg; }
    public EvidenceLedger ledger() { return ledger; }
    public DerivationProofBuilder proofBuilder() { return proofs; }
    public GroundedResolver resolver() { return resolver; }
    public ClaimStatusUpdater statusUpdater() { return statuses; }
    public CalibrationTracker calibration() { return calibration; }
    public ConfidenceAdjuster adjuster() { return adjuster; }
    public ClaimAssessor assessor() { return assessor; }

    public EvidenceChains evidenceChains() {
        return new EvidenceChains(ledger, cfg.ledger.chainMaxDepth);
    }

    public DefeatPropagator propagator(List<DefeatPropagator.Dependency> dependencies) {
        return new DefeatPropagator(dependencies, cfg.defeat.propagationMaxDepth);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        ledger.close();
        log.info("CredenceKernel closed");
    }
}
