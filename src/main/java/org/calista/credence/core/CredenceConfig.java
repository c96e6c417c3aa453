package org.calista.credence.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.credence.calibration.CalibrationTracker;
import org.calista.credence.confidence.FormulaParser;
import org.calista.credence.defeat.DefeatPropagator;
import org.calista.credence.defeat.DefeatStrength;
import org.calista.credence.defeat.GroundedResolver;
import org.calista.credence.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * CredenceConfig — plain POJO config:
 * - defaults live in the fields
 * - loadOrCreate() writes the file when it is missing or empty
 * - validate() normalizes out-of-range values back to defaults
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CredenceConfig {

    private static final Logger log = LoggerFactory.getLogger(CredenceConfig.class);

    public String baseDir = "data";
    public Ledger ledger = new Ledger();
    public Derivation derivation = new Derivation();
    public Defeat defeat = new Defeat();
    public Calibration calibration = new Calibration();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Ledger {
        /** "jsonl" (durable, under baseDir) or "memory". */
        public String store = "jsonl";
        public String file = "ledger.jsonl";
        public boolean fsyncOnAppend = false;
        /** Ancestor walk limit for evidence chains. */
        public int chainMaxDepth = 64;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Derivation {
        public int maxFormulaDepth = FormulaParser.DEFAULT_MAX_DEPTH;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Defeat {
        public int maxIterations = GroundedResolver.DEFAULT_MAX_ITERATIONS;
        public int propagationMaxDepth = DefeatPropagator.DEFAULT_MAX_DEPTH;

        /** "linear" or "bayesian". */
        public String reduction = "linear";
        public double priorStrength = DefeatStrength.DEFAULT_PRIOR_STRENGTH;
        public double priorSampleSize = DefeatStrength.DEFAULT_PRIOR_SAMPLE_SIZE;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Calibration {
        public int bucketCount = 10;
        public double targetEce = 0.05;

        // PAC sufficiency: half-width and failure probability
        public double pacEpsilon = 0.1;
        public double pacDelta = 0.05;

        public int minSamples = 20;

        // ConfidenceAdjuster
        public int adjustMinSamples = 3;
        public int adjustFullWeightSamples = 20;
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config. When the file is missing (or empty) writes the defaults first.
     */
    public static CredenceConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            CredenceConfig created = new CredenceConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            CredenceConfig created = new CredenceConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        CredenceConfig cfg = mapper.readValue(json, CredenceConfig.class);
        if (cfg == null) cfg = new CredenceConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, CredenceConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, CredenceConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (ledger == null) ledger = new Ledger();
        ledger.store = (ledger.store == null) ? "jsonl" : ledger.store.trim().toLowerCase(Locale.ROOT);
        if (!ledger.store.equals("jsonl") && !ledger.store.equals("memory")) {
            log.warn("Unknown ledger.store '{}', using jsonl", ledger.store);
            ledger.store = "jsonl";
        }
        if (ledger.file == null || ledger.file.isBlank()) ledger.file = "ledger.jsonl";
        if (ledger.chainMaxDepth < 1) ledger.chainMaxDepth = 64;

        if (derivation == null) derivation = new Derivation();
        if (derivation.maxFormulaDepth < 1) derivation.maxFormulaDepth = FormulaParser.DEFAULT_MAX_DEPTH;

        if (defeat == null) defeat = new Defeat();
        // graphs up to DEFAULT_MAX_ITERATIONS nodes must be able to converge
        if (defeat.maxIterations < GroundedResolver.DEFAULT_MAX_ITERATIONS) {
            log.warn("defeat.maxIterations {} is below {}, raising it", defeat.maxIterations,
                    GroundedResolver.DEFAULT_MAX_ITERATIONS);
            defeat.maxIterations = GroundedResolver.DEFAULT_MAX_ITERATIONS;
        }
        if (defeat.propagationMaxDepth < 1) defeat.propagationMaxDepth = DefeatPropagator.DEFAULT_MAX_DEPTH;
        defeat.reduction = (defeat.reduction == null) ? "linear" : defeat.reduction.trim().toLowerCase(Locale.ROOT);
        if (!defeat.reduction.equals("linear") && !defeat.reduction.equals("bayesian")) defeat.reduction = "linear";
        if (!(defeat.priorStrength > 0.0 && defeat.priorStrength < 1.0)) defeat.priorStrength = DefeatStrength.DEFAULT_PRIOR_STRENGTH;
        if (!(defeat.priorSampleSize > 0.0) || !Double.isFinite(defeat.priorSampleSize)) {
            defeat.priorSampleSize = DefeatStrength.DEFAULT_PRIOR_SAMPLE_SIZE;
        }

        if (calibration == null) calibration = new Calibration();
        if (calibration.bucketCount < 1) calibration.bucketCount = 10;
        if (!(calibration.targetEce > 0.0 && calibration.targetEce < 1.0)) calibration.targetEce = 0.05;
        if (!(calibration.pacEpsilon > 0.0 && calibration.pacEpsilon < 1.0)) calibration.pacEpsilon = 0.1;
        if (!(calibration.pacDelta > 0.0 && calibration.pacDelta < 1.0)) calibration.pacDelta = 0.05;
        if (calibration.minSamples < 0) calibration.minSamples = 20;
        if (calibration.adjustMinSamples < 1) calibration.adjustMinSamples = 3;
        if (calibration.adjustFullWeightSamples < calibration.adjustMinSamples) {
            calibration.adjustFullWeightSamples = Math.max(20, calibration.adjustMinSamples);
        }
    }

    // -------------------- Derived settings --------------------

    public DefeatStrength defeatStrength() {
        return "bayesian".equals(defeat.reduction)
                ? DefeatStrength.bayesian(defeat.priorStrength, defeat.priorSampleSize)
                : DefeatStrength.linear();
    }

    public CalibrationTracker.Settings calibrationSettings() {
        return new CalibrationTracker.Settings(calibration.bucketCount, calibration.targetEce,
                calibration.pacEpsilon, calibration.pacDelta);
    }
}
