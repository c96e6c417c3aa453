package org.calista.credence.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.credence.defeat.DefeatStrength;
import org.calista.credence.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CredenceConfigTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = CredenceKernel.Builder.defaultMapper();

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("conf/credence.json");

        CredenceConfig cfg = CredenceConfig.loadOrCreate(io, file, mapper);

        assertTrue(Files.exists(file));
        assertEquals("data", cfg.baseDir);
        assertEquals("jsonl", cfg.ledger.store);
        assertEquals(1000, cfg.defeat.maxIterations);
        assertEquals(DefeatStrength.Method.LINEAR, cfg.defeatStrength().method());
        assertEquals(185, cfg.calibrationSettings().requiredSamples());

        CredenceConfig again = CredenceConfig.loadOrCreate(io, file, mapper);
        assertEquals(cfg.calibration.pacEpsilon, again.calibration.pacEpsilon);
    }

    @Test
    void outOfRangeValuesFallBackToDefaults() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("credence.json");
        io.writeString(file, "{\"ledger\":{\"store\":\" Memory \",\"chainMaxDepth\":0},"
                + "\"defeat\":{\"reduction\":\"BAYESIAN\",\"maxIterations\":-1,\"priorStrength\":2.0},"
                + "\"calibration\":{\"bucketCount\":0,\"adjustMinSamples\":5,\"adjustFullWeightSamples\":2},"
                + "\"comment\":\"unknown fields are ignored\"}");

        CredenceConfig cfg = CredenceConfig.loadOrCreate(io, file, mapper);

        assertEquals("memory", cfg.ledger.store);
        assertEquals(64, cfg.ledger.chainMaxDepth);
        assertEquals("bayesian", cfg.defeat.reduction);
        assertEquals(1000, cfg.defeat.maxIterations);
        assertEquals(DefeatStrength.DEFAULT_PRIOR_STRENGTH, cfg.defeat.priorStrength);
        assertEquals(10, cfg.calibration.bucketCount);
        assertEquals(20, cfg.calibration.adjustFullWeightSamples);
        assertEquals(DefeatStrength.Method.BAYESIAN, cfg.defeatStrength().method());
    }

    @Test
    void iterationCapCannotDropBelowTheDefault() {
        CredenceConfig low = new CredenceConfig();
        low.defeat.maxIterations = 10;
        low.validate();
        assertEquals(1000, low.defeat.maxIterations);

        CredenceConfig high = new CredenceConfig();
        high.defeat.maxIterations = 5000;
        high.validate();
        assertEquals(5000, high.defeat.maxIterations);
    }

    @Test
    void unknownStoreIsReplaced() {
        CredenceConfig cfg = new CredenceConfig();
        cfg.ledger.store = "postgres";
        cfg.defeat.reduction = "exponential";

        cfg.validate();

        assertEquals("jsonl", cfg.ledger.store);
        assertEquals("linear", cfg.defeat.reduction);
    }

    @Test
    void emptyFileIsRecreatedAndSaveRoundTrips() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("credence.json");
        io.writeString(file, "  ");

        CredenceConfig cfg = CredenceConfig.loadOrCreate(io, file, mapper);
        assertFalse(io.readString(file).isBlank());

        cfg.defeat.propagationMaxDepth = 4;
        cfg.calibration.targetEce = 0.02;
        CredenceConfig.save(io, file, mapper, cfg);

        CredenceConfig back = CredenceConfig.loadOrCreate(io, file, mapper);
        assertEquals(4, back.defeat.propagationMaxDepth);
        assertEquals(0.02, back.calibration.targetEce);
    }
}
