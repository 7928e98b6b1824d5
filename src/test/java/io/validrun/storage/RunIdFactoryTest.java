package io.validrun.storage;

import io.validrun.Fixtures;
import io.validrun.model.RunType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

final class RunIdFactoryTest {

    @Test
    void prefixesByRunType() {
        RunIdFactory factory = new RunIdFactory(Clock.fixed(Instant.parse("2026-03-04T05:06:07Z"), ZoneOffset.UTC));
        Assertions.assertTrue(factory.newRunId(RunType.TEST_CASE).startsWith("R-20260304050607-"));
        Assertions.assertTrue(factory.newRunId(RunType.TEST_SUITE).startsWith("S-20260304050607-"));
        Assertions.assertTrue(factory.newRunId(RunType.TEST_PLAN).startsWith("P-20260304050607-"));
    }

    @Test
    void allocatedFoldersAreUniqueAndMatchIds() throws Exception {
        Path root = Files.createTempDirectory("validrun-runid-");
        try {
            RunIdFactory factory = new RunIdFactory(Clock.fixed(Instant.now(), ZoneOffset.UTC));
            Set<String> ids = new HashSet<>();
            for (int i = 0; i < 100; i++) {
                RunIdFactory.Allocation allocation = factory.allocate(root, RunType.TEST_CASE);
                Assertions.assertTrue(ids.add(allocation.runId()));
                Assertions.assertEquals(allocation.runId(), allocation.folder().getFileName().toString());
                Assertions.assertTrue(Files.isDirectory(allocation.folder()));
            }
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }
}
