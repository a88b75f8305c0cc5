/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */


package org.quantadb.qntql.executor.transaction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileDecisionLogTest {

  @TempDir Path directory;

  @Test
  void testMissingFileIsEmpty() {
    FileDecisionLog log = new FileDecisionLog(directory.resolve("absent.log"));

    assertTrue(log.readAll().isEmpty());
    assertTrue(log.inDoubt().isEmpty());
  }

  @Test
  void testEntriesSurviveReopening() {
    Path path = directory.resolve("txn/decisions.log");
    FileDecisionLog log = new FileDecisionLog(path);
    log.append(
        new TransactionDecision(
            "t1", TransactionDecision.Outcome.COMMIT, Map.of("scalar", "pg-7"), 10L));
    log.append(new TransactionDecision("t1", TransactionDecision.Outcome.COMPLETED, null, 11L));
    log.append(new TransactionDecision("t2", TransactionDecision.Outcome.COMMIT, Map.of(), 12L));

    List<TransactionDecision> decisions = new FileDecisionLog(path).readAll();

    assertEquals(3, decisions.size());
    assertEquals(Map.of("scalar", "pg-7"), decisions.get(0).handles());
    assertEquals(Map.of(), decisions.get(1).handles());
    assertEquals(12L, decisions.get(2).timestamp());
    assertEquals(1, new FileDecisionLog(path).inDoubt().size());
  }

  @Test
  void testTornLastLineIsSkipped() throws IOException {
    Path path = directory.resolve("decisions.log");
    FileDecisionLog log = new FileDecisionLog(path);
    log.append(new TransactionDecision("t1", TransactionDecision.Outcome.COMMIT, Map.of(), 1L));
    Files.write(
        path,
        "{\"txn\":\"t2\",\"outc".getBytes(StandardCharsets.UTF_8),
        StandardOpenOption.APPEND);

    List<TransactionDecision> decisions = log.readAll();

    assertEquals(1, decisions.size());
    assertEquals("t1", decisions.get(0).transactionId());
  }

  @Test
  void testLinesAreJson() throws IOException {
    Path path = directory.resolve("decisions.log");
    new FileDecisionLog(path)
        .append(
            new TransactionDecision("t9", TransactionDecision.Outcome.COMMIT, Map.of(), 5L));

    String line = Files.readAllLines(path, StandardCharsets.UTF_8).get(0);

    assertTrue(line.startsWith("{") && line.endsWith("}"), line);
    assertTrue(line.contains("\"txn\":\"t9\""), line);
    assertTrue(line.contains("\"outcome\":\"COMMIT\""), line);
  }
}
