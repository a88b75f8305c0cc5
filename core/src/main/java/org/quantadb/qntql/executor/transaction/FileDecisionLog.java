/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.executor.transaction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;

/**
 * Decision log appended to a file, one JSON object per line. Each append is forced to disk before
 * returning.
 */
@Log4j2
public class FileDecisionLog implements TransactionDecisionLog {

  private final Path path;

  private final ObjectMapper objectMapper = new ObjectMapper();

  public FileDecisionLog(Path path) {
    this.path = path;
  }

  @Override
  public synchronized void append(TransactionDecision decision) {
    try {
      String line = objectMapper.writeValueAsString(decision) + System.lineSeparator();
      if (path.getParent() != null) {
        Files.createDirectories(path.getParent());
      }
      Files.write(
          path,
          line.getBytes(StandardCharsets.UTF_8),
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND,
          StandardOpenOption.SYNC);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to append to decision log " + path, e);
    }
  }

  @Override
  public synchronized List<TransactionDecision> readAll() {
    if (!Files.exists(path)) {
      return List.of();
    }
    List<TransactionDecision> decisions = new ArrayList<>();
    try {
      for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
        if (line.isBlank()) {
          continue;
        }
        try {
          decisions.add(objectMapper.readValue(line, TransactionDecision.class));
        } catch (JsonProcessingException e) {
          // A torn last line from a crash mid-append carries no decision.
          log.warn("Skipping unreadable decision log entry in {}: {}", path, line);
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read decision log " + path, e);
    }
    return decisions;
  }
}
