/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.common.setting;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import lombok.Getter;
import lombok.Setter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Engine settings, read from the {@code quantadb} section of a YAML file.
 *
 * <pre>
 * quantadb:
 *   execution:
 *     query_timeout_ms: 30000
 *     worker_threads: 8
 *   planner:
 *     default_scan_rows: 10000
 * </pre>
 *
 * <p>Every property has a default, so an empty or missing file yields a usable configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
public class QuantaSettings {

  private static final Logger LOG = LogManager.getLogger();

  private Execution execution = new Execution();

  private Planner planner = new Planner();

  private Transaction transaction = new Transaction();

  private Schema schema = new Schema();

  @JsonIgnoreProperties(ignoreUnknown = true)
  @Getter
  @Setter
  public static class Execution {

    /** Wall-clock budget for one statement, including every backend call. */
    @JsonProperty("query_timeout_ms")
    private long queryTimeoutMs = 30_000L;

    @JsonProperty("worker_threads")
    private int workerThreads = 8;

    /** Default for requests that do not say whether partial results are acceptable. */
    @JsonProperty("allow_partial_results")
    private boolean allowPartialResults = false;

    /** Wrap writes that touch more than one engine in a transaction of their own. */
    @JsonProperty("implicit_transactions")
    private boolean implicitTransactions = true;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @Getter
  @Setter
  public static class Planner {

    @JsonProperty("default_scan_rows")
    private long defaultScanRows = 10_000L;

    @JsonProperty("indexed_selectivity")
    private double indexedSelectivity = 0.01;

    @JsonProperty("unindexed_selectivity")
    private double unindexedSelectivity = 0.25;

    @JsonProperty("navigation_fanout")
    private double navigationFanout = 3.0;

    /** Below this many estimated rows on both sides, nested-loop joins are used. */
    @JsonProperty("hash_join_threshold")
    private long hashJoinThreshold = 64L;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @Getter
  @Setter
  public static class Transaction {

    /** Path of the commit decision log. Empty keeps decisions in memory only. */
    @JsonProperty("decision_log")
    private String decisionLog = "";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @Getter
  @Setter
  public static class Schema {

    /** Classpath resource or file with bucket schemas to load at start-up. Empty disables. */
    @JsonProperty("preload")
    private String preload = "";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @Getter
  @Setter
  static class Root {
    private QuantaSettings quantadb;
  }

  /** Settings with every property at its default. */
  public static QuantaSettings defaults() {
    return new QuantaSettings();
  }

  /**
   * Reads settings from a YAML stream.
   *
   * @param inputStream YAML document with a top-level {@code quantadb} key.
   * @return settings, defaults for anything absent.
   */
  public static QuantaSettings fromYaml(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper(new YAMLFactory());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    try {
      Root root = objectMapper.readValue(inputStream, Root.class);
      if (root == null || root.getQuantadb() == null) {
        return defaults();
      }
      return root.getQuantadb();
    } catch (IOException e) {
      LOG.error("QuantaDB settings file is malformed. Verify and reload.");
      throw new IllegalArgumentException("Malformed QuantaDB settings: " + e.getMessage(), e);
    }
  }

  /**
   * Reads settings from a classpath resource, falling back to defaults when it does not exist.
   */
  public static QuantaSettings fromClasspath(String resource) {
    InputStream inputStream = QuantaSettings.class.getClassLoader().getResourceAsStream(resource);
    if (inputStream == null) {
      LOG.info("No {} on the classpath, using default settings.", resource);
      return defaults();
    }
    try (InputStream in = inputStream) {
      return fromYaml(in);
    } catch (IOException e) {
      throw new IllegalArgumentException("Failed to read " + resource, e);
    }
  }
}
