package com.flamingo.ai.stripsequencer.service.distance;

import com.flamingo.ai.stripsequencer.exception.DistanceComputationException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Word Mover's Distance between two token sequences.
 *
 * <p>Tokens unknown to the {@link WordVectors} source are dropped first. If either side is left
 * without tokens the distance is {@link Double#POSITIVE_INFINITY}. Otherwise each side becomes a
 * normalized bag of words, and the distance is the minimum cost of moving one bag onto the other,
 * with the Euclidean distance between word vectors as the per-unit cost.
 *
 * <p>A single distinct word across both sides, or word-to-word costs summing to less than {@code
 * 1e-8}, give {@code 0.0} without solving the transport problem.
 */
@Slf4j
public class WordMoversDistanceOracle implements DistanceOracle {

  private static final double ZERO_COST_TOLERANCE = 1e-8;

  private final WordVectors wordVectors;
  private final boolean normalizeVectors;

  public WordMoversDistanceOracle(WordVectors wordVectors, boolean normalizeVectors) {
    this.wordVectors = wordVectors;
    this.normalizeVectors = normalizeVectors;
    log.info(
        "Word Mover's Distance oracle initialized: vectors={}, normalizeVectors={}",
        wordVectors.getSourceName(),
        normalizeVectors);
  }

  @Override
  public double distance(List<String> from, List<String> to) {
    Map<String, Optional<double[]>> lookups = new HashMap<>();
    List<String> knownFrom = knownTokens(from, lookups);
    List<String> knownTo = knownTokens(to, lookups);

    int dropped = (from.size() - knownFrom.size()) + (to.size() - knownTo.size());
    if (dropped > 0) {
      log.debug("Dropped {} token(s) without a word vector", dropped);
    }

    if (knownFrom.isEmpty() || knownTo.isEmpty()) {
      log.debug(
          "At least one side has no known words (from={}, to={}), distance is infinite",
          knownFrom.size(),
          knownTo.size());
      return Double.POSITIVE_INFINITY;
    }

    Map<String, Double> fromWeights = bagOfWords(knownFrom);
    Map<String, Double> toWeights = bagOfWords(knownTo);

    if (fromWeights.size() == 1 && fromWeights.keySet().equals(toWeights.keySet())) {
      return 0.0;
    }

    List<String> fromWords = new ArrayList<>(fromWeights.keySet());
    List<String> toWords = new ArrayList<>(toWeights.keySet());
    double[][] cost = new double[fromWords.size()][toWords.size()];
    double totalCost = 0.0;
    for (int i = 0; i < fromWords.size(); i++) {
      double[] a = lookups.get(fromWords.get(i)).orElseThrow();
      for (int j = 0; j < toWords.size(); j++) {
        double[] b = lookups.get(toWords.get(j)).orElseThrow();
        cost[i][j] = euclidean(a, b);
        totalCost += cost[i][j];
      }
    }
    if (Math.abs(totalCost) < ZERO_COST_TOLERANCE) {
      return 0.0;
    }

    double[] supply = fromWeights.values().stream().mapToDouble(Double::doubleValue).toArray();
    double[] demand = toWeights.values().stream().mapToDouble(Double::doubleValue).toArray();
    return TransportSolver.solve(supply, demand, cost);
  }

  private List<String> knownTokens(List<String> tokens, Map<String, Optional<double[]>> lookups) {
    List<String> known = new ArrayList<>(tokens.size());
    for (String token : tokens) {
      Optional<double[]> vector = lookups.computeIfAbsent(token, this::lookup);
      if (vector.isPresent()) {
        known.add(token);
      }
    }
    return known;
  }

  private Optional<double[]> lookup(String word) {
    Optional<float[]> vector;
    try {
      vector = wordVectors.vectorFor(word);
    } catch (DistanceComputationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DistanceComputationException(
          "Word vector lookup failed in " + wordVectors.getSourceName() + ": " + e.getMessage(),
          e);
    }
    return vector.map(this::prepare);
  }

  private double[] prepare(float[] raw) {
    double[] vector = new double[raw.length];
    double norm = 0.0;
    for (int i = 0; i < raw.length; i++) {
      vector[i] = raw[i];
      norm += vector[i] * vector[i];
    }
    norm = Math.sqrt(norm);
    if (normalizeVectors && norm > 0.0) {
      for (int i = 0; i < vector.length; i++) {
        vector[i] /= norm;
      }
    }
    return vector;
  }

  /** Relative frequency of each distinct word, in first-occurrence order. */
  private static Map<String, Double> bagOfWords(List<String> tokens) {
    Map<String, Double> weights = new LinkedHashMap<>();
    for (String token : tokens) {
      weights.merge(token, 1.0, Double::sum);
    }
    double total = tokens.size();
    weights.replaceAll((word, count) -> count / total);
    return weights;
  }

  private static double euclidean(double[] a, double[] b) {
    if (a.length != b.length) {
      throw new DistanceComputationException(
          "Word vectors have different dimensions: " + a.length + " vs " + b.length);
    }
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      double d = a[i] - b[i];
      sum += d * d;
    }
    return Math.sqrt(sum);
  }
}
