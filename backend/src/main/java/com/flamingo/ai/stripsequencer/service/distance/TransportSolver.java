package com.flamingo.ai.stripsequencer.service.distance;

import java.util.Arrays;

/**
 * Exact solver for the transportation problem behind the Earth Mover's Distance.
 *
 * <p>Moves the mass of {@code supply} onto {@code demand} at minimum total cost using successive
 * shortest paths (Bellman-Ford on the residual network). Sizes here are the distinct words of two
 * short text fragments, so the cubic running time is acceptable.
 */
final class TransportSolver {

  private static final double EPSILON = 1e-12;

  private TransportSolver() {}

  /**
   * Minimum cost of moving {@code supply} onto {@code demand}.
   *
   * @param supply non-negative mass at each source
   * @param demand non-negative mass at each target
   * @param cost {@code cost[i][j]} is the cost of moving one unit from source i to target j
   * @return the minimum total cost of moving {@code min(sum(supply), sum(demand))} units
   */
  static double solve(double[] supply, double[] demand, double[][] cost) {
    int n = supply.length;
    int m = demand.length;
    int source = 0;
    int sink = n + m + 1;
    FlowNetwork network = new FlowNetwork(n + m + 2, n + m + n * m);

    for (int i = 0; i < n; i++) {
      network.addEdge(source, 1 + i, supply[i], 0.0);
    }
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < m; j++) {
        network.addEdge(1 + i, 1 + n + j, Double.POSITIVE_INFINITY, cost[i][j]);
      }
    }
    for (int j = 0; j < m; j++) {
      network.addEdge(1 + n + j, sink, demand[j], 0.0);
    }

    double target = Math.min(Arrays.stream(supply).sum(), Arrays.stream(demand).sum());
    double flow = 0.0;
    double totalCost = 0.0;

    while (flow < target - EPSILON) {
      int[] parentEdge = network.shortestPath(source);
      if (parentEdge[sink] < 0) {
        break;
      }

      double push = target - flow;
      for (int v = sink; v != source; v = network.tail(parentEdge[v])) {
        push = Math.min(push, network.capacity[parentEdge[v]]);
      }
      if (push <= EPSILON) {
        break;
      }

      for (int v = sink; v != source; v = network.tail(parentEdge[v])) {
        int e = parentEdge[v];
        network.capacity[e] -= push;
        network.capacity[e ^ 1] += push;
        totalCost += push * network.cost[e];
      }
      flow += push;
    }

    return totalCost;
  }

  /** Residual network stored as paired edge arrays; edge {@code e ^ 1} is the reverse of e. */
  private static final class FlowNetwork {
    private final int nodeCount;
    private final int[] from;
    private final int[] to;
    private final double[] capacity;
    private final double[] cost;
    private int edgeCount;

    FlowNetwork(int nodeCount, int maxEdges) {
      this.nodeCount = nodeCount;
      this.from = new int[2 * maxEdges];
      this.to = new int[2 * maxEdges];
      this.capacity = new double[2 * maxEdges];
      this.cost = new double[2 * maxEdges];
    }

    void addEdge(int u, int v, double cap, double c) {
      from[edgeCount] = u;
      to[edgeCount] = v;
      capacity[edgeCount] = cap;
      cost[edgeCount] = c;
      edgeCount++;
      from[edgeCount] = v;
      to[edgeCount] = u;
      capacity[edgeCount] = 0.0;
      cost[edgeCount] = -c;
      edgeCount++;
    }

    int tail(int edge) {
      return from[edge];
    }

    /** Bellman-Ford over edges with residual capacity; returns the parent edge of each node. */
    int[] shortestPath(int source) {
      double[] dist = new double[nodeCount];
      int[] parentEdge = new int[nodeCount];
      Arrays.fill(dist, Double.POSITIVE_INFINITY);
      Arrays.fill(parentEdge, -1);
      dist[source] = 0.0;

      boolean updated = true;
      for (int round = 0; round < nodeCount - 1 && updated; round++) {
        updated = false;
        for (int e = 0; e < edgeCount; e++) {
          if (capacity[e] <= EPSILON || dist[from[e]] == Double.POSITIVE_INFINITY) {
            continue;
          }
          double candidate = dist[from[e]] + cost[e];
          if (candidate < dist[to[e]] - EPSILON) {
            dist[to[e]] = candidate;
            parentEdge[to[e]] = e;
            updated = true;
          }
        }
      }
      return parentEdge;
    }
  }
}
