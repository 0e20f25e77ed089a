package com.routelab.backend.algorithms.mst;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Disjoint sets over airport codes with union by rank and path compression.
 */
public final class UnionFind {

  private final Map<String, String> parent = new HashMap<>();
  private final Map<String, Integer> rank = new HashMap<>();

  public UnionFind(Collection<String> elements) {
    for (String element : elements) {
      parent.put(element, element);
      rank.put(element, 0);
    }
  }

  public String find(String element) {
    String root = parent.get(element);
    if (root == null) {
      throw new IllegalArgumentException("Unknown element: " + element);
    }
    while (!root.equals(parent.get(root))) {
      root = parent.get(root);
    }

    // compress the walked path
    String node = element;
    while (!node.equals(root)) {
      String next = parent.get(node);
      parent.put(node, root);
      node = next;
    }
    return root;
  }

  /**
   * Merge the sets of a and b.
   *
   * @return false if they were already in the same set
   */
  public boolean union(String a, String b) {
    String rootA = find(a);
    String rootB = find(b);
    if (rootA.equals(rootB)) {
      return false;
    }

    int rankA = rank.get(rootA);
    int rankB = rank.get(rootB);
    if (rankA < rankB) {
      parent.put(rootA, rootB);
    } else if (rankA > rankB) {
      parent.put(rootB, rootA);
    } else {
      parent.put(rootB, rootA);
      rank.put(rootA, rankA + 1);
    }
    return true;
  }

  public boolean connected(String a, String b) {
    return find(a).equals(find(b));
  }
}
