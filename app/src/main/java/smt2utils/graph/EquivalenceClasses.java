package smt2utils.graph;

import java.util.Arrays;

/**
 * Disjoint sets over dense node ids with path compression and union by size. When two classes
 * of equal size are joined, the lower root id becomes the representative.
 */
public final class EquivalenceClasses {
  private int[] parent = new int[16];
  private int[] size = new int[16];
  private int count;
  private int classCount;

  /** Adds a singleton class and returns its id. */
  public int add() {
    if (count == parent.length) {
      parent = Arrays.copyOf(parent, count * 2);
      size = Arrays.copyOf(size, count * 2);
    }
    parent[count] = count;
    size[count] = 1;
    classCount++;
    return count++;
  }

  public int find(int id) {
    checkId(id);
    int root = id;
    while (parent[root] != root) {
      root = parent[root];
    }
    int current = id;
    while (parent[current] != root) {
      int next = parent[current];
      parent[current] = root;
      current = next;
    }
    return root;
  }

  /**
   * Joins the classes of {@code a} and {@code b}.
   *
   * @return {@code true} if they were distinct
   */
  public boolean union(int a, int b) {
    int rootA = find(a);
    int rootB = find(b);
    if (rootA == rootB) {
      return false;
    }
    int winner;
    int loser;
    if (size[rootA] != size[rootB]) {
      winner = size[rootA] > size[rootB] ? rootA : rootB;
    } else {
      winner = Math.min(rootA, rootB);
    }
    loser = winner == rootA ? rootB : rootA;
    parent[loser] = winner;
    size[winner] += size[loser];
    classCount--;
    return true;
  }

  public boolean same(int a, int b) {
    return find(a) == find(b);
  }

  public int classSize(int id) {
    return size[find(id)];
  }

  public int size() {
    return count;
  }

  public int classCount() {
    return classCount;
  }

  private void checkId(int id) {
    if (id < 0 || id >= count) {
      throw new IndexOutOfBoundsException("Unknown node id " + id + " of " + count);
    }
  }
}
