package com.flamingo.ai.ragpipeline.service.rag.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Reciprocal Rank Fusion over any number of ranked lists.
 *
 * <p>An item's score is the sum of {@code 1 / (k + rank)} over the lists it appears in, with
 * {@code rank} 1-based. Ties are broken by the number of lists the item appears in, then by the
 * supplied document order, so the output never depends on hash iteration order. Only the first
 * occurrence of an item within one list counts.
 */
public final class ReciprocalRankFusion {

  private ReciprocalRankFusion() {}

  /**
   * An item with its fused score.
   *
   * @param item the first occurrence of the item across the input lists
   * @param score the summed reciprocal rank
   * @param lists indexes of the input lists the item appeared in
   */
  public record Fused<T>(T item, double score, Set<Integer> lists) {

    public int listCount() {
      return lists.size();
    }

    public boolean foundIn(int listIndex) {
      return lists.contains(listIndex);
    }
  }

  /**
   * Fuses ranked lists.
   *
   * @param rankings the ranked lists, best first
   * @param idOf identity of an item across lists
   * @param documentOrder final tie-breaker between items with equal score and list count
   * @param k smoothing constant, must be positive
   * @param size maximum number of results
   * @return fused items, best first, at most {@code size}
   * @throws IllegalArgumentException if {@code k} or {@code size} is not positive
   */
  public static <T> List<Fused<T>> fuse(
      List<List<T>> rankings,
      Function<T, String> idOf,
      Comparator<T> documentOrder,
      int k,
      int size) {
    if (k <= 0) {
      throw new IllegalArgumentException("RRF k must be positive: " + k);
    }
    if (size <= 0) {
      throw new IllegalArgumentException("Result size must be positive: " + size);
    }

    Map<String, Accumulator<T>> byId = new LinkedHashMap<>();
    for (int listIndex = 0; listIndex < rankings.size(); listIndex++) {
      List<T> ranking = rankings.get(listIndex);
      for (int i = 0; i < ranking.size(); i++) {
        T item = ranking.get(i);
        Accumulator<T> acc = byId.computeIfAbsent(idOf.apply(item), id -> new Accumulator<>(item));
        if (acc.lists.add(listIndex)) {
          acc.score += 1.0 / (k + i + 1);
        }
      }
    }

    Comparator<Accumulator<T>> order =
        Comparator.<Accumulator<T>>comparingDouble(a -> a.score)
            .reversed()
            .thenComparing(Comparator.<Accumulator<T>>comparingInt(a -> a.lists.size()).reversed())
            .thenComparing((a, b) -> documentOrder.compare(a.item, b.item));

    List<Accumulator<T>> sorted = new ArrayList<>(byId.values());
    sorted.sort(order);

    List<Fused<T>> fused = new ArrayList<>(Math.min(size, sorted.size()));
    for (Accumulator<T> acc : sorted.subList(0, Math.min(size, sorted.size()))) {
      fused.add(new Fused<>(acc.item, acc.score, Set.copyOf(acc.lists)));
    }
    return fused;
  }

  private static final class Accumulator<T> {
    private final T item;
    private final TreeSet<Integer> lists = new TreeSet<>();
    private double score;

    private Accumulator(T item) {
      this.item = item;
    }
  }
}
