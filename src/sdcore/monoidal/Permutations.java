package sdcore.monoidal;

import java.util.ArrayList;
import java.util.List;

public final class Permutations {
  private Permutations() {}

  /**
   * Decomposes a permutation into layers of adjacent transpositions, one odd-even bubble pass per layer.
   * Reading the layers top to bottom sorts the wires, so the wire at position i on top ends up at position
   *  {@code permutation[i]} at the bottom. Each layer removes at least one inversion.
   * @param permutation a permutation of {@code 0..n-1}
   * @return the swap slices; empty for the identity
   */
  public static <W> List<Slice<W>> permutationToSwaps(List<Integer> permutation) {
    int[] current = permutation.stream().mapToInt(Integer::intValue).toArray();
    List<Slice<W>> slices = new ArrayList<>();
    boolean finished = false;
    while (!finished) {
      finished = true;
      List<SliceOp<W>> ops = new ArrayList<>();
      int i = 0;
      while (i + 1 < current.length) {
        if (current[i] <= current[i + 1]) {
          ops.add(SliceOp.id());
          i += 1;
        } else {
          finished = false;
          ops.add(SliceOp.swap());
          int tmp = current[i];
          current[i] = current[i + 1];
          current[i + 1] = tmp;
          i += 2;
        }
      }
      if (i + 1 == current.length)
        ops.add(SliceOp.id());
      if (!finished)
        slices.add(new Slice<>(ops));
    }
    return slices;
  }
}
