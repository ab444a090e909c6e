package sdcore.monoidal;

import java.util.List;
import sdcore.hypergraph.Port;

/**
 * The slices synthesized for one rank, top to bottom: operations, copies, swaps.
 * The port lists name the hypergraph output port carried by each wire at the four cuts of the layer.
 * @param above wires entering the operation slice
 * @param operations the rank's operations and thunks, with identity wires for values passing through
 * @param produced wires between the operation slice and the copy slice
 * @param copies fan-out of each produced wire to its number of consumers
 * @param sorted wires between the copy slice and the swap slices, grouped by producer
 * @param swaps the transpositions reordering the grouped wires into demand order
 * @param below wires leaving the layer, in the order the layer underneath demands them
 */
public record WiringLayer<W>(List<Port> above, Slice<W> operations, List<Port> produced, Slice<W> copies, List<Port> sorted,
                             List<Slice<W>> swaps, List<Port> below) {
  public WiringLayer {
    above = List.copyOf(above);
    produced = List.copyOf(produced);
    sorted = List.copyOf(sorted);
    swaps = List.copyOf(swaps);
    below = List.copyOf(below);
  }
}
