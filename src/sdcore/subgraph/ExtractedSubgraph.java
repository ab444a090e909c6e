package sdcore.subgraph;

import java.util.List;
import sdcore.graph.EdgeLike;
import sdcore.hypergraph.HyperGraph;

/**
 * The result of {@link SubgraphExtractor#extract(Selection)}.
 * @param graph the independent hypergraph
 * @param inputs the source-graph edges feeding its Input ports, in port order
 * @param outputs the source-graph edges leaving through its Output node, in port order
 */
public record ExtractedSubgraph<W>(HyperGraph<W> graph, List<EdgeLike<W>> inputs, List<EdgeLike<W>> outputs) {
  public ExtractedSubgraph {
    inputs = List.copyOf(inputs);
    outputs = List.copyOf(outputs);
  }
}
