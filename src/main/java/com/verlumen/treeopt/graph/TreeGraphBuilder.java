package com.verlumen.treeopt.graph;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assembles a {@link TreeGraph} from node declarations and undirected edges. Graph loaders feed
 * their parsed topology through this builder; node types are derived here with {@link
 * NodeClassifier}.
 */
public final class TreeGraphBuilder {
  private final Map<Integer, NodeMetadata> nodes = new LinkedHashMap<>();
  private final ImmutableSetMultimap.Builder<Integer, Integer> edges =
      ImmutableSetMultimap.builder();

  public static TreeGraphBuilder create() {
    return new TreeGraphBuilder();
  }

  public TreeGraphBuilder addNode(int id) {
    return addNode(NodeMetadata.of(id, NodeType.NORMAL));
  }

  /** Adds a node typed from raw loader flags. */
  public TreeGraphBuilder addNode(int id, String name, NodeFlags flags) {
    return addNode(
        NodeMetadata.builder()
            .setId(id)
            .setName(name)
            .setType(NodeClassifier.classify(flags))
            .build());
  }

  public TreeGraphBuilder addMastery(int id, ImmutableList<Integer> effects) {
    checkArgument(!effects.isEmpty(), "Mastery node %s needs at least one effect", id);
    return addNode(
        NodeMetadata.builder()
            .setId(id)
            .setName("mastery-" + id)
            .setType(NodeType.MASTERY)
            .setMasteryEffects(effects)
            .build());
  }

  public TreeGraphBuilder addNode(NodeMetadata metadata) {
    checkArgument(!nodes.containsKey(metadata.id()), "Node %s declared twice", metadata.id());
    nodes.put(metadata.id(), metadata);
    return this;
  }

  public TreeGraphBuilder addEdge(int a, int b) {
    checkArgument(a != b, "Self loop on node %s", a);
    edges.put(a, b);
    edges.put(b, a);
    return this;
  }

  public TreeGraph build() {
    ImmutableSetMultimap<Integer, Integer> adjacency = edges.build();
    for (int endpoint : adjacency.keySet()) {
      checkState(nodes.containsKey(endpoint), "Edge references undeclared node %s", endpoint);
    }
    return new TreeGraphImpl(ImmutableMap.copyOf(nodes), adjacency);
  }

  private TreeGraphBuilder() {}
}
