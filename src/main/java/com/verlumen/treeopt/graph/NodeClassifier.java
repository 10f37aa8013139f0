package com.verlumen.treeopt.graph;

/**
 * Derives a node's {@link NodeType} from its loader flags. This is the only place node types are
 * decided; everything downstream reads {@link NodeMetadata#type()}.
 */
public final class NodeClassifier {
  /** Precedence is mastery, socket, keystone, notable, then normal. */
  public static NodeType classify(NodeFlags flags) {
    if (flags.mastery()) {
      return NodeType.MASTERY;
    }
    if (flags.jewelSocket()) {
      return NodeType.SOCKET;
    }
    if (flags.keystone()) {
      return NodeType.KEYSTONE;
    }
    if (flags.notable()) {
      return NodeType.NOTABLE;
    }
    return NodeType.NORMAL;
  }

  private NodeClassifier() {}
}
