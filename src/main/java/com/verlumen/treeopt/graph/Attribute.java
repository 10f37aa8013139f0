package com.verlumen.treeopt.graph;

public enum Attribute {
  STRENGTH,
  DEXTERITY,
  INTELLIGENCE
}
