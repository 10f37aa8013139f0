package com.verlumen.treeopt.evaluation;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Optional;

/** Metrics an evaluator worker reports, with the keys used on the wire. */
public enum Metric {
  DPS("dps"),
  LIFE("life"),
  EHP("ehp"),
  MANA("mana"),
  ENERGY_SHIELD("es"),
  BLOCK("block"),
  CLEAR_SPEED("clear_speed");

  private static final ImmutableMap<String, Metric> BY_WIRE_KEY =
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(Metric::wireKey, m -> m));

  private final String wireKey;

  Metric(String wireKey) {
    this.wireKey = wireKey;
  }

  public String wireKey() {
    return wireKey;
  }

  public static Optional<Metric> fromWireKey(String key) {
    return Optional.ofNullable(BY_WIRE_KEY.get(key));
  }
}
