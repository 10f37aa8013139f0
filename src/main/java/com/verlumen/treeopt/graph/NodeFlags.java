package com.verlumen.treeopt.graph;

import com.google.auto.value.AutoValue;

/** Raw classification flags as a graph loader reports them. */
@AutoValue
public abstract class NodeFlags {
  public static NodeFlags none() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_NodeFlags.Builder()
        .setKeystone(false)
        .setNotable(false)
        .setMastery(false)
        .setJewelSocket(false);
  }

  public abstract boolean keystone();

  public abstract boolean notable();

  public abstract boolean mastery();

  public abstract boolean jewelSocket();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setKeystone(boolean keystone);

    public abstract Builder setNotable(boolean notable);

    public abstract Builder setMastery(boolean mastery);

    public abstract Builder setJewelSocket(boolean jewelSocket);

    public abstract NodeFlags build();
  }
}
