package se.alipsa.stpls.core.model;

import java.util.Objects;

/** Result of a successful prepare-rename: the token range and the text shown in the rename box. */
public final class RenameTarget {
  private final Range range;
  private final String placeholder;

  public RenameTarget(Range range, String placeholder) {
    this.range = Objects.requireNonNull(range, "range");
    this.placeholder = Objects.requireNonNull(placeholder, "placeholder");
  }

  public Range getRange() { return range; }
  public String getPlaceholder() { return placeholder; }

  @Override
  public String toString() { return placeholder + range; }
}
