package io.intellixity.vista.pipeline.config;

import io.intellixity.vista.pipeline.StepType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Equi-join of two aliases. {@code leftSource} may be the literal {@link #PREVIOUS}, which the
 * validator resolves to the output alias of the preceding step.
 */
public record JoinConfig(String leftSource, String rightSource, JoinType joinType, String leftOn, String rightOn,
                         String suffixLeft, String suffixRight) implements StepConfig {
  public static final String PREVIOUS = "previous";
  public static final String DEFAULT_SUFFIX_LEFT = "_left";
  public static final String DEFAULT_SUFFIX_RIGHT = "_right";

  public JoinConfig {
    Objects.requireNonNull(rightSource, "rightSource");
    Objects.requireNonNull(leftOn, "leftOn");
    Objects.requireNonNull(rightOn, "rightOn");
    joinType = (joinType == null) ? JoinType.INNER : joinType;
    suffixLeft = (suffixLeft == null) ? DEFAULT_SUFFIX_LEFT : suffixLeft;
    suffixRight = (suffixRight == null) ? DEFAULT_SUFFIX_RIGHT : suffixRight;
  }

  public JoinConfig(String leftSource, String rightSource, JoinType joinType, String leftOn, String rightOn) {
    this(leftSource, rightSource, joinType, leftOn, rightOn, null, null);
  }

  public boolean leftIsPrevious() {
    return leftSource == null || PREVIOUS.equalsIgnoreCase(leftSource);
  }

  @Override public StepType type() { return StepType.JOIN; }

  @Override
  public List<String> referencedAliases() {
    List<String> out = new ArrayList<>(2);
    if (!leftIsPrevious()) out.add(leftSource);
    out.add(rightSource);
    return out;
  }
}
