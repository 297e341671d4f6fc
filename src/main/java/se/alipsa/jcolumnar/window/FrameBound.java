package se.alipsa.jcolumnar.window;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One end of a window frame.
 *
 * @param type
 *          the bound type
 * @param offset
 *          distance for {@link Type#PRECEDING} and {@link Type#FOLLOWING},
 *          otherwise {@code null}
 */
public record FrameBound(Type type, BigDecimal offset) {

  /** Bound types in frame order. */
  public enum Type {
    UNBOUNDED_PRECEDING, PRECEDING, CURRENT_ROW, FOLLOWING, UNBOUNDED_FOLLOWING
  }

  private static final FrameBound UNBOUNDED_PRECEDING = new FrameBound(Type.UNBOUNDED_PRECEDING, null);
  private static final FrameBound CURRENT_ROW = new FrameBound(Type.CURRENT_ROW, null);
  private static final FrameBound UNBOUNDED_FOLLOWING = new FrameBound(Type.UNBOUNDED_FOLLOWING, null);

  /**
   * Validating constructor.
   */
  public FrameBound {
    Objects.requireNonNull(type, "type");
    if (hasOffset(type) && offset == null) {
      throw new IllegalArgumentException(type + " requires an offset");
    }
    if (!hasOffset(type)) {
      offset = null;
    }
  }

  private static boolean hasOffset(Type type) {
    return type == Type.PRECEDING || type == Type.FOLLOWING;
  }

  public static FrameBound unboundedPreceding() {
    return UNBOUNDED_PRECEDING;
  }

  public static FrameBound currentRow() {
    return CURRENT_ROW;
  }

  public static FrameBound unboundedFollowing() {
    return UNBOUNDED_FOLLOWING;
  }

  public static FrameBound preceding(long offset) {
    return new FrameBound(Type.PRECEDING, BigDecimal.valueOf(offset));
  }

  public static FrameBound preceding(BigDecimal offset) {
    return new FrameBound(Type.PRECEDING, offset);
  }

  public static FrameBound following(long offset) {
    return new FrameBound(Type.FOLLOWING, BigDecimal.valueOf(offset));
  }

  public static FrameBound following(BigDecimal offset) {
    return new FrameBound(Type.FOLLOWING, offset);
  }

  /**
   * Whether the bound is UNBOUNDED PRECEDING or UNBOUNDED FOLLOWING.
   *
   * @return {@code true} if unbounded
   */
  public boolean isUnbounded() {
    return type == Type.UNBOUNDED_PRECEDING || type == Type.UNBOUNDED_FOLLOWING;
  }

  /**
   * Offset relative to the current row, negative for PRECEDING.
   *
   * @return the signed offset; zero for CURRENT ROW
   */
  BigDecimal signedOffset() {
    return switch (type) {
      case PRECEDING -> offset.negate();
      case FOLLOWING -> offset;
      default -> BigDecimal.ZERO;
    };
  }

  @Override
  public String toString() {
    return switch (type) {
      case UNBOUNDED_PRECEDING -> "UNBOUNDED PRECEDING";
      case PRECEDING -> offset.toPlainString() + " PRECEDING";
      case CURRENT_ROW -> "CURRENT ROW";
      case FOLLOWING -> offset.toPlainString() + " FOLLOWING";
      case UNBOUNDED_FOLLOWING -> "UNBOUNDED FOLLOWING";
    };
  }
}
