package com.github.libbloom;

/**
 * Stock {@link Canonicalizer} implementations.
 */
public final class Canonicalizers {
  private Canonicalizers() {}

  private static final Canonicalizer<Object> STRING_VALUE = String::valueOf;

  private static final Canonicalizer<Object> TYPED =
      item -> item.getClass().getName() + ':' + item;

  private static final Canonicalizer<String> IDENTITY = item -> item;

  /**
   * Canonicalizes with <code>String.valueOf(item)</code>.
   * <p>
   * <em>Distinct items with equal string forms collide.</em> The <code>Integer</code>
   * <code>1</code> and the <code>String</code> <code>"1"</code> are the same element
   * under this rule, and so are any two objects whose class does not override
   * <code>toString</code> in a value-based way. Use {@link #typed()} for sets that mix
   * types, or supply a dedicated {@link Canonicalizer} for composite values.
   */
  public static Canonicalizer<Object> stringValue() {
    return STRING_VALUE;
  }

  /**
   * Canonicalizes with the item's class name followed by its string form, so items of
   * different classes never collide. Items of the same class still collide when their
   * <code>toString</code> results are equal.
   */
  public static Canonicalizer<Object> typed() {
    return TYPED;
  }

  /** Hashes strings as they are. */
  public static Canonicalizer<String> identity() {
    return IDENTITY;
  }
}
