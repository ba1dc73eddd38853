package io.texmark.calltree;

/** What to do when a keyword argument or object key is written twice in one literal. */
public enum DuplicateKeyPolicy {
  /** Later write replaces the earlier one. */
  OVERWRITE,
  /** Fail with a {@link ParseException}. */
  REJECT
}
