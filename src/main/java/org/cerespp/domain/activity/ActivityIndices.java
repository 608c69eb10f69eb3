package org.cerespp.domain.activity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.cerespp.domain.error.CoverageException;

/**
 * Per-observation activity indices: computed values plus the reason each missing index is absent.
 *
 * @since 0.1.0
 */
public final class ActivityIndices {
  private final Map<IndexName, IndexValue> values;
  private final Map<IndexName, CoverageException> missing;

  /**
   * Creates an immutable snapshot.
   *
   * @param values computed indices
   * @param missing indices that could not be computed, with their cause
   */
  public ActivityIndices(Map<IndexName, IndexValue> values, Map<IndexName, CoverageException> missing) {
    EnumMap<IndexName, IndexValue> v = new EnumMap<>(IndexName.class);
    if (values != null) {
      v.putAll(values);
    }
    EnumMap<IndexName, CoverageException> m = new EnumMap<>(IndexName.class);
    if (missing != null) {
      m.putAll(missing);
    }
    this.values = Collections.unmodifiableMap(v);
    this.missing = Collections.unmodifiableMap(m);
  }

  public Optional<IndexValue> get(IndexName name) {
    return Optional.ofNullable(values.get(name));
  }

  public Optional<CoverageException> missingCause(IndexName name) {
    return Optional.ofNullable(missing.get(name));
  }

  public Map<IndexName, IndexValue> values() {
    return values;
  }

  public Map<IndexName, CoverageException> missing() {
    return missing;
  }

  @Override
  public String toString() {
    return "ActivityIndices{values=" + values + ", missing=" + missing.keySet() + '}';
  }
}
