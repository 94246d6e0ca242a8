package com.cario.valuation.app.engine;

import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * Step-function depreciation table over vehicle age in months.
 *
 * <p>Bands are half-open {@code [lower, upper)}: an age exactly on a boundary belongs to the older
 * band. The bands must start at zero, be contiguous, end in an open-ended band and never decrease
 * in percent; the constructor rejects anything else.
 */
public final class DepreciationSchedule {

  /** One age band. {@code upperMonths == null} means unbounded. */
  @Value
  public static class Band {
    int lowerMonths;
    Integer upperMonths;
    double percent;

    boolean contains(int months) {
      return months >= lowerMonths && (upperMonths == null || months < upperMonths);
    }
  }

  private final String name;
  private final List<Band> bands;

  private DepreciationSchedule(String name, List<Band> bands) {
    this.name = name;
    this.bands = List.copyOf(bands);
    validate();
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Depreciation fraction (0..1) for the given age.
   *
   * @param ageMonths whole months since manufacture; negative values are treated as zero
   */
  public double percentFor(int ageMonths) {
    int months = Math.max(0, ageMonths);
    for (Band band : bands) {
      if (band.contains(months)) return band.getPercent();
    }
    throw new IllegalStateException("schedule " + name + " does not cover age " + months);
  }

  public List<Band> getBands() {
    return bands;
  }

  public String getName() {
    return name;
  }

  private void validate() {
    if (bands.isEmpty()) throw new IllegalArgumentException(name + ": no bands");
    int expectedLower = 0;
    double previous = 0;
    for (int i = 0; i < bands.size(); i++) {
      Band b = bands.get(i);
      boolean last = i == bands.size() - 1;
      if (b.getLowerMonths() != expectedLower) {
        throw new IllegalArgumentException(name + ": gap or overlap at " + b.getLowerMonths());
      }
      if (b.getPercent() < previous) {
        throw new IllegalArgumentException(name + ": percent decreases at " + b.getLowerMonths());
      }
      if (last != (b.getUpperMonths() == null)) {
        throw new IllegalArgumentException(name + ": only the last band may be open-ended");
      }
      if (!last && b.getUpperMonths() <= b.getLowerMonths()) {
        throw new IllegalArgumentException(name + ": empty band at " + b.getLowerMonths());
      }
      previous = b.getPercent();
      expectedLower = last ? expectedLower : b.getUpperMonths();
    }
  }

  /** Collects bands in ascending age order. */
  public static final class Builder {
    private final String name;
    private final List<Band> bands = new ArrayList<>();
    private int nextLower = 0;

    private Builder(String name) {
      this.name = name;
    }

    /** Adds a band from the previous upper bound (or zero) up to {@code upperMonths}. */
    public Builder until(int upperMonths, double percent) {
      bands.add(new Band(nextLower, upperMonths, percent));
      nextLower = upperMonths;
      return this;
    }

    /** Adds the final, open-ended band and builds the schedule. */
    public DepreciationSchedule thereafter(double percent) {
      bands.add(new Band(nextLower, null, percent));
      return new DepreciationSchedule(name, bands);
    }
  }
}
