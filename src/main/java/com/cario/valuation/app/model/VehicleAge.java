package com.cario.valuation.app.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import lombok.Value;

/**
 * Whole-month age of a vehicle measured from its manufacturing month.
 *
 * <p>Age never goes negative: a manufacturing month in the future yields zero months.
 */
@Value
public class VehicleAge {

  /** Assumed running per month when no odometer reading is available. */
  public static final int KM_PER_MONTH = 1000;

  int totalMonths;

  public static VehicleAge between(YearMonth manufactured, LocalDate today) {
    long months = ChronoUnit.MONTHS.between(manufactured, YearMonth.from(today));
    return new VehicleAge((int) Math.max(0, months));
  }

  public static VehicleAge ofMonths(int months) {
    return new VehicleAge(Math.max(0, months));
  }

  public int getYears() {
    return totalMonths / 12;
  }

  public int getRemainderMonths() {
    return totalMonths % 12;
  }

  public double getFractionalYears() {
    return totalMonths / 12.0;
  }

  /** Odometer estimate used when no actual reading exists. */
  public int estimatedOdometer() {
    return totalMonths * KM_PER_MONTH;
  }

  /** Human readable form, e.g. {@code "7 years 1 months"}. */
  public String label() {
    return getYears() + " years " + getRemainderMonths() + " months";
  }
}
