package com.cario.valuation.app.engine;

import com.cario.valuation.app.model.VehicleClass;

/** The fixed depreciation grids and the lookup that picks one by pipeline and vehicle class. */
public final class DepreciationGrids {

  /** Resale grid shared by all body types. */
  public static final DepreciationSchedule RESALE =
      DepreciationSchedule.builder("resale")
          .until(6, 0.05)
          .until(12, 0.10)
          .until(24, 0.18)
          .until(36, 0.25)
          .until(48, 0.30)
          .until(60, 0.35)
          .until(72, 0.40)
          .until(84, 0.45)
          .until(96, 0.50)
          .thereafter(0.60);

  public static final DepreciationSchedule IDV_TWO_WHEELER =
      DepreciationSchedule.builder("idv-2w")
          .until(6, 0.05)
          .until(12, 0.15)
          .until(24, 0.20)
          .until(36, 0.30)
          .until(48, 0.40)
          .until(60, 0.50)
          .until(84, 0.60)
          .thereafter(0.65);

  /** Four-wheelers hold value longer in the 5-7 year band and carry two extra bands past 7. */
  public static final DepreciationSchedule IDV_FOUR_WHEELER =
      DepreciationSchedule.builder("idv-4w")
          .until(6, 0.05)
          .until(12, 0.15)
          .until(24, 0.20)
          .until(36, 0.30)
          .until(48, 0.40)
          .until(60, 0.50)
          .until(84, 0.55)
          .until(120, 0.65)
          .thereafter(0.70);

  private DepreciationGrids() {}

  public static double resalePercent(int ageMonths) {
    return RESALE.percentFor(ageMonths);
  }

  public static double idvPercent(VehicleClass vehicleClass, int ageMonths) {
    return idvSchedule(vehicleClass).percentFor(ageMonths);
  }

  public static DepreciationSchedule idvSchedule(VehicleClass vehicleClass) {
    return vehicleClass == VehicleClass.TWO_WHEELER ? IDV_TWO_WHEELER : IDV_FOUR_WHEELER;
  }
}
