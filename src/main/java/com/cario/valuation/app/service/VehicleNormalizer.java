package com.cario.valuation.app.service;

import com.cario.valuation.app.exception.NormalizationException;
import com.cario.valuation.app.exception.ValidationException;
import com.cario.valuation.app.model.BodyType;
import com.cario.valuation.app.model.FuelType;
import com.cario.valuation.app.model.RawVehicleAttributes;
import com.cario.valuation.app.model.VehicleClass;
import com.cario.valuation.app.model.VehicleInput;
import com.cario.valuation.app.model.VehicleRecord;
import java.time.DateTimeException;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.log4j.Log4j2;

/**
 * Canonicalizes raw vehicle attributes into a {@link VehicleRecord}.
 *
 * <p>Pure string handling, no I/O. Absent or unparseable make, model or manufacturing date fails
 * with {@link NormalizationException}.
 */
@Log4j2
public class VehicleNormalizer {

  /** Corporate-entity tokens removed from the end of a manufacturer name. */
  static final Set<String> CORPORATE_SUFFIXES =
      Set.of(
          "LTD", "LTD.", "LIMITED", "PVT", "PVT.", "PRIVATE", "INDIA", "MOTOR", "MOTORS", "COMPANY",
          "CO", "CO.", "INC", "INC.", "CORPORATION", "CORP", "CORP.", "AUTO");

  static final String UNKNOWN_CITY = "UNKNOWN";

  private static final Pattern YEAR_MONTH =
      Pattern.compile("^(\\d{4})[-/](\\d{1,2})(?:[-/]\\d{1,2})?");
  private static final Pattern DAY_MONTH_YEAR =
      Pattern.compile("^\\d{1,2}[-/.](\\d{1,2})[-/.](\\d{4})$");
  private static final Pattern MONTH_YEAR = Pattern.compile("^(\\d{1,2})[-/](\\d{4})$");
  private static final Pattern YEAR_ONLY = Pattern.compile("^(\\d{4})$");
  private static final Pattern YEAR_ANYWHERE = Pattern.compile("\\b((?:19|20)\\d{2})\\b");
  private static final Pattern NON_ALNUM = Pattern.compile("[^A-Z0-9]");

  /** Normalizes an RC registry record. */
  public VehicleRecord fromRc(RawVehicleAttributes raw) {
    if (raw == null) throw new NormalizationException("vehicle record is empty");

    String city = firstSegment(raw.getRegisteredAt());
    if (city.isEmpty()) city = firstSegment(raw.getPresentAddress());

    return VehicleRecord.builder()
        .registrationNumber(upper(raw.getRcNumber()))
        .make(cleanMake(raw.getMakerDescription()))
        .baseModel(baseModel(raw.getMakerModel()))
        .fullModel(raw.getMakerModel().trim())
        .variant(describeVariant(raw))
        .fuelType(fuel(raw.getFuelType()))
        .manufacturingDate(manufacturingDate(raw.getManufacturingDate()))
        .registrationCode(rtoCode(raw.getRcNumber()))
        .city(city.isEmpty() ? UNKNOWN_CITY : city.toUpperCase(Locale.ROOT))
        .bodyType(BodyType.fromLabel(raw.getBodyType()))
        .vehicleClass(VehicleClass.fromCategory(raw.getVehicleCategory()))
        .color(trimToNull(raw.getColor()))
        .ownerCount(ownerCount(raw.getOwnerNumber()))
        .build();
  }

  /** Normalizes caller-supplied attributes. */
  public VehicleRecord fromInput(VehicleInput input) {
    if (input == null) throw new NormalizationException("vehicle details are empty");
    if (input.getOwnerCount() != null && input.getOwnerCount() < 1) {
      throw new ValidationException("owner_count must be at least 1");
    }
    if (input.getOdometer() != null && input.getOdometer() < 0) {
      throw new ValidationException("odometer must not be negative");
    }
    String city = trimToNull(input.getCity());

    return VehicleRecord.builder()
        .make(cleanMake(input.getMake()))
        .baseModel(baseModel(input.getModel()))
        .fullModel(input.getModel().trim())
        .variant(trimToNull(input.getVariant()))
        .fuelType(fuel(input.getFuelType()))
        .manufacturingDate(manufacturingDate(input.getManufacturingDate()))
        .registrationCode(rtoCode(input.getRtoCode()))
        .city(city == null ? UNKNOWN_CITY : city.toUpperCase(Locale.ROOT))
        .bodyType(BodyType.fromLabel(input.getBodyType()))
        .vehicleClass(VehicleClass.fromCode(input.getVehicleType()))
        .color(trimToNull(input.getColor()))
        .ownerCount(input.getOwnerCount() == null ? 1 : input.getOwnerCount())
        .odometer(input.getOdometer())
        .build();
  }

  // ============================================================
  // Field rules
  // ============================================================

  /**
   * Strips trailing corporate-entity tokens, e.g. {@code MARUTI SUZUKI INDIA LTD -> MARUTI SUZUKI}.
   */
  static String cleanMake(String raw) {
    if (raw == null || raw.isBlank()) throw new NormalizationException("make is required");
    List<String> tokens = new ArrayList<>(Arrays.asList(raw.trim().split("\\s+")));
    while (tokens.size() > 1
        && CORPORATE_SUFFIXES.contains(tokens.get(tokens.size() - 1).toUpperCase(Locale.ROOT))) {
      tokens.remove(tokens.size() - 1);
    }
    return String.join(" ", tokens);
  }

  static String baseModel(String raw) {
    if (raw == null || raw.isBlank()) throw new NormalizationException("model is required");
    return raw.trim().split("\\s+")[0].toUpperCase(Locale.ROOT);
  }

  static YearMonth manufacturingDate(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new NormalizationException("manufacturing date is required");
    }
    String s = raw.trim();
    try {
      Matcher m = YEAR_MONTH.matcher(s);
      if (m.find()) return YearMonth.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
      m = DAY_MONTH_YEAR.matcher(s);
      if (m.find()) return YearMonth.of(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1)));
      m = MONTH_YEAR.matcher(s);
      if (m.find()) return YearMonth.of(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1)));
      m = YEAR_ONLY.matcher(s);
      if (m.find()) return YearMonth.of(Integer.parseInt(m.group(1)), 1);
      m = YEAR_ANYWHERE.matcher(s);
      if (m.find()) {
        log.warn("normalizer.manufacturingDate year only from value={}, month defaults to 1", s);
        return YearMonth.of(Integer.parseInt(m.group(1)), 1);
      }
    } catch (DateTimeException e) {
      throw new NormalizationException("manufacturing date is invalid: " + s);
    }
    throw new NormalizationException("manufacturing date is unparseable: " + s);
  }

  /** Blank fuel defaults to petrol; an unrecognised description is rejected. */
  static FuelType fuel(String raw) {
    if (raw == null || raw.isBlank()) {
      log.warn("normalizer.fuel missing, defaulting to {}", FuelType.PETROL);
      return FuelType.PETROL;
    }
    FuelType fuel = FuelType.fromLabel(raw);
    if (fuel == null) throw new NormalizationException("fuel type is not supported: " + raw.trim());
    return fuel;
  }

  /** First four alphanumerics of a registration number: {@code DL-08-AB-1234 -> DL08}. */
  static String rtoCode(String raw) {
    if (raw == null) return "";
    String compact = NON_ALNUM.matcher(raw.toUpperCase(Locale.ROOT)).replaceAll("");
    return compact.length() > 4 ? compact.substring(0, 4) : compact;
  }

  static int ownerCount(String raw) {
    if (raw == null || raw.isBlank()) return 1;
    int count;
    try {
      count = Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      log.warn("normalizer.ownerCount unparseable value={}, defaulting to 1", raw);
      return 1;
    }
    if (count < 1) throw new ValidationException("owner count must be at least 1");
    return count;
  }

  private static String describeVariant(RawVehicleAttributes raw) {
    StringBuilder sb = new StringBuilder(raw.getMakerModel().trim());
    if (raw.getCubicCapacity() != null && !raw.getCubicCapacity().isBlank()) {
      sb.append(' ').append(raw.getCubicCapacity().trim()).append("cc");
    }
    if (raw.getNormsType() != null && !raw.getNormsType().isBlank()) {
      sb.append(' ').append(raw.getNormsType().trim());
    }
    return sb.toString();
  }

  private static String firstSegment(String s) {
    if (s == null) return "";
    return s.split(",")[0].trim();
  }

  private static String upper(String s) {
    return s == null ? null : s.trim().toUpperCase(Locale.ROOT);
  }

  private static String trimToNull(String s) {
    return s == null || s.isBlank() ? null : s.trim();
  }
}
