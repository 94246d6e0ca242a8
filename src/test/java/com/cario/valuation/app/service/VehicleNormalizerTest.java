package com.cario.valuation.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.cario.valuation.app.exception.NormalizationException;
import com.cario.valuation.app.exception.ValidationException;
import com.cario.valuation.app.model.BodyType;
import com.cario.valuation.app.model.CacheKey;
import com.cario.valuation.app.model.FuelType;
import com.cario.valuation.app.model.RawVehicleAttributes;
import com.cario.valuation.app.model.VehicleClass;
import com.cario.valuation.app.model.VehicleInput;
import com.cario.valuation.app.model.VehicleRecord;
import java.time.YearMonth;
import org.junit.jupiter.api.Test;

class VehicleNormalizerTest {

  private final VehicleNormalizer normalizer = new VehicleNormalizer();

  private static RawVehicleAttributes.RawVehicleAttributesBuilder rc() {
    return RawVehicleAttributes.builder()
        .rcNumber("ka01ab1234")
        .makerDescription("MARUTI SUZUKI INDIA LTD")
        .makerModel("SWIFT VXI")
        .manufacturingDate("2019-11")
        .registrationDate("2020-01-04")
        .fuelType("PETROL")
        .registeredAt("Bangalore Central, Karnataka")
        .color("PEARL WHITE")
        .ownerNumber("2")
        .bodyType("HATCHBACK")
        .vehicleCategory("LMV")
        .cubicCapacity("1197")
        .normsType("BS VI");
  }

  @Test
  void rcRecordIsCanonicalized() {
    VehicleRecord v = normalizer.fromRc(rc().build());

    assertEquals("KA01AB1234", v.getRegistrationNumber());
    assertEquals("MARUTI SUZUKI", v.getMake());
    assertEquals("SWIFT", v.getBaseModel());
    assertEquals("SWIFT VXI", v.getFullModel());
    assertEquals("SWIFT VXI 1197cc BS VI", v.getVariant());
    assertEquals(FuelType.PETROL, v.getFuelType());
    assertEquals(YearMonth.of(2019, 11), v.getManufacturingDate());
    assertEquals("KA01", v.getRegistrationCode());
    assertEquals("BANGALORE CENTRAL", v.getCity());
    assertEquals(BodyType.HATCHBACK, v.getBodyType());
    assertEquals(VehicleClass.FOUR_WHEELER, v.getVehicleClass());
    assertEquals(2, v.getOwnerCount());
    assertNull(v.getOdometer());
    assertEquals(
        CacheKey.of("MARUTI SUZUKI", "SWIFT", "2019", "BANGALORE CENTRAL"), v.cacheKey());
  }

  @Test
  void manufacturingMonthWinsOverRegistrationDate() {
    VehicleRecord v = normalizer.fromRc(rc().manufacturingDate("2019-12").build());
    assertEquals("2019", v.getManufacturingYear());
  }

  @Test
  void addressIsUsedWhenRegistrationCityIsMissing() {
    VehicleRecord v =
        normalizer.fromRc(rc().registeredAt(null).presentAddress("Pune, Maharashtra").build());
    assertEquals("PUNE", v.getCity());

    VehicleRecord none = normalizer.fromRc(rc().registeredAt(" ").presentAddress(null).build());
    assertEquals("UNKNOWN", none.getCity());
  }

  @Test
  void twoWheelerCategoryIsRecognised() {
    VehicleRecord v = normalizer.fromRc(rc().vehicleCategory("M-Cycle/Scooter(2WN)").build());
    assertEquals(VehicleClass.TWO_WHEELER, v.getVehicleClass());
  }

  @Test
  void unparseableOwnerNumberDefaultsToFirstOwner() {
    assertEquals(1, normalizer.fromRc(rc().ownerNumber("first").build()).getOwnerCount());
    assertEquals(1, normalizer.fromRc(rc().ownerNumber(null).build()).getOwnerCount());
    assertThrows(ValidationException.class, () -> normalizer.fromRc(rc().ownerNumber("0").build()));
  }

  @Test
  void missingModelOrDateIsRejected() {
    assertThrows(
        NormalizationException.class, () -> normalizer.fromRc(rc().makerModel(" ").build()));
    assertThrows(
        NormalizationException.class,
        () -> normalizer.fromRc(rc().manufacturingDate(null).build()));
    assertThrows(
        NormalizationException.class,
        () -> normalizer.fromRc(rc().manufacturingDate("sometime").build()));
    assertThrows(NormalizationException.class, () -> normalizer.fromRc(null));
  }

  @Test
  void manufacturingDateFormats() {
    assertEquals(YearMonth.of(2021, 3), VehicleNormalizer.manufacturingDate("2021-03"));
    assertEquals(YearMonth.of(2021, 3), VehicleNormalizer.manufacturingDate("2021-03-28"));
    assertEquals(YearMonth.of(2021, 3), VehicleNormalizer.manufacturingDate("03/2021"));
    assertEquals(YearMonth.of(2021, 1), VehicleNormalizer.manufacturingDate("2021"));
    assertThrows(
        NormalizationException.class, () -> VehicleNormalizer.manufacturingDate("2021-13"));
  }

  @Test
  void dayFirstDatesAndEmbeddedYears() {
    assertEquals(YearMonth.of(2021, 3), VehicleNormalizer.manufacturingDate("28-03-2021"));
    assertEquals(YearMonth.of(2021, 3), VehicleNormalizer.manufacturingDate("28/03/2021"));
    assertEquals(YearMonth.of(2018, 11), VehicleNormalizer.manufacturingDate("1/11/2018"));
    assertEquals(YearMonth.of(2019, 1), VehicleNormalizer.manufacturingDate("Mfg Aug 2019"));
    VehicleRecord v = normalizer.fromRc(rc().manufacturingDate("15-06-2017").build());
    assertEquals(YearMonth.of(2017, 6), v.getManufacturingDate());
  }

  @Test
  void corporateSuffixesAreStripped() {
    assertEquals("TATA", VehicleNormalizer.cleanMake("TATA MOTORS LIMITED"));
    assertEquals("HONDA CARS", VehicleNormalizer.cleanMake("HONDA CARS INDIA LTD"));
    assertEquals("MOTORS", VehicleNormalizer.cleanMake("MOTORS"));
  }

  @Test
  void fuelDescriptions() {
    assertEquals(FuelType.CNG, VehicleNormalizer.fuel("PETROL/CNG"));
    assertEquals(FuelType.ELECTRIC, VehicleNormalizer.fuel("ELECTRIC(BOV)"));
    assertEquals(FuelType.PETROL, VehicleNormalizer.fuel(null));
    assertThrows(NormalizationException.class, () -> VehicleNormalizer.fuel("HYDROGEN"));
  }

  @Test
  void rtoCodeIsFirstFourAlphanumerics() {
    assertEquals("DL08", VehicleNormalizer.rtoCode("dl-08-ab-1234"));
    assertEquals("HR26", VehicleNormalizer.rtoCode("HR 26 DK 0001"));
    assertEquals("", VehicleNormalizer.rtoCode(null));
  }

  @Test
  void callerInputIsCanonicalized() {
    VehicleInput in = new VehicleInput();
    in.setMake("Hyundai Motor India Ltd");
    in.setModel("creta sx(o)");
    in.setFuelType("diesel");
    in.setManufacturingDate("2021-06");
    in.setRtoCode("TN09");
    in.setCity(" chennai ");
    in.setBodyType("SUV");
    in.setVehicleType("2w");
    in.setOdometer(42_000);

    VehicleRecord v = normalizer.fromInput(in);

    assertEquals("Hyundai", v.getMake());
    assertEquals("CRETA", v.getBaseModel());
    assertEquals("creta sx(o)", v.getFullModel());
    assertEquals(FuelType.DIESEL, v.getFuelType());
    assertEquals("CHENNAI", v.getCity());
    assertEquals(BodyType.SUV, v.getBodyType());
    assertEquals(VehicleClass.TWO_WHEELER, v.getVehicleClass());
    assertEquals(1, v.getOwnerCount());
    assertEquals(42_000, v.getOdometer());
  }

  @Test
  void callerInputBoundsAreEnforced() {
    VehicleInput in = new VehicleInput();
    in.setMake("Kia");
    in.setModel("Seltos");
    in.setManufacturingDate("2022-01");
    in.setOwnerCount(0);
    assertThrows(ValidationException.class, () -> normalizer.fromInput(in));

    in.setOwnerCount(1);
    in.setOdometer(-5);
    assertThrows(ValidationException.class, () -> normalizer.fromInput(in));
  }
}
