package com.cario.valuation.app.engine.rules;

import com.cario.valuation.app.model.VehicleAge;
import com.cario.valuation.app.model.VehicleRecord;
import lombok.Value;

/** Inputs every adjustment rule may inspect. */
@Value
public class ValuationContext {

  VehicleRecord vehicle;

  VehicleAge age;

  /** Historical reference price the book value was derived from. */
  double referencePrice;
}
