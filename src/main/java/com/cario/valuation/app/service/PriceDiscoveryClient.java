package com.cario.valuation.app.service;

import com.cario.valuation.app.model.PriceDiscovery;
import com.cario.valuation.app.model.VehicleRecord;

/** Proposes the historical on-road price and current market median for a vehicle. */
public interface PriceDiscoveryClient {

  /**
   * @throws com.cario.valuation.app.exception.CollaboratorException when no usable on-road price
   *     could be obtained
   */
  PriceDiscovery discover(VehicleRecord vehicle);
}
