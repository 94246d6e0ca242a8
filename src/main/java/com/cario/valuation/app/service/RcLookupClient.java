package com.cario.valuation.app.service;

import com.cario.valuation.app.model.RawVehicleAttributes;

/** Fetches registration-certificate attributes for a registration number. */
public interface RcLookupClient {

  RawVehicleAttributes lookup(String rcNumber);
}
