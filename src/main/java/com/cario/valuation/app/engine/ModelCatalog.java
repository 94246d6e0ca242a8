package com.cario.valuation.app.engine;

import java.util.List;
import java.util.Locale;

/** Lifecycle lists used by market intelligence. Matching is whole-token and case-insensitive. */
public final class ModelCatalog {

  public static final List<String> DISCONTINUED =
      List.of(
          "Ecosport", "Figo", "Aspire", "Civic", "CR-V", "Yaris", "Etios", "Corolla Altis", "Punto",
          "Linea", "Aveo", "Beat", "Sail");

  public static final List<String> NEW_GENERATION_LAUNCHED =
      List.of(
          "Swift", "Dzire", "Baleno", "Creta", "Venue", "i20", "Verna", "Seltos", "Sonet", "City",
          "Amaze", "WR-V", "Brezza", "Ertiga");

  private final List<String> discontinued;
  private final List<String> newGeneration;

  public ModelCatalog(List<String> discontinued, List<String> newGeneration) {
    this.discontinued = List.copyOf(discontinued);
    this.newGeneration = List.copyOf(newGeneration);
  }

  public static ModelCatalog defaults() {
    return new ModelCatalog(DISCONTINUED, NEW_GENERATION_LAUNCHED);
  }

  public boolean isDiscontinued(String model) {
    return matchesAny(model, discontinued);
  }

  public boolean hasNewGeneration(String model) {
    return matchesAny(model, newGeneration);
  }

  /** True when one of the names appears in the model as a whole token sequence. */
  static boolean matchesAny(String model, List<String> names) {
    if (model == null || model.isBlank()) return false;
    String padded = " " + model.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ") + " ";
    for (String name : names) {
      if (padded.contains(" " + name.toUpperCase(Locale.ROOT) + " ")) return true;
    }
    return false;
  }
}
