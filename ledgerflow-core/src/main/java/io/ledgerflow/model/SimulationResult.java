package io.ledgerflow.model;

public record SimulationResult(boolean success, String error) {

  public static SimulationResult ok() {
    return new SimulationResult(true, null);
  }

  public static SimulationResult failed(String error) {
    return new SimulationResult(false, error);
  }
}
