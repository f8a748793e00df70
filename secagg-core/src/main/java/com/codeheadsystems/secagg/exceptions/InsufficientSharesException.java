package com.codeheadsystems.secagg.exceptions;

/**
 * Thrown when a secret reconstruction is attempted with fewer shares than the threshold.
 */
public class InsufficientSharesException extends IllegalArgumentException {

  private final int required;
  private final int provided;

  /**
   * Instantiates a new Insufficient shares exception.
   *
   * @param required the threshold
   * @param provided the number of shares supplied
   */
  public InsufficientSharesException(final int required, final int provided) {
    super("Need at least " + required + " shares, got " + provided + ".");
    this.required = required;
    this.provided = provided;
  }

  public int required() {
    return required;
  }

  public int provided() {
    return provided;
  }
}
