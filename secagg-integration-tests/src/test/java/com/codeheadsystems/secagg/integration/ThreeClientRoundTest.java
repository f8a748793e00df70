package com.codeheadsystems.secagg.integration;

class ThreeClientRoundTest extends AbstractSecureRoundTest {

  @Override
  protected int clientCount() {
    return 3;
  }

  @Override
  protected int threshold() {
    return 2;
  }

  @Override
  protected int droppedCount() {
    return 1;
  }
}
