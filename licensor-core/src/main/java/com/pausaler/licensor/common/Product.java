package com.pausaler.licensor.common;

/**
 * Identity of the licensed product.
 */
public class Product {

  /**
   * Canonical application identifier. Activation codes must carry exactly this value.
   */
  public static final String APP_ID = "com.dstankovski.pausaler-app";

  private Product() {
  }
}
