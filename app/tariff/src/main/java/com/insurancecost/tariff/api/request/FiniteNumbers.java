package com.insurancecost.tariff.api.request;

/** 料率と価格の上限。JSON の 1e400 などは Infinity として読まれるため、最大の有限 double で弾く。 */
final class FiniteNumbers {

  // Double.MAX_VALUE の 10 進表記。注釈の属性値には定数式の String が必要
  static final String MAX_FINITE = "1.7976931348623157E308";

  private FiniteNumbers() {}
}
