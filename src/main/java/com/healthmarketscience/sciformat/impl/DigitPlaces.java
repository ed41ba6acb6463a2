/*
Copyright (c) 2024 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.sciformat.impl;

import java.math.BigDecimal;

/**
 * Digit place queries on exact decimal values.  Digit places are powers of
 * ten, i.e. place 0 is the ones place, place 2 the hundreds place and place
 * -1 the tenths place.
 * <p/>
 * All calculations work off of the decimal digit sequence (precision and
 * scale) and never a logarithm, so there are no off-by-one errors at powers
 * of ten.
 *
 * @author James Ahlborn
 */
public class DigitPlaces
{
  private static final BigDecimal TWO = BigDecimal.valueOf(2);

  private DigitPlaces() {}

  /**
   * @return the digit place of the most significant digit of the given
   *         number, 0 for 0
   */
  public static int getTopDigit(BigDecimal num) {
    if(num.signum() == 0) {
      return 0;
    }
    return num.precision() - num.scale() - 1;
  }

  /**
   * @return the digit place of the least significant digit in the exact
   *         decimal representation of the given number, e.g. -2 for
   *         {@code 1.50} but 2 for {@code 1.5E+3}
   */
  public static int getBottomDigit(BigDecimal num) {
    return -num.scale();
  }

  /**
   * @return {@code floor(log2(|num|))}, 0 for 0
   */
  public static int getTopDigitBinary(BigDecimal num) {
    if(num.signum() == 0) {
      return 0;
    }

    BigDecimal abs = num.abs();
    if(abs.compareTo(BigDecimal.ONE) >= 0) {
      return abs.toBigInteger().bitLength() - 1;
    }

    int exp = 0;
    while(abs.compareTo(BigDecimal.ONE) < 0) {
      abs = abs.multiply(TWO);
      --exp;
    }
    return exp;
  }
}
