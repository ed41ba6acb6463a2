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
import java.math.RoundingMode;

import com.healthmarketscience.sciformat.FormatOptions;
import com.healthmarketscience.sciformat.RoundMode;

/**
 * Determines the digit place to which a number is rounded and performs the
 * (exact) decimal rounding.
 *
 * @author James Ahlborn
 */
public class Rounding
{
  public static final RoundingMode ROUND_MODE = RoundingMode.HALF_EVEN;

  private static final int PDG_TWO_DIGIT_MAX = 354;

  private Rounding() {}

  /**
   * @param num finite number which determines the digit place
   * @param roundMode significant figure or decimal place rounding
   * @param ndigits number of digits or {@link FormatOptions#AUTO}
   * @param pdgSigFigs whether to apply the particle data group rule when
   *                   significant figures are chosen automatically
   *
   * @return the decimal place of the least significant digit to keep
   */
  public static int getRoundDigit(BigDecimal num, RoundMode roundMode,
                                  int ndigits, boolean pdgSigFigs) {
    boolean auto = (ndigits == FormatOptions.AUTO);
    switch(roundMode) {
    case SIG_FIG:
      if(auto) {
        return (pdgSigFigs ? getPdgRoundDigit(num) :
                DigitPlaces.getBottomDigit(num));
      }
      return DigitPlaces.getTopDigit(num) - (ndigits - 1);
    case DEC_PLACE:
      return (auto ? DigitPlaces.getBottomDigit(num) : -ndigits);
    default:
      throw new IllegalArgumentException("Unhandled round mode " + roundMode);
    }
  }

  /**
   * Particle data group 3-5-4 rule: if the top three significant digits are
   * 100-354 two significant figures are kept, 355-949 keep one, and 950-999
   * are rounded up to 1000 which then shows two (e.g. 0.987 becomes 1.0).
   */
  public static int getPdgRoundDigit(BigDecimal num) {
    int topDigit = DigitPlaces.getTopDigit(num);
    if(num.signum() == 0) {
      return topDigit;
    }

    int topThree = num.abs().scaleByPowerOfTen(2 - topDigit)
      .setScale(0, RoundingMode.DOWN).intValueExact();

    if(topThree <= PDG_TWO_DIGIT_MAX) {
      return topDigit - 1;
    }
    // 950-999 rounds up to 1000, which again shows two digits
    return topDigit;
  }

  /**
   * @return the given number rounded to the given decimal place
   */
  public static BigDecimal round(BigDecimal num, int roundDigit) {
    return num.setScale(-roundDigit, ROUND_MODE);
  }
}
