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

import com.healthmarketscience.sciformat.LeftPadChar;
import com.healthmarketscience.sciformat.SignMode;
import org.apache.commons.lang3.StringUtils;

/**
 * Renders a (rounded) mantissa between a target top and bottom digit place,
 * including the sign and any left padding.
 *
 * @author James Ahlborn
 */
public class MantissaRenderer
{
  private MantissaRenderer() {}

  /**
   * @param mantissa the rounded mantissa
   * @param targetTop decimal place to which the number is left padded
   * @param targetBottom decimal place of the last digit shown
   * @param signMode how to show the sign of non-negative numbers
   * @param padChar left padding character
   */
  public static String render(BigDecimal mantissa, int targetTop,
                              int targetBottom, SignMode signMode,
                              LeftPadChar padChar) {
    int printPrec = Math.max(0, -targetBottom);
    String absStr = mantissa.abs().setScale(printPrec, Rounding.ROUND_MODE)
      .toPlainString();

    String signStr = getSignString(mantissa.signum(), signMode);
    String padStr = getPadString(padChar, DigitPlaces.getTopDigit(mantissa),
                                 targetTop);

    switch(padChar) {
    case SPACE:
      return padStr + signStr + absStr;
    case ZERO:
      return signStr + padStr + absStr;
    default:
      throw new IllegalArgumentException("Unhandled pad char " + padChar);
    }
  }

  /**
   * @param signum the sign of the number (0 for zero or nan)
   * @param signMode how to show the sign of non-negative numbers
   *
   * @return "-" for negative numbers, the sign mode character for positive
   *         numbers, and a single space (or nothing) for zero/nan
   */
  public static String getSignString(int signum, SignMode signMode) {
    if(signum < 0) {
      return "-";
    }
    switch(signMode) {
    case NEGATIVE:
      return "";
    case ALWAYS:
      return ((signum > 0) ? "+" : " ");
    case SPACE:
      return " ";
    default:
      throw new IllegalArgumentException("Unhandled sign mode " + signMode);
    }
  }

  static String getPadString(LeftPadChar padChar, int topDigit,
                             int targetTop) {
    if(targetTop <= topDigit) {
      return "";
    }
    return StringUtils.repeat(padChar.getChar(), targetTop -
                              Math.max(topDigit, 0));
  }
}
