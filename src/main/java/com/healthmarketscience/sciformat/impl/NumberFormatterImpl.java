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
import java.util.Locale;

import com.healthmarketscience.sciformat.ExpMode;
import com.healthmarketscience.sciformat.FormatOptions;
import com.healthmarketscience.sciformat.FormattedNumber;

/**
 * Formats a single number using fully resolved options.
 *
 * @author James Ahlborn
 */
public class NumberFormatterImpl
{
  private NumberFormatterImpl() {}

  public static FormattedNumber format(Num num, FormatOptions opts) {
    ExpMode expMode = opts.getExpMode();
    if(expMode == ExpMode.PERCENT) {
      num = num.scaleByPowerOfTen(2);
    }
    num = num.normalize();

    if(!num.isFinite()) {
      return formatNonFinite(num, opts);
    }

    int inputExp = opts.getExpVal();
    MantissaExp mantExp = ExponentResolver.resolve(
        num.getValue(), expMode, inputExp);
    int roundDigit = getRoundDigit(mantExp, opts);
    BigDecimal rounded = Rounding.round(mantExp.getMantissa(), roundDigit);

    // rounding may have bumped the number into the next exponent (9.99 ->
    // 10.0), so resolve again from the rounded number
    BigDecimal roundedNum = ExponentResolver.scale(
        rounded, mantExp.getBase(), mantExp.getExp());
    mantExp = ExponentResolver.resolve(roundedNum, expMode, inputExp);
    roundDigit = getRoundDigit(mantExp, opts);
    rounded = Rounding.round(mantExp.getMantissa(), roundDigit);

    int exp = mantExp.getExp();
    if(rounded.signum() == 0) {
      // a number rounded away entirely is shown as a plain zero
      exp = 0;
    }

    String body = MantissaRenderer.render(
        rounded, opts.getLeftPadDecPlace(), roundDigit, opts.getSignMode(),
        opts.getLeftPadChar());
    body = DigitGrouper.group(body, opts.getUpperSeparator(),
                              opts.getDecimalSeparator(),
                              opts.getLowerSeparator());

    return new FormattedNumber(
        body, ExponentRenderer.render(exp, expMode, opts));
  }

  /**
   * Non-finite numbers are never rounded or padded.  They are shown with an
   * exponent only when requested via {@link FormatOptions#isNanInfExp}.
   */
  static FormattedNumber formatNonFinite(Num num, FormatOptions opts) {
    String token = getNonFiniteString(num, opts);
    ExpMode expMode = opts.getExpMode();

    if(expMode == ExpMode.PERCENT) {
      return new FormattedNumber("(" + token + ")", ExpSuffix.PERCENT);
    }

    if(opts.isNanInfExp() && !expMode.isFixed()) {
      int exp = ExponentResolver.getNonFiniteExp(expMode, opts.getExpVal());
      ExpSuffix suffix = ExponentRenderer.render(exp, expMode, opts);
      if(!suffix.isEmpty()) {
        return new FormattedNumber("(" + token + ")", suffix);
      }
    }

    return new FormattedNumber(token, ExpSuffix.NONE);
  }

  /**
   * @return the signed "nan"/"inf" string for the given non-finite number
   */
  static String getNonFiniteString(Num num, FormatOptions opts) {
    String token = MantissaRenderer.getSignString(
        num.signum(), opts.getSignMode()) + num.getAbsName();
    return (opts.isCapitalize() ? token.toUpperCase(Locale.ROOT) : token);
  }

  private static int getRoundDigit(MantissaExp mantExp, FormatOptions opts) {
    return Rounding.getRoundDigit(mantExp.getMantissa(), opts.getRoundMode(),
                                  opts.getNdigits(), false);
  }
}
