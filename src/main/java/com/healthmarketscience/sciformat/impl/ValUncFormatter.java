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

import com.healthmarketscience.sciformat.ExpMode;
import com.healthmarketscience.sciformat.FormatOptions;
import com.healthmarketscience.sciformat.FormattedNumber;
import com.healthmarketscience.sciformat.RoundMode;
import com.healthmarketscience.sciformat.Separator;
import com.healthmarketscience.sciformat.SignMode;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Formats a value together with its uncertainty.  Both numbers are rounded
 * to the same digit place (determined by the uncertainty when possible) and
 * are shown with a single shared exponent.
 *
 * @author James Ahlborn
 */
public class ValUncFormatter
{
  private static final Log LOG = LogFactory.getLog(ValUncFormatter.class);

  private static final String PM = "\u00B1";

  private ValUncFormatter() {}

  public static FormattedNumber format(Num val, Num unc, FormatOptions opts) {
    int ndigits = opts.getNdigits();
    if(opts.getRoundMode() == RoundMode.DEC_PLACE) {
      LOG.warn("Decimal place rounding is not supported when formatting a " +
               "value with an uncertainty, using significant figure " +
               "rounding on the uncertainty instead");
      if(ndigits < 1) {
        // zero or negative decimal places are not a significant figure count
        ndigits = FormatOptions.AUTO;
      }
    }

    ExpMode expMode = opts.getExpMode();
    boolean percent = (expMode == ExpMode.PERCENT);

    unc = unc.abs();
    if(percent) {
      val = val.scaleByPowerOfTen(2);
      unc = unc.scaleByPowerOfTen(2);
    }
    val = val.normalize();
    unc = unc.normalize();

    RoundedValUnc rounded = roundValUnc(val, unc, ndigits, opts);
    // the first rounding may have changed the top digit of the round driver
    // (e.g. 0.0996 -> 0.100), so round again from the rounded numbers
    rounded = roundValUnc(rounded._val, rounded._unc, ndigits, opts);
    val = rounded._val;
    unc = rounded._unc;

    int exp = 0;
    int bottomDigit = 0;
    Num valMantissa = val;
    Num uncMantissa = unc;
    if(val.isFinite() || unc.isFinite()) {
      Num expDriver = (val.isFinite() ? val : unc);
      exp = ExponentResolver.resolve(expDriver.getValue(), expMode,
                                     opts.getExpVal()).getExp();

      ExpMode freeExpMode = getFreeExpMode(expMode);
      valMantissa = getMantissa(val, freeExpMode, exp);
      uncMantissa = getMantissa(unc, freeExpMode, exp);
      // for the binary modes a base 2 exponent is also taken as the number
      // of extra decimal places, 2^-n has exactly n decimal places so the
      // rounded digits are still shown exactly (1024 ± 1 is
      // (1.0000000000 ± 0.0009765625)b+10)
      bottomDigit = rounded._roundDigit - exp;
    } else {
      exp = ExponentResolver.getNonFiniteExp(expMode, opts.getExpVal());
    }

    int targetTop = opts.getLeftPadDecPlace();
    if(opts.isLeftPadMatching()) {
      targetTop = Math.max(targetTop, Math.max(getTopDigit(valMantissa),
                                               getTopDigit(uncMantissa)));
    }

    String valStr = renderMantissa(valMantissa, targetTop, bottomDigit,
                                   opts.getSignMode(), opts);
    String uncStr = renderMantissa(uncMantissa, targetTop, bottomDigit,
                                   SignMode.NEGATIVE, opts);

    String valUncStr = null;
    if(opts.isParenUncertainty()) {
      if(isTrimmable(valMantissa, uncMantissa)) {
        uncStr = trimParenUncertainty(uncStr, opts);
      }
      valUncStr = valStr + "(" + uncStr + ")";
    } else {
      String pm = (opts.isPmWhitespace() ? (" " + PM + " ") : PM);
      valUncStr = valStr + pm + uncStr;
    }

    ExpSuffix suffix = ExpSuffix.NONE;
    if(val.isFinite() || unc.isFinite() || opts.isNanInfExp()) {
      suffix = ExponentRenderer.render(
          exp, (percent ? ExpMode.FIXEDPOINT : expMode), opts);
    }

    String body = valUncStr;
    if(!suffix.isEmpty() && !opts.isParenUncertainty()) {
      // 123(4)e+03 needs no parens, (123 ± 4)e+03 does
      body = "(" + valUncStr + ")";
    }

    if(percent) {
      body = "(" + body + ")";
      suffix = ExpSuffix.PERCENT;
    }

    return new FormattedNumber(body, suffix);
  }

  private static RoundedValUnc roundValUnc(Num val, Num unc, int ndigits,
                                           FormatOptions opts) {
    int roundDigit = 0;
    if(unc.isFinite() && (unc.signum() != 0)) {
      roundDigit = Rounding.getRoundDigit(unc.getValue(), RoundMode.SIG_FIG,
                                          ndigits, opts.isPdgSigFigs());
      unc = Num.of(Rounding.round(unc.getValue(), roundDigit));
    } else if(val.isFinite()) {
      roundDigit = Rounding.getRoundDigit(val.getValue(), RoundMode.SIG_FIG,
                                          ndigits, false);
    }

    if(val.isFinite()) {
      val = Num.of(Rounding.round(val.getValue(), roundDigit));
    }

    return new RoundedValUnc(val, unc, roundDigit);
  }

  /**
   * Engineering and IEC modes restrict which exponents may be used, so the
   * mantissas are computed with the equivalent unrestricted mode.
   */
  static ExpMode getFreeExpMode(ExpMode expMode) {
    switch(expMode) {
    case ENGINEERING:
    case ENGINEERING_SHIFTED:
      return ExpMode.SCIENTIFIC;
    case BINARY_IEC:
      return ExpMode.BINARY;
    default:
      return expMode;
    }
  }

  private static Num getMantissa(Num num, ExpMode freeExpMode, int exp) {
    if(!num.isFinite()) {
      return num;
    }
    return Num.of(ExponentResolver.resolve(num.getValue(), freeExpMode, exp)
                  .getMantissa());
  }

  private static int getTopDigit(Num num) {
    return (num.isFinite() ? DigitPlaces.getTopDigit(num.getValue()) : 0);
  }

  private static String renderMantissa(Num mantissa, int targetTop,
                                       int bottomDigit, SignMode signMode,
                                       FormatOptions opts) {
    if(!mantissa.isFinite()) {
      return NumberFormatterImpl.getNonFiniteString(mantissa, opts);
    }
    String str = MantissaRenderer.render(
        mantissa.getValue(), targetTop, bottomDigit, signMode,
        opts.getLeftPadChar());
    return DigitGrouper.group(str, opts.getUpperSeparator(),
                              opts.getDecimalSeparator(),
                              opts.getLowerSeparator());
  }

  /**
   * The parenthetical uncertainty only loses its leading zeros when it is
   * nonzero and smaller than the value, otherwise nothing (or something
   * misleading) would be left.
   */
  private static boolean isTrimmable(Num valMantissa, Num uncMantissa) {
    if(!valMantissa.isFinite() || !uncMantissa.isFinite()) {
      return false;
    }
    BigDecimal unc = uncMantissa.getValue();
    return ((unc.signum() > 0) &&
            (unc.compareTo(valMantissa.getValue().abs()) < 0));
  }

  static String trimParenUncertainty(String uncStr, FormatOptions opts) {
    StringBuilder stripChars = new StringBuilder("0");
    for(Separator sep : Separator.values()) {
      stripChars.append(sep.getString());
    }
    String trimmed = StringUtils.stripStart(uncStr, stripChars.toString());

    if(!opts.isParenUncertaintySeparators()) {
      for(Separator sep : Separator.values()) {
        if(sep != Separator.NONE) {
          trimmed = StringUtils.remove(trimmed, sep.getString());
        }
      }
    }
    return trimmed;
  }

  private static final class RoundedValUnc
  {
    private final Num _val;
    private final Num _unc;
    private final int _roundDigit;

    private RoundedValUnc(Num val, Num unc, int roundDigit) {
      _val = val;
      _unc = unc;
      _roundDigit = roundDigit;
    }
  }
}
