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
import java.math.BigInteger;
import java.math.MathContext;

import com.healthmarketscience.sciformat.ConfigException;
import com.healthmarketscience.sciformat.ExpMode;
import com.healthmarketscience.sciformat.FormatOptions;

/**
 * Chooses the exponent for a number according to an {@link ExpMode} (and an
 * optional fixed exponent) and computes the corresponding mantissa.
 *
 * @author James Ahlborn
 */
public class ExponentResolver
{
  private static final int DEC_SIG_DIGITS = 28;

  /** base 2 scaling is not exact in general, so it is done with the same 28
      digit precision used for plain decimal values */
  public static final MathContext DEC_MATH_CONTEXT =
    new MathContext(DEC_SIG_DIGITS, Rounding.ROUND_MODE);

  private ExponentResolver() {}

  /**
   * Resolves the exponent and mantissa for the given finite number.  Zero is
   * given the exponent 0 (or the fixed exponent, if any).
   *
   * @param num the number to split
   * @param expMode the exponent mode
   * @param inputExp the fixed exponent or {@link FormatOptions#AUTO}
   *
   * @throws ConfigException if the fixed exponent is not valid for the mode
   */
  public static MantissaExp resolve(BigDecimal num, ExpMode expMode,
                                    int inputExp) {
    int base = expMode.getBase();

    int exp = 0;
    BigDecimal mantissa = num;
    if(num.signum() == 0) {
      exp = getNonFiniteExp(expMode, inputExp);
    } else {
      exp = getExp(num, expMode, inputExp);
      mantissa = scale(num, base, -exp);
    }

    return new MantissaExp(mantissa.stripTrailingZeros(), exp, base);
  }

  /**
   * @return the exponent used for values without a usable magnitude (zero,
   *         nan, inf)
   */
  public static int getNonFiniteExp(ExpMode expMode, int inputExp) {
    if(inputExp == FormatOptions.AUTO) {
      return 0;
    }
    return checkFixedExp(expMode, inputExp);
  }

  /**
   * @return {@code num * base^exp}
   */
  public static BigDecimal scale(BigDecimal num, int base, int exp) {
    switch(base) {
    case 10:
      return num.scaleByPowerOfTen(exp);
    case 2:
      BigDecimal pow = new BigDecimal(BigInteger.ONE.shiftLeft(Math.abs(exp)));
      return ((exp >= 0) ? num.multiply(pow, DEC_MATH_CONTEXT) :
              num.divide(pow, DEC_MATH_CONTEXT));
    default:
      throw new IllegalArgumentException("Unhandled base " + base);
    }
  }

  private static int getExp(BigDecimal num, ExpMode expMode, int inputExp) {
    if(inputExp != FormatOptions.AUTO) {
      return checkFixedExp(expMode, inputExp);
    }

    if(expMode.isFixed()) {
      return 0;
    }

    switch(expMode) {
    case SCIENTIFIC:
      return DigitPlaces.getTopDigit(num);
    case ENGINEERING:
      return floorToMultiple(DigitPlaces.getTopDigit(num), 3);
    case ENGINEERING_SHIFTED:
      // selects the "0.xxx" mantissa rather than "x.xx"
      return floorToMultiple(DigitPlaces.getTopDigit(num) + 1, 3);
    case BINARY:
      return DigitPlaces.getTopDigitBinary(num);
    case BINARY_IEC:
      return floorToMultiple(DigitPlaces.getTopDigitBinary(num), 10);
    default:
      throw new IllegalArgumentException("Unhandled exponent mode " + expMode);
    }
  }

  /**
   * @return the given fixed exponent
   * @throws ConfigException if the exponent is not allowed for the mode
   */
  public static int checkFixedExp(ExpMode expMode, int inputExp) {
    switch(expMode) {
    case FIXEDPOINT:
    case PERCENT:
      if(inputExp != 0) {
        throw new ConfigException(
            "Cannot set non-zero exponent " + inputExp + " in " + expMode +
            " exponent mode");
      }
      break;
    case ENGINEERING:
    case ENGINEERING_SHIFTED:
      if((inputExp % 3) != 0) {
        throw new ConfigException(
            "Exponent must be an integer multiple of 3 in " + expMode +
            " exponent mode, not " + inputExp);
      }
      break;
    case BINARY_IEC:
      if((inputExp % 10) != 0) {
        throw new ConfigException(
            "Exponent must be an integer multiple of 10 in " + expMode +
            " exponent mode, not " + inputExp);
      }
      break;
    case SCIENTIFIC:
    case BINARY:
      break;
    default:
      throw new IllegalArgumentException("Unhandled exponent mode " + expMode);
    }
    return inputExp;
  }

  private static int floorToMultiple(int val, int mult) {
    return Math.floorDiv(val, mult) * mult;
  }
}
