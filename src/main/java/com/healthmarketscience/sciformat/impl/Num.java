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

import com.healthmarketscience.sciformat.ConfigException;

/**
 * A number to be formatted: either an exact decimal value or one of the
 * non-finite values (nan, +inf, -inf).
 *
 * @author James Ahlborn
 */
public final class Num
{
  private enum Kind {
    FINITE, NAN, POS_INF, NEG_INF;
  }

  public static final Num NAN = new Num(Kind.NAN, null);
  public static final Num POS_INF = new Num(Kind.POS_INF, null);
  public static final Num NEG_INF = new Num(Kind.NEG_INF, null);

  private final Kind _kind;
  private final BigDecimal _val;

  private Num(Kind kind, BigDecimal val) {
    _kind = kind;
    _val = val;
  }

  public static Num of(BigDecimal val) {
    if(val == null) {
      throw new ConfigException("Cannot format null value");
    }
    return new Num(Kind.FINITE, val);
  }

  /**
   * Converts the given double using its shortest decimal string
   * representation, so that e.g. {@code 0.1} is {@code 0.1} and not the
   * exact binary value {@code 0.1000000000000000055511151231257827...}.
   */
  public static Num valueOf(double d) {
    if(Double.isNaN(d)) {
      return NAN;
    }
    if(Double.isInfinite(d)) {
      return ((d > 0d) ? POS_INF : NEG_INF);
    }
    return of(BigDecimal.valueOf(d));
  }

  /**
   * Parses a decimal number string.  The (case insensitive) strings "nan",
   * "inf", "infinity" (optionally signed) are also accepted.
   */
  public static Num parse(String str) {
    String trimmed = ((str != null) ? str.trim() : null);
    if((trimmed == null) || trimmed.isEmpty()) {
      throw new ConfigException("Cannot format empty value '" + str + "'");
    }

    String lower = trimmed.toLowerCase(Locale.ROOT);
    boolean neg = lower.startsWith("-");
    String unsigned = ((neg || lower.startsWith("+")) ?
                       lower.substring(1) : lower);
    if(unsigned.equals("nan")) {
      return NAN;
    }
    if(unsigned.equals("inf") || unsigned.equals("infinity")) {
      return (neg ? NEG_INF : POS_INF);
    }

    try {
      return of(new BigDecimal(trimmed));
    } catch(NumberFormatException e) {
      throw new ConfigException("Invalid numeric value '" + str + "'", e);
    }
  }

  public boolean isFinite() {
    return (_kind == Kind.FINITE);
  }

  /**
   * @return the exact decimal value, only valid for finite numbers
   */
  public BigDecimal getValue() {
    if(!isFinite()) {
      throw new IllegalStateException("Non-finite number " + this +
                                      " has no decimal value");
    }
    return _val;
  }

  /**
   * @return -1, 0 or 1 as the number is negative, zero (or nan), or positive
   */
  public int signum() {
    switch(_kind) {
    case FINITE:
      return _val.signum();
    case NAN:
      return 0;
    case POS_INF:
      return 1;
    case NEG_INF:
      return -1;
    default:
      throw new IllegalStateException("unknown kind " + _kind);
    }
  }

  public Num abs() {
    switch(_kind) {
    case FINITE:
      return ((_val.signum() < 0) ? of(_val.negate()) : this);
    case NEG_INF:
      return POS_INF;
    default:
      return this;
    }
  }

  public Num scaleByPowerOfTen(int n) {
    return (isFinite() ? of(_val.scaleByPowerOfTen(n)) : this);
  }

  /**
   * @return this number with any trailing zeros removed
   */
  public Num normalize() {
    return (isFinite() ? of(_val.stripTrailingZeros()) : this);
  }

  /**
   * @return the lower case name of this number without any sign if
   *         non-finite ("nan" or "inf"), the plain decimal string otherwise
   */
  String getAbsName() {
    switch(_kind) {
    case FINITE:
      return _val.abs().toPlainString();
    case NAN:
      return "nan";
    case POS_INF:
    case NEG_INF:
      return "inf";
    default:
      throw new IllegalStateException("unknown kind " + _kind);
    }
  }

  @Override
  public String toString() {
    return ((signum() < 0) ? "-" : "") + getAbsName();
  }
}
