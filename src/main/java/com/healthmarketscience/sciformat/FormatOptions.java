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

package com.healthmarketscience.sciformat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.healthmarketscience.sciformat.impl.CustomToStringStyle;
import com.healthmarketscience.sciformat.impl.ExponentResolver;

/**
 * Fully populated, immutable set of formatting options.  All of the
 * formatting code works exclusively off of an instance of this class, there
 * is no other (global) state consulted during formatting.
 * <p/>
 * Instances are created by {@link FormatOptionsBuilder#build(FormatOptions)},
 * which merges partially specified options with a set of defaults and
 * validates the result.  The built-in defaults are available as
 * {@link #DEFAULTS}.
 *
 * @author James Ahlborn
 */
public final class FormatOptions
{
  /** sentinel value for {@code expVal} and {@code ndigits} indicating that
      the value should be chosen automatically */
  public static final int AUTO = Integer.MIN_VALUE;

  public static final FormatOptions DEFAULTS = new FormatOptions(
      ExpMode.FIXEDPOINT, AUTO, RoundMode.SIG_FIG, AUTO,
      Separator.NONE, Separator.POINT, Separator.NONE, SignMode.NEGATIVE,
      LeftPadChar.SPACE, 0, ExpFormat.STANDARD,
      Collections.<Integer,String>emptyMap(),
      Collections.<Integer,String>emptyMap(),
      Collections.<Integer,String>emptyMap(),
      false, false, false, false, false, false, true, true);

  private final ExpMode _expMode;
  private final int _expVal;
  private final RoundMode _roundMode;
  private final int _ndigits;
  private final Separator _upperSeparator;
  private final Separator _decimalSeparator;
  private final Separator _lowerSeparator;
  private final SignMode _signMode;
  private final LeftPadChar _leftPadChar;
  private final int _leftPadDecPlace;
  private final ExpFormat _expFormat;
  private final Map<Integer,String> _extraSiPrefixes;
  private final Map<Integer,String> _extraIecPrefixes;
  private final Map<Integer,String> _extraPartsPerForms;
  private final boolean _capitalize;
  private final boolean _superscript;
  private final boolean _nanInfExp;
  private final boolean _parenUncertainty;
  private final boolean _pdgSigFigs;
  private final boolean _leftPadMatching;
  private final boolean _parenUncertaintySeparators;
  private final boolean _pmWhitespace;

  FormatOptions(ExpMode expMode, int expVal, RoundMode roundMode,
                int ndigits, Separator upperSeparator,
                Separator decimalSeparator, Separator lowerSeparator,
                SignMode signMode, LeftPadChar leftPadChar,
                int leftPadDecPlace, ExpFormat expFormat,
                Map<Integer,String> extraSiPrefixes,
                Map<Integer,String> extraIecPrefixes,
                Map<Integer,String> extraPartsPerForms,
                boolean capitalize, boolean superscript, boolean nanInfExp,
                boolean parenUncertainty, boolean pdgSigFigs,
                boolean leftPadMatching, boolean parenUncertaintySeparators,
                boolean pmWhitespace)
  {
    _expMode = expMode;
    _expVal = expVal;
    _roundMode = roundMode;
    _ndigits = ndigits;
    _upperSeparator = upperSeparator;
    _decimalSeparator = decimalSeparator;
    _lowerSeparator = lowerSeparator;
    _signMode = signMode;
    _leftPadChar = leftPadChar;
    _leftPadDecPlace = leftPadDecPlace;
    _expFormat = expFormat;
    _extraSiPrefixes = copyPrefixes(extraSiPrefixes);
    _extraIecPrefixes = copyPrefixes(extraIecPrefixes);
    _extraPartsPerForms = copyPrefixes(extraPartsPerForms);
    _capitalize = capitalize;
    _superscript = superscript;
    _nanInfExp = nanInfExp;
    _parenUncertainty = parenUncertainty;
    _pdgSigFigs = pdgSigFigs;
    _leftPadMatching = leftPadMatching;
    _parenUncertaintySeparators = parenUncertaintySeparators;
    _pmWhitespace = pmWhitespace;

    validate();
  }

  public ExpMode getExpMode() {
    return _expMode;
  }

  /**
   * @return the fixed exponent value or {@link #AUTO}
   */
  public int getExpVal() {
    return _expVal;
  }

  public boolean isAutoExpVal() {
    return (_expVal == AUTO);
  }

  public RoundMode getRoundMode() {
    return _roundMode;
  }

  /**
   * @return the number of significant figures or decimal place (depending on
   *         the round mode) or {@link #AUTO}
   */
  public int getNdigits() {
    return _ndigits;
  }

  public boolean isAutoNdigits() {
    return (_ndigits == AUTO);
  }

  public Separator getUpperSeparator() {
    return _upperSeparator;
  }

  public Separator getDecimalSeparator() {
    return _decimalSeparator;
  }

  public Separator getLowerSeparator() {
    return _lowerSeparator;
  }

  public SignMode getSignMode() {
    return _signMode;
  }

  public LeftPadChar getLeftPadChar() {
    return _leftPadChar;
  }

  /**
   * @return the decimal place (0 is the ones place) to which formatted
   *         numbers are left padded
   */
  public int getLeftPadDecPlace() {
    return _leftPadDecPlace;
  }

  public ExpFormat getExpFormat() {
    return _expFormat;
  }

  /**
   * @return unmodifiable map of additional SI prefixes, {@code null} values
   *         suppress the built-in prefix for that exponent
   */
  public Map<Integer,String> getExtraSiPrefixes() {
    return _extraSiPrefixes;
  }

  /**
   * @return unmodifiable map of additional IEC prefixes, {@code null} values
   *         suppress the built-in prefix for that exponent
   */
  public Map<Integer,String> getExtraIecPrefixes() {
    return _extraIecPrefixes;
  }

  /**
   * @return unmodifiable map of additional parts-per forms, {@code null}
   *         values suppress the built-in form for that exponent
   */
  public Map<Integer,String> getExtraPartsPerForms() {
    return _extraPartsPerForms;
  }

  public boolean isCapitalize() {
    return _capitalize;
  }

  public boolean isSuperscript() {
    return _superscript;
  }

  public boolean isNanInfExp() {
    return _nanInfExp;
  }

  public boolean isParenUncertainty() {
    return _parenUncertainty;
  }

  public boolean isPdgSigFigs() {
    return _pdgSigFigs;
  }

  public boolean isLeftPadMatching() {
    return _leftPadMatching;
  }

  public boolean isParenUncertaintySeparators() {
    return _parenUncertaintySeparators;
  }

  public boolean isPmWhitespace() {
    return _pmWhitespace;
  }

  private void validate() {
    if(!isAutoExpVal()) {
      ExponentResolver.checkFixedExp(_expMode, _expVal);
    }

    if((_roundMode == RoundMode.SIG_FIG) && !isAutoNdigits() &&
       (_ndigits < 1)) {
      throw new ConfigException(
          "ndigits must be >= 1 for significant figure rounding, not " +
          _ndigits);
    }

    if(!_upperSeparator.isValidUpper()) {
      throw new ConfigException(
          "Invalid upper separator " + _upperSeparator);
    }
    if(!_decimalSeparator.isValidDecimal()) {
      throw new ConfigException(
          "Invalid decimal separator " + _decimalSeparator);
    }
    if(!_lowerSeparator.isValidLower()) {
      throw new ConfigException(
          "Invalid lower separator " + _lowerSeparator);
    }
    if(_upperSeparator == _decimalSeparator) {
      throw new ConfigException(
          "Upper separator and decimal separator must differ, both are " +
          _upperSeparator);
    }

    if(_leftPadDecPlace < 0) {
      throw new ConfigException(
          "leftPadDecPlace must be >= 0, not " + _leftPadDecPlace);
    }
  }

  private static Map<Integer,String> copyPrefixes(Map<Integer,String> prefixes)
  {
    if(prefixes.isEmpty()) {
      return Collections.emptyMap();
    }
    // LinkedHashMap permits the null "suppressed" values
    return Collections.unmodifiableMap(
        new LinkedHashMap<Integer,String>(prefixes));
  }

  private static Object autoStr(int val) {
    return ((val == AUTO) ? "AUTO" : Integer.valueOf(val));
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("expMode", _expMode)
      .append("expVal", autoStr(_expVal))
      .append("roundMode", _roundMode)
      .append("ndigits", autoStr(_ndigits))
      .append("upperSeparator", _upperSeparator)
      .append("decimalSeparator", _decimalSeparator)
      .append("lowerSeparator", _lowerSeparator)
      .append("signMode", _signMode)
      .append("leftPadChar", _leftPadChar)
      .append("leftPadDecPlace", _leftPadDecPlace)
      .append("expFormat", _expFormat)
      .append("extraSiPrefixes", _extraSiPrefixes)
      .append("extraIecPrefixes", _extraIecPrefixes)
      .append("extraPartsPerForms", _extraPartsPerForms)
      .append("capitalize", _capitalize)
      .append("superscript", _superscript)
      .append("nanInfExp", _nanInfExp)
      .append("parenUncertainty", _parenUncertainty)
      .append("pdgSigFigs", _pdgSigFigs)
      .append("leftPadMatching", _leftPadMatching)
      .append("parenUncertaintySeparators", _parenUncertaintySeparators)
      .append("pmWhitespace", _pmWhitespace)
      .toString();
  }
}
