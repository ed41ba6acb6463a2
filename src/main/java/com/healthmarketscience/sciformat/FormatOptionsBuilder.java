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

import java.util.LinkedHashMap;
import java.util.Map;

import com.healthmarketscience.sciformat.impl.CustomToStringStyle;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Builder style class for specifying (possibly partial) formatting options.
 * Any option which is not explicitly set is taken from the defaults passed
 * to {@link #build(FormatOptions)}.
 * <p/>
 * Simple example usage:
 * <pre>
 *   FormatOptions opts = new FormatOptionsBuilder()
 *     .setExpMode(ExpMode.ENGINEERING)
 *     .setRoundMode(RoundMode.SIG_FIG)
 *     .setNdigits(4)
 *     .build(FormatOptions.DEFAULTS);
 * </pre>
 *
 * @author James Ahlborn
 */
public class FormatOptionsBuilder
{
  private ExpMode _expMode;
  private Integer _expVal;
  private RoundMode _roundMode;
  private Integer _ndigits;
  private Separator _upperSeparator;
  private Separator _decimalSeparator;
  private Separator _lowerSeparator;
  private SignMode _signMode;
  private LeftPadChar _leftPadChar;
  private Integer _leftPadDecPlace;
  private ExpFormat _expFormat;
  private Map<Integer,String> _extraSiPrefixes;
  private Map<Integer,String> _extraIecPrefixes;
  private Map<Integer,String> _extraPartsPerForms;
  private Boolean _capitalize;
  private Boolean _superscript;
  private Boolean _nanInfExp;
  private Boolean _parenUncertainty;
  private Boolean _pdgSigFigs;
  private Boolean _leftPadMatching;
  private Boolean _parenUncertaintySeparators;
  private Boolean _pmWhitespace;
  /** if true, {@code -2 -> c} is added to the SI prefixes */
  private boolean _addCPrefix;
  /** if true, {@code -2 -> c, -1 -> d, 1 -> da, 2 -> h} are added to the SI
      prefixes */
  private boolean _addSmallSiPrefixes;
  /** if true, {@code -3 -> ppth} is added to the parts-per forms */
  private boolean _addPpthForm;

  public FormatOptionsBuilder() {
  }

  /**
   * @return a new builder with the same options set as this builder
   */
  public FormatOptionsBuilder copy() {
    FormatOptionsBuilder copy = new FormatOptionsBuilder()
      .setExpMode(_expMode)
      .setExpVal(_expVal)
      .setRoundMode(_roundMode)
      .setNdigits(_ndigits)
      .setUpperSeparator(_upperSeparator)
      .setDecimalSeparator(_decimalSeparator)
      .setLowerSeparator(_lowerSeparator)
      .setSignMode(_signMode)
      .setLeftPadChar(_leftPadChar)
      .setLeftPadDecPlace(_leftPadDecPlace)
      .setExpFormat(_expFormat)
      .setExtraSiPrefixes(copyMap(_extraSiPrefixes))
      .setExtraIecPrefixes(copyMap(_extraIecPrefixes))
      .setExtraPartsPerForms(copyMap(_extraPartsPerForms))
      .setCapitalize(_capitalize)
      .setSuperscript(_superscript)
      .setNanInfExp(_nanInfExp)
      .setParenUncertainty(_parenUncertainty)
      .setPdgSigFigs(_pdgSigFigs)
      .setLeftPadMatching(_leftPadMatching)
      .setParenUncertaintySeparators(_parenUncertaintySeparators)
      .setPmWhitespace(_pmWhitespace)
      .setAddCPrefix(_addCPrefix)
      .setAddSmallSiPrefixes(_addSmallSiPrefixes)
      .setAddPpthForm(_addPpthForm);
    return copy;
  }

  public ExpMode getExpMode() {
    return _expMode;
  }

  public FormatOptionsBuilder setExpMode(ExpMode expMode) {
    _expMode = expMode;
    return this;
  }

  public Integer getExpVal() {
    return _expVal;
  }

  /**
   * Sets a fixed exponent value, or {@link FormatOptions#AUTO} to have the
   * exponent chosen from the formatted number.
   */
  public FormatOptionsBuilder setExpVal(Integer expVal) {
    _expVal = expVal;
    return this;
  }

  public RoundMode getRoundMode() {
    return _roundMode;
  }

  public FormatOptionsBuilder setRoundMode(RoundMode roundMode) {
    _roundMode = roundMode;
    return this;
  }

  public Integer getNdigits() {
    return _ndigits;
  }

  /**
   * Sets the number of significant figures (must be >= 1) or the decimal
   * place (any integer) to round to, or {@link FormatOptions#AUTO} to show
   * the full precision of the formatted number.
   */
  public FormatOptionsBuilder setNdigits(Integer ndigits) {
    _ndigits = ndigits;
    return this;
  }

  public Separator getUpperSeparator() {
    return _upperSeparator;
  }

  public FormatOptionsBuilder setUpperSeparator(Separator upperSeparator) {
    _upperSeparator = upperSeparator;
    return this;
  }

  public Separator getDecimalSeparator() {
    return _decimalSeparator;
  }

  public FormatOptionsBuilder setDecimalSeparator(Separator decimalSeparator) {
    _decimalSeparator = decimalSeparator;
    return this;
  }

  public Separator getLowerSeparator() {
    return _lowerSeparator;
  }

  public FormatOptionsBuilder setLowerSeparator(Separator lowerSeparator) {
    _lowerSeparator = lowerSeparator;
    return this;
  }

  public SignMode getSignMode() {
    return _signMode;
  }

  public FormatOptionsBuilder setSignMode(SignMode signMode) {
    _signMode = signMode;
    return this;
  }

  public LeftPadChar getLeftPadChar() {
    return _leftPadChar;
  }

  public FormatOptionsBuilder setLeftPadChar(LeftPadChar leftPadChar) {
    _leftPadChar = leftPadChar;
    return this;
  }

  public Integer getLeftPadDecPlace() {
    return _leftPadDecPlace;
  }

  /**
   * Sets the decimal place to which numbers are left padded, e.g. {@code 4}
   * formats {@code 12} as {@code "   12"} (or {@code "00012"} when padding
   * with zeros).
   */
  public FormatOptionsBuilder setLeftPadDecPlace(Integer leftPadDecPlace) {
    _leftPadDecPlace = leftPadDecPlace;
    return this;
  }

  public ExpFormat getExpFormat() {
    return _expFormat;
  }

  public FormatOptionsBuilder setExpFormat(ExpFormat expFormat) {
    _expFormat = expFormat;
    return this;
  }

  public Map<Integer,String> getExtraSiPrefixes() {
    return _extraSiPrefixes;
  }

  /**
   * Sets additional exponent to SI prefix translations.  Entries override
   * the built-in prefixes, a {@code null} value suppresses the translation
   * for that exponent.
   */
  public FormatOptionsBuilder setExtraSiPrefixes(
      Map<Integer,String> extraSiPrefixes) {
    _extraSiPrefixes = extraSiPrefixes;
    return this;
  }

  public Map<Integer,String> getExtraIecPrefixes() {
    return _extraIecPrefixes;
  }

  /**
   * Sets additional exponent to IEC prefix translations.  Entries override
   * the built-in prefixes, a {@code null} value suppresses the translation
   * for that exponent.
   */
  public FormatOptionsBuilder setExtraIecPrefixes(
      Map<Integer,String> extraIecPrefixes) {
    _extraIecPrefixes = extraIecPrefixes;
    return this;
  }

  public Map<Integer,String> getExtraPartsPerForms() {
    return _extraPartsPerForms;
  }

  /**
   * Sets additional exponent to "parts-per" translations.  Entries override
   * the built-in forms, a {@code null} value suppresses the translation for
   * that exponent.
   */
  public FormatOptionsBuilder setExtraPartsPerForms(
      Map<Integer,String> extraPartsPerForms) {
    _extraPartsPerForms = extraPartsPerForms;
    return this;
  }

  public Boolean getCapitalize() {
    return _capitalize;
  }

  /**
   * Sets whether exponent symbols (and non-finite values) are upper case,
   * e.g. {@code 1.2E+03} instead of {@code 1.2e+03}.
   */
  public FormatOptionsBuilder setCapitalize(Boolean capitalize) {
    _capitalize = capitalize;
    return this;
  }

  public Boolean getSuperscript() {
    return _superscript;
  }

  /**
   * Sets whether numeric exponents are rendered as superscripts, e.g.
   * {@code 1.23×10²} instead of {@code 1.23e+02}.
   */
  public FormatOptionsBuilder setSuperscript(Boolean superscript) {
    _superscript = superscript;
    return this;
  }

  public Boolean getNanInfExp() {
    return _nanInfExp;
  }

  /**
   * Sets whether non-finite values are rendered with an exponent in exponent
   * modes, e.g. {@code (nan)e+00}.
   */
  public FormatOptionsBuilder setNanInfExp(Boolean nanInfExp) {
    _nanInfExp = nanInfExp;
    return this;
  }

  public Boolean getParenUncertainty() {
    return _parenUncertainty;
  }

  /**
   * Sets whether uncertainties are rendered in parentheses, e.g.
   * {@code 12.34(82)} instead of {@code 12.34 ± 0.82}.
   */
  public FormatOptionsBuilder setParenUncertainty(Boolean parenUncertainty) {
    _parenUncertainty = parenUncertainty;
    return this;
  }

  public Boolean getPdgSigFigs() {
    return _pdgSigFigs;
  }

  /**
   * Sets whether the particle data group "3-5-4" rule chooses the number of
   * significant figures of an uncertainty (when ndigits is
   * {@link FormatOptions#AUTO}).
   */
  public FormatOptionsBuilder setPdgSigFigs(Boolean pdgSigFigs) {
    _pdgSigFigs = pdgSigFigs;
    return this;
  }

  public Boolean getLeftPadMatching() {
    return _leftPadMatching;
  }

  /**
   * Sets whether a value and its uncertainty are left padded to the same
   * decimal place.
   */
  public FormatOptionsBuilder setLeftPadMatching(Boolean leftPadMatching) {
    _leftPadMatching = leftPadMatching;
    return this;
  }

  public Boolean getParenUncertaintySeparators() {
    return _parenUncertaintySeparators;
  }

  /**
   * Sets whether separators are kept in a parenthetical uncertainty, e.g.
   * {@code 123.4(2.3)} instead of {@code 123.4(23)}.
   */
  public FormatOptionsBuilder setParenUncertaintySeparators(
      Boolean parenUncertaintySeparators) {
    _parenUncertaintySeparators = parenUncertaintySeparators;
    return this;
  }

  public Boolean getPmWhitespace() {
    return _pmWhitespace;
  }

  /**
   * Sets whether the {@code ±} symbol is surrounded by spaces.
   */
  public FormatOptionsBuilder setPmWhitespace(Boolean pmWhitespace) {
    _pmWhitespace = pmWhitespace;
    return this;
  }

  public FormatOptionsBuilder setAddCPrefix(boolean addCPrefix) {
    _addCPrefix = addCPrefix;
    return this;
  }

  public FormatOptionsBuilder setAddSmallSiPrefixes(
      boolean addSmallSiPrefixes) {
    _addSmallSiPrefixes = addSmallSiPrefixes;
    return this;
  }

  public FormatOptionsBuilder setAddPpthForm(boolean addPpthForm) {
    _addPpthForm = addPpthForm;
    return this;
  }

  /**
   * Creates a fully populated (and validated) set of options using the
   * options set on this builder and taking everything else from the given
   * defaults.
   *
   * @throws ConfigException if the resulting options are inconsistent
   */
  public FormatOptions build(FormatOptions defaults) {

    Map<Integer,String> siPrefixes = or(_extraSiPrefixes,
                                        defaults.getExtraSiPrefixes());
    Map<Integer,String> ppForms = or(_extraPartsPerForms,
                                     defaults.getExtraPartsPerForms());

    // the "add" flags extend the resolved maps, explicit entries (including
    // null suppressions) win
    if(_addCPrefix || _addSmallSiPrefixes) {
      siPrefixes = new LinkedHashMap<Integer,String>(siPrefixes);
      putIfAbsent(siPrefixes, -2, "c");
      if(_addSmallSiPrefixes) {
        putIfAbsent(siPrefixes, -1, "d");
        putIfAbsent(siPrefixes, 1, "da");
        putIfAbsent(siPrefixes, 2, "h");
      }
    }
    if(_addPpthForm) {
      ppForms = new LinkedHashMap<Integer,String>(ppForms);
      putIfAbsent(ppForms, -3, "ppth");
    }

    return new FormatOptions(
        or(_expMode, defaults.getExpMode()),
        or(_expVal, defaults.getExpVal()),
        or(_roundMode, defaults.getRoundMode()),
        or(_ndigits, defaults.getNdigits()),
        or(_upperSeparator, defaults.getUpperSeparator()),
        or(_decimalSeparator, defaults.getDecimalSeparator()),
        or(_lowerSeparator, defaults.getLowerSeparator()),
        or(_signMode, defaults.getSignMode()),
        or(_leftPadChar, defaults.getLeftPadChar()),
        or(_leftPadDecPlace, defaults.getLeftPadDecPlace()),
        or(_expFormat, defaults.getExpFormat()),
        siPrefixes,
        or(_extraIecPrefixes, defaults.getExtraIecPrefixes()),
        ppForms,
        or(_capitalize, defaults.isCapitalize()),
        or(_superscript, defaults.isSuperscript()),
        or(_nanInfExp, defaults.isNanInfExp()),
        or(_parenUncertainty, defaults.isParenUncertainty()),
        or(_pdgSigFigs, defaults.isPdgSigFigs()),
        or(_leftPadMatching, defaults.isLeftPadMatching()),
        or(_parenUncertaintySeparators,
           defaults.isParenUncertaintySeparators()),
        or(_pmWhitespace, defaults.isPmWhitespace()));
  }

  private static Map<Integer,String> copyMap(Map<Integer,String> map) {
    return ((map != null) ? new LinkedHashMap<Integer,String>(map) : null);
  }

  private static void putIfAbsent(Map<Integer,String> map, Integer key,
                                  String val) {
    // containsKey, since a null value marks a suppressed prefix
    if(!map.containsKey(key)) {
      map.put(key, val);
    }
  }

  private static <T> T or(T val, T def) {
    return ((val != null) ? val : def);
  }

  @Override
  public String toString() {
    // only explicitly set options are listed
    ToStringBuilder sb = CustomToStringStyle.builder(this);
    append(sb, "expMode", _expMode);
    append(sb, "expVal", _expVal);
    append(sb, "roundMode", _roundMode);
    append(sb, "ndigits", _ndigits);
    append(sb, "upperSeparator", _upperSeparator);
    append(sb, "decimalSeparator", _decimalSeparator);
    append(sb, "lowerSeparator", _lowerSeparator);
    append(sb, "signMode", _signMode);
    append(sb, "leftPadChar", _leftPadChar);
    append(sb, "leftPadDecPlace", _leftPadDecPlace);
    append(sb, "expFormat", _expFormat);
    append(sb, "extraSiPrefixes", _extraSiPrefixes);
    append(sb, "extraIecPrefixes", _extraIecPrefixes);
    append(sb, "extraPartsPerForms", _extraPartsPerForms);
    append(sb, "capitalize", _capitalize);
    append(sb, "superscript", _superscript);
    append(sb, "nanInfExp", _nanInfExp);
    append(sb, "parenUncertainty", _parenUncertainty);
    append(sb, "pdgSigFigs", _pdgSigFigs);
    append(sb, "leftPadMatching", _leftPadMatching);
    append(sb, "parenUncertaintySeparators", _parenUncertaintySeparators);
    append(sb, "pmWhitespace", _pmWhitespace);
    if(_addCPrefix) {
      sb.append("addCPrefix", _addCPrefix);
    }
    if(_addSmallSiPrefixes) {
      sb.append("addSmallSiPrefixes", _addSmallSiPrefixes);
    }
    if(_addPpthForm) {
      sb.append("addPpthForm", _addPpthForm);
    }
    return sb.toString();
  }

  private static void append(ToStringBuilder sb, String name, Object value) {
    if(value != null) {
      sb.append(name, value);
    }
  }
}
