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

import java.math.BigDecimal;

import com.healthmarketscience.sciformat.impl.CustomToStringStyle;
import com.healthmarketscience.sciformat.impl.FormatSpecParser;
import com.healthmarketscience.sciformat.impl.Num;
import com.healthmarketscience.sciformat.impl.NumberFormatterImpl;
import com.healthmarketscience.sciformat.impl.ValUncFormatter;

/**
 * Formats numbers, and numbers with uncertainties, according to a set of
 * {@link FormatOptions}.
 * <p/>
 * The options are resolved once, when the Formatter is created, by filling
 * any option not set on the given builder from the defaults.  Invalid
 * options are therefore reported by the constructor.  A Formatter is
 * immutable and may be shared between threads.
 * <p/>
 * Example:
 * <pre>
 *   Formatter fmt = new Formatter(new FormatOptionsBuilder()
 *       .setExpMode(ExpMode.ENGINEERING)
 *       .setNdigits(4));
 *   fmt.format(12345.678).toString();   // "12.35e+03"
 * </pre>
 *
 * @author James Ahlborn
 */
public class Formatter
{
  private final FormatOptionsBuilder _inputOptions;
  private final FormatOptions _options;

  /**
   * Creates a Formatter using the current {@link FormatDefaults} for any
   * option not set on the given builder.
   *
   * @throws ConfigException if the resulting options are invalid
   */
  public Formatter(FormatOptionsBuilder options) {
    this(options, FormatDefaults.get());
  }

  /**
   * Creates a Formatter using the given defaults for any option not set on
   * the given builder.
   *
   * @throws ConfigException if the resulting options are invalid
   */
  public Formatter(FormatOptionsBuilder options, FormatOptions defaults) {
    _inputOptions = options.copy();
    _options = _inputOptions.build(defaults);
  }

  /**
   * Creates a Formatter from a format specification string, e.g.
   * {@code "0=+5,.3e"}.
   *
   * @throws ParseException if the string is not a valid format specification
   */
  public static Formatter fromFormatSpec(String formatSpec) {
    return new Formatter(FormatSpecParser.parse(formatSpec));
  }

  /**
   * @return the fully resolved options used by this Formatter
   */
  public FormatOptions getOptions() {
    return _options;
  }

  /**
   * @return a copy of the options explicitly given to this Formatter
   */
  public FormatOptionsBuilder getInputOptions() {
    return _inputOptions.copy();
  }

  public FormattedNumber format(double value) {
    return format(Num.valueOf(value));
  }

  public FormattedNumber format(BigDecimal value) {
    return format(Num.of(value));
  }

  /**
   * @param value a decimal number, or "nan"/"inf" (case insensitive,
   *              optionally signed)
   * @throws ConfigException if the value is not a valid number
   */
  public FormattedNumber format(String value) {
    return format(Num.parse(value));
  }

  public FormattedNumber format(double value, double uncertainty) {
    return format(Num.valueOf(value), Num.valueOf(uncertainty));
  }

  public FormattedNumber format(BigDecimal value, BigDecimal uncertainty) {
    return format(Num.of(value), Num.of(uncertainty));
  }

  public FormattedNumber format(String value, String uncertainty) {
    return format(Num.parse(value), Num.parse(uncertainty));
  }

  private FormattedNumber format(Num value) {
    return NumberFormatterImpl.format(value, _options);
  }

  private FormattedNumber format(Num value, Num uncertainty) {
    return ValUncFormatter.format(value, uncertainty, _options);
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("options", _options)
      .toString();
  }
}
