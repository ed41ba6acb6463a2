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

/**
 * Sciformat formats numbers, and numbers with uncertainties, using the
 * conventions of scientific and engineering notation.
 * <p/>
 * <h2>Formatting</h2>
 * <p/>
 * A {@link com.healthmarketscience.sciformat.Formatter} is created from a
 * {@link com.healthmarketscience.sciformat.FormatOptionsBuilder} (or from a
 * compact format specification string) and produces a
 * {@link com.healthmarketscience.sciformat.FormattedNumber}:
 * <ul>
 *   <li><b>Exponent modes:</b> fixed point, percent, scientific,
 *       engineering (exponent a multiple of 3), shifted engineering,
 *       binary and binary IEC (exponent a multiple of 10).</li>
 *   <li><b>Rounding:</b> to a number of significant figures or to a decimal
 *       place.  Numbers are handled as exact decimals, so {@code 0.1} is
 *       never shown as {@code 0.1000000000000000055511151231257827}.</li>
 *   <li><b>Uncertainties:</b> the value and uncertainty are rounded
 *       together, optionally using the particle data group rule for the
 *       number of significant figures, and share one exponent, e.g.
 *       {@code (12.3457 ± 0.0034)e+03} or {@code 12.3457(34)e+03}.</li>
 *   <li><b>Prefixes:</b> exponents may be replaced by SI prefixes, IEC
 *       binary prefixes or parts-per forms, e.g. {@code 3.1415 k}.</li>
 * </ul>
 * <p/>
 * <h2>Format specifications</h2>
 * <p/>
 * The compact format specification has the form:
 * <pre>
 *   [[ 0]=][-+ ][#][digits][n,.s_][.,][ns_][[.!][+-]digits][fF%eErRbB][x[+-]digits][p][()]
 * </pre>
 * i.e. fill character, sign mode, alternate mode flag, left pad digit place,
 * upper/decimal/lower separators, decimal place or significant figure
 * rounding, exponent mode, fixed exponent, prefix mode and parenthetical
 * uncertainty.
 * <p/>
 * <h2>Defaults</h2>
 * <p/>
 * Options which are not given explicitly are taken from
 * {@link com.healthmarketscience.sciformat.FormatDefaults} when the
 * Formatter is created.
 */
package com.healthmarketscience.sciformat;
