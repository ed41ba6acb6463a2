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

/**
 * Determines how a numeric exponent is presented.
 *
 * @author James Ahlborn
 */
public enum ExpFormat
{
  /** always numeric, e.g. {@code e+03} */
  STANDARD,
  /** SI prefix for base 10 (e.g. {@code k}), IEC prefix for base 2
      (e.g. {@code Ki}) where one exists */
  PREFIX,
  /** "parts-per" form (e.g. {@code ppm}) where one exists */
  PARTS_PER;
}
