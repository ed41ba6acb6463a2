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
 * Exception thrown when a combination of formatting options is invalid,
 * e.g. an exponent value which is incompatible with the exponent mode or an
 * upper separator which matches the decimal separator.
 *
 * @author James Ahlborn
 */
public class ConfigException extends FormatException
{
  private static final long serialVersionUID = 20240612L;

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
