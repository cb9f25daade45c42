// =================================================================================================
// Copyright 2026 The cmdline-commons Authors
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.cmdline.common.base;

import com.google.common.base.Preconditions;

import org.apache.commons.lang.StringUtils;

/**
 * A utility helpful in concisely checking preconditions on arguments.  This utility is a complement
 * to {@link com.google.common.base.Preconditions}.
 */
public final class MorePreconditions {

  private static final String ARG_NOT_BLANK_MSG = "Argument cannot be blank";

  private MorePreconditions() {
    // utility
  }

  /**
   * Checks that a string is both non-null and non-empty.
   *
   * @see #checkNotBlank(String, String, Object...)
   */
  public static String checkNotBlank(String argument) {
    return checkNotBlank(argument, ARG_NOT_BLANK_MSG);
  }

  /**
   * Checks that a string is both non-null and non-empty.
   *
   * @param argument the argument to validate
   * @param message the message template for validation exception messages where %s serves as the
   *     sole argument placeholder
   * @param args any arguments needed by the message template
   * @return the argument if it is valid
   * @throws NullPointerException if the argument is null
   * @throws IllegalArgumentException if the argument is the empty string or a pure whitespace
   *    string
   */
  public static String checkNotBlank(String argument, String message, Object... args) {
    Preconditions.checkNotNull(argument, message, args);
    Preconditions.checkArgument(!StringUtils.isBlank(argument), message, args);
    return argument;
  }

  /**
   * Checks that the window {@code [offset, offset + length)} lies within a sequence of
   * {@code size} characters.
   *
   * @param offset start of the window.
   * @param length number of characters in the window.
   * @param size size of the enclosing sequence.
   * @return {@code offset + length}, the exclusive end of the window.
   * @throws IndexOutOfBoundsException if {@code offset} is negative or past {@code size}, if
   *     {@code length} is negative, or if the window runs past {@code size}.
   */
  public static int checkWindow(int offset, int length, int size) {
    if (offset < 0 || offset > size) {
      throw new IndexOutOfBoundsException(
          String.format("offset (%s) must be in [0, %s]", offset, size));
    }
    if (length < 0) {
      throw new IndexOutOfBoundsException(
          String.format("length (%s) must not be negative", length));
    }
    if (length > size - offset) {
      throw new IndexOutOfBoundsException(
          String.format("window [%s, %s) runs past size %s", offset, offset + length, size));
    }
    return offset + length;
  }
}
