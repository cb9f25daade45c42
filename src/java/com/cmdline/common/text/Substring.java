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

package com.cmdline.common.text;

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import com.cmdline.common.base.MorePreconditions;

/**
 * An immutable window over a backing string.  The window covers
 * {@code [startingOffset, startingOffset + length)} of the base string.
 *
 * <p>As a {@link CharSequence}, indexes are relative to the start of the window.  Offsets reported
 * by {@link #getStartingOffset()}, {@link #getEndingOffset()} and {@link #indexOf(char)} are
 * absolute offsets into the base string.
 */
public final class Substring implements CharSequence {

  private final String base;
  private final int startingOffset;
  private final int length;

  /**
   * Creates a substring covering everything in {@code base} from {@code startingOffset} on.
   *
   * @param base The backing string.
   * @param startingOffset Offset into {@code base} at which the window starts.
   * @throws NullPointerException if {@code base} is null.
   * @throws IndexOutOfBoundsException if {@code startingOffset} is outside {@code [0, length]}.
   */
  public Substring(String base, int startingOffset) {
    this(base, startingOffset, Preconditions.checkNotNull(base).length() - startingOffset);
  }

  /**
   * Creates a substring of {@code length} characters of {@code base} starting at
   * {@code startingOffset}.
   *
   * @param base The backing string.
   * @param startingOffset Offset into {@code base} at which the window starts.
   * @param length Number of characters in the window.
   * @throws NullPointerException if {@code base} is null.
   * @throws IndexOutOfBoundsException if the window does not lie within {@code base}.
   */
  public Substring(String base, int startingOffset, int length) {
    Preconditions.checkNotNull(base);
    MorePreconditions.checkWindow(startingOffset, length, base.length());

    this.base = base;
    this.startingOffset = startingOffset;
    this.length = length;
  }

  /**
   * Creates a nested window over everything in {@code outer} from {@code relativeOffset} on.
   *
   * @param outer The enclosing substring.
   * @param relativeOffset Offset relative to the start of {@code outer}.
   */
  public Substring(Substring outer, int relativeOffset) {
    this(outer, relativeOffset, Preconditions.checkNotNull(outer).length - relativeOffset);
  }

  /**
   * Creates a nested window over {@code outer}.  The new window is validated against the bounds of
   * {@code outer}, not against the bounds of the base string.
   *
   * @param outer The enclosing substring.
   * @param relativeOffset Offset relative to the start of {@code outer}.
   * @param length Number of characters in the window.
   * @throws IndexOutOfBoundsException if the window does not lie within {@code outer}.
   */
  public Substring(Substring outer, int relativeOffset, int length) {
    Preconditions.checkNotNull(outer);
    MorePreconditions.checkWindow(relativeOffset, length, outer.length);

    this.base = outer.base;
    this.startingOffset = outer.startingOffset + relativeOffset;
    this.length = length;
  }

  public String getBase() {
    return base;
  }

  public int getStartingOffset() {
    return startingOffset;
  }

  /**
   * @return The exclusive offset in the base string at which this window ends.
   */
  public int getEndingOffset() {
    return startingOffset + length;
  }

  @Override
  public int length() {
    return length;
  }

  public boolean isEmpty() {
    return length == 0;
  }

  @Override
  public char charAt(int index) {
    Preconditions.checkElementIndex(index, length);
    return base.charAt(startingOffset + index);
  }

  @Override
  public Substring subSequence(int start, int end) {
    Preconditions.checkPositionIndexes(start, end, length);
    return new Substring(this, start, end - start);
  }

  /**
   * Looks for the first occurrence of {@code c} inside the window.
   *
   * @param c The character to look for.
   * @return The offset of the first occurrence, expressed as an offset into the base string (not
   *     relative to the window), or {@code -1} if the window does not contain {@code c}.
   */
  public int indexOf(char c) {
    int end = getEndingOffset();
    for (int i = startingOffset; i < end; ++i) {
      if (base.charAt(i) == c) {
        return i;
      }
    }
    return -1;
  }

  public boolean contains(char c) {
    return indexOf(c) >= 0;
  }

  /**
   * Checks whether any character in the window matches {@code matcher}.
   *
   * @param matcher The matcher to apply to each character.
   * @return {@code true} if at least one character matched.
   */
  public boolean contains(CharMatcher matcher) {
    Preconditions.checkNotNull(matcher);
    return matcher.indexIn(this) >= 0;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof Substring)) {
      return false;
    }
    Substring other = (Substring) o;
    return startingOffset == other.startingOffset
        && length == other.length
        && base.equals(other.base);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(base, startingOffset, length);
  }

  @Override
  public String toString() {
    return base.substring(startingOffset, getEndingOffset());
  }
}
