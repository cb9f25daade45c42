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


package com.cmdline.common.util.templating;

import java.util.logging.Logger;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

import com.cmdline.common.expressions.Expression;
import com.cmdline.common.expressions.ExpressionEnvironment;
import com.cmdline.common.expressions.ExpressionParser;

/**
 * Expands {@code {...}} placeholders in template strings.  The text between the braces is parsed
 * with {@link ExpressionParser} and replaced by its value in a given environment; everything
 * outside placeholders is copied through unchanged.
 *
 * <p>Expansion is all or nothing: a brace with no closing brace after it, an empty placeholder, or
 * a placeholder that does not parse or evaluate fails the whole template.  Placeholders do not
 * nest; the first closing brace after an opening brace ends the placeholder.
 *
 * @see ExpressionParser
 */
public final class StringExpander {

  private static final Logger LOG = Logger.getLogger(StringExpander.class.getName());

  private static final char PLACEHOLDER_START = '{';
  private static final char PLACEHOLDER_END = '}';

  private StringExpander() {
    // utility
  }

  /**
   * Expands {@code template} in {@code env}.
   *
   * @param env Environment in which to evaluate placeholders.
   * @param template The template to expand.
   * @return The expanded string, or absent if any placeholder could not be expanded.
   */
  public static Optional<String> tryExpand(ExpressionEnvironment env, String template) {
    Preconditions.checkNotNull(env);
    Preconditions.checkNotNull(template);

    if (template.indexOf(PLACEHOLDER_START) < 0) {
      return Optional.of(template);
    }

    StringBuilder expanded = new StringBuilder(template.length());
    int index = 0;
    while (index < template.length()) {
      int start = template.indexOf(PLACEHOLDER_START, index);
      if (start < 0) {
        expanded.append(template, index, template.length());
        break;
      }
      expanded.append(template, index, start);

      int end = template.indexOf(PLACEHOLDER_END, start + 1);
      if (end < 0) {
        LOG.fine(String.format("Unclosed placeholder at offset %d of: %s", start, template));
        return Optional.absent();
      }
      if (end == start + 1) {
        LOG.fine(String.format("Empty placeholder at offset %d of: %s", start, template));
        return Optional.absent();
      }

      Optional<Expression> expression =
          ExpressionParser.tryParse(template.substring(start + 1, end));
      if (!expression.isPresent()) {
        return Optional.absent();
      }

      Optional<String> value = expression.get().tryEvaluate(env);
      if (!value.isPresent()) {
        LOG.fine(String.format("Failed to evaluate placeholder at offset %d of: %s",
            start, template));
        return Optional.absent();
      }
      expanded.append(value.get());

      index = end + 1;
    }

    return Optional.of(expanded.toString());
  }
}
