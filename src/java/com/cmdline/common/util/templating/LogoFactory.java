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

import java.util.Locale;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import com.cmdline.common.expressions.ExpressionEnvironment;
import com.cmdline.common.util.BuildInfo;

/**
 * Expands program logos, such as the banner printed above usage text.  Logo formats are
 * {@link StringExpander} templates whose variables name pieces of the program's build metadata,
 * for example {@code "{$TITLE} version {$VERSION}"}.
 *
 * <p>Variable names are case insensitive.  {@code TITLE} is always defined, falling back to the
 * program class's simple name.  {@code VERSION} and {@code COMPANY} fall back to the program
 * package's manifest attributes when the build properties lack them.
 */
public class LogoFactory implements ExpressionEnvironment {

  private static final ImmutableMap<String, BuildInfo.Key> VARIABLES =
      ImmutableMap.<String, BuildInfo.Key>builder()
          .put("TITLE", BuildInfo.Key.TITLE)
          .put("VERSION", BuildInfo.Key.VERSION)
          .put("COMPANY", BuildInfo.Key.VENDOR)
          .put("DESCRIPTION", BuildInfo.Key.DESCRIPTION)
          .put("COPYRIGHT", BuildInfo.Key.COPYRIGHT)
          .put("USER", BuildInfo.Key.USER)
          .put("MACHINE", BuildInfo.Key.MACHINE)
          .put("DATE", BuildInfo.Key.DATE)
          .put("TIME", BuildInfo.Key.TIME)
          .put("TIMESTAMP", BuildInfo.Key.TIMESTAMP)
          .put("GITTAG", BuildInfo.Key.GIT_TAG)
          .put("GITREVISION", BuildInfo.Key.GIT_REVISION)
          .put("GITBRANCH", BuildInfo.Key.GIT_BRANCHNAME)
          .build();

  private final Class<?> programClass;
  private final BuildInfo buildInfo;

  /**
   * Creates a logo factory over the default {@code build.properties} resource.
   *
   * @param programClass The program's main class.
   */
  public LogoFactory(Class<?> programClass) {
    this(programClass, new BuildInfo());
  }

  public LogoFactory(Class<?> programClass, BuildInfo buildInfo) {
    this.programClass = Preconditions.checkNotNull(programClass);
    this.buildInfo = Preconditions.checkNotNull(buildInfo);
  }

  /**
   * Expands a logo format.
   *
   * @param logoFormat The format to expand.
   * @return The expanded logo, or absent if the format could not be expanded.
   */
  public Optional<String> tryExpand(String logoFormat) {
    return StringExpander.tryExpand(this, logoFormat);
  }

  @Override
  public Optional<String> tryGetVariable(String variableName) {
    Preconditions.checkNotNull(variableName);

    BuildInfo.Key key = VARIABLES.get(variableName.toUpperCase(Locale.ROOT));
    if (key == null) {
      return Optional.absent();
    }

    Optional<String> value = buildInfo.getValue(key);
    Package programPackage = programClass.getPackage();
    switch (key) {
      case TITLE:
        return value.or(Optional.of(programClass.getSimpleName()));
      case VERSION:
        return value.or(programPackage == null ? Optional.<String>absent()
            : Optional.fromNullable(programPackage.getImplementationVersion()));
      case VENDOR:
        return value.or(programPackage == null ? Optional.<String>absent()
            : Optional.fromNullable(programPackage.getImplementationVendor()));
      case COPYRIGHT:
        return value.isPresent()
            ? Optional.of(value.get().replace("\u00a9", "(C)"))
            : value;
      default:
        return value;
    }
  }
}
