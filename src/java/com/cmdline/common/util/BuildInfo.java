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


package com.cmdline.common.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Charsets;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.io.Closeables;

import org.apache.commons.lang.StringUtils;

import com.cmdline.common.base.MorePreconditions;

/**
 * Handles loading of a build properties file, and provides keys to look up known values in the
 * properties.  The file is read as UTF-8 the first time it is needed; a missing or unreadable file
 * is logged and leaves every key undefined.
 */
public class BuildInfo {

  private static final Logger LOG = Logger.getLogger(BuildInfo.class.getName());

  public static final String DEFAULT_BUILD_PROPERTIES_PATH = "build.properties";

  private final String resourcePath;

  private Properties properties = null;

  /**
   * Creates a build info container that will use the default properties file path.
   */
  public BuildInfo() {
    this(DEFAULT_BUILD_PROPERTIES_PATH);
  }

  /**
   * Creates a build info container, reading from the given path.
   *
   * @param resourcePath The classpath resource to read build properties from.
   */
  public BuildInfo(String resourcePath) {
    this.resourcePath = MorePreconditions.checkNotBlank(resourcePath);
  }

  @VisibleForTesting
  public BuildInfo(Properties properties) {
    this.resourcePath = null;
    this.properties = Preconditions.checkNotNull(properties);
  }

  private void fetchProperties() {
    properties = new Properties();
    LOG.fine("Fetching build properties from " + resourcePath);
    InputStream in = BuildInfo.class.getClassLoader().getResourceAsStream(resourcePath);
    if (in == null) {
      LOG.warning("Failed to fetch build properties from " + resourcePath);
      return;
    }

    try {
      properties.load(new InputStreamReader(in, Charsets.UTF_8));
    } catch (IOException e) {
      LOG.log(Level.WARNING, "Failed to load properties file " + resourcePath, e);
    } finally {
      Closeables.closeQuietly(in);
    }
  }

  /**
   * Fetches the properties stored in the resource location.
   *
   * @return The loaded properties, or an empty properties object if there was a problem loading
   *    the specified properties resource.
   */
  public synchronized Properties getProperties() {
    if (properties == null) fetchProperties();
    return properties;
  }

  /**
   * Looks up a known value.
   *
   * @param key The key to look up.
   * @return The value of {@code key}, or absent if it is undefined or blank.
   */
  public Optional<String> getValue(Key key) {
    Preconditions.checkNotNull(key);
    String value = getProperties().getProperty(key.value);
    return StringUtils.isBlank(value) ? Optional.<String>absent() : Optional.of(value);
  }

  /**
   * Values of keys that are expected to exist in the loaded properties file.
   */
  public enum Key {
    TITLE("build.title"),
    VERSION("build.version"),
    VENDOR("build.vendor"),
    DESCRIPTION("build.description"),
    COPYRIGHT("build.copyright"),
    USER("build.user.name"),
    MACHINE("build.machine"),
    DATE("build.date"),
    TIME("build.time"),
    TIMESTAMP("build.timestamp"),
    GIT_TAG("build.git.tag"),
    GIT_REVISION("build.git.revision"),
    GIT_BRANCHNAME("build.git.branchname");

    public final String value;
    private Key(String value) {
      this.value = value;
    }
  }
}
