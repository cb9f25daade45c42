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


package com.cmdline.common.util.logging;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

import com.google.common.base.Preconditions;
import com.google.common.io.Closeables;

import com.cmdline.common.base.MorePreconditions;

/**
 * A custom java.util.logging configuration class that loads the logging configuration from a
 * properties file resource (as opposed to a file as natively supported by LogManager via
 * java.util.logging.config.file).  By default this configurator will look for the resource at
 * /logging.properties but the resource path can be overridden by setting the system property with
 * key {@link #LOGGING_PROPERTIES_RESOURCE_PATH cmdline.logging.config.resource}.  To install this
 * configurator specify the following system property:
 * java.util.logging.config.class=com.cmdline.common.util.logging.ResourceLoggingConfigurator
 */
public class ResourceLoggingConfigurator {

  /**
   * A system property that controls where ResourceLoggingConfigurator looks for the logging
   * configuration on the process classpath.
   */
  public static final String LOGGING_PROPERTIES_RESOURCE_PATH = "cmdline.logging.config.resource";

  public static final String DEFAULT_RESOURCE_PATH = "/logging.properties";

  /**
   * Loads the resource named by {@link #LOGGING_PROPERTIES_RESOURCE_PATH}, or
   * {@link #DEFAULT_RESOURCE_PATH} when that property is unset.
   *
   * @throws IOException if the configuration could not be read.
   */
  public ResourceLoggingConfigurator() throws IOException {
    this(System.getProperty(LOGGING_PROPERTIES_RESOURCE_PATH, DEFAULT_RESOURCE_PATH));
  }

  /**
   * Loads logging configuration from the given classpath resource.
   *
   * @param resourcePath Resource path, resolved as by {@link Class#getResourceAsStream(String)}.
   * @throws NullPointerException if there is no resource at {@code resourcePath}.
   * @throws IOException if the configuration could not be read.
   */
  public ResourceLoggingConfigurator(String resourcePath) throws IOException {
    MorePreconditions.checkNotBlank(resourcePath);
    InputStream loggingConfig = getClass().getResourceAsStream(resourcePath);
    Preconditions.checkNotNull(loggingConfig,
        "Could not locate logging config file at resource path: %s", resourcePath);
    try {
      LogManager.getLogManager().readConfiguration(loggingConfig);
    } finally {
      Closeables.closeQuietly(loggingConfig);
    }
  }
}
