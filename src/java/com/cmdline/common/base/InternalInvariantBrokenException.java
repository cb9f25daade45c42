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

/**
 * Thrown when an internal invariant is broken.  Seeing one of these means there is a defect in
 * this library (or in a hand-built expression tree), not a problem with user input.
 */
public class InternalInvariantBrokenException extends IllegalStateException {

  public InternalInvariantBrokenException() {
    super();
  }

  public InternalInvariantBrokenException(String message) {
    super(message);
  }

  public InternalInvariantBrokenException(String message, Throwable cause) {
    super(message, cause);
  }
}
