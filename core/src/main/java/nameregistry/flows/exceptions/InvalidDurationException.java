// Copyright 2026 The Name Registry Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package nameregistry.flows.exceptions;

import static nameregistry.flows.RegistryException.ErrorCode.INVALID_DURATION;

import nameregistry.flows.RegistryException;
import nameregistry.flows.RegistryException.RegistryErrorCode;
import org.joda.time.Duration;

/** Thrown when a claim asks for a registration period outside the allowed range. */
@RegistryErrorCode(INVALID_DURATION)
public class InvalidDurationException extends RegistryException {

  private final Duration duration;

  public InvalidDurationException(Duration duration) {
    super(String.format("Invalid claim duration %s", duration));
    this.duration = duration;
  }

  public Duration getDuration() {
    return duration;
  }

  @Override
  public Duration getDetail() {
    return duration;
  }
}
