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

package nameregistry.flows;

import static com.google.common.base.Preconditions.checkNotNull;

import nameregistry.model.Identity;
import nameregistry.util.Clock;
import org.joda.time.DateTime;

/**
 * Who is calling a registry operation, and when.
 *
 * <p>Both are supplied by the execution environment. {@code now} is fixed for the whole operation,
 * so every comparison and every timestamp it writes agree with each other.
 */
public record CallContext(Identity caller, DateTime now) {

  public CallContext {
    checkNotNull(caller, "caller");
    checkNotNull(now, "now");
  }

  /** Creates a context for {@code caller} at the current time of {@code clock}. */
  public static CallContext create(Identity caller, Clock clock) {
    return new CallContext(caller, clock.nowUtc());
  }
}
