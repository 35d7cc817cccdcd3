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

package nameregistry.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

/**
 * An opaque principal that can own, reserve, or administer domains.
 *
 * <p>Identities are encoded by the transport layer; the registry only compares them by value.
 */
public record Identity(String id) {

  public Identity {
    checkArgument(!isNullOrEmpty(id) && !id.isBlank(), "Identity must not be blank");
  }

  public static Identity of(String id) {
    return new Identity(id);
  }

  @Override
  public String toString() {
    return id;
  }
}
