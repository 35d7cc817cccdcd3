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

package nameregistry.config;

import java.util.List;

/** The POJO that registry YAML config files are deserialized into. */
public class RegistryConfigSettings {

  public DomainPolicy domainPolicy;
  public Storage storage;

  /** Configuration options for which domains may be registered, and for how long. */
  public static class DomainPolicy {
    public List<String> supportedExtensions;
    public int minNameLength;
    public int maxNameLength;
    public String minClaimDuration;
    public String maxClaimDuration;
  }

  /** Configuration options for where registry state is kept. */
  public static class Storage {
    public String type;
    public String directory;
  }
}
