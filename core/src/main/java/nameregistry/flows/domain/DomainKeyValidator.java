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

package nameregistry.flows.domain;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import jakarta.inject.Inject;
import nameregistry.config.RegistryConfig.Config;
import nameregistry.flows.RegistryException;
import nameregistry.flows.exceptions.InvalidDomainExtensionException;
import nameregistry.flows.exceptions.InvalidDomainKeyException;
import nameregistry.flows.exceptions.InvalidDomainNameLengthException;

/**
 * Validates domain names and extensions and combines them into canonical domain keys.
 *
 * <p>A canonical key is {@code name + "." + extension}. Names are taken exactly as given, without
 * case folding or other normalization.
 */
public class DomainKeyValidator {

  public static final char SEPARATOR = '.';

  private final ImmutableSet<String> supportedExtensions;
  private final int minNameLength;
  private final int maxNameLength;

  @Inject
  public DomainKeyValidator(
      @Config("supportedExtensions") ImmutableSet<String> supportedExtensions,
      @Config("minNameLength") int minNameLength,
      @Config("maxNameLength") int maxNameLength) {
    checkArgument(!supportedExtensions.isEmpty(), "At least one extension must be supported");
    checkArgument(
        0 < minNameLength && minNameLength <= maxNameLength,
        "Invalid name length bounds [%s, %s]",
        minNameLength,
        maxNameLength);
    this.supportedExtensions = supportedExtensions;
    this.minNameLength = minNameLength;
    this.maxNameLength = maxNameLength;
  }

  /**
   * Validates {@code name} and {@code extension} and returns the canonical key they form.
   *
   * <p>Checks are made in order: name length, extension, then that the name does not contain the
   * separator.
   */
  public String validate(String name, String extension) throws RegistryException {
    checkNotNull(name, "name");
    checkNotNull(extension, "extension");
    int length = name.codePointCount(0, name.length());
    if (length < minNameLength || length > maxNameLength) {
      throw new InvalidDomainNameLengthException(length);
    }
    if (!supportedExtensions.contains(extension)) {
      throw new InvalidDomainExtensionException(extension);
    }
    String domainKey = name + SEPARATOR + extension;
    // A name containing the separator would split differently when the key is parsed back.
    if (name.indexOf(SEPARATOR) >= 0) {
      throw new InvalidDomainKeyException(domainKey);
    }
    return domainKey;
  }

  /**
   * Validates a combined key by splitting it on its first separator and validating both parts.
   *
   * @throws InvalidDomainKeyException if there is no separator or either part is invalid, with the
   *     underlying failure as its cause
   */
  public String validateKey(String domainKey) throws InvalidDomainKeyException {
    checkNotNull(domainKey, "domainKey");
    int separatorIndex = domainKey.indexOf(SEPARATOR);
    if (separatorIndex < 0) {
      throw new InvalidDomainKeyException(domainKey);
    }
    try {
      return validate(
          domainKey.substring(0, separatorIndex), domainKey.substring(separatorIndex + 1));
    } catch (RegistryException e) {
      throw new InvalidDomainKeyException(domainKey, e);
    }
  }

  public ImmutableSet<String> getSupportedExtensions() {
    return supportedExtensions;
  }
}
