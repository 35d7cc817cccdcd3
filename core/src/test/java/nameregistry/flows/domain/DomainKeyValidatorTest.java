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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableSet;
import nameregistry.flows.exceptions.InvalidDomainExtensionException;
import nameregistry.flows.exceptions.InvalidDomainKeyException;
import nameregistry.flows.exceptions.InvalidDomainNameLengthException;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link DomainKeyValidator}. */
class DomainKeyValidatorTest {

  private final DomainKeyValidator validator =
      new DomainKeyValidator(ImmutableSet.of("icp", "ic", "moon"), 3, 40);

  @Test
  void testValidate_success() throws Exception {
    assertThat(validator.validate("alice", "icp")).isEqualTo("alice.icp");
    assertThat(validator.validate("bob", "moon")).isEqualTo("bob.moon");
  }

  @Test
  void testValidate_lengthBoundaries() throws Exception {
    assertThat(validator.validate("abc", "ic")).isEqualTo("abc.ic");
    assertThat(validator.validate("a".repeat(40), "ic")).isEqualTo("a".repeat(40) + ".ic");
    assertThat(
            assertThrows(
                    InvalidDomainNameLengthException.class, () -> validator.validate("ab", "ic"))
                .getLength())
        .isEqualTo(2);
    assertThat(
            assertThrows(
                    InvalidDomainNameLengthException.class,
                    () -> validator.validate("a".repeat(41), "ic"))
                .getLength())
        .isEqualTo(41);
  }

  @Test
  void testValidate_emptyName() {
    InvalidDomainNameLengthException thrown =
        assertThrows(InvalidDomainNameLengthException.class, () -> validator.validate("", "icp"));
    assertThat(thrown.getDetail()).isEqualTo(0);
  }

  @Test
  void testValidate_lengthCountsCodePoints() throws Exception {
    // Three emoji: six UTF-16 chars but three code points.
    String name = "😀😁😂";
    assertThat(validator.validate(name, "icp")).isEqualTo(name + ".icp");
    InvalidDomainNameLengthException thrown =
        assertThrows(
            InvalidDomainNameLengthException.class,
            () -> validator.validate("😀😁", "icp"));
    assertThat(thrown.getLength()).isEqualTo(2);
  }

  @Test
  void testValidate_unsupportedExtension() {
    InvalidDomainExtensionException thrown =
        assertThrows(
            InvalidDomainExtensionException.class, () -> validator.validate("alice", "com"));
    assertThat(thrown.getExtension()).isEqualTo("com");
  }

  @Test
  void testValidate_extensionIsCaseSensitive() {
    assertThrows(InvalidDomainExtensionException.class, () -> validator.validate("alice", "ICP"));
  }

  @Test
  void testValidate_lengthCheckedBeforeExtension() {
    assertThrows(InvalidDomainNameLengthException.class, () -> validator.validate("ab", "com"));
  }

  @Test
  void testValidate_nameContainingSeparator() {
    InvalidDomainKeyException thrown =
        assertThrows(InvalidDomainKeyException.class, () -> validator.validate("a.b", "icp"));
    assertThat(thrown.getDomainKey()).isEqualTo("a.b.icp");
  }

  @Test
  void testValidate_extensionCheckedBeforeSeparator() {
    assertThrows(InvalidDomainExtensionException.class, () -> validator.validate("a.b", "com"));
  }

  @Test
  void testValidate_noCaseFolding() throws Exception {
    assertThat(validator.validate("Alice", "icp")).isEqualTo("Alice.icp");
  }

  @Test
  void testValidateKey_success() throws Exception {
    assertThat(validator.validateKey("alice.icp")).isEqualTo("alice.icp");
  }

  @Test
  void testValidateKey_isIdempotentWithValidate() throws Exception {
    String key = validator.validate("carol", "moon");
    assertThat(validator.validateKey(key)).isEqualTo(key);
    assertThat(validator.validateKey(validator.validateKey(key))).isEqualTo(key);
  }

  @Test
  void testValidateKey_noSeparator() {
    InvalidDomainKeyException thrown =
        assertThrows(InvalidDomainKeyException.class, () -> validator.validateKey("aliceicp"));
    assertThat(thrown.getDomainKey()).isEqualTo("aliceicp");
    assertThat(thrown).hasCauseThat().isNull();
  }

  @Test
  void testValidateKey_splitsOnFirstSeparator() {
    InvalidDomainKeyException thrown =
        assertThrows(InvalidDomainKeyException.class, () -> validator.validateKey("abc.def.icp"));
    assertThat(thrown.getDomainKey()).isEqualTo("abc.def.icp");
    assertThat(thrown).hasCauseThat().isInstanceOf(InvalidDomainExtensionException.class);
  }

  @Test
  void testValidateKey_invalidName() {
    InvalidDomainKeyException thrown =
        assertThrows(InvalidDomainKeyException.class, () -> validator.validateKey("ab.icp"));
    assertThat(thrown.getDomainKey()).isEqualTo("ab.icp");
    assertThat(thrown).hasCauseThat().isInstanceOf(InvalidDomainNameLengthException.class);
  }

  @Test
  void testValidateKey_emptyExtension() {
    InvalidDomainKeyException thrown =
        assertThrows(InvalidDomainKeyException.class, () -> validator.validateKey("alice."));
    assertThat(thrown).hasCauseThat().isInstanceOf(InvalidDomainExtensionException.class);
  }

  @Test
  void testConstructor_rejectsBadBounds() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () -> new DomainKeyValidator(ImmutableSet.of("icp"), 5, 4));
    assertThat(thrown).hasMessageThat().contains("Invalid name length bounds");
    assertThrows(
        IllegalArgumentException.class, () -> new DomainKeyValidator(ImmutableSet.of(), 3, 40));
  }
}
