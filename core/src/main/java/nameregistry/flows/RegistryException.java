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

import static com.google.common.base.Preconditions.checkState;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import javax.annotation.Nullable;

/**
 * Base class for every error a registry operation can report to its caller.
 *
 * <p>Each concrete subclass is annotated with exactly one {@link RegistryErrorCode} and carries the
 * value the caller needs to react to it, available from {@link #getDetail()}. Throwing one of these
 * means that the operation made no changes.
 */
public abstract class RegistryException extends Exception {

  protected RegistryException(String message) {
    super(message);
  }

  protected RegistryException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }

  /** The error code declared on the concrete exception class. */
  public ErrorCode getErrorCode() {
    RegistryErrorCode annotation = getClass().getAnnotation(RegistryErrorCode.class);
    checkState(annotation != null, "%s has no @RegistryErrorCode", getClass().getName());
    return annotation.value();
  }

  /** The context value this error carries, such as the offending input or a conflicting owner. */
  public abstract Object getDetail();

  /** Annotation for associating an {@link ErrorCode} with an exception subclass. */
  @Documented
  @Inherited
  @Retention(RUNTIME)
  @Target(TYPE)
  public @interface RegistryErrorCode {
    ErrorCode value();
  }

  /** The closed set of errors that registry operations report. */
  public enum ErrorCode {
    CALLER_NOT_CANISTER_OWNER("CallerNotCanisterOwner"),
    CALLER_NOT_DOMAIN_OWNER("CallerNotDomainOwner"),
    DOMAIN_NOT_FOUND("DomainNotFound"),
    DOMAIN_STILL_VALID("DomainStillValid"),
    DOMAIN_ALREADY_CLAIMED("DomainAlreadyClaimed"),
    DOMAIN_OWNERSHIP_EXPIRED("DomainOwnershipExpired"),
    INVALID_DURATION("InvalidDuration"),
    INVALID_DOMAIN_NAME_LENGTH("InvalidDomainNameLength"),
    INVALID_DOMAIN_EXTENSION("InvalidDomainExtension"),
    INVALID_DOMAIN_KEY("InvalidDomainKey"),
    DOMAIN_RESERVED("DomainReserved"),
    UNKNOWN_ERROR("UnknownError");

    private final String variantName;

    ErrorCode(String variantName) {
      this.variantName = variantName;
    }

    /** The name under which the transport layer reports this error. */
    public String getVariantName() {
      return variantName;
    }
  }
}
