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

package nameregistry.util;

import static org.joda.time.DateTimeZone.UTC;

import org.joda.time.DateTime;

/** Utilities methods and constants related to Joda {@link DateTime} objects. */
public final class DateTimeUtils {

  /** The start of the epoch, in a convenient constant. */
  public static final DateTime START_OF_TIME = new DateTime(0, UTC);

  private DateTimeUtils() {}

  /** Returns whether the first {@link DateTime} is equal to or earlier than the second. */
  public static boolean isBeforeOrAt(DateTime timeToCheck, DateTime timeToCompareTo) {
    return !timeToCheck.isAfter(timeToCompareTo);
  }

  /** Returns whether the first {@link DateTime} is equal to or later than the second. */
  public static boolean isAtOrAfter(DateTime timeToCheck, DateTime timeToCompareTo) {
    return !timeToCheck.isBefore(timeToCompareTo);
  }
}
