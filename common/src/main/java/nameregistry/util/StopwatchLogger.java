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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import java.time.Duration;

/**
 * A helper class to log only if the time elapsed between calls is more than a specified threshold.
 */
public final class StopwatchLogger {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final Duration DEFAULT_THRESHOLD = Duration.ofMillis(400);

  private final Ticker ticker;
  private final long thresholdNanos;
  private long lastTickNanos;

  public StopwatchLogger() {
    this(DEFAULT_THRESHOLD, Ticker.systemTicker());
  }

  @VisibleForTesting
  StopwatchLogger(Duration threshold, Ticker ticker) {
    checkArgument(!threshold.isNegative(), "Threshold must not be negative: %s", threshold);
    this.ticker = ticker;
    this.thresholdNanos = threshold.toNanos();
    this.lastTickNanos = ticker.read();
  }

  /**
   * Logs the message if more than the threshold has passed since the previous tick.
   *
   * @return whether the message was logged
   */
  public boolean tick(String message) {
    long currentNanos = ticker.read();
    long elapsedNanos = currentNanos - lastTickNanos;
    this.lastTickNanos = currentNanos;

    // Only log if the elapsed time is over the threshold.
    if (elapsedNanos > thresholdNanos) {
      logger.atInfo().log("%s (took %d ms)", message, Duration.ofNanos(elapsedNanos).toMillis());
      return true;
    }
    return false;
  }
}
