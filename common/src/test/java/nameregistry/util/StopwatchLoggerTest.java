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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.base.Ticker;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link StopwatchLogger}. */
class StopwatchLoggerTest {

  private final AtomicLong nanos = new AtomicLong(1_000L);
  private final Ticker ticker =
      new Ticker() {
        @Override
        public long read() {
          return nanos.get();
        }
      };

  @Test
  void testTick_underThreshold_doesNotLog() {
    StopwatchLogger stopwatch = new StopwatchLogger(Duration.ofMillis(400), ticker);
    nanos.addAndGet(Duration.ofMillis(399).toNanos());
    assertThat(stopwatch.tick("fast")).isFalse();
  }

  @Test
  void testTick_overThreshold_logs() {
    StopwatchLogger stopwatch = new StopwatchLogger(Duration.ofMillis(400), ticker);
    nanos.addAndGet(Duration.ofMillis(401).toNanos());
    assertThat(stopwatch.tick("slow")).isTrue();
  }

  @Test
  void testTick_measuresFromPreviousTick() {
    StopwatchLogger stopwatch = new StopwatchLogger(Duration.ofMillis(400), ticker);
    nanos.addAndGet(Duration.ofMillis(300).toNanos());
    assertThat(stopwatch.tick("first")).isFalse();
    nanos.addAndGet(Duration.ofMillis(300).toNanos());
    assertThat(stopwatch.tick("second")).isFalse();
  }

  @Test
  void testConstructor_negativeThreshold_throws() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () -> new StopwatchLogger(Duration.ofMillis(-1), ticker));
    assertThat(thrown).hasMessageThat().contains("must not be negative");
  }
}
