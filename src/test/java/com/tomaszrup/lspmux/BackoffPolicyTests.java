////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspmux;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BackoffPolicyTests {

	@Test
	void testDoublesFromFiveSeconds() {
		BackoffPolicy policy = new BackoffPolicy(() -> 1.0);

		Assertions.assertEquals(5_000, policy.delayMs(1));
		Assertions.assertEquals(10_000, policy.delayMs(2));
		Assertions.assertEquals(20_000, policy.delayMs(3));
		Assertions.assertEquals(40_000, policy.delayMs(4));
	}

	@Test
	void testCappedAtOneMinute() {
		BackoffPolicy policy = new BackoffPolicy(() -> 1.0);

		Assertions.assertEquals(60_000, policy.delayMs(5));
		Assertions.assertEquals(60_000, policy.delayMs(64), "large attempt counts must not overflow");
	}

	@Test
	void testJitterIsApplied() {
		Assertions.assertEquals(4_000, new BackoffPolicy(() -> 0.8).delayMs(1));
		Assertions.assertEquals(72_000, new BackoffPolicy(() -> 1.2).delayMs(10));
	}

	@Test
	void testFloorOfOneSecond() {
		Assertions.assertEquals(1_000, new BackoffPolicy(() -> 0.01).delayMs(1));
	}

	@Test
	void testDefaultJitterStaysInRange() {
		BackoffPolicy policy = new BackoffPolicy();
		for (int i = 0; i < 200; i++) {
			long delay = policy.delayMs(1);
			Assertions.assertTrue(delay >= 4_000 && delay <= 6_000, "delay out of range: " + delay);
		}
	}

	@Test
	void testBrokenStateBacksOffUntilRetryAt() {
		BrokenServerState state = new BrokenServerState(2, 10_000, "boom");

		Assertions.assertTrue(state.isBackingOff(9_999));
		Assertions.assertFalse(state.isBackingOff(10_000));
	}
}
