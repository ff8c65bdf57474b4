/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.openregister.solr.setup.provisioning;

import java.time.Duration;
import org.openregister.solr.setup.config.ProvisioningProperties;

/**
 * Bounded exponential backoff.
 *
 * @param maxAttempts
 *            total number of attempts, at least 1
 * @param baseDelay
 *            delay after the first failed attempt
 * @param maxDelay
 *            upper bound for any single delay
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

	public RetryPolicy {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
		}
		if (baseDelay.isNegative() || maxDelay.isNegative()) {
			throw new IllegalArgumentException("Retry delays must not be negative");
		}
	}

	public static RetryPolicy from(ProvisioningProperties.Provisioning provisioning) {
		return new RetryPolicy(provisioning.maxAttempts(), provisioning.baseDelay(), provisioning.maxDelay());
	}

	/**
	 * Returns the delay to wait after the given failed attempt:
	 * {@code baseDelay * 2^(attempt - 1)}, capped at {@code maxDelay}.
	 *
	 * @param attempt
	 *            1-based number of the attempt that failed
	 */
	public Duration delayAfterAttempt(int attempt) {
		if (attempt < 1) {
			throw new IllegalArgumentException("attempt must be at least 1, was " + attempt);
		}
		// 2^30 already exceeds any sensible cap
		int exponent = Math.min(attempt - 1, 30);
		Duration delay = baseDelay.multipliedBy(1L << exponent);
		return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
	}
}
