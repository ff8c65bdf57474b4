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
import java.util.List;
import org.openregister.solr.setup.metadata.SolrOperationException;

/**
 * Signals that collection creation kept failing with configSet propagation
 * errors until all attempts were used up.
 */
public class PropagationTimeoutException extends Exception {

	private static final long serialVersionUID = 1L;

	private final int attempts;

	private final List<Duration> delays;

	private final Duration elapsed;

	public PropagationTimeoutException(String collectionName, int attempts, List<Duration> delays,
			Duration elapsed, SolrOperationException lastFailure) {
		super("Collection " + collectionName + " could not be created after " + attempts
				+ " attempts, the configSet did not propagate: " + lastFailure.getReportedMessage(), lastFailure);
		this.attempts = attempts;
		this.delays = List.copyOf(delays);
		this.elapsed = elapsed;
	}

	public int getAttempts() {
		return attempts;
	}

	public List<Duration> getDelays() {
		return delays;
	}

	public Duration getElapsed() {
		return elapsed;
	}

	public SolrOperationException getLastFailure() {
		return (SolrOperationException) getCause();
	}
}
