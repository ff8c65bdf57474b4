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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.openregister.solr.setup.metadata.CollectionService;
import org.openregister.solr.setup.metadata.SolrOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a collection, retrying while SOLR reports that the configSet has not
 * propagated yet.
 *
 * <p>
 * A freshly uploaded configSet is written to ZooKeeper, and the node handling
 * the CREATE call may not see it for a few seconds. Only failures whose message
 * matches one of the known propagation symptoms are retried; anything else is
 * rethrown after the first attempt.
 */
class CollectionCreationRetrier {

	private static final Logger log = LoggerFactory.getLogger(CollectionCreationRetrier.class);

	static final List<String> PROPAGATION_SYMPTOMS = List.of(
			"underlying core creation failed while creating collection", "configset does not exist",
			"config does not exist", "could not find configset", "configset not found",
			"can not find the specified config set");

	private final CollectionService collectionService;

	private final RetryPolicy retryPolicy;

	private final Sleeper sleeper;

	private final Clock clock;

	CollectionCreationRetrier(CollectionService collectionService, RetryPolicy retryPolicy, Sleeper sleeper,
			Clock clock) {
		this.collectionService = collectionService;
		this.retryPolicy = retryPolicy;
		this.sleeper = sleeper;
		this.clock = clock;
	}

	/**
	 * Creates the collection.
	 *
	 * @return the number of attempts it took
	 * @throws SolrOperationException
	 *             on a failure that is not a propagation symptom
	 * @throws PropagationTimeoutException
	 *             when every attempt failed with a propagation symptom
	 * @throws InterruptedException
	 *             when interrupted while waiting between attempts
	 */
	int create(String collectionName, String configSetName)
			throws SolrOperationException, PropagationTimeoutException, InterruptedException {
		Instant start = clock.instant();
		List<Duration> delays = new ArrayList<>();
		SolrOperationException lastFailure = null;

		for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
			try {
				collectionService.createCollection(collectionName, configSetName);
				return attempt;
			} catch (SolrOperationException e) {
				if (!isPropagationSymptom(e)) {
					throw e;
				}
				lastFailure = e;
				if (attempt == retryPolicy.maxAttempts()) {
					break;
				}
				Duration delay = retryPolicy.delayAfterAttempt(attempt);
				log.atWarn().addKeyValue("collection", collectionName).addKeyValue("configSet", configSetName)
						.addKeyValue("attempt", attempt).addKeyValue("maxAttempts", retryPolicy.maxAttempts())
						.addKeyValue("delayMs", delay.toMillis()).addKeyValue("error", e.getReportedMessage())
						.log("ConfigSet not propagated yet, retrying collection creation");
				delays.add(delay);
				sleeper.sleep(delay);
			}
		}

		throw new PropagationTimeoutException(collectionName, retryPolicy.maxAttempts(), delays,
				Duration.between(start, clock.instant()), lastFailure);
	}

	static boolean isPropagationSymptom(SolrOperationException e) {
		return matchesSymptom(e.getMessage()) || matchesSymptom(e.getSolrErrorMessage());
	}

	private static boolean matchesSymptom(String message) {
		if (message == null) {
			return false;
		}
		String normalized = message.toLowerCase(Locale.ROOT);
		return PROPAGATION_SYMPTOMS.stream().anyMatch(normalized::contains);
	}
}
