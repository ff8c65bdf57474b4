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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State of one step of a provisioning run.
 *
 * @param stepNumber
 *            position in the run, 1 to 6
 * @param stepName
 *            human-readable step name
 * @param status
 *            current status
 * @param description
 *            what the step did or is doing
 * @param timestamp
 *            when the step entered this status
 * @param details
 *            named diagnostic fields
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StepReport(int stepNumber, String stepName, StepStatus status, String description,
		Instant timestamp, Map<String, Object> details) {

	public StepReport {
		details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
	}

	static StepReport pending(ProvisioningStep step, Instant now) {
		return new StepReport(step.number(), step.stepName(), StepStatus.PENDING, step.description(), now, Map.of());
	}
}
