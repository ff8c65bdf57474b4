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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Progress report of one provisioning run.
 *
 * <p>
 * All steps are registered as {@link StepStatus#PENDING} when the run is
 * created, so a client can render the full checklist even when the run stops
 * early. Status transitions replace the step's report in place.
 *
 * <p>
 * A run is owned by the thread executing it and is not safe for concurrent
 * modification. It is terminal once {@link #finish()} has been called.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({ "success", "tenant_id", "config_set", "collection", "started_at", "completed_at",
		"total_steps", "completed_steps", "steps", "infrastructure", "error_details" })
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProvisioningRun {

	public static final int TOTAL_STEPS = ProvisioningStep.values().length;

	private final Clock clock;

	private final String tenantId;

	private final Instant startedAt;

	private final List<StepReport> steps = new ArrayList<>(TOTAL_STEPS);

	private final InfrastructureSummary infrastructure = new InfrastructureSummary();

	private String configSet;

	private String collection;

	private Instant completedAt;

	private boolean success;

	private int completedSteps;

	private ErrorDetail errorDetails;

	ProvisioningRun(String tenantId, Clock clock) {
		this.clock = clock;
		this.tenantId = tenantId;
		this.startedAt = clock.instant();
		for (ProvisioningStep step : ProvisioningStep.values()) {
			steps.add(StepReport.pending(step, startedAt));
		}
	}

	void track(ProvisioningStep step, StepStatus status, String description, Map<String, Object> details) {
		steps.set(step.number() - 1, new StepReport(step.number(), step.stepName(), status, description,
				clock.instant(), details));
	}

	void stepCompleted() {
		if (completedSteps >= TOTAL_STEPS) {
			throw new IllegalStateException("All " + TOTAL_STEPS + " steps are already completed");
		}
		completedSteps++;
	}

	void fail(ErrorDetail errorDetail) {
		this.errorDetails = errorDetail;
		this.success = false;
	}

	void succeed() {
		if (completedSteps != TOTAL_STEPS) {
			throw new IllegalStateException(
					"Run cannot succeed with " + completedSteps + " of " + TOTAL_STEPS + " steps completed");
		}
		this.success = true;
	}

	void finish() {
		this.completedAt = clock.instant();
	}

	void setConfigSet(String configSet) {
		this.configSet = configSet;
	}

	void setCollection(String collection) {
		this.collection = collection;
	}

	public boolean isSuccess() {
		return success;
	}

	public String getTenantId() {
		return tenantId;
	}

	public String getConfigSet() {
		return configSet;
	}

	public String getCollection() {
		return collection;
	}

	public Instant getStartedAt() {
		return startedAt;
	}

	public Instant getCompletedAt() {
		return completedAt;
	}

	public int getTotalSteps() {
		return TOTAL_STEPS;
	}

	public int getCompletedSteps() {
		return completedSteps;
	}

	public List<StepReport> getSteps() {
		return Collections.unmodifiableList(steps);
	}

	public StepReport step(ProvisioningStep step) {
		return steps.get(step.number() - 1);
	}

	public InfrastructureSummary getInfrastructure() {
		return infrastructure;
	}

	public ErrorDetail getErrorDetails() {
		return errorDetails;
	}

	@JsonIgnore
	public Optional<ErrorDetail> errorDetail() {
		return Optional.ofNullable(errorDetails);
	}
}
