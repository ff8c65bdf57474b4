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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.openregister.solr.setup.config.ProvisioningProperties;
import org.openregister.solr.setup.config.SolrConfig;
import org.openregister.solr.setup.metadata.CollectionService;
import org.openregister.solr.setup.metadata.ConfigSetService;
import org.openregister.solr.setup.metadata.FailureCause;
import org.openregister.solr.setup.metadata.SchemaFieldCatalog;
import org.openregister.solr.setup.metadata.SchemaFieldResult;
import org.openregister.solr.setup.metadata.SchemaService;
import org.openregister.solr.setup.metadata.SolrOperationException;
import org.openregister.solr.setup.metadata.SolrSystemInfo;
import org.openregister.solr.setup.tenant.TenantEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Spring Service that provisions the SOLR infrastructure of one tenant.
 *
 * <p>
 * A run executes a fixed sequence of steps and stops at the first hard
 * failure:
 *
 * <ol>
 * <li><strong>SOLR Connectivity</strong>: system info check
 * <li><strong>EnsureTenantConfigSet</strong>: upload the packaged configSet
 * under the tenant-qualified name unless it exists
 * <li><strong>ConfigSet Propagation</strong>: best-effort configSet list and
 * cluster status calls, followed by a short pause. A failure is tolerated
 * unless {@code solr.provisioning.propagation-failure-is-fatal} is set
 * <li><strong>Collection Creation</strong>: create the tenant-qualified
 * collection unless it exists, retrying with exponential backoff while the
 * configSet propagates
 * <li><strong>Schema Configuration</strong>: add or replace every field of
 * {@link SchemaFieldCatalog#OBJECT_ENTITY_FIELDS}
 * <li><strong>Setup Validation</strong>: configSet exists, collection exists,
 * match-all query answers with status {@code 0}
 * </ol>
 *
 * <p>
 * Runs are idempotent: repeating a run against a provisioned tenant skips the
 * configSet and collection and re-applies every field. Nothing is rolled back
 * on failure.
 *
 * <p>
 * {@link #provision()} never throws. Every failure, including unexpected
 * runtime exceptions, ends the run with an {@link ErrorDetail}. Runs are not
 * synchronized; callers serialize them.
 */
@Service
public class TenantProvisioner {

	private static final Logger log = LoggerFactory.getLogger(TenantProvisioner.class);

	private static final String ACTION = "action";
	private static final String CREATED = "created";
	private static final String SKIPPED = "skipped";
	private static final int PROPAGATION_CALLS = 2;

	private final ProvisioningProperties properties;

	private final TenantEnvironment tenantEnvironment;

	private final CollectionService collectionService;

	private final ConfigSetService configSetService;

	private final SchemaService schemaService;

	private final CollectionCreationRetrier creationRetrier;

	private final Sleeper sleeper;

	private final Clock clock;

	@Autowired
	public TenantProvisioner(ProvisioningProperties properties, TenantEnvironment tenantEnvironment,
			CollectionService collectionService, ConfigSetService configSetService, SchemaService schemaService) {
		this(properties, tenantEnvironment, collectionService, configSetService, schemaService, Sleeper.SYSTEM,
				Clock.systemUTC());
	}

	TenantProvisioner(ProvisioningProperties properties, TenantEnvironment tenantEnvironment,
			CollectionService collectionService, ConfigSetService configSetService, SchemaService schemaService,
			Sleeper sleeper, Clock clock) {
		this.properties = properties;
		this.tenantEnvironment = tenantEnvironment;
		this.collectionService = collectionService;
		this.configSetService = configSetService;
		this.schemaService = schemaService;
		this.sleeper = sleeper;
		this.clock = clock;
		this.creationRetrier = new CollectionCreationRetrier(collectionService,
				RetryPolicy.from(properties.provisioning()), sleeper, clock);
	}

	/**
	 * Runs all provisioning steps.
	 *
	 * @return the finished run, successful or not
	 */
	public ProvisioningRun provision() {
		ProvisioningRun run = new ProvisioningRun(tenantEnvironment.tenantId(), clock);
		log.atInfo().addKeyValue("tenant", run.getTenantId()).addKeyValue("solrUrl", SolrConfig.baseUrl(properties))
				.log("Starting SOLR tenant provisioning");

		for (ProvisioningStep step : ProvisioningStep.values()) {
			boolean proceed;
			try {
				proceed = execute(step, run);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				proceed = failUnexpectedly(run, step, "Provisioning was interrupted", e);
			} catch (RuntimeException e) {
				proceed = failUnexpectedly(run, step, "Unexpected error: " + e.getMessage(), e);
			}
			if (!proceed) {
				run.finish();
				return run;
			}
		}

		run.succeed();
		run.finish();
		log.atInfo().addKeyValue("tenant", run.getTenantId()).addKeyValue("configSet", run.getConfigSet())
				.addKeyValue("collection", run.getCollection())
				.addKeyValue("durationMs", Duration.between(run.getStartedAt(), run.getCompletedAt()).toMillis())
				.log("SOLR tenant provisioning completed");
		return run;
	}

	private boolean execute(ProvisioningStep step, ProvisioningRun run) throws InterruptedException {
		switch (step) {
			case CONNECTIVITY :
				return checkConnectivity(run);
			case CONFIG_SET :
				return ensureConfigSet(run);
			case PROPAGATION :
				return forcePropagation(run);
			case COLLECTION :
				return ensureCollection(run);
			case SCHEMA :
				return configureSchema(run);
			case VALIDATION :
				return validate(run);
			default :
				throw new IllegalStateException("Unknown step " + step);
		}
	}

	private boolean checkConnectivity(ProvisioningRun run) {
		ProvisioningStep step = ProvisioningStep.CONNECTIVITY;
		String baseUrl = SolrConfig.baseUrl(properties);
		run.track(step, StepStatus.STARTED, "Checking SOLR connectivity", Map.of("solr_url", baseUrl));

		SolrSystemInfo systemInfo;
		try {
			systemInfo = collectionService.getSystemInfo();
		} catch (SolrOperationException e) {
			return fail(run, step, ErrorKind.CONNECTIVITY_FAILURE, e.getFailureCause(), "connectivity check",
					"SOLR is not reachable at " + baseUrl + ": " + e.getMessage(), e.context());
		}

		run.getInfrastructure().setCloudMode(systemInfo.cloudMode());
		Map<String, Object> details = new LinkedHashMap<>();
		details.put("solr_url", baseUrl);
		details.put("solr_version", systemInfo.solrVersion());
		details.put("mode", systemInfo.mode());
		return complete(run, step, "SOLR is reachable", details);
	}

	private boolean ensureConfigSet(ProvisioningRun run) {
		ProvisioningStep step = ProvisioningStep.CONFIG_SET;
		String configSet = tenantEnvironment.tenantName(properties.configSet());
		run.setConfigSet(configSet);
		run.track(step, StepStatus.STARTED, "Ensuring configSet " + configSet, Map.of("config_set", configSet));

		Map<String, Object> details = new LinkedHashMap<>();
		details.put("config_set", configSet);
		if (configSetService.configSetExists(configSet)) {
			run.getInfrastructure().configSetSkipped(configSet);
			details.put(ACTION, SKIPPED);
			return complete(run, step, "ConfigSet " + configSet + " already exists", details);
		}

		try {
			configSetService.uploadConfigSet(configSet, properties.configSetArchive());
		} catch (SolrOperationException e) {
			Map<String, Object> context = new LinkedHashMap<>(e.context());
			context.put("config_set", configSet);
			if (properties.configSetArchive() != null) {
				context.put("archive", properties.configSetArchive().getDescription());
			}
			return fail(run, step, ErrorKind.CONFIGSET_CREATION_FAILURE, e.getFailureCause(), "upload configSet",
					"Failed to create configSet " + configSet + ": " + e.getMessage(), context);
		}

		run.getInfrastructure().configSetCreated(configSet);
		details.put(ACTION, CREATED);
		return complete(run, step, "ConfigSet " + configSet + " created", details);
	}

	private boolean forcePropagation(ProvisioningRun run) throws InterruptedException {
		ProvisioningStep step = ProvisioningStep.PROPAGATION;
		run.track(step, StepStatus.STARTED, "Triggering configSet propagation", Map.of());

		int succeeded = 0;
		if (configSetService.refreshConfigSets()) {
			succeeded++;
		}
		if (collectionService.refreshClusterStatus()) {
			succeeded++;
		}

		Map<String, Object> details = new LinkedHashMap<>();
		details.put("successful_calls", succeeded);
		details.put("total_calls", PROPAGATION_CALLS);

		if (succeeded > 0) {
			Duration pause = properties.provisioning().propagationPause();
			sleeper.sleep(pause);
			details.put("pause_ms", pause.toMillis());
			return complete(run, step, "Propagation triggered", details);
		}

		if (properties.provisioning().propagationFailureIsFatal()) {
			return fail(run, step, ErrorKind.PROPAGATION_FAILURE, null, "force configSet propagation",
					"None of the propagation calls succeeded", details);
		}

		log.atWarn().addKeyValue("tenant", run.getTenantId()).addKeyValue("configSet", run.getConfigSet())
				.log("ConfigSet propagation could not be triggered, continuing");
		run.track(step, StepStatus.FAILED, "Propagation calls failed, continuing", details);
		run.stepCompleted();
		return true;
	}

	private boolean ensureCollection(ProvisioningRun run) throws InterruptedException {
		ProvisioningStep step = ProvisioningStep.COLLECTION;
		String collection = tenantEnvironment.tenantName(properties.collection());
		String configSet = run.getConfigSet();
		run.setCollection(collection);
		run.track(step, StepStatus.STARTED, "Ensuring collection " + collection,
				Map.of("collection", collection, "config_set", configSet));

		Map<String, Object> details = new LinkedHashMap<>();
		details.put("collection", collection);
		details.put("config_set", configSet);
		if (tenantEnvironment.collectionExists(collection)) {
			run.getInfrastructure().collectionSkipped(collection);
			details.put(ACTION, SKIPPED);
			return complete(run, step, "Collection " + collection + " already exists", details);
		}

		int attempts;
		try {
			attempts = creationRetrier.create(collection, configSet);
		} catch (PropagationTimeoutException e) {
			Map<String, Object> context = new LinkedHashMap<>(e.getLastFailure().context());
			context.put("collection", collection);
			context.put("config_set", configSet);
			context.put("attempts", e.getAttempts());
			context.put("delays_seconds", e.getDelays().stream().map(Duration::toSeconds).toList());
			context.put("elapsed_ms", e.getElapsed().toMillis());
			return fail(run, step, ErrorKind.COLLECTION_CREATION_FAILURE, FailureCause.PROPAGATION_TIMEOUT,
					"create collection", e.getMessage(), context);
		} catch (SolrOperationException e) {
			Map<String, Object> context = new LinkedHashMap<>(e.context());
			context.put("collection", collection);
			context.put("config_set", configSet);
			return fail(run, step, ErrorKind.COLLECTION_CREATION_FAILURE, creationFailureCause(e),
					"create collection", "Failed to create collection " + collection + ": " + e.getMessage(),
					context);
		}

		run.getInfrastructure().collectionCreated(collection);
		details.put(ACTION, CREATED);
		details.put("attempts", attempts);
		return complete(run, step, "Collection " + collection + " created", details);
	}

	private boolean configureSchema(ProvisioningRun run) {
		ProvisioningStep step = ProvisioningStep.SCHEMA;
		String collection = run.getCollection();
		run.track(step, StepStatus.STARTED, "Configuring schema fields of " + collection,
				Map.of("total_fields", SchemaFieldCatalog.OBJECT_ENTITY_FIELDS.size()));

		SchemaFieldResult result = schemaService.applyFields(collection, SchemaFieldCatalog.OBJECT_ENTITY_FIELDS);
		run.getInfrastructure().setSchemaFieldsConfigured(result.success());
		if (!result.success()) {
			FailureCause cause = result.lastFailureCause();
			return fail(run, step, ErrorKind.SCHEMA_FIELD_FAILURE, cause == null ? FailureCause.UNKNOWN : cause,
					"configure schema fields", result.failedFields().size() + " of " + result.totalFields()
							+ " fields could not be configured: " + String.join(", ", result.failedFields()),
					result.toDetails());
		}
		return complete(run, step, result.totalFields() + " schema fields configured", result.toDetails());
	}

	private boolean validate(ProvisioningRun run) {
		ProvisioningStep step = ProvisioningStep.VALIDATION;
		String configSet = run.getConfigSet();
		String collection = run.getCollection();
		run.track(step, StepStatus.STARTED, "Validating setup", Map.of());

		boolean configSetExists = false;
		SolrOperationException configSetFailure = null;
		try {
			configSetExists = configSetService.listConfigSets().contains(configSet);
		} catch (SolrOperationException e) {
			configSetFailure = e;
		}
		boolean collectionExists = tenantEnvironment.collectionExists(collection);
		SolrOperationException queryFailure = null;
		try {
			collectionService.checkQueryable(collection);
		} catch (SolrOperationException e) {
			queryFailure = e;
		}

		Map<String, Object> details = new LinkedHashMap<>();
		details.put("config_set", configSet);
		details.put("config_set_exists", configSetExists);
		details.put("collection", collection);
		details.put("collection_exists", collectionExists);
		details.put("query_ok", queryFailure == null);

		if (configSetExists && collectionExists && queryFailure == null) {
			run.getInfrastructure().setMultiTenantReady(true);
			return complete(run, step, "Tenant SOLR setup is ready", details);
		}

		List<String> failedChecks = new ArrayList<>();
		Map<String, Object> context = new LinkedHashMap<>(details);
		FailureCause cause = null;
		if (configSetFailure != null) {
			failedChecks.add("configSet list failed: " + configSetFailure.getReportedMessage());
			context.putAll(configSetFailure.context());
			cause = configSetFailure.getFailureCause();
		} else if (!configSetExists) {
			failedChecks.add("configSet " + configSet + " not found");
		}
		if (!collectionExists) {
			failedChecks.add("collection " + collection + " not found");
		}
		if (queryFailure != null) {
			failedChecks.add("query failed: " + queryFailure.getReportedMessage());
			if (configSetFailure == null) {
				context.putAll(queryFailure.context());
				cause = queryFailure.getFailureCause();
			}
		}
		return fail(run, step, ErrorKind.VALIDATION_FAILURE, cause, "validate setup",
				"Setup validation failed: " + String.join("; ", failedChecks), context);
	}

	private static FailureCause creationFailureCause(SolrOperationException e) {
		switch (e.getFailureCause()) {
			case TRANSPORT_EXCEPTION :
				return FailureCause.NETWORK_CONNECTIVITY;
			case SOLR_API_ERROR :
			case HTTP_ERROR :
				return FailureCause.SOLR_VALIDATION_ERROR;
			default :
				return FailureCause.UNKNOWN;
		}
	}

	private boolean complete(ProvisioningRun run, ProvisioningStep step, String description,
			Map<String, Object> details) {
		run.track(step, StepStatus.COMPLETED, description, details);
		run.stepCompleted();
		log.atInfo().addKeyValue("tenant", run.getTenantId()).addKeyValue("step", step.number())
				.addKeyValue("stepName", step.stepName()).log(description);
		return true;
	}

	private boolean fail(ProvisioningRun run, ProvisioningStep step, ErrorKind kind, FailureCause cause,
			String operation, String message, Map<String, Object> context) {
		ErrorDetail detail = ErrorDetail.of(kind, cause, operation, step, message, context);
		run.track(step, StepStatus.FAILED, message, context);
		run.fail(detail);
		log.atError().addKeyValue("tenant", run.getTenantId()).addKeyValue("step", step.number())
				.addKeyValue("stepName", step.stepName()).addKeyValue("errorType", kind.tag())
				.addKeyValue("errorCategory", cause == null ? null : cause.tag()).addKeyValue("operation", operation)
				.log(message);
		return false;
	}

	private boolean failUnexpectedly(ProvisioningRun run, ProvisioningStep step, String message, Exception e) {
		Map<String, Object> context = new LinkedHashMap<>();
		context.put("exception_type", e.getClass().getName());
		if (e.getMessage() != null) {
			context.put("exception_message", e.getMessage());
		}
		ErrorDetail detail = ErrorDetail.of(ErrorKind.GENERAL_FAILURE, FailureCause.UNKNOWN, step.stepName(), step,
				message, context);
		run.track(step, StepStatus.FAILED, message, context);
		run.fail(detail);
		log.atError().addKeyValue("tenant", run.getTenantId()).addKeyValue("step", step.number())
				.addKeyValue("errorType", ErrorKind.GENERAL_FAILURE.tag()).setCause(e).log(message);
		return false;
	}
}
