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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openregister.solr.setup.config.ProvisioningProperties;
import org.openregister.solr.setup.config.ResourceNameValidator;
import org.openregister.solr.setup.config.TestProperties;
import org.openregister.solr.setup.metadata.CollectionService;
import org.openregister.solr.setup.metadata.ConfigSetService;
import org.openregister.solr.setup.metadata.FailureCause;
import org.openregister.solr.setup.metadata.SchemaFieldCatalog;
import org.openregister.solr.setup.metadata.SchemaService;
import org.openregister.solr.setup.tenant.SolrTenantEnvironment;
import org.springframework.core.io.ClassPathResource;

/**
 * Runs complete provisioning runs against an in-memory SOLR cluster.
 */
class TenantProvisionerScenarioTest {

	private static final String CONFIG_SET = "openregister_nc_ab12";

	private static final String COLLECTION = "openregister_nc_ab12";

	private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T10:15:30Z"), ZoneOffset.UTC);

	private final List<Duration> sleeps = new ArrayList<>();

	private InMemorySolrCluster cluster;

	@BeforeEach
	void setUp() {
		cluster = new InMemorySolrCluster();
	}

	private TenantProvisioner provisioner(ProvisioningProperties properties) {
		CollectionService collectionService = new CollectionService(cluster, cluster);
		ConfigSetService configSetService = new ConfigSetService(cluster, cluster);
		SchemaService schemaService = new SchemaService(cluster, cluster);
		SolrTenantEnvironment tenantEnvironment = new SolrTenantEnvironment(properties, collectionService,
				new ResourceNameValidator());
		return new TenantProvisioner(properties, tenantEnvironment, collectionService, configSetService,
				schemaService, sleeps::add, clock);
	}

	@Test
	void freshTenant_ShouldCreateConfigSetCollectionAndFields() {
		// When
		ProvisioningRun run = provisioner(TestProperties.defaults()).provision();

		// Then
		assertTrue(run.isSuccess());
		assertEquals(6, run.getCompletedSteps());
		assertEquals(6, run.getTotalSteps());
		assertTrue(run.errorDetail().isEmpty());
		assertNotNull(run.getCompletedAt());
		run.getSteps().forEach(step -> assertEquals(StepStatus.COMPLETED, step.status(), step.stepName()));

		assertEquals("created", run.step(ProvisioningStep.CONFIG_SET).details().get("action"));
		assertEquals("created", run.step(ProvisioningStep.COLLECTION).details().get("action"));
		assertEquals(1, run.step(ProvisioningStep.COLLECTION).details().get("attempts"));
		assertEquals(25, run.step(ProvisioningStep.SCHEMA).details().get("fields_added"));

		assertTrue(cluster.configSets.contains(CONFIG_SET));
		assertEquals(CONFIG_SET, cluster.collections.get(COLLECTION));
		assertEquals(SchemaFieldCatalog.OBJECT_ENTITY_FIELDS.size(), cluster.schemas.get(COLLECTION).size());

		InfrastructureSummary infrastructure = run.getInfrastructure();
		assertEquals(List.of(CONFIG_SET), infrastructure.getConfigSetsCreated());
		assertEquals(List.of(COLLECTION), infrastructure.getCollectionsCreated());
		assertTrue(infrastructure.isSchemaFieldsConfigured());
		assertTrue(infrastructure.isMultiTenantReady());
		assertTrue(infrastructure.isCloudMode());

		assertEquals(List.of(Duration.ofSeconds(1)), sleeps, "Only the propagation pause should sleep");
	}

	@Test
	void secondRun_ShouldSkipExistingConfigSetAndCollection() {
		// Given
		TenantProvisioner provisioner = provisioner(TestProperties.defaults());
		assertTrue(provisioner.provision().isSuccess());

		// When
		ProvisioningRun second = provisioner.provision();

		// Then
		assertTrue(second.isSuccess());
		assertEquals(6, second.getCompletedSteps());
		assertEquals("skipped", second.step(ProvisioningStep.CONFIG_SET).details().get("action"));
		assertEquals("skipped", second.step(ProvisioningStep.COLLECTION).details().get("action"));
		assertEquals(25, second.step(ProvisioningStep.SCHEMA).details().get("fields_updated"));
		assertEquals(List.of(CONFIG_SET), second.getInfrastructure().getConfigSetsSkipped());
		assertEquals(List.of(COLLECTION), second.getInfrastructure().getCollectionsSkipped());

		assertEquals(1, cluster.count("/admin/configs UPLOAD"));
		assertEquals(1, cluster.count("/admin/collections CREATE"));
	}

	@Test
	void defaultConfigSet_ShouldBeUsedWithoutUpload() {
		ProvisioningRun run = provisioner(TestProperties.builder().configSet("_default").build()).provision();

		assertTrue(run.isSuccess());
		assertEquals("_default", run.getConfigSet());
		assertEquals("skipped", run.step(ProvisioningStep.CONFIG_SET).details().get("action"));
		assertEquals("_default", cluster.collections.get(COLLECTION));
		assertEquals(0, cluster.count("/admin/configs UPLOAD"));
	}

	@Test
	void slowPropagation_ShouldRetryCollectionCreation() {
		// Given
		cluster.createFailures = 2;
		cluster.createFailureMessage = "Underlying core creation failed while creating collection: " + COLLECTION;

		// When
		ProvisioningRun run = provisioner(TestProperties.defaults()).provision();

		// Then
		assertTrue(run.isSuccess());
		assertEquals(3, run.step(ProvisioningStep.COLLECTION).details().get("attempts"));
		assertEquals(3, cluster.count("/admin/collections CREATE"));
		assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
	}

	@Test
	void propagationNeverCompleting_ShouldFailWithPropagationTimeout() {
		// Given
		cluster.createFailures = Integer.MAX_VALUE;
		cluster.createFailureMessage = "Could not find configSet: " + CONFIG_SET;

		// When
		ProvisioningRun run = provisioner(TestProperties.defaults()).provision();

		// Then
		assertFalse(run.isSuccess());
		assertEquals(6, cluster.count("/admin/collections CREATE"));
		assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8),
				Duration.ofSeconds(16), Duration.ofSeconds(32)), sleeps);

		ErrorDetail error = run.errorDetail().orElseThrow();
		assertEquals(ErrorKind.COLLECTION_CREATION_FAILURE, error.kind());
		assertEquals(FailureCause.PROPAGATION_TIMEOUT, error.cause());
		assertEquals(4, error.step());
		assertEquals(6, error.context().get("attempts"));
		assertEquals(List.of(2L, 4L, 8L, 16L, 32L), error.context().get("delays_seconds"));

		assertEquals(3, run.getCompletedSteps());
		assertEquals(StepStatus.FAILED, run.step(ProvisioningStep.COLLECTION).status());
		assertEquals(StepStatus.PENDING, run.step(ProvisioningStep.SCHEMA).status());
		assertEquals(StepStatus.PENDING, run.step(ProvisioningStep.VALIDATION).status());
	}

	@Test
	void nonPropagationCreateError_ShouldFailAfterOneAttempt() {
		// Given
		cluster.createFailures = Integer.MAX_VALUE;
		cluster.createFailureMessage = "Cannot create collection " + COLLECTION + ". No live Solr-instances";

		// When
		ProvisioningRun run = provisioner(TestProperties.defaults()).provision();

		// Then
		assertFalse(run.isSuccess());
		assertEquals(1, cluster.count("/admin/collections CREATE"));
		ErrorDetail error = run.errorDetail().orElseThrow();
		assertEquals(ErrorKind.COLLECTION_CREATION_FAILURE, error.kind());
		assertEquals(FailureCause.SOLR_VALIDATION_ERROR, error.cause());
		assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
	}

	@Test
	void unreachableSolr_ShouldFailConnectivityAndLeaveOtherStepsPending() {
		// Given
		cluster.unreachable = true;

		// When
		ProvisioningRun run = provisioner(TestProperties.defaults()).provision();

		// Then
		assertFalse(run.isSuccess());
		assertEquals(0, run.getCompletedSteps());
		assertEquals(6, run.getSteps().size());
		assertEquals(StepStatus.FAILED, run.getSteps().get(0).status());
		run.getSteps().subList(1, 6).forEach(step -> assertEquals(StepStatus.PENDING, step.status()));

		ErrorDetail error = run.errorDetail().orElseThrow();
		assertEquals(ErrorKind.CONNECTIVITY_FAILURE, error.kind());
		assertEquals(FailureCause.TRANSPORT_EXCEPTION, error.cause());
		assertEquals(1, error.step());
		assertEquals("SOLR Connectivity", error.stepName());
		assertFalse(error.operation().isEmpty());
		assertFalse(error.troubleshooting().isEmpty());
		assertEquals(List.of("/admin/info/system"), cluster.requests);
	}

	@Test
	void missingArchive_ShouldFailConfigSetCreation() {
		ProvisioningProperties properties = TestProperties.builder()
				.configSetArchive(new ClassPathResource("solr/does-not-exist.zip")).build();

		ProvisioningRun run = provisioner(properties).provision();

		assertFalse(run.isSuccess());
		ErrorDetail error = run.errorDetail().orElseThrow();
		assertEquals(ErrorKind.CONFIGSET_CREATION_FAILURE, error.kind());
		assertEquals(FailureCause.ARCHIVE_NOT_FOUND, error.cause());
		assertEquals(2, error.step());
		assertEquals(1, run.getCompletedSteps());
		assertEquals(0, cluster.count("/admin/configs UPLOAD"));
	}
}
