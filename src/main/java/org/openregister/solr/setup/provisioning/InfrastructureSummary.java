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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a provisioning run created, and what it found already in place.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InfrastructureSummary {

	private final List<String> configSetsCreated = new ArrayList<>();
	private final List<String> configSetsSkipped = new ArrayList<>();
	private final List<String> collectionsCreated = new ArrayList<>();
	private final List<String> collectionsSkipped = new ArrayList<>();
	private boolean schemaFieldsConfigured;
	private boolean multiTenantReady;
	private boolean cloudMode;

	void configSetCreated(String name) {
		configSetsCreated.add(name);
	}

	void configSetSkipped(String name) {
		configSetsSkipped.add(name);
	}

	void collectionCreated(String name) {
		collectionsCreated.add(name);
	}

	void collectionSkipped(String name) {
		collectionsSkipped.add(name);
	}

	void setSchemaFieldsConfigured(boolean schemaFieldsConfigured) {
		this.schemaFieldsConfigured = schemaFieldsConfigured;
	}

	void setMultiTenantReady(boolean multiTenantReady) {
		this.multiTenantReady = multiTenantReady;
	}

	void setCloudMode(boolean cloudMode) {
		this.cloudMode = cloudMode;
	}

	public List<String> getConfigSetsCreated() {
		return Collections.unmodifiableList(configSetsCreated);
	}

	public List<String> getConfigSetsSkipped() {
		return Collections.unmodifiableList(configSetsSkipped);
	}

	public List<String> getCollectionsCreated() {
		return Collections.unmodifiableList(collectionsCreated);
	}

	public List<String> getCollectionsSkipped() {
		return Collections.unmodifiableList(collectionsSkipped);
	}

	public boolean isSchemaFieldsConfigured() {
		return schemaFieldsConfigured;
	}

	public boolean isMultiTenantReady() {
		return multiTenantReady;
	}

	public boolean isCloudMode() {
		return cloudMode;
	}
}
