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

/**
 * The fixed sequence of a provisioning run.
 */
public enum ProvisioningStep {

	CONNECTIVITY(1, "SOLR Connectivity", "Verify that SOLR answers admin requests"),

	CONFIG_SET(2, "EnsureTenantConfigSet", "Create the tenant configSet unless it already exists"),

	PROPAGATION(3, "ConfigSet Propagation", "Trigger configSet and cluster state refresh across the cluster"),

	COLLECTION(4, "Collection Creation", "Create the tenant collection unless it already exists"),

	SCHEMA(5, "Schema Configuration", "Add or replace the object metadata fields"),

	VALIDATION(6, "Setup Validation", "Verify configSet, collection and query access");

	private final int number;
	private final String stepName;
	private final String description;

	ProvisioningStep(int number, String stepName, String description) {
		this.number = number;
		this.stepName = stepName;
		this.description = description;
	}

	public int number() {
		return number;
	}

	public String stepName() {
		return stepName;
	}

	public String description() {
		return description;
	}
}
