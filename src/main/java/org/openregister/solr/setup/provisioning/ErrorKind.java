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

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/**
 * Kind of failure that ended a provisioning run, reported as
 * {@code error_type}. Each kind carries the remediation hints shown when no
 * more specific ones apply.
 */
public enum ErrorKind {

	CONNECTIVITY_FAILURE("connectivity_failure", List.of("Check that SOLR is running and reachable from this host",
			"Verify solr.host, solr.port, solr.scheme and solr.path", "Verify the SOLR credentials if authentication is enabled")),

	CONFIGSET_CREATION_FAILURE("configset_creation_failure", List.of(
			"Verify that the packaged configSet archive exists and is a valid zip",
			"Check that the SOLR user may upload configSets (/admin/configs)",
			"Verify template configSet exists and SOLR is running in SolrCloud mode")),

	PROPAGATION_FAILURE("propagation_failure", List.of("Check ZooKeeper coordination and connectivity",
			"Check the SOLR logs for configSet or cluster state errors")),

	COLLECTION_CREATION_FAILURE("collection_creation_failure", List.of("Check ZooKeeper coordination",
			"Verify the tenant configSet exists in the cluster", "Check that the cluster has live nodes to host a replica")),

	SCHEMA_FIELD_FAILURE("schema_field_failure", List.of(
			"Check that the configSet uses a mutable managed schema",
			"Verify that the field types used by the field catalog exist in the configSet")),

	VALIDATION_FAILURE("validation_failure", List.of("Check the SOLR logs for core initialization errors",
			"Re-run the setup, provisioning steps are safe to repeat")),

	GENERAL_FAILURE("general_failure", List.of("Check the application logs for the full stack trace"));

	private final String tag;
	private final List<String> troubleshooting;

	ErrorKind(String tag, List<String> troubleshooting) {
		this.tag = tag;
		this.troubleshooting = troubleshooting;
	}

	@JsonValue
	public String tag() {
		return tag;
	}

	public List<String> troubleshooting() {
		return troubleshooting;
	}
}
