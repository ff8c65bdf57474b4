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
package org.openregister.solr.setup.tenant;

/**
 * Tenant identity and collection knowledge supplied by the hosting
 * environment.
 *
 * <p>
 * The provisioner asks this collaborator for the qualified names of the
 * resources it manages and for collection existence, which the environment may
 * answer from a cheaper or cached source than a fresh admin API call.
 */
public interface TenantEnvironment {

	/**
	 * Returns the identifier of the tenant being provisioned.
	 */
	String tenantId();

	/**
	 * Maps a base resource name to its tenant-qualified name.
	 */
	default String tenantName(String baseName) {
		return TenantNames.qualify(baseName, tenantId());
	}

	/**
	 * Returns true if the named collection exists in the cluster.
	 */
	boolean collectionExists(String collectionName);
}
