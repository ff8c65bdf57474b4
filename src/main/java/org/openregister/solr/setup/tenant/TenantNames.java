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
 * Naming rules for tenant-qualified SOLR resources.
 *
 * <p>
 * A base name is qualified by appending an underscore and the tenant
 * identifier, so that tenants sharing a cluster never share a configSet or a
 * collection. The SOLR-provided {@value #DEFAULT_CONFIG_SET} configSet is the
 * only exception: it is used as-is to stay compatible with the known-good
 * default configuration.
 *
 * <pre>{@code
 * TenantNames.qualify("_default", "nc_ab12"); // "_default"
 * TenantNames.qualify("custom", "nc_ab12"); // "custom_nc_ab12"
 * }</pre>
 */
public final class TenantNames {

	/** Name of the configSet every SOLR installation ships with */
	public static final String DEFAULT_CONFIG_SET = "_default";

	private TenantNames() {
	}

	/**
	 * Qualifies a base resource name for the given tenant.
	 *
	 * @param baseName
	 *            configSet or collection base name
	 * @param tenantId
	 *            tenant identifier
	 * @return the tenant-qualified name
	 */
	public static String qualify(String baseName, String tenantId) {
		if (DEFAULT_CONFIG_SET.equals(baseName)) {
			return baseName;
		}
		return baseName + "_" + tenantId;
	}
}
