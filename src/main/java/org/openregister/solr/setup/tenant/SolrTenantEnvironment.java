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

import org.openregister.solr.setup.config.ProvisioningProperties;
import org.openregister.solr.setup.config.ResourceNameValidator;
import org.openregister.solr.setup.metadata.CollectionService;
import org.springframework.stereotype.Component;

/**
 * {@link TenantEnvironment} backed by the configured tenant identifier and the
 * SOLR cluster status.
 *
 * <p>
 * The tenant identifier must be configured explicitly through
 * {@code solr.tenant-id}. There is no fallback to a shared tenant: two
 * installations silently provisioning into the same collection would defeat
 * the isolation this naming scheme exists for.
 */
@Component
public class SolrTenantEnvironment implements TenantEnvironment {

	private final String tenantId;

	private final CollectionService collectionService;

	private final ResourceNameValidator nameValidator;

	public SolrTenantEnvironment(ProvisioningProperties properties, CollectionService collectionService,
			ResourceNameValidator nameValidator) {
		if (properties.tenantId() == null || properties.tenantId().isBlank()) {
			throw new IllegalStateException("solr.tenant-id must be configured");
		}
		this.tenantId = properties.tenantId().trim();
		this.collectionService = collectionService;
		this.nameValidator = nameValidator;
	}

	@Override
	public String tenantId() {
		return tenantId;
	}

	@Override
	public String tenantName(String baseName) {
		return nameValidator.assertValid("resource", TenantNames.qualify(baseName, tenantId));
	}

	@Override
	public boolean collectionExists(String collectionName) {
		return collectionService.collectionExists(collectionName);
	}
}
