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
package org.openregister.solr.setup.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.core.io.Resource;

/**
 * Spring Boot Configuration Properties record for SOLR tenant provisioning.
 *
 * <p>
 * Binds every {@code solr.*} property needed for one provisioning run: the
 * connection parameters of the SOLR admin API, the tenant identity, the base
 * names of the configSet and collection to provision, the packaged configSet
 * archive and the retry behavior used while ZooKeeper propagates a freshly
 * uploaded configSet.
 *
 * <p>
 * <strong>Configuration Example:</strong>
 *
 * <pre>{@code
 * # application.properties
 * solr.host=solr.internal
 * solr.port=8983
 * solr.tenant-id=nc_f0e53393
 * solr.config-set=openregister
 * solr.collection=openregister
 * solr.provisioning.max-attempts=6
 * }</pre>
 *
 * <p>
 * The record is immutable; a provisioning run reads it once and never changes
 * it. Qualified tenant names are derived by
 * {@link org.openregister.solr.setup.tenant.TenantNames}.
 *
 * @param scheme
 *            URL scheme of the SOLR server, {@code http} or {@code https}
 * @param host
 *            SOLR host name
 * @param port
 *            SOLR port; values of zero or below leave the port out of the URL
 * @param path
 *            base path of the SOLR web application, usually {@code /solr}
 * @param username
 *            optional basic-auth user name
 * @param password
 *            optional basic-auth password
 * @param httpVersion
 *            {@code 2} for the Jetty HTTP/2 client, {@code 1.1} for the JDK
 *            client
 * @param tenantId
 *            identifier appended to tenant-qualified resource names
 * @param configSet
 *            base configSet name; {@code _default} is used unqualified
 * @param collection
 *            base collection name
 * @param configSetArchive
 *            packaged configSet uploaded when the tenant configSet is missing
 * @param readTimeout
 *            timeout of read-only admin requests
 * @param writeTimeout
 *            timeout of uploads, collection creation and schema changes
 * @param provisioning
 *            retry and propagation settings of the provisioning run
 * @see SolrConfig
 */
@ConfigurationProperties(prefix = "solr")
public record ProvisioningProperties(@DefaultValue("http") String scheme, @DefaultValue("localhost") String host,
		@DefaultValue("8983") int port, @DefaultValue("/solr") String path, String username, String password,
		@DefaultValue("2") String httpVersion, String tenantId, @DefaultValue("_default") String configSet,
		@DefaultValue("openregister") String collection,
		@DefaultValue("classpath:solr/openregister-configset.zip") Resource configSetArchive,
		@DefaultValue("10s") Duration readTimeout, @DefaultValue("30s") Duration writeTimeout,
		@DefaultValue Provisioning provisioning) {

	/**
	 * Returns true when both basic-auth credentials are configured.
	 */
	public boolean hasCredentials() {
		return username != null && !username.isBlank() && password != null && !password.isBlank();
	}

	/**
	 * Retry and propagation settings.
	 *
	 * @param propagationFailureIsFatal
	 *            stop the run when neither propagation trigger succeeds
	 * @param maxAttempts
	 *            maximum number of collection creation attempts
	 * @param baseDelay
	 *            backoff delay after the first failed attempt
	 * @param maxDelay
	 *            upper bound of a single backoff delay
	 * @param propagationPause
	 *            pause after at least one propagation trigger succeeded
	 */
	public record Provisioning(@DefaultValue("false") boolean propagationFailureIsFatal,
			@DefaultValue("6") int maxAttempts, @DefaultValue("2s") Duration baseDelay,
			@DefaultValue("32s") Duration maxDelay, @DefaultValue("1s") Duration propagationPause) {
	}
}
