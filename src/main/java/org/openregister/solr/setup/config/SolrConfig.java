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
import java.util.concurrent.TimeUnit;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.impl.Http2SolrClient;
import org.apache.solr.client.solrj.impl.HttpJdkSolrClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Spring Configuration class for the SolrJ clients used by the provisioning
 * run.
 *
 * <p>
 * Two clients are created against the same SOLR base URL. The primary client
 * serves the read-only admin calls (system info, configSet listing, cluster
 * status, validation query) with the short read timeout. The write client
 * serves configSet uploads, collection creation and schema changes, which SOLR
 * may take considerably longer to answer.
 *
 * <p>
 * <strong>URL Composition:</strong>
 *
 * <ul>
 * <li>{@code http, localhost, 8983, /solr} → {@code http://localhost:8983/solr}
 * <li>{@code http, localhost, 8983, solr/} → {@code http://localhost:8983/solr}
 * <li>{@code https, solr.example.com, 0, /solr} →
 * {@code https://solr.example.com/solr}
 * <li>{@code http, solr.ns.svc.cluster.local, 8983, /solr} →
 * {@code http://solr.ns.svc.cluster.local/solr} (Kubernetes service names are
 * addressed without a port)
 * </ul>
 *
 * @see ProvisioningProperties
 * @see Http2SolrClient
 */
@Configuration
@EnableConfigurationProperties(ProvisioningProperties.class)
public class SolrConfig {

	/** Bean name of the client used for uploads, creation and schema changes */
	public static final String WRITE_CLIENT = "solrWriteClient";

	private static final int CONNECTION_TIMEOUT_MS = 10000;
	private static final String KUBERNETES_SERVICE_SUFFIX = ".svc.cluster.local";

	/**
	 * Creates the SolrClient used for read-only admin requests.
	 *
	 * @param properties
	 *            the injected provisioning properties
	 * @return client configured with the read timeout
	 */
	@Bean
	@Primary
	SolrClient solrClient(ProvisioningProperties properties) {
		return buildClient(properties, properties.readTimeout());
	}

	/**
	 * Creates the SolrClient used for write requests.
	 *
	 * @param properties
	 *            the injected provisioning properties
	 * @return client configured with the write timeout
	 */
	@Bean
	@Qualifier(WRITE_CLIENT)
	SolrClient solrWriteClient(ProvisioningProperties properties) {
		return buildClient(properties, properties.writeTimeout());
	}

	/**
	 * Composes the SOLR base URL from scheme, host, port and path.
	 *
	 * @param properties
	 *            connection properties
	 * @return base URL without trailing slash
	 */
	public static String baseUrl(ProvisioningProperties properties) {
		String scheme = properties.scheme() == null || properties.scheme().isBlank() ? "http" : properties.scheme();
		String host = properties.host();

		StringBuilder url = new StringBuilder(scheme).append("://").append(host);
		if (properties.port() > 0 && !host.endsWith(KUBERNETES_SERVICE_SUFFIX)) {
			url.append(':').append(properties.port());
		}

		String path = properties.path() == null ? "" : properties.path().trim();
		while (path.endsWith("/")) {
			path = path.substring(0, path.length() - 1);
		}
		if (!path.isEmpty()) {
			if (!path.startsWith("/")) {
				url.append('/');
			}
			url.append(path);
		}
		return url.toString();
	}

	SolrClient buildClient(ProvisioningProperties properties, Duration timeout) {
		String url = baseUrl(properties);
		long timeoutMs = timeout.toMillis();

		// Use HTTP/1.1 (HttpJdkSolrClient) or HTTP/2 (Http2SolrClient) based on
		// configuration
		if ("1.1".equals(properties.httpVersion())) {
			HttpJdkSolrClient.Builder builder = new HttpJdkSolrClient.Builder(url)
					.withConnectionTimeout(CONNECTION_TIMEOUT_MS, TimeUnit.MILLISECONDS)
					.withIdleTimeout(timeoutMs, TimeUnit.MILLISECONDS)
					.withRequestTimeout(timeoutMs, TimeUnit.MILLISECONDS);
			if (properties.hasCredentials()) {
				builder.withBasicAuthCredentials(properties.username(), properties.password());
			}
			return builder.build();
		}
		Http2SolrClient.Builder builder = new Http2SolrClient.Builder(url)
				.withConnectionTimeout(CONNECTION_TIMEOUT_MS, TimeUnit.MILLISECONDS)
				.withIdleTimeout(timeoutMs, TimeUnit.MILLISECONDS)
				.withRequestTimeout(timeoutMs, TimeUnit.MILLISECONDS);
		if (properties.hasCredentials()) {
			builder.withBasicAuthCredentials(properties.username(), properties.password());
		}
		return builder.build();
	}
}
