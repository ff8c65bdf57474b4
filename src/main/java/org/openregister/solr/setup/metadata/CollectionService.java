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
package org.openregister.solr.setup.metadata;

import java.util.List;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.client.solrj.request.CollectionAdminRequest;
import org.apache.solr.client.solrj.request.GenericSolrRequest;
import org.apache.solr.client.solrj.request.QueryRequest;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.apache.solr.common.util.NamedList;
import org.openregister.solr.setup.config.SolrConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Spring Service for the collection-level SOLR admin calls of a provisioning
 * run.
 *
 * <p>
 * <strong>Operations:</strong>
 *
 * <ul>
 * <li><strong>System info</strong>: {@code GET /admin/info/system}, used as the
 * connectivity check
 * <li><strong>Cluster status</strong>: {@code GET /admin/collections?action=CLUSTERSTATUS},
 * the source of truth for which collections exist
 * <li><strong>Create</strong>: {@code GET /admin/collections?action=CREATE}
 * with a single shard and a single NRT replica
 * <li><strong>Queryable check</strong>: {@code GET /{collection}/select?q=*:*&rows=0}
 * </ul>
 *
 * <p>
 * Collection creation goes through the write client, whose timeout allows for
 * SOLR loading the configSet and creating the core. Everything else uses the
 * read client.
 */
@Service
public class CollectionService {

	private static final Logger log = LoggerFactory.getLogger(CollectionService.class);

	static final String SYSTEM_INFO_PATH = "/admin/info/system";

	private static final int SHARDS = 1;
	private static final int REPLICAS = 1;

	private static final String ALL_DOCUMENTS_QUERY = "*:*";

	private final SolrClient solrClient;

	private final SolrClient writeClient;

	public CollectionService(SolrClient solrClient, @Qualifier(SolrConfig.WRITE_CLIENT) SolrClient writeClient) {
		this.solrClient = solrClient;
		this.writeClient = writeClient;
	}

	/**
	 * Asks the node for its version and run mode.
	 *
	 * @return the reported system info
	 * @throws SolrOperationException
	 *             if SOLR cannot be reached or reports an error
	 */
	public SolrSystemInfo getSystemInfo() throws SolrOperationException {
		GenericSolrRequest request = new GenericSolrRequest(SolrRequest.METHOD.GET, SYSTEM_INFO_PATH,
				new ModifiableSolrParams());
		NamedList<Object> response = SolrRequests.execute(solrClient, request, null, "SOLR system info");
		return new SolrSystemInfo(ResponseUtils.getString(response, "lucene", "solr-spec-version"),
				ResponseUtils.getString(response, "mode"));
	}

	/**
	 * Lists the collections known to the cluster.
	 *
	 * @return collection names in cluster status order
	 * @throws SolrOperationException
	 *             if the cluster status cannot be read
	 */
	public List<String> listCollections() throws SolrOperationException {
		NamedList<Object> response = SolrRequests.execute(solrClient, CollectionAdminRequest.getClusterStatus(),
				null, "cluster status");
		return ResponseUtils.keys(ResponseUtils.get(response, "cluster", "collections"));
	}

	/**
	 * Checks whether a collection exists.
	 *
	 * <p>
	 * A cluster status that cannot be read counts as "does not exist"; the
	 * subsequent create or validation call reports the actual problem.
	 */
	public boolean collectionExists(String collectionName) {
		try {
			return listCollections().contains(collectionName);
		} catch (SolrOperationException e) {
			log.atWarn().addKeyValue("collection", collectionName).addKeyValue("error", e.getMessage())
					.log("Could not read cluster status, assuming collection does not exist");
			return false;
		}
	}

	/**
	 * Issues a cluster status call to nudge SOLR into refreshing its view of
	 * ZooKeeper.
	 *
	 * @return whether the call succeeded
	 */
	public boolean refreshClusterStatus() {
		try {
			SolrRequests.execute(solrClient, CollectionAdminRequest.getClusterStatus(), null,
					"cluster status refresh");
			return true;
		} catch (SolrOperationException e) {
			log.atDebug().addKeyValue("error", e.getMessage()).log("Cluster status refresh failed");
			return false;
		}
	}

	/**
	 * Creates a single-shard, single-replica collection from a configSet.
	 *
	 * @param collectionName
	 *            name of the new collection
	 * @param configSetName
	 *            configSet the collection is created from
	 * @throws SolrOperationException
	 *             if SOLR rejects the creation
	 */
	public void createCollection(String collectionName, String configSetName) throws SolrOperationException {
		CollectionAdminRequest.Create request = CollectionAdminRequest.createCollection(collectionName,
				configSetName, SHARDS, REPLICAS);
		SolrRequests.execute(writeClient, request, null, "create collection");
		log.atInfo().addKeyValue("collection", collectionName).addKeyValue("configSet", configSetName)
				.log("Collection created");
	}

	/**
	 * Runs a match-all query that returns no rows.
	 *
	 * @throws SolrOperationException
	 *             if the query fails or the response header does not report
	 *             status {@code 0}
	 */
	public void checkQueryable(String collectionName) throws SolrOperationException {
		QueryRequest request = new QueryRequest(new SolrQuery(ALL_DOCUMENTS_QUERY).setRows(0));
		NamedList<Object> response = SolrRequests.execute(solrClient, request, collectionName, "validation query");
		if (ResponseUtils.status(response) != 0) {
			throw SolrOperationException
					.builder(FailureCause.SOLR_API_ERROR, "validation query",
							"Validation query on " + collectionName + " returned no successful response header")
					.request(SolrRequests.describe(solrClient, request, collectionName))
					.solrResponse(ResponseUtils.toMap(response)).build();
		}
	}
}
