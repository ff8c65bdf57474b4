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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.params.SolrParams;
import org.apache.solr.common.util.NamedList;
import org.apache.solr.common.util.SimpleOrderedMap;
import org.openregister.solr.setup.metadata.SolrResponses;

/**
 * A single-node SOLR cluster kept in memory, answering the admin requests of a
 * provisioning run the way SOLR does.
 */
class InMemorySolrCluster extends SolrClient {

	private static final long serialVersionUID = 1L;

	final Set<String> configSets = new LinkedHashSet<>(List.of("_default"));

	final Map<String, String> collections = new LinkedHashMap<>();

	final Map<String, Map<String, JsonNode>> schemas = new HashMap<>();

	final List<String> requests = new ArrayList<>();

	private final transient ObjectMapper objectMapper = new ObjectMapper();

	boolean unreachable;

	int createFailures;

	String createFailureMessage;

	@Override
	public NamedList<Object> request(SolrRequest<?> request, String collection)
			throws SolrServerException, IOException {
		SolrParams params = request.getParams();
		String action = params == null ? null : params.get("action");
		String key = (collection == null ? "" : "/" + collection) + request.getPath()
				+ (action == null ? "" : " " + action);
		requests.add(key);

		if (unreachable) {
			throw new SolrServerException("Server refused connection at: http://localhost:8983/solr");
		}

		String path = request.getPath();
		if (path.equals("/admin/info/system")) {
			return SolrResponses.systemInfo("9.8.1", "solrcloud");
		}
		if (path.equals("/admin/configs") && "LIST".equals(action)) {
			return SolrResponses.configSets(configSets.toArray(new String[0]));
		}
		if (path.equals("/admin/configs") && "UPLOAD".equals(action)) {
			configSets.add(params.get("name"));
			return SolrResponses.ok();
		}
		if (path.equals("/admin/collections") && "CLUSTERSTATUS".equals(action)) {
			return SolrResponses.clusterStatus(collections.keySet().toArray(new String[0]));
		}
		if (path.equals("/admin/collections") && "CREATE".equals(action)) {
			return create(params.get("name"), params.get("collection.configName"));
		}
		if (path.equals("/schema")) {
			return changeSchema(collection, objectMapper.readTree(SolrResponses.body(request)));
		}
		if (path.startsWith("/schema/fields/")) {
			JsonNode field = schema(collection).get(path.substring("/schema/fields/".length()));
			if (field == null) {
				throw new SolrException(SolrException.ErrorCode.NOT_FOUND, "No such path " + path);
			}
			NamedList<Object> response = SolrResponses.ok();
			response.add("field", new SimpleOrderedMap<>());
			return response;
		}
		if (path.equals("/select")) {
			if (!collections.containsKey(collection)) {
				throw new SolrException(SolrException.ErrorCode.NOT_FOUND,
						"Expected mime type application/octet-stream but got text/html.");
			}
			return SolrResponses.ok();
		}
		throw new SolrException(SolrException.ErrorCode.NOT_FOUND, "Unexpected request " + key);
	}

	private NamedList<Object> create(String name, String configSet) {
		if (createFailures > 0) {
			createFailures--;
			throw new SolrException(SolrException.ErrorCode.BAD_REQUEST, createFailureMessage);
		}
		if (!configSets.contains(configSet)) {
			throw new SolrException(SolrException.ErrorCode.BAD_REQUEST,
					"Can not find the specified config set: " + configSet);
		}
		if (collections.containsKey(name)) {
			throw new SolrException(SolrException.ErrorCode.BAD_REQUEST, "collection already exists: " + name);
		}
		collections.put(name, configSet);
		return SolrResponses.ok();
	}

	private NamedList<Object> changeSchema(String collection, JsonNode command) {
		Map<String, JsonNode> fields = schema(collection);
		if (command.has("add-field")) {
			JsonNode field = command.get("add-field");
			String name = field.get("name").asText();
			if (fields.containsKey(name)) {
				throw new SolrException(SolrException.ErrorCode.BAD_REQUEST, "Field '" + name + "' already exists.");
			}
			fields.put(name, field);
			return SolrResponses.ok();
		}
		if (command.has("replace-field")) {
			JsonNode field = command.get("replace-field");
			String name = field.get("name").asText();
			if (!fields.containsKey(name)) {
				throw new SolrException(SolrException.ErrorCode.BAD_REQUEST,
						"The field '" + name + "' is not present in this schema, and so cannot be replaced.");
			}
			fields.put(name, field);
			return SolrResponses.ok();
		}
		throw new SolrException(SolrException.ErrorCode.BAD_REQUEST, "error processing commands");
	}

	private Map<String, JsonNode> schema(String collection) {
		if (!collections.containsKey(collection)) {
			throw new SolrException(SolrException.ErrorCode.NOT_FOUND, "Collection not found: " + collection);
		}
		return schemas.computeIfAbsent(collection, name -> new LinkedHashMap<>());
	}

	long count(String requestKey) {
		return requests.stream().filter(requestKey::equals).count();
	}

	@Override
	public void close() {
	}
}
