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

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.request.ConfigSetAdminRequest;
import org.apache.solr.common.util.ContentStreamBase;
import org.apache.solr.common.util.NamedList;
import org.openregister.solr.setup.config.SolrConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.util.FileCopyUtils;

/**
 * Spring Service for the configSet admin API ({@code /admin/configs}).
 *
 * <p>
 * ConfigSets are uploaded as zip archives. The archive is read completely into
 * memory before the request is sent, so a missing or unreadable archive is
 * reported without touching SOLR.
 */
@Service
public class ConfigSetService {

	private static final Logger log = LoggerFactory.getLogger(ConfigSetService.class);

	static final String ZIP_CONTENT_TYPE = "application/octet-stream";

	private final SolrClient solrClient;

	private final SolrClient writeClient;

	public ConfigSetService(SolrClient solrClient, @Qualifier(SolrConfig.WRITE_CLIENT) SolrClient writeClient) {
		this.solrClient = solrClient;
		this.writeClient = writeClient;
	}

	/**
	 * Lists the configSets stored in the cluster.
	 *
	 * @throws SolrOperationException
	 *             if the list call fails
	 */
	public List<String> listConfigSets() throws SolrOperationException {
		NamedList<Object> response = SolrRequests.execute(solrClient, new ConfigSetAdminRequest.List(), null,
				"list configSets");
		return ResponseUtils.strings(response.get("configSets"));
	}

	/**
	 * Checks whether a configSet exists. A failing list call counts as "does not
	 * exist".
	 */
	public boolean configSetExists(String configSetName) {
		try {
			return listConfigSets().contains(configSetName);
		} catch (SolrOperationException e) {
			log.atWarn().addKeyValue("configSet", configSetName).addKeyValue("error", e.getMessage())
					.log("Could not list configSets, assuming configSet does not exist");
			return false;
		}
	}

	/**
	 * Uploads a zipped configSet under the given name.
	 *
	 * @param configSetName
	 *            name to store the configSet under
	 * @param archive
	 *            zip archive holding {@code solrconfig.xml} and the schema
	 * @throws SolrOperationException
	 *             if the archive cannot be read or SOLR rejects the upload
	 */
	public void uploadConfigSet(String configSetName, Resource archive) throws SolrOperationException {
		byte[] content = readArchive(archive);

		ConfigSetAdminRequest.Upload request = new ConfigSetAdminRequest.Upload().setConfigSetName(configSetName)
				.setUploadStream(new ContentStreamBase.ByteArrayStream(content, archive.getDescription(),
						ZIP_CONTENT_TYPE));
		SolrRequests.execute(writeClient, request, null, "upload configSet");
		log.atInfo().addKeyValue("configSet", configSetName).addKeyValue("bytes", content.length)
				.log("ConfigSet uploaded");
	}

	/**
	 * Issues a configSet list call to nudge SOLR into refreshing its configSet
	 * cache.
	 *
	 * @return whether the call succeeded
	 */
	public boolean refreshConfigSets() {
		try {
			SolrRequests.execute(solrClient, new ConfigSetAdminRequest.List(), null, "configSet refresh");
			return true;
		} catch (SolrOperationException e) {
			log.atDebug().addKeyValue("error", e.getMessage()).log("ConfigSet refresh failed");
			return false;
		}
	}

	private static byte[] readArchive(Resource archive) throws SolrOperationException {
		if (archive == null || !archive.exists()) {
			throw SolrOperationException.builder(FailureCause.ARCHIVE_NOT_FOUND, "upload configSet",
					"ConfigSet archive not found: " + (archive == null ? "none configured" : archive.getDescription()))
					.build();
		}
		try (InputStream in = archive.getInputStream()) {
			byte[] content = FileCopyUtils.copyToByteArray(in);
			if (content.length == 0) {
				throw SolrOperationException.builder(FailureCause.ARCHIVE_READ_FAILED, "upload configSet",
						"ConfigSet archive is empty: " + archive.getDescription()).build();
			}
			return content;
		} catch (IOException e) {
			throw SolrOperationException.builder(FailureCause.ARCHIVE_READ_FAILED, "upload configSet",
					"Failed to read configSet archive " + archive.getDescription() + ": " + e.getMessage())
					.cause(e).build();
		}
	}
}
