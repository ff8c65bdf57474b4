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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.request.schema.SchemaRequest;
import org.openregister.solr.setup.config.SolrConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Spring Service that configures fields through the SOLR Schema API.
 *
 * <p>
 * Fields are applied with add-or-replace semantics. Each field is first sent
 * as an {@code add-field} command. When SOLR reports that the field already
 * exists, exactly one {@code replace-field} command with the same attributes
 * follows. Any other failure is recorded against the field and the remaining
 * fields are still attempted.
 *
 * <p>
 * SOLR folds schema command errors into a generic "error processing commands"
 * message on some versions. When the add failure does not name the cause, the
 * field is looked up ({@code GET /schema/fields/{name}}) and an existing field
 * is treated the same as an explicit "already exists" error.
 *
 * @see SchemaFieldCatalog
 */
@Service
public class SchemaService {

	private static final Logger log = LoggerFactory.getLogger(SchemaService.class);

	static final String ADD_FIELD = "add-field";
	static final String REPLACE_FIELD = "replace-field";

	private static final String ALREADY_EXISTS = "already exists";

	private final SolrClient solrClient;

	private final SolrClient writeClient;

	public SchemaService(SolrClient solrClient, @Qualifier(SolrConfig.WRITE_CLIENT) SolrClient writeClient) {
		this.solrClient = solrClient;
		this.writeClient = writeClient;
	}

	public void addField(String collection, FieldDefinition field) throws SolrOperationException {
		SolrRequests.execute(writeClient, new SchemaRequest.AddField(field.toSolrAttributes()), collection,
				ADD_FIELD + " " + field.name());
	}

	public void replaceField(String collection, FieldDefinition field) throws SolrOperationException {
		SolrRequests.execute(writeClient, new SchemaRequest.ReplaceField(field.toSolrAttributes()), collection,
				REPLACE_FIELD + " " + field.name());
	}

	/**
	 * Checks whether the collection schema declares a field. Any failure counts as
	 * "not declared".
	 */
	public boolean fieldExists(String collection, String fieldName) {
		try {
			return ResponseUtils.get(SolrRequests.execute(solrClient, new SchemaRequest.Field(fieldName), collection,
					"field lookup"), "field") != null;
		} catch (SolrOperationException e) {
			log.atDebug().addKeyValue("field", fieldName).addKeyValue("error", e.getMessage())
					.log("Field lookup failed");
			return false;
		}
	}

	/**
	 * Applies every field in order, never stopping at a failed field.
	 *
	 * @param collection
	 *            collection whose schema is changed
	 * @param fields
	 *            fields to add or replace
	 * @return per-field outcome
	 */
	public SchemaFieldResult applyFields(String collection, List<FieldDefinition> fields) {
		List<String> added = new ArrayList<>();
		List<String> updated = new ArrayList<>();
		List<String> failed = new ArrayList<>();
		Map<String, String> errors = new LinkedHashMap<>();
		Map<String, FailureCause> causes = new LinkedHashMap<>();

		for (FieldDefinition field : fields) {
			try {
				addField(collection, field);
				added.add(field.name());
				continue;
			} catch (SolrOperationException addFailure) {
				if (!indicatesExistingField(collection, field, addFailure)) {
					failed.add(field.name());
					errors.put(field.name(), addFailure.getReportedMessage());
					causes.put(field.name(), addFailure.getFailureCause());
					log.atWarn().addKeyValue("collection", collection).addKeyValue("field", field.name())
							.addKeyValue("error", addFailure.getReportedMessage()).log("Failed to add field");
					continue;
				}
			}

			try {
				replaceField(collection, field);
				updated.add(field.name());
			} catch (SolrOperationException replaceFailure) {
				failed.add(field.name());
				errors.put(field.name(), replaceFailure.getReportedMessage());
				causes.put(field.name(), replaceFailure.getFailureCause());
				log.atWarn().addKeyValue("collection", collection).addKeyValue("field", field.name())
						.addKeyValue("error", replaceFailure.getReportedMessage()).log("Failed to replace field");
			}
		}

		log.atInfo().addKeyValue("collection", collection).addKeyValue("added", added.size())
				.addKeyValue("updated", updated.size()).addKeyValue("failed", failed.size())
				.log("Schema fields applied");
		return new SchemaFieldResult(fields.size(), List.copyOf(added), List.copyOf(updated), List.copyOf(failed),
				errors, causes);
	}

	static boolean isAlreadyExists(String message) {
		return message != null && message.toLowerCase(Locale.ROOT).contains(ALREADY_EXISTS);
	}

	private boolean indicatesExistingField(String collection, FieldDefinition field, SolrOperationException e) {
		if (isAlreadyExists(e.getMessage()) || isAlreadyExists(e.getSolrErrorMessage())) {
			return true;
		}
		return e.getFailureCause() == FailureCause.SOLR_API_ERROR && fieldExists(collection, field.name());
	}
}
