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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of applying a list of field definitions to a collection schema.
 *
 * @param totalFields
 *            number of fields attempted
 * @param addedFields
 *            fields created through {@code add-field}
 * @param updatedFields
 *            existing fields rewritten through {@code replace-field}
 * @param failedFields
 *            fields that could be neither added nor replaced
 * @param fieldErrors
 *            last error message per failed field
 * @param fieldCauses
 *            failure category of the last error per failed field
 */
public record SchemaFieldResult(int totalFields, List<String> addedFields, List<String> updatedFields,
		List<String> failedFields, Map<String, String> fieldErrors, Map<String, FailureCause> fieldCauses) {

	public boolean success() {
		return failedFields.isEmpty();
	}

	/**
	 * Returns the failure category of the last failed field, {@code null} when
	 * no field failed or its category is unknown.
	 */
	public FailureCause lastFailureCause() {
		if (failedFields.isEmpty()) {
			return null;
		}
		return fieldCauses.get(failedFields.get(failedFields.size() - 1));
	}

	public Map<String, Object> toDetails() {
		Map<String, Object> details = new LinkedHashMap<>();
		details.put("total_fields", totalFields);
		details.put("fields_added", addedFields.size());
		details.put("fields_updated", updatedFields.size());
		details.put("fields_failed", failedFields.size());
		details.put("added_fields", addedFields);
		details.put("updated_fields", updatedFields);
		details.put("failed_fields", failedFields);
		details.put("field_errors", fieldErrors);
		return details;
	}
}
