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
import java.util.Map;

/**
 * A field to configure in a collection's managed schema.
 *
 * @param name
 *            field name
 * @param type
 *            SOLR field type name, must exist in the configSet
 * @param stored
 *            whether the original value is retrievable
 * @param indexed
 *            whether the field is searchable
 * @param multiValued
 *            whether the field holds several values
 * @param required
 *            whether documents must carry the field, {@code null} leaves the
 *            SOLR default
 * @param docValues
 *            whether docValues are enabled, {@code null} leaves the SOLR
 *            default
 */
public record FieldDefinition(String name, String type, boolean stored, boolean indexed, boolean multiValued,
		Boolean required, Boolean docValues) {

	public static FieldDefinition of(String name, String type, boolean stored, boolean indexed,
			boolean multiValued) {
		return new FieldDefinition(name, type, stored, indexed, multiValued, null, null);
	}

	public FieldDefinition asRequired() {
		return new FieldDefinition(name, type, stored, indexed, multiValued, Boolean.TRUE, docValues);
	}

	/**
	 * Returns the attributes as the Schema API expects them in an
	 * {@code add-field} or {@code replace-field} command.
	 */
	public Map<String, Object> toSolrAttributes() {
		Map<String, Object> attributes = new LinkedHashMap<>();
		attributes.put("name", name);
		attributes.put("type", type);
		attributes.put("stored", stored);
		attributes.put("indexed", indexed);
		attributes.put("multiValued", multiValued);
		if (required != null) {
			attributes.put("required", required);
		}
		if (docValues != null) {
			attributes.put("docValues", docValues);
		}
		return attributes;
	}
}
