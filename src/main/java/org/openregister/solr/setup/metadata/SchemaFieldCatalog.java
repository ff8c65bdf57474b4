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
import java.util.Optional;

/**
 * The metadata fields every OpenRegister object carries in its tenant
 * collection. All names use the {@code self_} prefix so they never collide
 * with fields of the object payload itself.
 */
public final class SchemaFieldCatalog {

	public static final List<FieldDefinition> OBJECT_ENTITY_FIELDS = List.of(
			FieldDefinition.of("self_tenant", "string", true, true, false).asRequired(),
			FieldDefinition.of("self_object_id", "pint", true, true, false),
			FieldDefinition.of("self_uuid", "string", true, true, false),

			// context
			FieldDefinition.of("self_register", "pint", true, true, false),
			FieldDefinition.of("self_schema", "pint", true, true, false),
			FieldDefinition.of("self_schema_version", "string", true, true, false),

			// ownership
			FieldDefinition.of("self_owner", "string", true, true, false),
			FieldDefinition.of("self_organisation", "string", true, true, false),
			FieldDefinition.of("self_application", "string", true, true, false),

			// descriptive
			FieldDefinition.of("self_name", "string", true, true, false),
			FieldDefinition.of("self_description", "text_general", true, true, false),
			FieldDefinition.of("self_summary", "text_general", true, true, false),
			FieldDefinition.of("self_image", "string", true, false, false),
			FieldDefinition.of("self_slug", "string", true, true, false),
			FieldDefinition.of("self_uri", "string", true, true, false),
			FieldDefinition.of("self_version", "string", true, true, false),
			FieldDefinition.of("self_size", "string", true, false, false),
			FieldDefinition.of("self_folder", "string", true, true, false),

			// timestamps
			FieldDefinition.of("self_created", "pdate", true, true, false),
			FieldDefinition.of("self_updated", "pdate", true, true, false),
			FieldDefinition.of("self_published", "pdate", true, true, false),
			FieldDefinition.of("self_depublished", "pdate", true, true, false),

			// relations
			FieldDefinition.of("self_relations", "string", true, true, true),
			FieldDefinition.of("self_files", "string", true, true, true),
			FieldDefinition.of("self_parent_uuid", "string", true, true, false));

	private SchemaFieldCatalog() {
	}

	static Optional<FieldDefinition> byName(String name) {
		return OBJECT_ENTITY_FIELDS.stream().filter(field -> field.name().equals(name)).findFirst();
	}
}
