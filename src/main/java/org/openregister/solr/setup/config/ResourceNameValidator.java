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

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Validates configSet and collection names against the identifier rules SOLR
 * enforces for its admin API.
 *
 * <p>
 * A valid name consists of letters, digits, periods, underscores and hyphens
 * and does not start with a hyphen. Tenant-qualified names are checked before
 * any request is sent, so that a malformed tenant identifier fails the run
 * with a clear message instead of an opaque SOLR error.
 */
@Component
public class ResourceNameValidator {

	private static final Pattern IDENTIFIER = Pattern.compile("^(?!-)[._A-Za-z0-9\\-]+$");

	/**
	 * Returns true if the given name is a valid SOLR identifier.
	 */
	public boolean isValid(String name) {
		return name != null && IDENTIFIER.matcher(name).matches();
	}

	/**
	 * Throws IllegalArgumentException if the name is not a valid SOLR identifier.
	 */
	public String assertValid(String kind, String name) {
		if (!isValid(name)) {
			throw new IllegalArgumentException("Invalid " + kind + " name: " + name
					+ " (allowed: letters, digits, '.', '_', '-', not starting with '-')");
		}
		return name;
	}

}
