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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reason a SOLR operation failed, as reported in the {@code error_category} of
 * a provisioning error.
 */
public enum FailureCause {

	/** SOLR answered with a non-2xx status and no SOLR error payload */
	HTTP_ERROR("http_error"),

	/** The response body could not be parsed */
	INVALID_JSON_RESPONSE("invalid_json_response"),

	/** SOLR reported an error in its response payload */
	SOLR_API_ERROR("solr_api_error"),

	/** The request never produced a response (connect, timeout, I/O) */
	TRANSPORT_EXCEPTION("transport_exception"),

	/** Collection creation kept failing while the configSet propagated */
	PROPAGATION_TIMEOUT("propagation_timeout"),

	/** SOLR rejected the collection creation request */
	SOLR_VALIDATION_ERROR("solr_validation_error"),

	/** Collection creation failed on the network level */
	NETWORK_CONNECTIVITY("network_connectivity"),

	/** The packaged configSet archive does not exist */
	ARCHIVE_NOT_FOUND("archive_not_found"),

	/** The packaged configSet archive could not be read */
	ARCHIVE_READ_FAILED("archive_read_failed"),

	UNKNOWN("unknown");

	private final String tag;

	FailureCause(String tag) {
		this.tag = tag;
	}

	@JsonValue
	public String tag() {
		return tag;
	}
}
