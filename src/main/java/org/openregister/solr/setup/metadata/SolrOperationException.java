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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Signals that a request against the SOLR admin API did not succeed.
 *
 * <p>
 * Transport failures, non-2xx responses, unparseable responses and responses
 * whose {@code responseHeader.status} is not {@code 0} are all reported through
 * this exception, tagged with a {@link FailureCause} and carrying whatever
 * diagnostics the failure produced.
 */
public class SolrOperationException extends Exception {

	private static final long serialVersionUID = 1L;

	private final FailureCause failureCause;

	private final String operation;

	private final String request;

	private final Integer httpStatus;

	private final String solrErrorMessage;

	private final Map<String, Object> solrErrorMetadata;

	private final Map<String, Object> solrResponse;

	private SolrOperationException(Builder builder) {
		super(builder.message, builder.cause);
		this.failureCause = builder.failureCause;
		this.operation = builder.operation;
		this.request = builder.request;
		this.httpStatus = builder.httpStatus;
		this.solrErrorMessage = builder.solrErrorMessage;
		this.solrErrorMetadata = builder.solrErrorMetadata;
		this.solrResponse = builder.solrResponse;
	}

	public static Builder builder(FailureCause failureCause, String operation, String message) {
		return new Builder(failureCause, operation, message);
	}

	public FailureCause getFailureCause() {
		return failureCause;
	}

	public String getOperation() {
		return operation;
	}

	public String getRequest() {
		return request;
	}

	public Integer getHttpStatus() {
		return httpStatus;
	}

	public String getSolrErrorMessage() {
		return solrErrorMessage;
	}

	/**
	 * Returns the SOLR error message when there is one, the exception message
	 * otherwise.
	 */
	public String getReportedMessage() {
		return solrErrorMessage != null ? solrErrorMessage : getMessage();
	}

	/**
	 * Returns the diagnostics of this failure as named fields, leaving out the
	 * ones the failure did not produce.
	 */
	public Map<String, Object> context() {
		Map<String, Object> context = new LinkedHashMap<>();
		context.put("failure_cause", failureCause.tag());
		if (request != null) {
			context.put("url_attempted", request);
		}
		if (httpStatus != null) {
			context.put("http_status", httpStatus);
		}
		if (solrErrorMessage != null) {
			context.put("solr_error_message", solrErrorMessage);
		}
		if (solrErrorMetadata != null && !solrErrorMetadata.isEmpty()) {
			context.put("solr_error_metadata", solrErrorMetadata);
		}
		if (solrResponse != null) {
			context.put("solr_response", solrResponse);
		}
		if (getCause() != null) {
			context.put("exception_type", getCause().getClass().getName());
		}
		return context;
	}

	public static final class Builder {

		private final FailureCause failureCause;
		private final String operation;
		private final String message;
		private String request;
		private Integer httpStatus;
		private String solrErrorMessage;
		private Map<String, Object> solrErrorMetadata = Collections.emptyMap();
		private Map<String, Object> solrResponse;
		private Throwable cause;

		private Builder(FailureCause failureCause, String operation, String message) {
			this.failureCause = failureCause;
			this.operation = operation;
			this.message = message;
		}

		public Builder request(String request) {
			this.request = request;
			return this;
		}

		public Builder httpStatus(Integer httpStatus) {
			this.httpStatus = httpStatus;
			return this;
		}

		public Builder solrError(String message, Map<String, Object> metadata) {
			this.solrErrorMessage = message;
			this.solrErrorMetadata = metadata == null ? Collections.emptyMap() : metadata;
			return this;
		}

		public Builder solrResponse(Map<String, Object> solrResponse) {
			this.solrResponse = solrResponse;
			return this;
		}

		public Builder cause(Throwable cause) {
			this.cause = cause;
			return this;
		}

		public SolrOperationException build() {
			return new SolrOperationException(this);
		}
	}
}
