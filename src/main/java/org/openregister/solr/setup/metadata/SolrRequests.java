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
import java.util.Map;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.impl.HttpSolrClientBase;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.params.SolrParams;
import org.apache.solr.common.util.NamedList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes SOLR admin requests and normalizes every way they can fail into a
 * {@link SolrOperationException}.
 *
 * <p>
 * <strong>Failure Mapping:</strong>
 *
 * <ul>
 * <li>{@link SolrServerException}, {@link IOException}: the request produced
 * no response, {@link FailureCause#TRANSPORT_EXCEPTION}
 * <li>a response body in an unexpected format:
 * {@link FailureCause#INVALID_JSON_RESPONSE}
 * <li>a non-2xx status without a SOLR error payload:
 * {@link FailureCause#HTTP_ERROR}
 * <li>a non-2xx status with a SOLR error payload, or a 2xx response whose
 * {@code responseHeader.status} is not {@code 0}:
 * {@link FailureCause#SOLR_API_ERROR}
 * </ul>
 */
public final class SolrRequests {

	private static final Logger log = LoggerFactory.getLogger(SolrRequests.class);

	private static final String REMOTE_ERROR_PREFIX = "Error from server at ";
	private static final String UNEXPECTED_CONTENT_MARKER = "Expected mime type";
	private static final String NON_OK_STATUS_MARKER = "non ok status";

	private SolrRequests() {
	}

	/**
	 * Sends the request and returns the raw response.
	 *
	 * @param client
	 *            client to send the request with
	 * @param request
	 *            the request
	 * @param collection
	 *            target collection, or {@code null} for node-level admin calls
	 * @param operation
	 *            human-readable name of the operation, used in errors and logs
	 * @return the response, never {@code null}
	 * @throws SolrOperationException
	 *             if the request failed in any way
	 */
	public static NamedList<Object> execute(SolrClient client, SolrRequest<?> request, String collection,
			String operation) throws SolrOperationException {
		String described = describe(client, request, collection);
		log.atDebug().addKeyValue("operation", operation).addKeyValue("request", described).log("Sending SOLR request");

		NamedList<Object> response;
		try {
			response = client.request(request, collection);
		} catch (SolrException e) {
			throw fromSolrException(e, operation, described);
		} catch (SolrServerException | IOException e) {
			FailureCause cause = isParseFailure(e) ? FailureCause.INVALID_JSON_RESPONSE : FailureCause.TRANSPORT_EXCEPTION;
			throw SolrOperationException.builder(cause, operation, operation + " failed: " + e.getMessage())
					.request(described).cause(e).build();
		}

		if (response == null) {
			throw SolrOperationException
					.builder(FailureCause.INVALID_JSON_RESPONSE, operation, operation + " returned an empty response")
					.request(described).build();
		}

		int status = ResponseUtils.status(response);
		if (status > 0) {
			String message = ResponseUtils.getString(response, "error", "msg");
			Map<String, Object> metadata = ResponseUtils.toMap(ResponseUtils.get(response, "error", "metadata"));
			throw SolrOperationException
					.builder(FailureCause.SOLR_API_ERROR, operation,
							operation + " failed with SOLR status " + status + (message == null ? "" : ": " + message))
					.request(described).httpStatus(200).solrError(message, metadata)
					.solrResponse(ResponseUtils.toMap(response)).build();
		}
		return response;
	}

	/**
	 * Renders the method and URL of a request, for example
	 * {@code GET http://localhost:8983/solr/admin/configs?action=LIST}. The base
	 * URL is left out for clients that do not expose one.
	 */
	static String describe(SolrClient client, SolrRequest<?> request, String collection) {
		StringBuilder described = new StringBuilder(request.getMethod().name()).append(' ');
		if (client instanceof HttpSolrClientBase) {
			described.append(((HttpSolrClientBase) client).getBaseURL());
		}
		if (collection != null) {
			described.append('/').append(collection);
		}
		described.append(request.getPath());
		SolrParams params = request.getParams();
		if (params != null) {
			described.append(params.toQueryString());
		}
		return described.toString();
	}

	private static SolrOperationException fromSolrException(SolrException e, String operation, String described) {
		String message = e.getMessage() == null ? "" : e.getMessage();
		FailureCause cause;
		if (message.contains(UNEXPECTED_CONTENT_MARKER)) {
			cause = FailureCause.INVALID_JSON_RESPONSE;
		} else if (message.contains(NON_OK_STATUS_MARKER)) {
			cause = FailureCause.HTTP_ERROR;
		} else {
			cause = FailureCause.SOLR_API_ERROR;
		}

		SolrOperationException.Builder builder = SolrOperationException
				.builder(cause, operation, operation + " failed: " + message).request(described).cause(e);
		if (e.code() > 0) {
			builder.httpStatus(e.code());
		}
		if (cause == FailureCause.SOLR_API_ERROR) {
			builder.solrError(remoteMessage(message), ResponseUtils.toMap(e.getMetadata()));
		}
		return builder.build();
	}

	private static String remoteMessage(String message) {
		if (message.startsWith(REMOTE_ERROR_PREFIX)) {
			int separator = message.indexOf(": ");
			if (separator > 0) {
				return message.substring(separator + 2);
			}
		}
		return message;
	}

	private static boolean isParseFailure(Exception e) {
		String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase();
		return message.contains("parse") || message.contains("parsing");
	}
}
