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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.util.Map;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.impl.Http2SolrClient;
import org.apache.solr.client.solrj.request.ConfigSetAdminRequest;
import org.apache.solr.client.solrj.request.GenericSolrRequest;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.apache.solr.common.util.NamedList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SolrRequestsTest {

	@Mock
	private SolrClient solrClient;

	private static ConfigSetAdminRequest.List listRequest() {
		return new ConfigSetAdminRequest.List();
	}

	@Test
	void execute_WithSuccessfulResponse_ShouldReturnIt() throws Exception {
		NamedList<Object> response = SolrResponses.configSets("_default");
		when(solrClient.request(any(), isNull())).thenReturn(response);

		assertSame(response, SolrRequests.execute(solrClient, listRequest(), null, "list configSets"));
	}

	@Test
	void execute_WithoutResponseHeader_ShouldSucceed() throws Exception {
		NamedList<Object> response = new NamedList<>();
		response.add("mode", "solrcloud");
		when(solrClient.request(any(), isNull())).thenReturn(response);

		assertSame(response, SolrRequests.execute(solrClient, listRequest(), null, "system info"));
	}

	@Test
	void execute_WhenServerUnreachable_ShouldReportTransportException() throws Exception {
		SolrServerException failure = new SolrServerException("Connection refused");
		when(solrClient.request(any(), isNull())).thenThrow(failure);

		SolrOperationException ex = assertThrows(SolrOperationException.class,
				() -> SolrRequests.execute(solrClient, listRequest(), null, "list configSets"));

		assertEquals(FailureCause.TRANSPORT_EXCEPTION, ex.getFailureCause());
		assertEquals("list configSets", ex.getOperation());
		assertEquals("GET /admin/configs?action=LIST", ex.getRequest());
		assertSame(failure, ex.getCause());
		assertNull(ex.getHttpStatus());
		assertEquals(SolrServerException.class.getName(), ex.context().get("exception_type"));
	}

	@Test
	void execute_WithHttpClient_ShouldReportFullUrlAttempted() throws Exception {
		// Given
		Http2SolrClient httpClient = mock(Http2SolrClient.class);
		when(httpClient.getBaseURL()).thenReturn("http://solr.example:8983/solr");
		when(httpClient.request(any(), isNull())).thenThrow(new SolrServerException("Connection refused"));

		// When
		SolrOperationException ex = assertThrows(SolrOperationException.class,
				() -> SolrRequests.execute(httpClient, listRequest(), null, "list configSets"));

		// Then
		assertEquals("GET http://solr.example:8983/solr/admin/configs?action=LIST", ex.getRequest());
		assertEquals("GET http://solr.example:8983/solr/admin/configs?action=LIST", ex.context().get("url_attempted"));
	}

	@Test
	void execute_WhenIoFails_ShouldReportTransportException() throws Exception {
		when(solrClient.request(any(), isNull())).thenThrow(new IOException("Broken pipe"));

		SolrOperationException ex = assertThrows(SolrOperationException.class,
				() -> SolrRequests.execute(solrClient, listRequest(), null, "list configSets"));

		assertEquals(FailureCause.TRANSPORT_EXCEPTION, ex.getFailureCause());
		assertTrue(ex.getMessage().contains("Broken pipe"));
	}

	@Test
	void execute_WhenSolrRejectsRequest_ShouldReportSolrApiError() throws Exception {
		when(solrClient.request(any(), isNull()))
				.thenThrow(new SolrException(SolrException.ErrorCode.BAD_REQUEST,
						"Error from server at http://localhost:8983/solr: Can not find the specified config set: custom_nc_ab12"));

		SolrOperationException ex = assertThrows(SolrOperationException.class,
				() -> SolrRequests.execute(solrClient, listRequest(), null, "create collection"));

		assertEquals(FailureCause.SOLR_API_ERROR, ex.getFailureCause());
		assertEquals(400, ex.getHttpStatus());
		assertEquals("Can not find the specified config set: custom_nc_ab12", ex.getSolrErrorMessage());
		assertEquals(ex.getSolrErrorMessage(), ex.getReportedMessage());
		assertEquals(400, ex.context().get("http_status"));
		assertEquals("solr_api_error", ex.context().get("failure_cause"));
	}

	@Test
	void execute_WhenResponseIsNotParseable_ShouldReportInvalidResponse() throws Exception {
		when(solrClient.request(any(), isNull()))
				.thenThrow(new SolrException(SolrException.ErrorCode.NOT_FOUND,
						"Expected mime type application/octet-stream but got text/html."));

		SolrOperationException ex = assertThrows(SolrOperationException.class,
				() -> SolrRequests.execute(solrClient, listRequest(), null, "list configSets"));

		assertEquals(FailureCause.INVALID_JSON_RESPONSE, ex.getFailureCause());
		assertEquals(404, ex.getHttpStatus());
		assertNull(ex.getSolrErrorMessage());
	}

	@Test
	void execute_WhenStatusIsNotOkWithoutPayload_ShouldReportHttpError() throws Exception {
		when(solrClient.request(any(), isNull())).thenThrow(
				new SolrException(SolrException.ErrorCode.SERVER_ERROR, "non ok status: 503, message:Service Unavailable"));

		SolrOperationException ex = assertThrows(SolrOperationException.class,
				() -> SolrRequests.execute(solrClient, listRequest(), null, "list configSets"));

		assertEquals(FailureCause.HTTP_ERROR, ex.getFailureCause());
		assertEquals(500, ex.getHttpStatus());
	}

	@Test
	void execute_WhenResponseIsEmpty_ShouldReportInvalidResponse() throws Exception {
		when(solrClient.request(any(), isNull())).thenReturn(null);

		SolrOperationException ex = assertThrows(SolrOperationException.class,
				() -> SolrRequests.execute(solrClient, listRequest(), null, "list configSets"));

		assertEquals(FailureCause.INVALID_JSON_RESPONSE, ex.getFailureCause());
	}

	@Test
	void execute_WhenResponseHeaderReportsError_ShouldReportSolrApiError() throws Exception {
		when(solrClient.request(any(), isNull()))
				.thenReturn(SolrResponses.error(400, "ConfigSet already exists: openregister_nc_ab12"));

		SolrOperationException ex = assertThrows(SolrOperationException.class,
				() -> SolrRequests.execute(solrClient, listRequest(), null, "upload configSet"));

		assertEquals(FailureCause.SOLR_API_ERROR, ex.getFailureCause());
		assertEquals("ConfigSet already exists: openregister_nc_ab12", ex.getSolrErrorMessage());
		Map<String, Object> context = ex.context();
		assertEquals(Map.of("error-class", "org.apache.solr.common.SolrException"),
				context.get("solr_error_metadata"));
		assertNotNull(context.get("solr_response"));
	}

	@Test
	void describe_ShouldIncludeCollectionAndParameters() {
		ModifiableSolrParams params = new ModifiableSolrParams();
		params.set("rows", 0);
		GenericSolrRequest request = new GenericSolrRequest(SolrRequest.METHOD.GET, "/select", params)
				.setRequiresCollection(true);

		assertEquals("GET /openregister_nc_ab12/select?rows=0",
				SolrRequests.describe(solrClient, request, "openregister_nc_ab12"));
	}
}
