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
package org.openregister.solr.setup.web;

import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.openregister.solr.setup.provisioning.ProvisioningRun;
import org.openregister.solr.setup.provisioning.TenantProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint that triggers a tenant provisioning run.
 *
 * <ul>
 * <li>{@code 200 OK}: the run succeeded, body is the run report
 * <li>{@code 422 Unprocessable Entity}: the run failed, body is the run report
 * including {@code error_details}
 * <li>{@code 409 Conflict}: another run is still in progress
 * </ul>
 */
@RestController
@RequestMapping("/api/solr")
public class SolrSetupController {

	private static final Logger log = LoggerFactory.getLogger(SolrSetupController.class);

	private final TenantProvisioner tenantProvisioner;

	private final ReentrantLock runLock = new ReentrantLock();

	public SolrSetupController(TenantProvisioner tenantProvisioner) {
		this.tenantProvisioner = tenantProvisioner;
	}

	@PostMapping("/setup")
	public ResponseEntity<Object> setup() {
		if (!runLock.tryLock()) {
			log.warn("Rejecting SOLR setup request, a provisioning run is already in progress");
			return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("success", false, "message",
					"A SOLR setup run is already in progress"));
		}
		try {
			ProvisioningRun run = tenantProvisioner.provision();
			return ResponseEntity.status(run.isSuccess() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY).body(run);
		} finally {
			runLock.unlock();
		}
	}
}
