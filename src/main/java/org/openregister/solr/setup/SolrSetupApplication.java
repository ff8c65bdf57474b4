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
package org.openregister.solr.setup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the OpenRegister SOLR setup service.
 *
 * <p>
 * Provisioning runs are triggered through {@code POST /api/solr/setup}. The
 * tenant is configured once per installation through {@code solr.tenant-id}.
 */
@SpringBootApplication
public class SolrSetupApplication {

	public static void main(String[] args) {
		SpringApplication.run(SolrSetupApplication.class, args);
	}
}
