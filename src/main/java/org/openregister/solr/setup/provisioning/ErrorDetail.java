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
package org.openregister.solr.setup.provisioning;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.openregister.solr.setup.metadata.FailureCause;

/**
 * Diagnostics of the failure that ended a provisioning run.
 *
 * @param kind
 *            what failed
 * @param cause
 *            why it failed, {@code null} when not classified further
 * @param operation
 *            the operation that failed
 * @param step
 *            number of the failing step
 * @param stepName
 *            name of the failing step
 * @param message
 *            human-readable message
 * @param context
 *            named diagnostic fields (request, HTTP status, SOLR error, ...)
 * @param troubleshooting
 *            remediation hints
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorDetail(@JsonProperty("error_type") ErrorKind kind,
		@JsonProperty("error_category") FailureCause cause, String operation, int step,
		@JsonProperty("step_name") String stepName, String message, Map<String, Object> context,
		List<String> troubleshooting) {

	public ErrorDetail {
		context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
		troubleshooting = troubleshooting == null ? kind.troubleshooting() : List.copyOf(troubleshooting);
	}

	public static ErrorDetail of(ErrorKind kind, FailureCause cause, String operation, ProvisioningStep step,
			String message, Map<String, Object> context) {
		return new ErrorDetail(kind, cause, operation, step.number(), step.stepName(), message, context, null);
	}
}
