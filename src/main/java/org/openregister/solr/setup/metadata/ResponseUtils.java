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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.solr.common.util.NamedList;

/**
 * Navigation helpers for SOLR responses.
 *
 * <p>
 * SolrJ hands admin responses back as nested {@link NamedList} structures,
 * while JSON-derived payloads and test fixtures use plain maps. Every helper
 * here accepts either shape.
 */
public final class ResponseUtils {

	private ResponseUtils() {
	}

	/**
	 * Follows the given keys into a nested response structure.
	 *
	 * @return the value at the path, or {@code null} when any segment is missing
	 */
	public static Object get(Object node, String... path) {
		Object current = node;
		for (String key : path) {
			if (current instanceof NamedList) {
				current = ((NamedList<?>) current).get(key);
			} else if (current instanceof Map) {
				current = ((Map<?, ?>) current).get(key);
			} else {
				return null;
			}
		}
		return current;
	}

	/**
	 * Reads {@code responseHeader.status}.
	 *
	 * @return the status, or {@code -1} if the response carries no header
	 */
	public static int status(Object response) {
		Object status = get(response, "responseHeader", "status");
		return status instanceof Number ? ((Number) status).intValue() : -1;
	}

	public static String getString(Object node, String... path) {
		Object value = get(node, path);
		return value == null ? null : value.toString();
	}

	/** Returns the keys of a named list or map, empty for anything else. */
	public static List<String> keys(Object node) {
		List<String> keys = new ArrayList<>();
		if (node instanceof NamedList) {
			NamedList<?> namedList = (NamedList<?>) node;
			for (int i = 0; i < namedList.size(); i++) {
				keys.add(namedList.getName(i));
			}
		} else if (node instanceof Map) {
			((Map<?, ?>) node).keySet().forEach(key -> keys.add(String.valueOf(key)));
		}
		return keys;
	}

	/** Returns the elements of a collection or array as strings. */
	public static List<String> strings(Object node) {
		if (node instanceof Collection) {
			Collection<?> values = (Collection<?>) node;
			List<String> strings = new ArrayList<>(values.size());
			values.forEach(value -> strings.add(String.valueOf(value)));
			return strings;
		}
		if (node instanceof Object[]) {
			Object[] values = (Object[]) node;
			List<String> strings = new ArrayList<>(values.length);
			for (Object value : values) {
				strings.add(String.valueOf(value));
			}
			return strings;
		}
		return Collections.emptyList();
	}

	/**
	 * Converts a response structure into plain maps and lists so it can be
	 * serialized as part of an error report.
	 */
	public static Map<String, Object> toMap(Object node) {
		Object converted = convert(node);
		if (converted instanceof Map<?, ?>) {
			@SuppressWarnings("unchecked")
			Map<String, Object> map = (Map<String, Object>) converted;
			return map;
		}
		return Collections.emptyMap();
	}

	private static Object convert(Object node) {
		if (node instanceof NamedList) {
			Map<String, Object> map = new LinkedHashMap<>();
			for (Map.Entry<String, ?> entry : (NamedList<?>) node) {
				map.put(entry.getKey(), convert(entry.getValue()));
			}
			return map;
		}
		if (node instanceof Map) {
			Map<String, Object> map = new LinkedHashMap<>();
			((Map<?, ?>) node).forEach((key, value) -> map.put(String.valueOf(key), convert(value)));
			return map;
		}
		if (node instanceof Collection) {
			Collection<?> values = (Collection<?>) node;
			List<Object> list = new ArrayList<>(values.size());
			values.forEach(value -> list.add(convert(value)));
			return list;
		}
		return node;
	}
}
