package org.pacificobservatory.newsdb.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Best-effort field values pulled out of a page before validation. Values are either a string or a
 * list of strings; fields whose selector matched nothing are simply absent.
 */
public final class RawRecord {
	private final String sourceId;
	private final Instant fetchedAt;
	private final Map<String, Object> fields;

	public RawRecord(String sourceId, Instant fetchedAt) {
		this(sourceId, fetchedAt, new LinkedHashMap<>());
	}

	private RawRecord(String sourceId, Instant fetchedAt, Map<String, Object> fields) {
		this.sourceId = sourceId;
		this.fetchedAt = fetchedAt;
		this.fields = fields;
	}

	public String sourceId() {
		return sourceId;
	}

	/** When the page this record came from was fetched, may be {@code null} */
	public Instant fetchedAt() {
		return fetchedAt;
	}

	public RawRecord put(String field, Object value) {
		if (value == null) {
			fields.remove(field);
		} else if (value instanceof String || value instanceof List) {
			fields.put(field, value);
		} else {
			fields.put(field, value.toString());
		}
		return this;
	}

	public boolean has(String field) {
		Object value = fields.get(field);
		if (value instanceof String s) {
			return !s.isBlank();
		}
		return value instanceof List<?> l && !l.isEmpty();
	}

	public Object get(String field) {
		return fields.get(field);
	}

	/** Value as a single string; lists are joined with a space */
	public String getString(String field) {
		Object value = fields.get(field);
		if (value == null) {
			return null;
		}
		if (value instanceof List<?> list) {
			StringBuilder sb = new StringBuilder();
			for (Object o : list) {
				String s = String.valueOf(o).trim();
				if (!s.isEmpty()) {
					if (sb.length() > 0) {
						sb.append(' ');
					}
					sb.append(s);
				}
			}
			return sb.toString();
		}
		return (String) value;
	}

	public Map<String, Object> fields() {
		return Collections.unmodifiableMap(fields);
	}

	public RawRecord copy() {
		return new RawRecord(sourceId, fetchedAt, new LinkedHashMap<>(fields));
	}

	/** Copy of this record with the non-empty fields of {@code other} laid over it */
	public RawRecord overlay(RawRecord other) {
		Instant at = other.fetchedAt != null ? other.fetchedAt : fetchedAt;
		RawRecord merged = new RawRecord(sourceId, at, new LinkedHashMap<>(fields));
		for (Map.Entry<String, Object> e : other.fields.entrySet()) {
			if (other.has(e.getKey())) {
				merged.fields.put(e.getKey(), e.getValue());
			}
		}
		return merged;
	}

	@Override
	public String toString() {
		return "RawRecord{" + sourceId + ", " + fields + "}";
	}
}
