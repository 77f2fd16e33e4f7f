package org.springaicommunity.gitlab.labels;

import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;

/**
 * Identifier of a GitLab resource in a URL path: either a numeric ID or a string such as
 * a project path ({@code group/project}) or a label name.
 *
 * <p>
 * Use {@link #of(Object)} to convert caller-supplied values; it rejects anything that is
 * not an integral number or a string with an {@link InvalidIdException}.
 *
 * <pre>
 * {@code
 * ResourceId.of(42).toPathSegment();                 // "42"
 * ResourceId.of("group/project").toPathSegment();    // "group%2Fproject"
 * ResourceId.of(1.1);                                // throws InvalidIdException
 * }
 * </pre>
 */
public sealed interface ResourceId permits ResourceId.Numeric, ResourceId.Path {

	/**
	 * Returns the escaped form of this identifier for use as a single path segment.
	 * @return the path segment
	 */
	String toPathSegment();

	static ResourceId of(long id) {
		return new Numeric(id);
	}

	static ResourceId of(String path) {
		return new Path(path);
	}

	/**
	 * Convert an arbitrary value into a resource identifier.
	 * @param value an {@link Integer}, {@link Long}, {@link Short}, {@link Byte},
	 * {@link String} or {@link ResourceId}
	 * @return the identifier
	 * @throws InvalidIdException for any other value, including {@code null}
	 */
	static ResourceId of(@Nullable Object value) {
		if (value instanceof ResourceId id) {
			return id;
		}
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return new Numeric(((Number) value).longValue());
		}
		if (value instanceof String s) {
			return new Path(s);
		}
		throw new InvalidIdException(value);
	}

	/**
	 * Numeric resource ID.
	 *
	 * @param id the ID
	 */
	record Numeric(long id) implements ResourceId {

		@Override
		public String toPathSegment() {
			return Long.toString(id);
		}

		@Override
		public String toString() {
			return Long.toString(id);
		}

	}

	/**
	 * String resource identifier, escaped when placed in a path.
	 *
	 * @param value the unescaped value
	 */
	record Path(String value) implements ResourceId {

		private static final char[] HEX = "0123456789ABCDEF".toCharArray();

		public Path {
			if (value == null) {
				throw new InvalidIdException(null);
			}
		}

		@Override
		public String toPathSegment() {
			byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
			StringBuilder escaped = new StringBuilder(bytes.length);
			for (byte b : bytes) {
				int c = b & 0xFF;
				if (isAllowedInSegment(c)) {
					escaped.append((char) c);
				}
				else {
					escaped.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
				}
			}
			return escaped.toString();
		}

		@Override
		public String toString() {
			return value;
		}

		// RFC 3986 unreserved characters plus the sub-delims GitLab accepts unescaped in a
		// segment; '/', ';', ',' and '?' are always escaped. '.' is escaped too, otherwise
		// GitLab reads a trailing ".json" style suffix as the response format.
		private static boolean isAllowedInSegment(int c) {
			if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
				return true;
			}
			switch (c) {
				case '-', '_', '~', '$', '&', '+', ':', '=', '@':
					return true;
				default:
					return false;
			}
		}

	}

}
