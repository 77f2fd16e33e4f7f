package org.springaicommunity.gitlab.labels;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResourceId Tests")
class ResourceIdTest {

	@Nested
	@DisplayName("Conversion")
	class ConversionTest {

		@Test
		@DisplayName("Should accept integral numbers as numeric IDs")
		void shouldAcceptIntegralNumbers() {
			assertThat(ResourceId.of((Object) 5)).isEqualTo(new ResourceId.Numeric(5));
			assertThat(ResourceId.of((Object) 5L)).isEqualTo(new ResourceId.Numeric(5));
			assertThat(ResourceId.of((Object) (short) 5)).isEqualTo(new ResourceId.Numeric(5));
			assertThat(ResourceId.of((Object) (byte) 5)).isEqualTo(new ResourceId.Numeric(5));
		}

		@Test
		@DisplayName("Should accept strings as paths without parsing them")
		void shouldAcceptStrings() {
			assertThat(ResourceId.of((Object) "1")).isEqualTo(new ResourceId.Path("1"));
			assertThat(ResourceId.of((Object) "group/project")).isEqualTo(new ResourceId.Path("group/project"));
		}

		@Test
		@DisplayName("Should pass existing identifiers through")
		void shouldPassThroughResourceIds() {
			ResourceId id = ResourceId.of(7);

			assertThat(ResourceId.of((Object) id)).isSameAs(id);
		}

		@ParameterizedTest
		@MethodSource("org.springaicommunity.gitlab.labels.ResourceIdTest#invalidIds")
		@DisplayName("Should reject values that are neither integers nor strings")
		void shouldRejectInvalidValues(Object value) {
			assertThatThrownBy(() -> ResourceId.of(value)).isInstanceOfSatisfying(InvalidIdException.class, e -> {
				assertThat(e.getRejectedValue()).isEqualTo(value);
				assertThat(e.getMessage()).isEqualTo("invalid ID type " + value + ", the ID must be an int or a string");
			});
		}

		@Test
		@DisplayName("Should reject null")
		void shouldRejectNull() {
			assertThatThrownBy(() -> ResourceId.of((Object) null)).isInstanceOf(InvalidIdException.class)
				.hasMessage("invalid ID type null, the ID must be an int or a string");
		}

	}

	static Stream<Object> invalidIds() {
		return Stream.of(1.1, 2.0f, new BigDecimal("3"), true, 'c', List.of(1), new Object());
	}

	@Nested
	@DisplayName("Path Segments")
	class PathSegmentTest {

		@ParameterizedTest(name = "{0} -> {1}")
		@CsvSource(delimiter = '|', value = { "MyLabel|MyLabel", "kind/bug|kind%2Fbug", "group/sub/project|group%2Fsub%2Fproject",
				"needs review|needs%20review", "a;b,c?d|a%3Bb%2Cc%3Fd", "x+y=z@host:1|x+y=z@host:1",
				"~user_name.v-1|~user_name%2Ev-1", "v1.0|v1%2E0", "100%|100%25", "P1 #urgent|P1%20%23urgent", "ünïcode|%C3%BCn%C3%AFcode" })
		@DisplayName("Should escape string identifiers as a single path segment")
		void shouldEscapeStrings(String value, String expected) {
			assertThat(ResourceId.of(value).toPathSegment()).isEqualTo(expected);
		}

		@Test
		@DisplayName("Should render numeric IDs as digits")
		void shouldRenderNumericIds() {
			assertThat(ResourceId.of(42).toPathSegment()).isEqualTo("42");
			assertThat(ResourceId.of(Long.MAX_VALUE).toPathSegment()).isEqualTo("9223372036854775807");
		}

	}

}
