package org.pacificobservatory.newsdb.extract;

import static org.assertj.core.api.Assertions.*;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class DateNormalizerTest {

	@ParameterizedTest
	@CsvSource(
			delimiter = '|',
			value = {
				"2024-03-05|2024-03-05",
				"2024-03-05T08:30:00+11:00|2024-03-05",
				"March 5, 2024|2024-03-05",
				"Mar 5, 2024|2024-03-05",
				"5 March 2024|2024-03-05",
				"05/03/2024|2024-03-05",
				"Tuesday, March 5, 2024|2024-03-05",
				"Published: March 5th, 2024|2024-03-05",
				"By John Wasi, March 22, 2024|2024-03-22",
				"Posted on 22 March 2024 at 10:00|2024-03-22",
				"- 1st January 2020 -|2020-01-01",
				"march 5 2024|2024-03-05"
			})
	void testParse_KnownFormats(String raw, String expected) {
		assertThat(DateNormalizer.parse(raw)).contains(LocalDate.parse(expected));
	}

	@Test
	void testParse_DayFirstWhenAmbiguous() {
		assertThat(DateNormalizer.parse("04/03/2024")).contains(LocalDate.of(2024, 3, 4));
		assertThat(DateNormalizer.parse("12/25/2023")).contains(LocalDate.of(2023, 12, 25));
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "   ", "yesterday", "no date here", "31/04/2024", "2023-02-29", "April 31, 2024"})
	void testParse_Unparseable(String raw) {
		assertThat(DateNormalizer.parse(raw)).isEmpty();
	}

	@Test
	void testParse_LeapDay() {
		assertThat(DateNormalizer.parse("29/02/2024")).contains(LocalDate.of(2024, 2, 29));
	}

	@Test
	void testNormalize_KeepsCleanedInputWhenUnparseable() {
		assertThat(DateNormalizer.normalize("Mar 5, 2024")).isEqualTo("2024-03-05");
		assertThat(DateNormalizer.normalize("  Published:  a while ago ")).isEqualTo("a while ago");
		assertThat(DateNormalizer.normalize(null)).isEmpty();
	}
}
