/*
 * Copyright (C) 2023-2025 Toshiaki Maki <makingx@gmail.com>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package am.ik.spring.http.retry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import static am.ik.spring.http.retry.RetryClassifierPriority.HTTP_STATUS_CODE;
import static am.ik.spring.http.retry.RetryClassifierPriority.MODELED_AS_RETRYABLE;
import static am.ik.spring.http.retry.RetryClassifierPriority.SERVICE_ERROR_CODE;
import static am.ik.spring.http.retry.RetryClassifierPriority.TRANSIENT_ERROR;
import static am.ik.spring.http.retry.RetryClassifierPriority.after;
import static am.ik.spring.http.retry.RetryClassifierPriority.before;
import static am.ik.spring.http.retry.RetryClassifierPriority.between;
import static am.ik.spring.http.retry.RetryClassifierPriority.defaultPriority;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryClassifierPriorityTest {

	@Test
	void before_and_after_are_strict() {
		RetryClassifierPriority p = defaultPriority();
		assertThat(before(p)).isLessThan(p);
		assertThat(after(p)).isGreaterThan(p);
		assertThat(before(before(p))).isLessThan(before(p));
		assertThat(after(after(p))).isGreaterThan(after(p));
	}

	@Test
	void built_in_priorities_are_ordered() {
		List<RetryClassifierPriority> priorities = new ArrayList<>(
				Arrays.asList(TRANSIENT_ERROR, HTTP_STATUS_CODE, MODELED_AS_RETRYABLE, SERVICE_ERROR_CODE));
		Collections.sort(priorities);
		assertThat(priorities).containsExactly(HTTP_STATUS_CODE, SERVICE_ERROR_CODE, MODELED_AS_RETRYABLE,
				TRANSIENT_ERROR);
		assertThat(HTTP_STATUS_CODE).isEqualTo(defaultPriority());
	}

	@Test
	void between_keeps_splitting() {
		RetryClassifierPriority lower = SERVICE_ERROR_CODE;
		RetryClassifierPriority upper = MODELED_AS_RETRYABLE;
		for (int i = 0; i < 200; i++) {
			RetryClassifierPriority middle = between(lower, upper);
			assertThat(middle).isGreaterThan(lower).isLessThan(upper);
			upper = middle;
		}
	}

	@Test
	void between_requires_ordered_bounds() {
		assertThatThrownBy(() -> between(TRANSIENT_ERROR, HTTP_STATUS_CODE))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> between(HTTP_STATUS_CODE, HTTP_STATUS_CODE))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void equal_values_built_differently_are_equal() {
		RetryClassifierPriority a = before(after(HTTP_STATUS_CODE));
		RetryClassifierPriority b = between(before(HTTP_STATUS_CODE), after(HTTP_STATUS_CODE));
		assertThat(a).isEqualTo(HTTP_STATUS_CODE).hasSameHashCodeAs(HTTP_STATUS_CODE);
		assertThat(b).isEqualTo(HTTP_STATUS_CODE).hasSameHashCodeAs(HTTP_STATUS_CODE);
		assertThat(a.compareTo(b)).isZero();
	}

}
