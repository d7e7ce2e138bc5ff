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

import java.math.BigDecimal;

import org.springframework.util.Assert;

/**
 * Opaque ordering key of a {@link RetryClassifier}. Classifiers run in ascending priority
 * order, so the opinion of a higher priority classifier overrides the opinion of a lower
 * priority one.
 * <p>
 * Instances can only be created relative to existing ones:
 * <pre class="code">
 * RetryClassifierPriority p = RetryClassifierPriority.after(RetryClassifierPriority.HTTP_STATUS_CODE);
 * </pre>
 * The underlying encoding is not exposed so that the built-in priorities can be
 * renumbered without breaking user code.
 *
 * @since 0.1.0
 */
public final class RetryClassifierPriority implements Comparable<RetryClassifierPriority> {

	private static final RetryClassifierPriority DEFAULT = new RetryClassifierPriority(BigDecimal.ZERO);

	private static final BigDecimal TWO = BigDecimal.valueOf(2);

	/**
	 * Priority of {@link HttpStatusCodeClassifier}. Equal to {@link #defaultPriority()}.
	 */
	public static final RetryClassifierPriority HTTP_STATUS_CODE = DEFAULT;

	/**
	 * Priority of {@link ServiceErrorCodeClassifier}.
	 */
	public static final RetryClassifierPriority SERVICE_ERROR_CODE = after(HTTP_STATUS_CODE);

	/**
	 * Priority of {@link ModeledAsRetryableClassifier}.
	 */
	public static final RetryClassifierPriority MODELED_AS_RETRYABLE = after(SERVICE_ERROR_CODE);

	/**
	 * Priority of {@link TransientErrorClassifier}. The highest built-in priority.
	 */
	public static final RetryClassifierPriority TRANSIENT_ERROR = after(MODELED_AS_RETRYABLE);

	private final BigDecimal value;

	private RetryClassifierPriority(BigDecimal value) {
		this.value = value;
	}

	public static RetryClassifierPriority defaultPriority() {
		return DEFAULT;
	}

	/**
	 * @return a priority ordering strictly before the given one
	 */
	public static RetryClassifierPriority before(RetryClassifierPriority other) {
		Assert.notNull(other, "'other' must not be null");
		return new RetryClassifierPriority(other.value.subtract(BigDecimal.ONE));
	}

	/**
	 * @return a priority ordering strictly after the given one
	 */
	public static RetryClassifierPriority after(RetryClassifierPriority other) {
		Assert.notNull(other, "'other' must not be null");
		return new RetryClassifierPriority(other.value.add(BigDecimal.ONE));
	}

	/**
	 * Returns a priority ordering strictly after {@code lower} and strictly before
	 * {@code upper}. There is always room for another value between two distinct
	 * priorities.
	 * @throws IllegalArgumentException if {@code lower} does not order before
	 * {@code upper}
	 */
	public static RetryClassifierPriority between(RetryClassifierPriority lower, RetryClassifierPriority upper) {
		Assert.notNull(lower, "'lower' must not be null");
		Assert.notNull(upper, "'upper' must not be null");
		Assert.isTrue(lower.compareTo(upper) < 0, "'lower' must order before 'upper'");
		return new RetryClassifierPriority(lower.value.add(upper.value).divide(TWO));
	}

	@Override
	public int compareTo(RetryClassifierPriority o) {
		return this.value.compareTo(o.value);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof RetryClassifierPriority)) {
			return false;
		}
		return this.value.compareTo(((RetryClassifierPriority) o).value) == 0;
	}

	@Override
	public int hashCode() {
		return this.value.stripTrailingZeros().hashCode();
	}

}
