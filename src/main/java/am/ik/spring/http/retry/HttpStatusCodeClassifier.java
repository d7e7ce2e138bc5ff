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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import org.springframework.util.Assert;

/**
 * Indicates a {@link ErrorCategory#SERVER server error} retry when the raw HTTP status
 * code is in a configurable set of retryable statuses.
 *
 * @since 0.1.0
 */
public final class HttpStatusCodeClassifier implements RetryClassifier {

	public static final Set<Integer> DEFAULT_RETRYABLE_RESPONSE_STATUSES = Collections
		.unmodifiableSet(new LinkedHashSet<>(Arrays.asList( //
				500 /* Internal Server Error */, //
				502 /* Bad Gateway */, //
				503 /* Service Unavailable */, //
				504 /* Gateway Timeout */
		)));

	private final Set<Integer> retryableResponseStatuses;

	public HttpStatusCodeClassifier() {
		this(DEFAULT_RETRYABLE_RESPONSE_STATUSES);
	}

	public HttpStatusCodeClassifier(Set<Integer> retryableResponseStatuses) {
		Assert.notNull(retryableResponseStatuses, "'retryableResponseStatuses' must not be null");
		this.retryableResponseStatuses = Collections.unmodifiableSet(new LinkedHashSet<>(retryableResponseStatuses));
	}

	public Set<Integer> retryableResponseStatuses() {
		return this.retryableResponseStatuses;
	}

	@Override
	public Optional<ClassificationOutcome> classify(AttemptContext context, ClassificationOutcome precedingOutcome) {
		Integer status = context.statusCode();
		if (status == null || !this.retryableResponseStatuses.contains(status)) {
			return Optional.empty();
		}
		return Optional.of(ClassificationOutcome.serverError());
	}

	@Override
	public String name() {
		return "HTTP Status Code";
	}

	@Override
	public RetryClassifierPriority priority() {
		return RetryClassifierPriority.HTTP_STATUS_CODE;
	}

	@Override
	public String toString() {
		return name();
	}

}
