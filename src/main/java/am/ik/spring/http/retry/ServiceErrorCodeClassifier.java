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

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.http.HttpHeaders;

/**
 * Indicates a retry when the parsed error code is a well-known throttling or transient
 * error code. If the response carries an explicit wait, the retry reason carries it as
 * well. Two headers are read, in this order:
 * <ul>
 * <li>{@code x-amz-retry-after}: milliseconds</li>
 * <li>{@code Retry-After}: delta seconds. The HTTP-date form is ignored since
 * classification does not know the current time.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class ServiceErrorCodeClassifier implements RetryClassifier {

	public static final Set<String> THROTTLING_ERROR_CODES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList( //
			"Throttling", //
			"ThrottlingException", //
			"ThrottledException", //
			"RequestThrottledException", //
			"TooManyRequestsException", //
			"ProvisionedThroughputExceededException", //
			"TransactionInProgressException", //
			"RequestLimitExceeded", //
			"BandwidthLimitExceeded", //
			"LimitExceededException", //
			"RequestThrottled", //
			"SlowDown", //
			"PriorRequestNotComplete", //
			"EC2ThrottledException")));

	public static final Set<String> TRANSIENT_ERROR_CODES = Collections
		.unmodifiableSet(new HashSet<>(Arrays.asList("RequestTimeout", "RequestTimeoutException")));

	static final String RETRY_AFTER_MILLIS_HEADER = "x-amz-retry-after";

	// delays must stay representable in milliseconds
	private static final long MAX_RETRY_AFTER_SECONDS = Long.MAX_VALUE / 1000;

	private final Log log = LogFactory.getLog(ServiceErrorCodeClassifier.class);

	@Override
	public Optional<ClassificationOutcome> classify(AttemptContext context, ClassificationOutcome precedingOutcome) {
		if (!context.hasError() || context.error().code() == null) {
			return Optional.empty();
		}
		String code = context.error().code();
		ErrorCategory category;
		if (THROTTLING_ERROR_CODES.contains(code)) {
			category = ErrorCategory.THROTTLING;
		}
		else if (TRANSIENT_ERROR_CODES.contains(code)) {
			category = ErrorCategory.TRANSIENT;
		}
		else {
			return Optional.empty();
		}
		Duration retryAfter = retryAfter(context.headers());
		return Optional.of(retryAfter == null ? ClassificationOutcome.retryIndicated(RetryReason.error(category))
				: ClassificationOutcome.retryAfter(category, retryAfter));
	}

	private Duration retryAfter(HttpHeaders headers) {
		String millis = headers.getFirst(RETRY_AFTER_MILLIS_HEADER);
		if (millis != null) {
			Long value = parseNonNegative(millis);
			if (value != null) {
				return Duration.ofMillis(value);
			}
		}
		String seconds = headers.getFirst(HttpHeaders.RETRY_AFTER);
		if (seconds != null) {
			Long value = parseNonNegative(seconds);
			if (value != null && value <= MAX_RETRY_AFTER_SECONDS) {
				return Duration.ofSeconds(value);
			}
			if (value != null && log.isDebugEnabled()) {
				log.debug(String.format("type=cls classifier=\"%s\" reason=\"Ignoring retry-after value\" value=\"%s\"",
						name(), seconds));
			}
		}
		return null;
	}

	private Long parseNonNegative(String value) {
		try {
			long parsed = Long.parseLong(value.trim());
			return parsed < 0 ? null : parsed;
		}
		catch (NumberFormatException e) {
			if (log.isDebugEnabled()) {
				log.debug(String.format("type=cls classifier=\"%s\" reason=\"Ignoring retry-after value\" value=\"%s\"",
						name(), value));
			}
			return null;
		}
	}

	@Override
	public String name() {
		return "Service Error Codes";
	}

	@Override
	public RetryClassifierPriority priority() {
		return RetryClassifierPriority.SERVICE_ERROR_CODE;
	}

	@Override
	public String toString() {
		return name();
	}

}
