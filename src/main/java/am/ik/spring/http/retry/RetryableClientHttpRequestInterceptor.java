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

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.Assert;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

/**
 * A {@link ClientHttpRequestInterceptor} that classifies every attempt with a
 * {@link RetryClassifierChain} and retries while the chain indicates a retry and the
 * {@link BackOff} allows another attempt.
 * <ul>
 * <li>{@link ClassificationOutcome#NO_OPINION}: the response is returned, or the
 * exception rethrown, without retrying.</li>
 * <li>{@link ClassificationOutcome#RETRY_FORBIDDEN}: same, regardless of the remaining
 * back-off budget.</li>
 * <li>retry indicated: the interceptor waits for the back-off interval, or for the
 * explicit delay if the {@link RetryReason} carries one, and tries again.</li>
 * </ul>
 * The client level classifiers are configured through {@link Options}; a single call can
 * add to or replace them with {@link #withOverride(Consumer)}.
 */
public class RetryableClientHttpRequestInterceptor implements ClientHttpRequestInterceptor {

	private final BackOff backOff;

	private final RetryClassifierRegistry serviceClassifiers;

	private final RetryClassifierChain classifierChain;

	private final ServiceErrorParser serviceErrorParser;

	private final Function<? super ClientHttpResponse, ? extends ClientHttpResponse> clientHttpResponseMapper;

	private final Predicate<String> sensitiveHeaderPredicate;

	private static final int MAX_ATTEMPTS = 100;

	private static final Duration MAX_WAIT = Duration.ofMillis(Long.MAX_VALUE);

	private final Log log = LogFactory.getLog(RetryableClientHttpRequestInterceptor.class);

	public static class Options {

		public static final Set<String> DEFAULT_SENSITIVE_HEADERS = Collections.unmodifiableSet(new HashSet<>(
				Arrays.asList("authorization", "proxy-authenticate", "cookie", "set-cookie", "x-amz-security-token")));

		private Set<Integer> retryableResponseStatuses = HttpStatusCodeClassifier.DEFAULT_RETRYABLE_RESPONSE_STATUSES;

		private final List<Consumer<RetryClassifierRegistry>> classifierCustomizers = new ArrayList<>();

		private ServiceErrorParser serviceErrorParser = null;

		private Function<? super ClientHttpResponse, ? extends ClientHttpResponse> clientHttpResponseMapper = null;

		private Set<String> sensitiveHeaders = DEFAULT_SENSITIVE_HEADERS;

		private Predicate<String> sensitiveHeaderPredicate = null;

		/**
		 * Statuses retried by the built-in {@link HttpStatusCodeClassifier}.
		 */
		public Options retryableResponseStatuses(Set<Integer> retryableResponseStatuses) {
			Assert.notNull(retryableResponseStatuses, "'retryableResponseStatuses' must not be null");
			this.retryableResponseStatuses = retryableResponseStatuses;
			return this;
		}

		/**
		 * Customizes the client level registry, which starts with the built-in
		 * classifiers.
		 */
		public Options classifiers(Consumer<RetryClassifierRegistry> customizer) {
			Assert.notNull(customizer, "'customizer' must not be null");
			this.classifierCustomizers.add(customizer);
			return this;
		}

		public Options addClassifier(RetryClassifier classifier) {
			return this.classifiers(registry -> registry.add(classifier));
		}

		public Options serviceErrorParser(ServiceErrorParser serviceErrorParser) {
			this.serviceErrorParser = serviceErrorParser;
			return this;
		}

		public Options clientHttpResponseMapper(
				Function<? super ClientHttpResponse, ? extends ClientHttpResponse> clientHttpResponseMapper) {
			this.clientHttpResponseMapper = clientHttpResponseMapper;
			return this;
		}

		public Options sensitiveHeaders(Set<String> sensitiveHeaders) {
			this.sensitiveHeaders = sensitiveHeaders;
			return this;
		}

		public Options sensitiveHeaderPredicate(Predicate<String> sensitiveHeaderPredicate) {
			this.sensitiveHeaderPredicate = sensitiveHeaderPredicate;
			return this;
		}

	}

	public RetryableClientHttpRequestInterceptor(BackOff backOff) {
		this(backOff, __ -> {
		});
	}

	public RetryableClientHttpRequestInterceptor(BackOff backOff, Consumer<Options> configurer) {
		Assert.notNull(backOff, "'backOff' must not be null");
		Options options = new Options();
		configurer.accept(options);
		RetryClassifierRegistry registry = RetryClassifierRegistry.defaults(options.retryableResponseStatuses);
		options.classifierCustomizers.forEach(customizer -> customizer.accept(registry));
		this.backOff = backOff;
		this.serviceClassifiers = registry.freeze();
		this.classifierChain = RetryClassifierChain.of(registry);
		this.serviceErrorParser = options.serviceErrorParser;
		this.clientHttpResponseMapper = options.clientHttpResponseMapper;
		this.sensitiveHeaderPredicate = options.sensitiveHeaderPredicate == null ? options.sensitiveHeaders::contains
				: options.sensitiveHeaderPredicate;
	}

	private RetryableClientHttpRequestInterceptor(RetryableClientHttpRequestInterceptor base,
			RetryClassifierChain classifierChain) {
		this.backOff = base.backOff;
		this.serviceClassifiers = base.serviceClassifiers;
		this.classifierChain = classifierChain;
		this.serviceErrorParser = base.serviceErrorParser;
		this.clientHttpResponseMapper = base.clientHttpResponseMapper;
		this.sensitiveHeaderPredicate = base.sensitiveHeaderPredicate;
	}

	/**
	 * Returns a copy of this interceptor for a single call. The customizer receives an
	 * empty operation level registry: classifiers added to it are merged with the client
	 * level ones, while {@link RetryClassifierRegistry#replaceAll} replaces them.
	 */
	public RetryableClientHttpRequestInterceptor withOverride(Consumer<RetryClassifierRegistry> customizer) {
		Assert.notNull(customizer, "'customizer' must not be null");
		RetryClassifierRegistry operation = RetryClassifierRegistry.empty();
		customizer.accept(operation);
		return new RetryableClientHttpRequestInterceptor(this,
				RetryClassifierChain.of(this.serviceClassifiers, operation));
	}

	public RetryClassifierChain classifierChain() {
		return this.classifierChain;
	}

	@Override
	public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
			throws IOException {
		final BackOffExecution backOffExecution = this.backOff.start();
		for (int i = 1; i <= MAX_ATTEMPTS; i++) {
			final long backOff = backOffExecution.nextBackOff();
			ClientHttpResponse response = null;
			IOException failure = null;
			AttemptContext context;
			try {
				final long begin = System.currentTimeMillis();
				if (log.isDebugEnabled()) {
					log.debug(withHeaders(new StringBuilder("type=req attempts=").append(i)
						.append(" method=")
						.append(request.getMethod())
						.append(" url=\"")
						.append(request.getURI())
						.append("\" "), request.getHeaders()));
				}
				ClientHttpResponse delegate = execution.execute(request, body);
				response = this.clientHttpResponseMapper == null ? delegate
						: this.clientHttpResponseMapper.apply(delegate);
				if (log.isDebugEnabled()) {
					long duration = System.currentTimeMillis() - begin;
					log.debug(withHeaders(new StringBuilder("type=res attempts=").append(i)
						.append(" method=")
						.append(request.getMethod())
						.append(" url=\"")
						.append(request.getURI())
						.append("\" response_code=")
						.append(response.getStatusCode().value())
						.append(" duration=")
						.append(duration)
						.append(" "), response.getHeaders()));
				}
				context = toAttemptContext(response);
			}
			catch (IOException e) {
				failure = e;
				context = response == null ? AttemptContext.ofException(e) : AttemptContext.ofException(response, e);
				if (log.isInfoEnabled()) {
					log.info(String.format(
							"type=exp attempts=%d method=%s url=\"%s\" exception_class=\"%s\" exception_message=\"%s\"",
							i, request.getMethod(), request.getURI(), e.getClass().getName(), e.getMessage()));
				}
			}
			final ClassificationOutcome outcome = this.classifierChain.classify(context);
			if (!outcome.isRetryIndicated()) {
				if (outcome.isRetryForbidden() && log.isInfoEnabled()) {
					log.info(String.format("type=fin attempts=%d method=%s url=\"%s\" reason=\"Retry forbidden\"", i,
							request.getMethod(), request.getURI()));
				}
				return responseOrThrow(response, failure);
			}
			if (backOff == BackOffExecution.STOP) {
				if (log.isWarnEnabled()) {
					log.warn(String.format("type=fin attempts=%d method=%s url=\"%s\" reason=\"No longer retryable\"",
							i, request.getMethod(), request.getURI()), failure);
				}
				return responseOrThrow(response, failure);
			}
			if (response != null) {
				response.close();
			}
			final long wait = waitMillis(outcome.retryReason(), backOff);
			if (log.isInfoEnabled()) {
				log.info(String.format("type=wtg attempts=%d method=%s url=\"%s\" reason=\"%s\" backoff=\"%s\" wait=%d",
						i, request.getMethod(), request.getURI(), outcome.retryReason(), backOffExecution, wait));
			}
			try {
				Thread.sleep(wait);
			}
			catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
			}
		}
		throw new IllegalStateException("Maximum number of attempts reached!");
	}

	private AttemptContext toAttemptContext(ClientHttpResponse response) {
		if (this.serviceErrorParser == null) {
			return AttemptContext.ofResponse(response);
		}
		ServiceError error;
		try {
			error = this.serviceErrorParser.parse(response);
		}
		catch (IOException e) {
			if (log.isDebugEnabled()) {
				log.debug("type=prs reason=\"Service error could not be parsed\"", e);
			}
			return AttemptContext.ofResponse(response);
		}
		return error == null ? AttemptContext.ofResponse(response) : AttemptContext.ofError(response, error);
	}

	private static long waitMillis(RetryReason reason, long backOff) {
		if (reason instanceof RetryReason.RetryableError && ((RetryReason.RetryableError) reason).hasRetryAfter()) {
			Duration retryAfter = ((RetryReason.RetryableError) reason).retryAfter();
			return retryAfter.compareTo(MAX_WAIT) > 0 ? Long.MAX_VALUE : retryAfter.toMillis();
		}
		return backOff;
	}

	private static ClientHttpResponse responseOrThrow(ClientHttpResponse response, IOException failure)
			throws IOException {
		if (failure != null) {
			if (response != null) {
				response.close();
			}
			throw failure;
		}
		return response;
	}

	private String withHeaders(StringBuilder message, HttpHeaders headers) {
		maskHeaders(headers).forEach((k, v) -> message.append(k.toLowerCase(Locale.US).replace("-", "_"))
			.append("=\"")
			.append(v.stream().map(RetryableClientHttpRequestInterceptor::escape).collect(Collectors.joining(",")))
			.append("\" "));
		return message.toString().trim();
	}

	private Map<String, List<String>> maskHeaders(HttpHeaders headers) {
		Map<String, List<String>> masked = new LinkedHashMap<>();
		headers.forEach((name, values) -> {
			if (this.sensitiveHeaderPredicate.test(name.toLowerCase(Locale.US))) {
				masked.put(name, values.stream().map(s -> "(masked)").collect(Collectors.toList()));
			}
			else {
				masked.put(name, values);
			}
		});
		return masked;
	}

	private static String escape(String input) {
		if (input == null) {
			return null;
		}
		StringBuilder escaped = new StringBuilder();
		for (char c : input.toCharArray()) {
			switch (c) {
				case '"':
					escaped.append("\\\"");
					break;
				case '\\':
					escaped.append("\\\\");
					break;
				case '\n':
					escaped.append("\\n");
					break;
				case '\r':
					escaped.append("\\r");
					break;
				case '\t':
					escaped.append("\\t");
					break;
				default:
					if (c <= 0x1F) {
						escaped.append(String.format("\\u%04x", (int) c));
					}
					else {
						escaped.append(c);
					}
					break;
			}
		}
		return escaped.toString();
	}

}
