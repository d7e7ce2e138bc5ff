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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.Assert;

/**
 * Read-only view over the outcome of one request attempt, as seen by
 * {@link RetryClassifier}s. Depending on how far the attempt got, it carries
 * <ul>
 * <li>the raw response, if one was received,</li>
 * <li>the parsed output or the parsed {@link ServiceError}, if deserialization
 * succeeded,</li>
 * <li>the exception, if no response (or no readable response) was obtained.</li>
 * </ul>
 * The status code is read once at construction time so that classifiers never have to
 * deal with the {@link IOException} thrown by {@link ClientHttpResponse}.
 *
 * @since 0.1.0
 */
public final class AttemptContext {

	private static final Log log = LogFactory.getLog(AttemptContext.class);

	private final ClientHttpResponse response;

	private final Integer statusCode;

	private final Object output;

	private final ServiceError error;

	private final Exception exception;

	private AttemptContext(ClientHttpResponse response, Object output, ServiceError error, Exception exception) {
		this.response = response;
		this.statusCode = response == null ? null : readStatusCode(response);
		this.output = output;
		this.error = error;
		this.exception = exception;
	}

	public static AttemptContext ofResponse(ClientHttpResponse response) {
		Assert.notNull(response, "'response' must not be null");
		return new AttemptContext(response, null, null, null);
	}

	public static AttemptContext ofOutput(ClientHttpResponse response, Object output) {
		Assert.notNull(response, "'response' must not be null");
		return new AttemptContext(response, output, null, null);
	}

	public static AttemptContext ofError(ClientHttpResponse response, ServiceError error) {
		Assert.notNull(response, "'response' must not be null");
		return new AttemptContext(response, null, error, null);
	}

	/**
	 * The attempt failed before any response was received.
	 */
	public static AttemptContext ofException(Exception exception) {
		Assert.notNull(exception, "'exception' must not be null");
		return new AttemptContext(null, null, null, exception);
	}

	/**
	 * A response was received but could not be read.
	 */
	public static AttemptContext ofException(ClientHttpResponse response, Exception exception) {
		Assert.notNull(response, "'response' must not be null");
		Assert.notNull(exception, "'exception' must not be null");
		return new AttemptContext(response, null, null, exception);
	}

	public ClientHttpResponse response() {
		return this.response;
	}

	public boolean hasResponse() {
		return this.response != null;
	}

	/**
	 * @return the HTTP status code, or {@code null} if there is no response or the status
	 * could not be read
	 */
	public Integer statusCode() {
		return this.statusCode;
	}

	/**
	 * @return the response headers, empty if there is no response
	 */
	public HttpHeaders headers() {
		return this.response == null ? HttpHeaders.EMPTY : this.response.getHeaders();
	}

	public Object output() {
		return this.output;
	}

	public ServiceError error() {
		return this.error;
	}

	public boolean hasError() {
		return this.error != null;
	}

	public Exception exception() {
		return this.exception;
	}

	public boolean hasException() {
		return this.exception != null;
	}

	private static Integer readStatusCode(ClientHttpResponse response) {
		try {
			return response.getStatusCode().value();
		}
		catch (IOException e) {
			if (log.isDebugEnabled()) {
				log.debug("type=ctx reason=\"Status code unavailable\"", e);
			}
			return null;
		}
	}

	@Override
	public String toString() {
		if (this.exception != null) {
			return this.exception.toString();
		}
		else if (this.error != null) {
			return this.error.toString();
		}
		else if (this.statusCode != null) {
			return "status=" + this.statusCode;
		}
		return "null";
	}

}
