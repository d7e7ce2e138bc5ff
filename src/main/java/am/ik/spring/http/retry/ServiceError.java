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

import java.util.Optional;

/**
 * An error response parsed into the shape the service's interface contract declares.
 *
 * @since 0.1.0
 */
public interface ServiceError {

	/**
	 * @return the service specific error code such as {@code ThrottlingException}, or
	 * {@code null} if the response did not carry one
	 */
	String code();

	/**
	 * @return the error message, or {@code null}
	 */
	String message();

	/**
	 * @return the category under which the service contract declares this error
	 * retryable, or empty if it is not declared retryable
	 */
	default Optional<ErrorCategory> retryableErrorCategory() {
		return Optional.empty();
	}

	static ServiceError of(String code, String message) {
		return new SimpleServiceError(code, message, null);
	}

	static ServiceError retryable(String code, String message, ErrorCategory category) {
		return new SimpleServiceError(code, message, category);
	}

}
