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

import java.util.Objects;
import java.util.Optional;

final class SimpleServiceError implements ServiceError {

	private final String code;

	private final String message;

	private final ErrorCategory retryableErrorCategory;

	SimpleServiceError(String code, String message, ErrorCategory retryableErrorCategory) {
		this.code = code;
		this.message = message;
		this.retryableErrorCategory = retryableErrorCategory;
	}

	@Override
	public String code() {
		return this.code;
	}

	@Override
	public String message() {
		return this.message;
	}

	@Override
	public Optional<ErrorCategory> retryableErrorCategory() {
		return Optional.ofNullable(this.retryableErrorCategory);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SimpleServiceError)) {
			return false;
		}
		SimpleServiceError that = (SimpleServiceError) o;
		return Objects.equals(this.code, that.code) && Objects.equals(this.message, that.message)
				&& this.retryableErrorCategory == that.retryableErrorCategory;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.code, this.message, this.retryableErrorCategory);
	}

	@Override
	public String toString() {
		return "ServiceError{code=" + this.code + ", message=" + this.message + ", retryable="
				+ this.retryableErrorCategory + "}";
	}

}
