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
import java.util.Objects;

import org.springframework.util.Assert;

/**
 * Why a retry is warranted. New kinds of reasons may be added in the future, so callers
 * should check the concrete type rather than assume {@link RetryableError} is the only
 * one.
 *
 * @since 0.1.0
 */
public interface RetryReason {

	static RetryReason error(ErrorCategory category) {
		return new RetryableError(category, null);
	}

	static RetryReason error(ErrorCategory category, Duration retryAfter) {
		Assert.notNull(retryAfter, "'retryAfter' must not be null");
		return new RetryableError(category, retryAfter);
	}

	/**
	 * The attempt failed with an error of the given category. {@link #retryAfter()} is
	 * set when the failed party told us how long to wait.
	 */
	final class RetryableError implements RetryReason {

		private final ErrorCategory category;

		private final Duration retryAfter;

		RetryableError(ErrorCategory category, Duration retryAfter) {
			Assert.notNull(category, "'category' must not be null");
			Assert.isTrue(retryAfter == null || !retryAfter.isNegative(), "'retryAfter' must not be negative");
			this.category = category;
			this.retryAfter = retryAfter;
		}

		public ErrorCategory category() {
			return this.category;
		}

		/**
		 * @return the explicit delay, or {@code null} if none was given
		 */
		public Duration retryAfter() {
			return this.retryAfter;
		}

		public boolean hasRetryAfter() {
			return this.retryAfter != null;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof RetryableError)) {
				return false;
			}
			RetryableError that = (RetryableError) o;
			return this.category == that.category && Objects.equals(this.retryAfter, that.retryAfter);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.category, this.retryAfter);
		}

		@Override
		public String toString() {
			return this.retryAfter == null ? this.category.name()
					: this.category.name() + " retry_after=" + this.retryAfter;
		}

	}

}
