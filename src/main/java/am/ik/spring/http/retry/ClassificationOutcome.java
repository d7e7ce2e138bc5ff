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
 * The verdict of a {@link RetryClassifier}, or the aggregate verdict of a
 * {@link RetryClassifierChain}.
 * <ul>
 * <li>{@link #NO_OPINION}: the classifier abstains. When the whole chain abstains the
 * attempt must not be retried.</li>
 * <li>{@link #retryIndicated(RetryReason)}: a retry is recommended.</li>
 * <li>{@link #RETRY_FORBIDDEN}: a veto. Evaluation stops and the attempt is never
 * retried.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class ClassificationOutcome {

	public enum Kind {

		NO_OPINION, RETRY_INDICATED, RETRY_FORBIDDEN

	}

	public static final ClassificationOutcome NO_OPINION = new ClassificationOutcome(Kind.NO_OPINION, null);

	public static final ClassificationOutcome RETRY_FORBIDDEN = new ClassificationOutcome(Kind.RETRY_FORBIDDEN,
			null);

	private final Kind kind;

	private final RetryReason retryReason;

	private ClassificationOutcome(Kind kind, RetryReason retryReason) {
		this.kind = kind;
		this.retryReason = retryReason;
	}

	public static ClassificationOutcome retryIndicated(RetryReason retryReason) {
		Assert.notNull(retryReason, "'retryReason' must not be null");
		return new ClassificationOutcome(Kind.RETRY_INDICATED, retryReason);
	}

	public static ClassificationOutcome transientError() {
		return retryIndicated(RetryReason.error(ErrorCategory.TRANSIENT));
	}

	public static ClassificationOutcome throttlingError() {
		return retryIndicated(RetryReason.error(ErrorCategory.THROTTLING));
	}

	public static ClassificationOutcome serverError() {
		return retryIndicated(RetryReason.error(ErrorCategory.SERVER));
	}

	public static ClassificationOutcome clientError() {
		return retryIndicated(RetryReason.error(ErrorCategory.CLIENT));
	}

	public static ClassificationOutcome retryAfter(ErrorCategory category, Duration retryAfter) {
		return retryIndicated(RetryReason.error(category, retryAfter));
	}

	public Kind kind() {
		return this.kind;
	}

	/**
	 * @return the reason of the retry, or {@code null} unless a retry is indicated
	 */
	public RetryReason retryReason() {
		return this.retryReason;
	}

	public boolean isNoOpinion() {
		return this.kind == Kind.NO_OPINION;
	}

	public boolean isRetryIndicated() {
		return this.kind == Kind.RETRY_INDICATED;
	}

	public boolean isRetryForbidden() {
		return this.kind == Kind.RETRY_FORBIDDEN;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ClassificationOutcome)) {
			return false;
		}
		ClassificationOutcome that = (ClassificationOutcome) o;
		return this.kind == that.kind && Objects.equals(this.retryReason, that.retryReason);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.kind, this.retryReason);
	}

	@Override
	public String toString() {
		if (this.kind == Kind.RETRY_INDICATED) {
			return "RetryIndicated(" + this.retryReason + ")";
		}
		return this.kind == Kind.NO_OPINION ? "NoOpinion" : "RetryForbidden";
	}

}
