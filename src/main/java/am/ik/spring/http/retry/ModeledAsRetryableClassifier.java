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
 * Indicates a retry when the parsed {@link ServiceError} is declared retryable by the
 * service's interface contract, using the category the contract gives.
 *
 * @since 0.1.0
 */
public final class ModeledAsRetryableClassifier implements RetryClassifier {

	@Override
	public Optional<ClassificationOutcome> classify(AttemptContext context, ClassificationOutcome precedingOutcome) {
		if (!context.hasError()) {
			return Optional.empty();
		}
		return context.error()
			.retryableErrorCategory()
			.map(category -> ClassificationOutcome.retryIndicated(RetryReason.error(category)));
	}

	@Override
	public String name() {
		return "Errors Modeled As Retryable";
	}

	@Override
	public RetryClassifierPriority priority() {
		return RetryClassifierPriority.MODELED_AS_RETRYABLE;
	}

	@Override
	public String toString() {
		return name();
	}

}
