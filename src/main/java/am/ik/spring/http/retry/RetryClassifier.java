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
import java.util.function.BiFunction;

import org.springframework.util.Assert;

/**
 * A rule that inspects one attempt and renders an opinion on whether it should be
 * retried. Built-in and user defined classifiers are interchangeable and run through the
 * same {@link RetryClassifierChain}.
 * <p>
 * Implementations must be side-effect free and must not block or throw. A classifier
 * that cannot decide, for example because it needs a parsed response that is not
 * available, abstains by returning {@link Optional#empty()}.
 *
 * @since 0.1.0
 */
public interface RetryClassifier {

	/**
	 * @param context the attempt to classify
	 * @param precedingOutcome the aggregate outcome of the lower priority classifiers
	 * evaluated so far in this run
	 * @return the opinion of this classifier, or empty to abstain
	 */
	Optional<ClassificationOutcome> classify(AttemptContext context, ClassificationOutcome precedingOutcome);

	/**
	 * @return a stable name used in diagnostics only
	 */
	String name();

	default RetryClassifierPriority priority() {
		return RetryClassifierPriority.defaultPriority();
	}

	static RetryClassifier of(String name, RetryClassifierPriority priority,
			BiFunction<AttemptContext, ClassificationOutcome, Optional<ClassificationOutcome>> classifier) {
		Assert.hasText(name, "'name' must not be empty");
		Assert.notNull(priority, "'priority' must not be null");
		Assert.notNull(classifier, "'classifier' must not be null");
		return new RetryClassifier() {
			@Override
			public Optional<ClassificationOutcome> classify(AttemptContext context,
					ClassificationOutcome precedingOutcome) {
				return classifier.apply(context, precedingOutcome);
			}

			@Override
			public String name() {
				return name;
			}

			@Override
			public RetryClassifierPriority priority() {
				return priority;
			}

			@Override
			public String toString() {
				return name;
			}
		};
	}

}
