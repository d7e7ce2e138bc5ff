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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.util.Assert;

/**
 * The frozen, priority ordered sequence of classifiers that is active for a call, and the
 * algorithm that runs it against an attempt.
 * <p>
 * Classifiers are evaluated from the lowest to the highest priority. Every classifier
 * that does not abstain overwrites the running result, so the highest priority opinion
 * wins. A {@link ClassificationOutcome#RETRY_FORBIDDEN} result stops the evaluation
 * immediately. If every classifier abstains the result is
 * {@link ClassificationOutcome#NO_OPINION}, which means "do not retry".
 * <p>
 * Instances are immutable and can be shared between concurrent calls.
 *
 * @since 0.1.0
 */
public final class RetryClassifierChain {

	private static final Log log = LogFactory.getLog(RetryClassifierChain.class);

	private final List<RetryClassifier> classifiers;

	private RetryClassifierChain(List<RetryClassifier> classifiers) {
		this.classifiers = Collections.unmodifiableList(classifiers);
	}

	/**
	 * Freezes the given registry and builds a chain from it.
	 */
	public static RetryClassifierChain of(RetryClassifierRegistry registry) {
		Assert.notNull(registry, "'registry' must not be null");
		return new RetryClassifierChain(new ArrayList<>(registry.freeze().effectiveSequence()));
	}

	/**
	 * Freezes both layers and merges them into a chain. If the operation layer replaced
	 * its contents, it supersedes the service layer. Otherwise the classifiers of both
	 * layers are combined and re-sorted; among equal priorities service level
	 * classifiers come first.
	 */
	public static RetryClassifierChain of(RetryClassifierRegistry service, RetryClassifierRegistry operation) {
		Assert.notNull(service, "'service' must not be null");
		Assert.notNull(operation, "'operation' must not be null");
		service.freeze();
		operation.freeze();
		if (operation.isReplacing()) {
			return new RetryClassifierChain(new ArrayList<>(operation.effectiveSequence()));
		}
		List<RetryClassifier> merged = new ArrayList<>(service.effectiveSequence());
		merged.addAll(operation.effectiveSequence());
		merged.sort(RetryClassifierRegistry.BY_PRIORITY);
		return new RetryClassifierChain(merged);
	}

	public static RetryClassifierChain defaults() {
		return of(RetryClassifierRegistry.defaults());
	}

	/**
	 * @return the classifiers in evaluation order
	 */
	public List<RetryClassifier> classifiers() {
		return this.classifiers;
	}

	public boolean isEmpty() {
		return this.classifiers.isEmpty();
	}

	public ClassificationOutcome classify(AttemptContext context) {
		Assert.notNull(context, "'context' must not be null");
		ClassificationOutcome result = ClassificationOutcome.NO_OPINION;
		for (RetryClassifier classifier : this.classifiers) {
			Optional<ClassificationOutcome> outcome = classifier.classify(context, result);
			if (outcome == null) {
				outcome = Optional.empty();
			}
			if (log.isTraceEnabled()) {
				log.trace(String.format("type=cls classifier=\"%s\" outcome=\"%s\"", classifier.name(),
						outcome.map(ClassificationOutcome::toString).orElse("None")));
			}
			if (!outcome.isPresent() || outcome.get().isNoOpinion()) {
				continue;
			}
			result = outcome.get();
			if (result.isRetryForbidden()) {
				if (log.isDebugEnabled()) {
					log.debug(String.format("type=cls classifier=\"%s\" reason=\"Retry forbidden\" context=\"%s\"",
							classifier.name(), context));
				}
				return result;
			}
		}
		if (log.isDebugEnabled()) {
			log.debug(String.format("type=cls outcome=\"%s\" context=\"%s\"", result, context));
		}
		return result;
	}

	@Override
	public String toString() {
		return "RetryClassifierChain" + this.classifiers;
	}

}
