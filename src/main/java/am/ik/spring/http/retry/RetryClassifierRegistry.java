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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Predicate;

import org.springframework.util.Assert;

/**
 * The classifiers contributed by one configuration layer, e.g. the client (service)
 * level or a single call (operation). The contents are always kept in ascending
 * {@link RetryClassifierPriority priority} order; classifiers of equal priority keep the
 * order in which they were registered.
 * <p>
 * A registry is mutable only until it is {@link #freeze() frozen}, which happens when a
 * {@link RetryClassifierChain} is built from it. After that only
 * {@link #effectiveSequence()} may be used.
 *
 * @since 0.1.0
 */
public final class RetryClassifierRegistry {

	static final Comparator<RetryClassifier> BY_PRIORITY = Comparator.comparing(RetryClassifier::priority);

	private final List<RetryClassifier> classifiers = new ArrayList<>();

	private boolean replacing = false;

	private volatile boolean frozen = false;

	private RetryClassifierRegistry() {
	}

	public static RetryClassifierRegistry empty() {
		return new RetryClassifierRegistry();
	}

	/**
	 * @return a registry holding the built-in classifiers
	 */
	public static RetryClassifierRegistry defaults() {
		return defaults(HttpStatusCodeClassifier.DEFAULT_RETRYABLE_RESPONSE_STATUSES);
	}

	/**
	 * @return a registry holding the built-in classifiers, with
	 * {@link HttpStatusCodeClassifier} retrying the given statuses
	 */
	public static RetryClassifierRegistry defaults(Collection<Integer> retryableResponseStatuses) {
		return empty().add(new TransientErrorClassifier())
			.add(new ModeledAsRetryableClassifier())
			.add(new ServiceErrorCodeClassifier())
			.add(new HttpStatusCodeClassifier(new LinkedHashSet<>(retryableResponseStatuses)));
	}

	public RetryClassifierRegistry add(RetryClassifier classifier) {
		Assert.notNull(classifier, "'classifier' must not be null");
		assertNotFrozen();
		this.classifiers.add(classifier);
		this.classifiers.sort(BY_PRIORITY);
		return this;
	}

	/**
	 * Discards the current contents and installs the given classifiers. The layer then
	 * supersedes the layers beneath it instead of adding to them.
	 */
	public RetryClassifierRegistry replaceAll(Collection<? extends RetryClassifier> classifiers) {
		Assert.notNull(classifiers, "'classifiers' must not be null");
		Assert.noNullElements(classifiers, "'classifiers' must not contain null");
		assertNotFrozen();
		this.classifiers.clear();
		this.classifiers.addAll(classifiers);
		this.classifiers.sort(BY_PRIORITY);
		this.replacing = true;
		return this;
	}

	public RetryClassifierRegistry replaceAll(RetryClassifier... classifiers) {
		return this.replaceAll(Arrays.asList(classifiers));
	}

	/**
	 * Removes the classifiers of this layer that match the given predicate.
	 */
	public RetryClassifierRegistry removeIf(Predicate<? super RetryClassifier> filter) {
		Assert.notNull(filter, "'filter' must not be null");
		assertNotFrozen();
		this.classifiers.removeIf(filter);
		return this;
	}

	/**
	 * @return the classifiers of this layer in ascending priority order
	 */
	public List<RetryClassifier> effectiveSequence() {
		return Collections.unmodifiableList(new ArrayList<>(this.classifiers));
	}

	public boolean isReplacing() {
		return this.replacing;
	}

	public RetryClassifierRegistry freeze() {
		this.frozen = true;
		return this;
	}

	public boolean isFrozen() {
		return this.frozen;
	}

	private void assertNotFrozen() {
		Assert.state(!this.frozen, "The registry is frozen and can no longer be modified");
	}

	@Override
	public String toString() {
		return "RetryClassifierRegistry" + this.classifiers + (this.replacing ? " (replacing)" : "");
	}

}
