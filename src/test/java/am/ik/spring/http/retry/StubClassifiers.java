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

import java.util.List;
import java.util.Optional;

final class StubClassifiers {

	private StubClassifiers() {
	}

	/**
	 * A classifier that always renders the given outcome and records its invocation.
	 */
	static RetryClassifier fixed(String name, RetryClassifierPriority priority, ClassificationOutcome outcome,
			List<String> invocations) {
		return RetryClassifier.of(name, priority, (context, preceding) -> {
			invocations.add(name);
			return Optional.of(outcome);
		});
	}

	static RetryClassifier abstaining(String name, RetryClassifierPriority priority, List<String> invocations) {
		return RetryClassifier.of(name, priority, (context, preceding) -> {
			invocations.add(name);
			return Optional.empty();
		});
	}

	static RetryClassifier named(String name, RetryClassifierPriority priority) {
		return RetryClassifier.of(name, priority, (context, preceding) -> Optional.empty());
	}

}
