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
import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class HttpStatusCodeClassifierTest {

	@ParameterizedTest
	@ValueSource(ints = { 500, 502, 503, 504 })
	void default_statuses_are_server_errors(int status) {
		assertThat(new HttpStatusCodeClassifier().classify(AttemptContext.ofResponse(new StubClientHttpResponse(status)),
				ClassificationOutcome.NO_OPINION))
			.contains(ClassificationOutcome.serverError());
	}

	@ParameterizedTest
	@ValueSource(ints = { 200, 400, 404, 429, 501 })
	void other_statuses_abstain(int status) {
		assertThat(new HttpStatusCodeClassifier().classify(AttemptContext.ofResponse(new StubClientHttpResponse(status)),
				ClassificationOutcome.NO_OPINION))
			.isEmpty();
	}

	@Test
	void custom_statuses() {
		HttpStatusCodeClassifier classifier = new HttpStatusCodeClassifier(Collections.singleton(429));
		assertThat(classifier.classify(AttemptContext.ofResponse(new StubClientHttpResponse(429)),
				ClassificationOutcome.NO_OPINION))
			.contains(ClassificationOutcome.serverError());
		assertThat(classifier.classify(AttemptContext.ofResponse(new StubClientHttpResponse(503)),
				ClassificationOutcome.NO_OPINION))
			.isEmpty();
	}

	@Test
	void no_response_abstains() {
		assertThat(new HttpStatusCodeClassifier().classify(AttemptContext.ofException(new IOException("reset")),
				ClassificationOutcome.NO_OPINION))
			.isEmpty();
	}

	@Test
	void unreadable_status_abstains() {
		AttemptContext context = AttemptContext.ofResponse(new StubClientHttpResponse(503).statusUnreadable());
		assertThat(context.statusCode()).isNull();
		assertThat(new HttpStatusCodeClassifier().classify(context, ClassificationOutcome.NO_OPINION)).isEmpty();
	}

}
