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
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import org.springframework.web.client.ResourceAccessException;

import static org.assertj.core.api.Assertions.assertThat;

class TransientErrorClassifierTest {

	private final TransientErrorClassifier classifier = new TransientErrorClassifier();

	static Stream<Exception> transportFailures() {
		return Stream.of(new SocketTimeoutException("Read timed out"), new ConnectException("Connection refused"),
				new UnknownHostException("noanswer.example.com"), new SocketException("Connection reset"),
				new IOException("Broken pipe"),
				new ResourceAccessException("I/O error", new SocketException("Connection reset")));
	}

	@ParameterizedTest
	@MethodSource("transportFailures")
	void transport_failure_is_transient(Exception e) {
		assertThat(this.classifier.classify(AttemptContext.ofException(e), ClassificationOutcome.NO_OPINION))
			.contains(ClassificationOutcome.transientError());
	}

	@Test
	void transport_failure_kinds() {
		assertThat(TransportFailure.of(new SocketTimeoutException())).isSameAs(TransportFailure.CLIENT_TIMEOUT);
		assertThat(TransportFailure.of(new ConnectException())).isSameAs(TransportFailure.CONNECT_TIMEOUT);
		assertThat(TransportFailure.of(new UnknownHostException())).isSameAs(TransportFailure.UNKNOWN_HOST);
		assertThat(TransportFailure.of(new SocketException("Connection reset")))
			.isSameAs(TransportFailure.CONNECTION_RESET);
		assertThat(TransportFailure.of(new IOException())).isSameAs(TransportFailure.IO);
	}

	@Test
	void io_failure_after_response_is_transient() {
		AttemptContext context = AttemptContext.ofException(new StubClientHttpResponse(200),
				new IOException("Premature EOF"));
		assertThat(this.classifier.classify(context, ClassificationOutcome.NO_OPINION))
			.contains(ClassificationOutcome.transientError());
	}

	@Test
	void non_io_failure_after_response_abstains() {
		AttemptContext context = AttemptContext.ofException(new StubClientHttpResponse(200),
				new IllegalStateException("Unexpected end of body"));
		assertThat(this.classifier.classify(context, ClassificationOutcome.NO_OPINION)).isEmpty();
	}

	@Test
	void non_io_failure_without_response_abstains() {
		AttemptContext context = AttemptContext.ofException(new IllegalArgumentException("Not absolute URI"));
		assertThat(this.classifier.classify(context, ClassificationOutcome.NO_OPINION)).isEmpty();
	}

	@Test
	void response_abstains() {
		assertThat(this.classifier.classify(AttemptContext.ofResponse(new StubClientHttpResponse(503)),
				ClassificationOutcome.NO_OPINION))
			.isEmpty();
	}

}
