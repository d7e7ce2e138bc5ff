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
import java.util.Optional;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Indicates a {@link ErrorCategory#TRANSIENT transient} retry when the attempt failed
 * with a timeout, an I/O or a connection level error, including a response that was
 * received but could not be read. Exceptions wrapping an {@link IOException}, such as Spring's
 * {@code ResourceAccessException}, are unwrapped.
 *
 * @since 0.1.0
 */
public final class TransientErrorClassifier implements RetryClassifier {

	private final Log log = LogFactory.getLog(TransientErrorClassifier.class);

	@Override
	public Optional<ClassificationOutcome> classify(AttemptContext context, ClassificationOutcome precedingOutcome) {
		if (!context.hasException()) {
			return Optional.empty();
		}
		IOException ioException = findIOException(context.exception());
		if (ioException != null) {
			if (log.isTraceEnabled()) {
				log.trace(String.format("type=cls classifier=\"%s\" failure=%s", name(),
						TransportFailure.of(ioException)));
			}
			return Optional.of(ClassificationOutcome.transientError());
		}
		return Optional.empty();
	}

	@Override
	public String name() {
		return "Transient Errors";
	}

	@Override
	public RetryClassifierPriority priority() {
		return RetryClassifierPriority.TRANSIENT_ERROR;
	}

	private static IOException findIOException(Throwable e) {
		Throwable current = e;
		while (current != null) {
			if (current instanceof IOException) {
				return (IOException) current;
			}
			current = current.getCause();
		}
		return null;
	}

	@Override
	public String toString() {
		return name();
	}

}
