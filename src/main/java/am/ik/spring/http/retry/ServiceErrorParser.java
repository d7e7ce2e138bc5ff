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

import org.springframework.http.client.ClientHttpResponse;

/**
 * Parses an HTTP response into a {@link ServiceError}. Implementations that need to read
 * the body should be combined with a
 * {@link RetryableClientHttpRequestInterceptor.Options#clientHttpResponseMapper buffering
 * response mapper} so that the body can still be consumed afterwards.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ServiceErrorParser {

	/**
	 * @return the parsed error, or {@code null} if the response is not an error
	 * @throws IOException if the error cannot be read; the attempt is then classified as
	 * if no error had been parsed
	 */
	ServiceError parse(ClientHttpResponse response) throws IOException;

}
