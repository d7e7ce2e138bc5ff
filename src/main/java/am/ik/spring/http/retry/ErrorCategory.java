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

/**
 * Broad category of a retryable failure.
 *
 * @since 0.1.0
 */
public enum ErrorCategory {

	/**
	 * Timeouts, I/O and connection level failures.
	 */
	TRANSIENT,

	/**
	 * The server is rate limiting the caller.
	 */
	THROTTLING,

	/**
	 * The server failed to handle an otherwise valid request.
	 */
	SERVER,

	/**
	 * The request itself was at fault but may succeed when sent again.
	 */
	CLIENT

}
