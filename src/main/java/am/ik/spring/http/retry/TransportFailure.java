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

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URLConnection;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.concurrent.TimeoutException;

/**
 * Kinds of transport level failure recognized by {@link TransientErrorClassifier}. All of
 * them are transient; the kind only shows up in diagnostics.
 */
enum TransportFailure {

	/**
	 * @see URLConnection#setReadTimeout(int)
	 */
	CLIENT_TIMEOUT {
		@Override
		boolean matches(IOException e) {
			return e instanceof SocketTimeoutException || e.getCause() instanceof TimeoutException
					|| (e instanceof HttpTimeoutException && !(e instanceof HttpConnectTimeoutException));
		}
	},
	UNKNOWN_HOST {
		@Override
		boolean matches(IOException e) {
			return e instanceof UnknownHostException
					|| (e instanceof ConnectException && e.getCause() instanceof ConnectException
							&& e.getCause().getCause() instanceof UnresolvedAddressException);
		}
	},
	/**
	 * @see URLConnection#setConnectTimeout(int)
	 */
	CONNECT_TIMEOUT {
		@Override
		boolean matches(IOException e) {
			return e instanceof ConnectException || e instanceof HttpConnectTimeoutException;
		}
	},
	CONNECTION_RESET {
		@Override
		boolean matches(IOException e) {
			return e instanceof SocketException || e instanceof EOFException;
		}
	},
	IO {
		@Override
		boolean matches(IOException e) {
			return true;
		}
	};

	abstract boolean matches(IOException e);

	static TransportFailure of(IOException e) {
		for (TransportFailure failure : values()) {
			if (failure.matches(e)) {
				return failure;
			}
		}
		return IO;
	}

}
