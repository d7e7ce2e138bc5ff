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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;

class StubClientHttpResponse implements ClientHttpResponse {

	private final int status;

	private final HttpHeaders headers = new HttpHeaders();

	private final byte[] body;

	private boolean statusUnreadable = false;

	private boolean closed = false;

	StubClientHttpResponse(int status) {
		this(status, "");
	}

	StubClientHttpResponse(int status, String body) {
		this.status = status;
		this.body = body.getBytes(StandardCharsets.UTF_8);
	}

	StubClientHttpResponse header(String name, String value) {
		this.headers.add(name, value);
		return this;
	}

	StubClientHttpResponse statusUnreadable() {
		this.statusUnreadable = true;
		return this;
	}

	@Override
	public HttpStatusCode getStatusCode() throws IOException {
		if (this.statusUnreadable) {
			throw new IOException("Connection closed while reading status line");
		}
		return HttpStatusCode.valueOf(this.status);
	}

	@Override
	public String getStatusText() {
		return "";
	}

	@Override
	public void close() {
		this.closed = true;
	}

	boolean isClosed() {
		return this.closed;
	}

	@Override
	public HttpHeaders getHeaders() {
		return this.headers;
	}

	@Override
	public InputStream getBody() {
		return new ByteArrayInputStream(this.body);
	}

}
