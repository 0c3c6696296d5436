/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.revetware.secretapprovals.util;

import ch.qos.logback.classic.pattern.MessageConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.regex.Pattern;

/**
 * Logback converter that redacts encrypted secret material from log messages.
 * <p>
 * Ciphertext, IVs and auth tags are identified by their field names, whether they appear as JSON properties
 * ({@code "secretValueCiphertext":"..."}) or in record {@code toString()} output ({@code secretValueCiphertext=...}).
 * <p>
 * Usage in logback.xml:
 * <pre>{@code
 * <conversionRule conversionWord="msg" converterClass="com.revetware.secretapprovals.util.LoggingRedactor"/>
 * }</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LoggingRedactor extends MessageConverter {
	@NonNull
	private static final Pattern JSON_FIELD_PATTERN;
	@NonNull
	private static final Pattern TO_STRING_FIELD_PATTERN;

	static {
		JSON_FIELD_PATTERN = Pattern.compile("(\"\\w*(?:Ciphertext|Iv|Tag)\"\\s*:\\s*)\"[^\"]*\"");
		TO_STRING_FIELD_PATTERN = Pattern.compile("(\\b\\w*(?:Ciphertext|Iv|Tag)=)[^,\\]}\\s]+");
	}

	@Override
	public String convert(ILoggingEvent event) {
		return redact(super.convert(event));
	}

	@NonNull
	public static String redact(@NonNull String message) {
		String redacted = JSON_FIELD_PATTERN.matcher(message).replaceAll("$1\"[REDACTED]\"");
		return TO_STRING_FIELD_PATTERN.matcher(redacted).replaceAll("$1[REDACTED]");
	}
}
