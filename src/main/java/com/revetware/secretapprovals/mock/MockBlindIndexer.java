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

package com.revetware.secretapprovals.mock;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.revetware.secretapprovals.util.BlindIndexer;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Base64;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Mock implementation of {@link BlindIndexer} which computes HMAC-SHA256 indexes locally.
 * <p>
 * Project salts are derived from the project ID with a fixed development key, so they are stable across restarts and
 * safe to evict from the cache.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MockBlindIndexer implements BlindIndexer {
	@NonNull
	private static final String HMAC_ALGORITHM;
	@NonNull
	private static final byte[] DEVELOPMENT_ROOT_KEY;

	static {
		HMAC_ALGORITHM = "HmacSHA256";
		DEVELOPMENT_ROOT_KEY = "mock-blind-indexer-development-root-key".getBytes(StandardCharsets.UTF_8);
	}

	@NonNull
	private final LoadingCache<@NonNull UUID, @NonNull String> saltsByProjectId;
	@NonNull
	private final Logger logger;

	public MockBlindIndexer(@NonNull Long saltCacheMaximumSize,
													@NonNull Duration saltCacheExpiration) {
		requireNonNull(saltCacheMaximumSize);
		requireNonNull(saltCacheExpiration);

		this.logger = LoggerFactory.getLogger(getClass());
		this.saltsByProjectId = Caffeine.newBuilder()
				.maximumSize(saltCacheMaximumSize)
				.expireAfterAccess(saltCacheExpiration)
				.build(this::deriveProjectSalt);
	}

	@NonNull
	@Override
	public String getOrCreateProjectSalt(@NonNull UUID projectId) {
		requireNonNull(projectId);
		return this.saltsByProjectId.get(projectId);
	}

	@NonNull
	@Override
	public String computeBlindIndex(@NonNull String secretName,
																	@NonNull String salt) {
		requireNonNull(secretName);
		requireNonNull(salt);

		return Base64.getEncoder().encodeToString(hmac(Base64.getDecoder().decode(salt), secretName.getBytes(StandardCharsets.UTF_8)));
	}

	@NonNull
	private String deriveProjectSalt(@NonNull UUID projectId) {
		requireNonNull(projectId);

		getLogger().debug("Deriving mock salt for project ID {}", projectId);

		ByteBuffer projectIdBytes = ByteBuffer.allocate(16);
		projectIdBytes.putLong(projectId.getMostSignificantBits());
		projectIdBytes.putLong(projectId.getLeastSignificantBits());

		return Base64.getEncoder().encodeToString(hmac(DEVELOPMENT_ROOT_KEY, projectIdBytes.array()));
	}

	@NonNull
	private byte[] hmac(@NonNull byte[] key,
											@NonNull byte[] data) {
		requireNonNull(key);
		requireNonNull(data);

		try {
			Mac mac = Mac.getInstance(HMAC_ALGORITHM);
			mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
			return mac.doFinal(data);
		} catch (NoSuchAlgorithmException | InvalidKeyException e) {
			throw new IllegalStateException(e);
		}
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
