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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.UUID;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MockBlindIndexerTests {
	@Test
	public void testIndexesAreDeterministicPerProject() {
		MockBlindIndexer blindIndexer = new MockBlindIndexer(10L, Duration.ofMinutes(1));
		UUID projectId = UUID.randomUUID();
		UUID otherProjectId = UUID.randomUUID();

		String salt = blindIndexer.getOrCreateProjectSalt(projectId);

		Assertions.assertEquals(salt, blindIndexer.getOrCreateProjectSalt(projectId), "Salt should be stable");
		Assertions.assertEquals(salt, new MockBlindIndexer(10L, Duration.ofMinutes(1)).getOrCreateProjectSalt(projectId),
				"Salt should survive a restart");
		Assertions.assertNotEquals(salt, blindIndexer.getOrCreateProjectSalt(otherProjectId), "Projects should not share salts");

		String index = blindIndexer.computeBlindIndex("DATABASE_URL", salt);

		Assertions.assertEquals(index, blindIndexer.computeBlindIndex("DATABASE_URL", salt));
		Assertions.assertNotEquals(index, blindIndexer.computeBlindIndex("DATABASE_URl", salt), "Names are case-sensitive");
		Assertions.assertNotEquals(index, blindIndexer.computeBlindIndex("DATABASE_URL", blindIndexer.getOrCreateProjectSalt(otherProjectId)));
		Assertions.assertFalse(index.contains("DATABASE_URL"), "Index should not disclose the name");
	}
}
