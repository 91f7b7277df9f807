/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.statuswatch.poller.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.statuswatch.poller.exception.SecretResolutionException;
import org.statuswatch.poller.model.ErrorKind;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DirectorySecretStoreTest {

    @TempDir
    Path secretDir;

    private DirectorySecretStore store;

    @BeforeEach
    void setUp() {
        store = new DirectorySecretStore(secretDir);
    }

    @Test
    void testRead_StripsTrailingNewline() throws Exception {
        Files.writeString(secretDir.resolve("token"), "abc123\r\n");
        assertEquals("abc123", store.read("token"));
    }

    @Test
    void testRead_KeepsInnerContent() throws Exception {
        Files.writeString(secretDir.resolve("graph"), "{\"api_key\":\"abc\"}\n");
        assertEquals("{\"api_key\":\"abc\"}", store.read("graph"));
    }

    @Test
    void testRead_SeesRotatedValue() throws Exception {
        Path secret = secretDir.resolve("token");
        Files.writeString(secret, "old");
        assertEquals("old", store.read("token"));

        Files.writeString(secret, "new");
        assertEquals("new", store.read("token"));
    }

    @Test
    void testRead_MissingSecret() {
        SecretResolutionException e = assertThrows(SecretResolutionException.class, () -> store.read("nope"));
        assertEquals(ErrorKind.SECRET_NOT_FOUND, e.getKind());
    }

    @Test
    void testRead_DirectoryIsNotASecret() throws Exception {
        Files.createDirectory(secretDir.resolve("folder"));
        assertThrows(SecretResolutionException.class, () -> store.read("folder"));
    }

    @Test
    void testRead_RejectsPathTraversal() {
        SecretResolutionException e = assertThrows(SecretResolutionException.class, () -> store.read("../etc/passwd"));
        assertEquals(ErrorKind.SECRET_NOT_FOUND, e.getKind());
    }
}
