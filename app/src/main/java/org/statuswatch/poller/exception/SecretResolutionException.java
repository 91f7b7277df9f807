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
package org.statuswatch.poller.exception;

import org.statuswatch.poller.model.ErrorKind;

/**
 * The credential could not be resolved from an otherwise healthy secret store.
 * Converted by the poller into a failed poll result.
 */
public class SecretResolutionException extends PollerException {

    private SecretResolutionException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public static SecretResolutionException notFound(String secretName) {
        return new SecretResolutionException(ErrorKind.SECRET_NOT_FOUND,
                "Secret '" + secretName + "' not found", null);
    }

    public static SecretResolutionException fieldMissing(String secretName, String jsonKey) {
        return new SecretResolutionException(ErrorKind.SECRET_FIELD_MISSING,
                "Secret '" + secretName + "' has no field '" + jsonKey + "'", null);
    }

    public static SecretResolutionException formatError(String secretName, String reason, Throwable cause) {
        return new SecretResolutionException(ErrorKind.SECRET_FORMAT_ERROR,
                "Secret '" + secretName + "' is not a JSON object: " + reason, cause);
    }
}
