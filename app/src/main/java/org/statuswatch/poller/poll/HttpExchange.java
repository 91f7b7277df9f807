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
package org.statuswatch.poller.poll;

import java.io.IOException;
import java.time.Duration;

/**
 * Sends a single HTTP request. Implementations do not retry.
 */
public interface HttpExchange {

    /**
     * Send the request and wait for the complete response.
     *
     * @param request Request to send
     * @param timeout Hard cutoff for this attempt
     * @return Received response, whatever its status
     * @throws java.io.InterruptedIOException if the attempt timed out
     * @throws IOException                    on connection or protocol errors
     * @throws InterruptedException           if the calling thread was interrupted;
     *                                        the in-flight request is cancelled first
     */
    HttpResponseData send(HttpRequestSpec request, Duration timeout) throws IOException, InterruptedException;
}
