/**
 * Copyright (C) 2015-2016, BMW Car IT GmbH and BMW AG
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.bmw.viterbi;

/**
 * Thrown if the transition matrix, the emission matrix and the initial state distribution do
 * not agree on a single number of states, or if the emission matrix rows differ in length.
 */
public class InvalidDimensionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidDimensionException(String message) {
        super(message);
    }

}
