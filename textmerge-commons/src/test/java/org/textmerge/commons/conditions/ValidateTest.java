/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.textmerge.commons.conditions;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class ValidateTest {

    @Test
    public void argumentMessage() {
        try {
            Validate.checkArgument(false, "Number of given sources (%s) must be greater than 1", 1);
            fail("expected failure");
        } catch (IllegalArgumentException e) {
            assertEquals("Number of given sources (1) must be greater than 1", e.getMessage());
        }
        Validate.checkArgument(true, "not used");
    }

    @Test(expected = IllegalStateException.class)
    public void stateFails() {
        Validate.checkState(false, "size = %s", 3);
    }

    @Test
    public void templateArguments() {
        assertEquals(2, Validate.countArguments("%s of %d"));
        assertEquals(1, Validate.countArguments("100%% of %s"));
        assertTrue(Validate.checkTemplate("%s", "a"));
        assertFalse(Validate.checkTemplate("%s %s", "a"));
    }
}
