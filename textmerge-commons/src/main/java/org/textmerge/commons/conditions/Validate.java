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

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.textmerge.commons.properties.SystemPropertySupplier;

/**
 * Argument and state checks used by the merge entry points. Failed argument
 * checks surface as {@link IllegalArgumentException} before any I/O happens,
 * failed state checks as {@link IllegalStateException}.
 */
public final class Validate {

    private Validate() {
        // no instances for you
    }

    private static final Logger LOG = LoggerFactory.getLogger(Validate.class);

    // when true, message templates are checked even when the condition holds
    private static final boolean CHECK_MESSAGE_TEMPLATE = SystemPropertySupplier
            .create("textmerge.checks.messageTemplate", false).loggingTo(LOG).get();

    /**
     * Checks the specified expression
     *
     * @param expression
     *            to check
     * @param message
     *            to use in exception
     * @throws IllegalArgumentException
     *             when false
     */
    public static void checkArgument(boolean expression, @NotNull String message) throws IllegalArgumentException {
        Objects.requireNonNull(message);
        if (!expression) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Checks the specified expression
     *
     * @param expression
     *            to check
     * @param messageTemplate
     *            to use in exception (using {@link String#format} syntax)
     * @param messageArgs
     *            arguments of the template
     * @throws IllegalArgumentException
     *             when false
     */
    public static void checkArgument(boolean expression, @NotNull String messageTemplate, @Nullable Object... messageArgs) {
        Objects.requireNonNull(messageTemplate);
        if (CHECK_MESSAGE_TEMPLATE) {
            checkTemplate(messageTemplate, messageArgs);
        }
        if (!expression) {
            throw new IllegalArgumentException(format(messageTemplate, messageArgs));
        }
    }

    /**
     * Checks whether the specified expression is true
     *
     * @param expression expression to check
     * @param messageTemplate to use in exception (using {@link String#format} syntax)
     * @param messageArgs arguments to use in messageTemplate
     * @throws IllegalStateException if expression is false
     */
    public static void checkState(boolean expression, @NotNull String messageTemplate, @Nullable Object... messageArgs) {
        Objects.requireNonNull(messageTemplate);
        if (CHECK_MESSAGE_TEMPLATE) {
            checkTemplate(messageTemplate, messageArgs);
        }
        if (!expression) {
            throw new IllegalStateException(format(messageTemplate, messageArgs));
        }
    }

    private static String format(String messageTemplate, Object... messageArgs) {
        if (!CHECK_MESSAGE_TEMPLATE) {
            checkTemplate(messageTemplate, messageArgs);
        }
        return String.format(messageTemplate, messageArgs);
    }

    static boolean checkTemplate(@NotNull String messageTemplate, @Nullable Object... messageArgs) {
        int argsSpecified = messageArgs == null ? 0 : messageArgs.length;
        int argsInTemplate = countArguments(messageTemplate);
        if (argsSpecified != argsInTemplate) {
            LOG.error("Invalid message format: template '{}', argument count {}", messageTemplate, argsSpecified);
            return false;
        }
        return true;
    }

    static int countArguments(String template) {
        int count = 0;
        boolean inEscape = false;
        for (char c : template.toCharArray()) {
            if (inEscape) {
                if (c != '%') {
                    count++;
                }
                inEscape = false;
            } else if (c == '%') {
                inEscape = true;
            }
        }
        return count;
    }
}
