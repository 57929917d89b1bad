/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.jackrabbit.shareddoc.commons.properties;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a typed JVM system property with a default.
 * <ul>
 * <li>TRACE level logging of the raw lookup
 * <li>ERROR level logging when the value does not parse or fails the
 * {@link Predicate} given to {@link #validateWith(Predicate)}; the default
 * is used in that case
 * <li>INFO level logging when the effective value differs from the default
 * </ul>
 * Supported types are {@link Boolean}, {@link Integer}, {@link Long},
 * {@link Double} and {@link String}.
 */
public class SystemPropertySupplier<T> implements Supplier<T> {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertySupplier.class);

    private final String propName;
    private final T defaultValue;
    private final Function<String, T> parser;

    private Logger log = LOG;
    private Predicate<T> validator = (a) -> true;
    private Function<String, String> sysPropReader = System::getProperty;

    private SystemPropertySupplier(@NotNull String propName, @NotNull T defaultValue) {
        this.propName = Objects.requireNonNull(propName, "propertyName must be non-null");
        this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue must be non-null");
        this.parser = getValueParser(defaultValue);
    }

    /**
     * Create it for a given property name and default value.
     *
     * @throws IllegalArgumentException for unsupported value types
     */
    public static <U> SystemPropertySupplier<U> create(@NotNull String propName, @NotNull U defaultValue) {
        return new SystemPropertySupplier<U>(propName, defaultValue);
    }

    /**
     * Log to the given logger instead of the one of this class.
     */
    public SystemPropertySupplier<T> loggingTo(@NotNull Logger log) {
        this.log = Objects.requireNonNull(log);
        return this;
    }

    /**
     * Reject parsed values for which {@code validator} is false.
     */
    public SystemPropertySupplier<T> validateWith(@NotNull Predicate<T> validator) {
        this.validator = Objects.requireNonNull(validator);
        return this;
    }

    /**
     * <em>For unit testing</em>: read properties with the given function
     * instead of {@link System#getProperty(String)}.
     */
    protected SystemPropertySupplier<T> usingSystemPropertyReader(@NotNull Function<String, String> sysPropReader) {
        this.sysPropReader = Objects.requireNonNull(sysPropReader);
        return this;
    }

    @Override
    public T get() {
        T returnValue = defaultValue;

        String value = sysPropReader.apply(propName);
        if (value == null) {
            log.trace("System property {} not set", propName);
            return returnValue;
        }

        log.trace("System property {} set to '{}'", propName, value);
        try {
            T v = parser.apply(value.trim());
            if (validator.test(v)) {
                returnValue = v;
            } else {
                log.error("Ignoring invalid value '{}' for system property {}", value, propName);
            }
        } catch (NumberFormatException ex) {
            log.error("Ignoring malformed value '{}' for system property {}", value, propName);
        }

        if (!returnValue.equals(defaultValue)) {
            log.info("System property {} found to be '{}'", propName, returnValue);
        }
        return returnValue;
    }

    @SuppressWarnings("unchecked")
    private static <T> Function<String, T> getValueParser(T defaultValue) {
        if (defaultValue instanceof Boolean) {
            return v -> (T) Boolean.valueOf(v);
        } else if (defaultValue instanceof Integer) {
            return v -> (T) Integer.valueOf(v);
        } else if (defaultValue instanceof Long) {
            return v -> (T) Long.valueOf(v);
        } else if (defaultValue instanceof Double) {
            return v -> (T) Double.valueOf(v);
        } else if (defaultValue instanceof String) {
            return v -> (T) v;
        } else {
            throw new IllegalArgumentException(
                    String.format("expects a defaultValue of Boolean, Integer, Long, Double or String, but got: %s",
                            defaultValue.getClass()));
        }
    }
}
