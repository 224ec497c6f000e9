/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.testing;

import java.lang.reflect.Field;
import java.lang.reflect.Method;

/**
 * Reflection helpers for wiring CDI beans by hand in unit tests.
 */
public final class TestFields {

    private TestFields() {
    }

    public static void setField(Object target, String fieldName, Object value) {
        try {
            Field field = target.getClass().getDeclaredField(fieldName);
            field.setAccessible(true);
            field.set(target, value);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot set " + fieldName + " on " + target.getClass().getSimpleName(), e);
        }
    }

    /**
     * Invokes a no-arg lifecycle method such as {@code init} or {@code shutdown}.
     */
    public static void invoke(Object target, String methodName) {
        try {
            Method method = target.getClass().getDeclaredMethod(methodName);
            method.setAccessible(true);
            method.invoke(target);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot invoke " + methodName + " on " + target.getClass().getSimpleName(),
                    e);
        }
    }
}
