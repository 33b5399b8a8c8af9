/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package rpctrace.internal;

import java.lang.annotation.RetentionPolicy;

/** Marks a field, parameter or return value that can be null. Documentation only. */
@java.lang.annotation.Documented
@java.lang.annotation.Retention(RetentionPolicy.SOURCE)
public @interface Nullable {
}
