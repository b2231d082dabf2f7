/**
 * GitHub GraphQL provider core package.
 *
 * <p>
 * Resolves credentials, keeps GitHub App installation tokens fresh and dispatches
 * GraphQL operations in blocking and non-blocking modes.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.github.provider;

import org.jspecify.annotations.NullMarked;
