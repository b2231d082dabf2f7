/**
 * Command-line runner that executes a GraphQL document through the GitHub providers.
 */
@NullMarked
package org.springaicommunity.github.provider.cli;

import org.jspecify.annotations.NullMarked;
