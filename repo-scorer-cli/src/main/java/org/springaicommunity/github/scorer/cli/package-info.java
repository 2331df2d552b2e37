/**
 * Command-line front end for the repository scorer.
 */
@NullMarked
package org.springaicommunity.github.scorer.cli;

import org.jspecify.annotations.NullMarked;
