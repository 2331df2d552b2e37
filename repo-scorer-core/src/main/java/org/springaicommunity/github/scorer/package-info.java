/**
 * Repository engagement scoring engine.
 *
 * <p>
 * Collects the stargazers, watchers and forkers of a GitHub repository through the
 * GraphQL API, classifies every engaged user and reports the power user and organization
 * user rates. Entry point is {@link org.springaicommunity.github.scorer.EngagementScorer},
 * wired through {@link org.springaicommunity.github.scorer.RepoScorerBuilder}.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.github.scorer;

import org.jspecify.annotations.NullMarked;
