package org.springaicommunity.github.scorer;

/**
 * Aggregate engagement counts reported by GitHub for a repository.
 *
 * <p>
 * Advisory only: these are the totals GitHub reports, not the sizes of the collected
 * user sets.
 *
 * @param starCount number of stargazers
 * @param watcherCount number of watchers
 * @param forkCount number of forks
 */
public record RepositoryCounts(int starCount, int watcherCount, int forkCount) {

	public static RepositoryCounts zero() {
		return new RepositoryCounts(0, 0, 0);
	}

}
