package org.springaicommunity.github.scorer;

/**
 * Outcome of one scoring run.
 *
 * <p>
 * A run that was interrupted classifies only part of the engaged users. Its rates are
 * taken over {@code classifiedCount} rather than {@code totalEngaged}, and
 * {@link #isComplete()} returns false.
 *
 * @param repository the scored repository, as {@code owner/name}
 * @param starCount stargazer total reported by GitHub
 * @param watcherCount watcher total reported by GitHub
 * @param forkCount fork total reported by GitHub
 * @param totalEngaged number of unique users who starred, watched or forked
 * @param classifiedCount engaged users whose classification finished
 * @param significantCount classified users found significant by either rule
 * @param orgCount classified users found significant through the organization rule
 * @param powerUserRate {@code significantCount / classifiedCount}, 0 when nobody was
 * classified
 * @param orgUserRate {@code orgCount / classifiedCount}, 0 when nobody was classified
 */
public record ScoreResult(String repository, int starCount, int watcherCount, int forkCount, int totalEngaged,
		int classifiedCount, int significantCount, int orgCount, double powerUserRate, double orgUserRate) {

	/**
	 * Build a result, deriving both rates from the tallies.
	 * @param repository the scored repository
	 * @param counts aggregate counts reported by GitHub
	 * @param totalEngaged size of the engaged user set
	 * @param classifiedCount number of users whose classification finished
	 * @param significantCount number of significant users
	 * @param orgCount number of organization users
	 * @return the score
	 */
	public static ScoreResult of(RepositoryId repository, RepositoryCounts counts, int totalEngaged,
			int classifiedCount, int significantCount, int orgCount) {
		return new ScoreResult(repository.toString(), counts.starCount(), counts.watcherCount(), counts.forkCount(),
				totalEngaged, classifiedCount, significantCount, orgCount, rate(significantCount, classifiedCount),
				rate(orgCount, classifiedCount));
	}

	/**
	 * Whether every engaged user was classified.
	 * @return false if the run was interrupted before classification finished
	 */
	public boolean isComplete() {
		return classifiedCount == totalEngaged;
	}

	static double rate(int count, int total) {
		return total == 0 ? 0.0 : (double) count / total;
	}

}
