package org.springaicommunity.github.scorer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scores the engagement quality of a repository.
 *
 * <p>
 * A run reads the repository counts, collects stargazers, watchers and forkers, unions
 * them into one engaged user set and classifies every member. The three relations and
 * the per-user classifications run on a bounded worker pool owned by the run; their
 * results are gathered by the calling thread, so no state is shared between tasks.
 *
 * <p>
 * Transport failures never escape: they only shrink the collected data. If the calling
 * thread is interrupted, outstanding tasks are cancelled and the score is computed from
 * what finished, with the interrupt flag restored. Rates of such a run are taken over the
 * users that were actually classified; see {@link ScoreResult#isComplete()}.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * EngagementScorer scorer = RepoScorerBuilder.create()
 *     .tokenFromEnv()
 *     .buildEngagementScorer();
 *
 * ScoreResult result = scorer.score("https://github.com/octocat/Hello-World");
 * }
 * </pre>
 */
public class EngagementScorer {

	private static final Logger logger = LoggerFactory.getLogger(EngagementScorer.class);

	private final RelationCollectionService relationCollectionService;

	private final RepositoryCountService repositoryCountService;

	private final UserSignificanceClassifier classifier;

	private final int concurrency;

	public EngagementScorer(RelationCollectionService relationCollectionService,
			RepositoryCountService repositoryCountService, UserSignificanceClassifier classifier, int concurrency) {
		if (concurrency < 1) {
			throw new IllegalArgumentException("Concurrency must be at least 1 (got: " + concurrency + ")");
		}
		this.relationCollectionService = relationCollectionService;
		this.repositoryCountService = repositoryCountService;
		this.classifier = classifier;
		this.concurrency = concurrency;
	}

	/**
	 * Score the repository at the given address.
	 * @param repositoryAddress e.g. {@code https://github.com/owner/name}
	 * @return the score
	 * @throws InvalidRepositoryAddressException if the address has no owner/name
	 */
	public ScoreResult score(String repositoryAddress) {
		return score(RepositoryId.parse(repositoryAddress));
	}

	/**
	 * Score a repository.
	 * @param repositoryId the repository
	 * @return the score
	 */
	public ScoreResult score(RepositoryId repositoryId) {
		logger.info("Scoring repository {}", repositoryId);
		long start = System.currentTimeMillis();

		ExecutorService executor = Executors.newFixedThreadPool(concurrency, new WorkerThreadFactory());
		try {
			RepositoryCounts counts = repositoryCountService.count(repositoryId);
			logger.info("Stars: {}, Watches: {}, Forks: {}", counts.starCount(), counts.watcherCount(),
					counts.forkCount());

			Set<String> engagedUsers = collectEngagedUsers(repositoryId, executor);
			logger.info("Total unique users (starred, watched, forked): {}", engagedUsers.size());

			ClassificationTally tally = classifyAll(engagedUsers, executor);

			ScoreResult result = ScoreResult.of(repositoryId, counts, engagedUsers.size(), tally.classified(),
					tally.significant(), tally.count(Classification.SIGNIFICANT_ORG));
			if (!result.isComplete()) {
				logger.warn("Score for {} is partial: {}/{} users classified", repositoryId, result.classifiedCount(),
						result.totalEngaged());
			}
			logger.info("Scored {} in {}ms: power user rate {}, org user rate {}", repositoryId,
					System.currentTimeMillis() - start, String.format(Locale.ROOT, "%.2f", result.powerUserRate()),
					String.format(Locale.ROOT, "%.2f", result.orgUserRate()));
			return result;
		}
		finally {
			executor.shutdownNow();
		}
	}

	/**
	 * Collect every relation and union the results. A login present in several relations
	 * counts once.
	 */
	Set<String> collectEngagedUsers(RepositoryId repositoryId, ExecutorService executor) {
		List<Future<Set<String>>> futures = new ArrayList<>();
		for (RelationKind kind : RelationKind.values()) {
			futures.add(executor.submit(() -> relationCollectionService.collect(kind, repositoryId)));
		}

		Set<String> engagedUsers = new LinkedHashSet<>();
		for (int i = 0; i < futures.size(); i++) {
			RelationKind kind = RelationKind.values()[i];
			Future<Set<String>> future = futures.get(i);
			try {
				engagedUsers.addAll(future.get());
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Interrupted while collecting users of {}; keeping finished relations", repositoryId);
				cancelAll(futures);
				engagedUsers.addAll(collectFinished(futures));
				break;
			}
			catch (ExecutionException e) {
				logger.error("Collection of {} for {} failed: {}", kind.connectionField(), repositoryId,
						e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
			}
		}
		return engagedUsers;
	}

	/**
	 * Classify every engaged user and count the outcomes. Stops at the first interrupt,
	 * counting only the classifications that finished.
	 */
	ClassificationTally classifyAll(Set<String> logins, ExecutorService executor) {
		Map<Classification, Integer> tally = new EnumMap<>(Classification.class);
		for (Classification classification : Classification.values()) {
			tally.put(classification, 0);
		}
		if (Thread.currentThread().isInterrupted()) {
			logger.warn("Skipping classification of {} users: interrupted", logins.size());
			return new ClassificationTally(tally, 0);
		}

		List<Future<Classification>> futures = new ArrayList<>(logins.size());
		for (String login : logins) {
			futures.add(executor.submit(() -> classifier.classify(login)));
		}

		int classified = 0;
		for (Future<Classification> future : futures) {
			try {
				tally.merge(future.get(), 1, Integer::sum);
				classified++;
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				cancelAll(futures);
				logger.warn("Interrupted after classifying {}/{} users; rates cover the classified users only",
						classified, logins.size());
				break;
			}
			catch (ExecutionException e) {
				logger.error("Classification task failed; counting user as not significant: {}",
						e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
				tally.merge(Classification.NOT_SIGNIFICANT, 1, Integer::sum);
				classified++;
			}
		}
		logger.debug("Classification tally: {}", tally);
		return new ClassificationTally(tally, classified);
	}

	private static <T> void cancelAll(List<Future<T>> futures) {
		for (Future<T> future : futures) {
			future.cancel(true);
		}
	}

	private static Set<String> collectFinished(List<Future<Set<String>>> futures) {
		Set<String> finished = new LinkedHashSet<>();
		for (Future<Set<String>> future : futures) {
			if (future.isDone() && !future.isCancelled()) {
				// completed futures return without blocking, even on an interrupted thread
				try {
					finished.addAll(future.get());
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				catch (ExecutionException | CancellationException e) {
					logger.debug("Relation task ended without a result: {}", e.getMessage());
				}
			}
		}
		return finished;
	}

	/**
	 * Outcome counts of one classification pass.
	 *
	 * @param counts users per classification
	 * @param classified users whose classification finished
	 */
	record ClassificationTally(Map<Classification, Integer> counts, int classified) {

		int count(Classification classification) {
			return counts.getOrDefault(classification, 0);
		}

		int significant() {
			int significant = 0;
			for (Map.Entry<Classification, Integer> entry : counts.entrySet()) {
				if (entry.getKey().isSignificant()) {
					significant += entry.getValue();
				}
			}
			return significant;
		}

	}

	private static final class WorkerThreadFactory implements ThreadFactory {

		private static final AtomicInteger POOL_NUMBER = new AtomicInteger(1);

		private final int poolNumber = POOL_NUMBER.getAndIncrement();

		private final AtomicInteger threadNumber = new AtomicInteger(1);

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable,
					"repo-scorer-" + poolNumber + "-worker-" + threadNumber.getAndIncrement());
			thread.setDaemon(true);
			return thread;
		}

	}

}
