package org.springaicommunity.github.scorer;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies an engaged user from their GitHub profile.
 *
 * <p>
 * One query fetches the user's contribution total over a rolling window ending now,
 * their declared company and their owned repository count. The window is second-precise,
 * from {@code contributionWindowDays} before the current instant up to it, rather than
 * aligned to whole UTC days.
 *
 * <p>
 * The rule is evaluated in order:
 * <ol>
 * <li>company contains the organization keyword (case-insensitive): {@link Classification#SIGNIFICANT_ORG}</li>
 * <li>contributions and owned repositories both reach their thresholds:
 * {@link Classification#SIGNIFICANT_OTHER}</li>
 * <li>otherwise {@link Classification#NOT_SIGNIFICANT}</li>
 * </ol>
 * An organization user is never re-checked for activity. A user that cannot be fetched
 * is classified on {@link UserProfile#empty()}.
 *
 * <p>
 * Instances hold no mutable state and may be shared across worker threads.
 */
public class UserSignificanceClassifier {

	private static final Logger logger = LoggerFactory.getLogger(UserSignificanceClassifier.class);

	static final String USER_PROFILE_QUERY = """
			query($login: String!, $from: DateTime!, $to: DateTime!) {
			  user(login: $login) {
			    contributionsCollection(from: $from, to: $to) {
			      contributionCalendar {
			        totalContributions
			      }
			    }
			    company
			    repositories {
			      totalCount
			    }
			  }
			}
			""";

	private final GraphQLService graphQLService;

	private final Clock clock;

	private final String organizationKeyword;

	private final int minContributions;

	private final int minOwnedRepositories;

	private final Duration contributionWindow;

	public UserSignificanceClassifier(GraphQLService graphQLService, ScoringProperties properties, Clock clock) {
		this.graphQLService = graphQLService;
		this.clock = clock;
		this.organizationKeyword = properties.getOrganizationKeyword().toLowerCase(Locale.ROOT);
		this.minContributions = properties.getMinContributions();
		this.minOwnedRepositories = properties.getMinOwnedRepositories();
		this.contributionWindow = Duration.ofDays(properties.getContributionWindowDays());
	}

	/**
	 * Fetch the user's profile and classify it.
	 * @param login the user login
	 * @return the classification
	 */
	public Classification classify(String login) {
		UserProfile profile = fetchProfile(login);
		Classification classification = classify(profile);
		logger.debug("{} -> {} ({})", login, classification, profile);
		return classification;
	}

	/**
	 * Apply the decision rule to an already fetched profile.
	 * @param profile the profile
	 * @return the classification
	 */
	public Classification classify(UserProfile profile) {
		if (profile.declaredOrganization().toLowerCase(Locale.ROOT).contains(organizationKeyword)) {
			return Classification.SIGNIFICANT_ORG;
		}
		if (profile.contributionsLastYear() >= minContributions
				&& profile.ownedRepositoryCount() >= minOwnedRepositories) {
			return Classification.SIGNIFICANT_OTHER;
		}
		return Classification.NOT_SIGNIFICANT;
	}

	/**
	 * Fetch the facts the rule needs for one user.
	 * @param login the user login
	 * @return the profile, or {@link UserProfile#empty()} if the query failed or the user
	 * does not exist
	 */
	public UserProfile fetchProfile(String login) {
		Instant to = clock.instant().truncatedTo(ChronoUnit.SECONDS);
		Instant from = to.minus(contributionWindow);

		Map<String, @Nullable Object> variables = Map.of("login", login, "from", from.toString(), "to",
				to.toString());

		Optional<JsonNode> user = graphQLService.executeQuery(USER_PROFILE_QUERY, variables)
			.flatMap(response -> JsonNodeUtils.getNode(response, "data", "user"));
		if (user.isEmpty()) {
			logger.debug("No profile available for {}", login);
			return UserProfile.empty();
		}

		int contributions = JsonNodeUtils
			.getInt(user.get(), "contributionsCollection", "contributionCalendar", "totalContributions")
			.orElse(0);
		String company = JsonNodeUtils.getString(user.get(), "company").orElse("");
		int repositories = JsonNodeUtils.getInt(user.get(), "repositories", "totalCount").orElse(0);

		return new UserProfile(Math.max(0, contributions), company, Math.max(0, repositories));
	}

}
