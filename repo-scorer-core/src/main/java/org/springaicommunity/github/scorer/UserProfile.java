package org.springaicommunity.github.scorer;

/**
 * The profile facts a user is classified on. Fetched per classification and discarded
 * afterwards.
 *
 * @param contributionsLastYear total contributions in the trailing window
 * @param declaredOrganization the free-text company field, empty when not set
 * @param ownedRepositoryCount number of repositories the user owns
 */
public record UserProfile(int contributionsLastYear, String declaredOrganization, int ownedRepositoryCount) {

	public UserProfile {
		if (contributionsLastYear < 0 || ownedRepositoryCount < 0) {
			throw new IllegalArgumentException("Profile counts must be non-negative");
		}
	}

	/**
	 * Profile used when the user cannot be fetched: no contributions, no organization,
	 * no repositories.
	 * @return the empty profile
	 */
	public static UserProfile empty() {
		return new UserProfile(0, "", 0);
	}

}
