package org.springaicommunity.github.scorer;

/**
 * Outcome of classifying an engaged user.
 */
public enum Classification {

	NOT_SIGNIFICANT,

	/**
	 * Significant through activity: enough contributions and enough owned repositories.
	 */
	SIGNIFICANT_OTHER,

	/**
	 * Significant through affiliation with the designated organization.
	 */
	SIGNIFICANT_ORG;

	public boolean isSignificant() {
		return this != NOT_SIGNIFICANT;
	}

}
