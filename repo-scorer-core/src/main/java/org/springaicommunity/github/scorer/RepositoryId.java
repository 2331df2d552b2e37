package org.springaicommunity.github.scorer;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;

/**
 * Owner and name of a GitHub repository.
 *
 * <p>
 * Parsed once from a caller-supplied address and immutable for the scoring run.
 *
 * @param owner the repository owner (user or organization login)
 * @param name the repository name
 */
public record RepositoryId(String owner, String name) {

	public RepositoryId {
		if (owner.isBlank() || name.isBlank()) {
			throw new InvalidRepositoryAddressException(owner + "/" + name, "owner and name must not be blank");
		}
	}

	/**
	 * Parse a repository address such as {@code https://github.com/octocat/Hello-World}
	 * or {@code octocat/Hello-World}. Only the first two segments of the path are
	 * consulted; anything after them (e.g. {@code /tree/main}) is ignored.
	 * @param address the repository address
	 * @return the parsed identifier
	 * @throws InvalidRepositoryAddressException if the address has fewer than two path
	 * segments or is not a valid URI
	 */
	public static RepositoryId parse(String address) {
		if (address.isBlank()) {
			throw new InvalidRepositoryAddressException(address, "address is empty");
		}

		String path;
		try {
			path = new URI(address.trim()).getPath();
		}
		catch (URISyntaxException e) {
			throw new InvalidRepositoryAddressException(address, "not a valid URI", e);
		}
		if (path == null) {
			throw new InvalidRepositoryAddressException(address, "address has no path");
		}

		List<String> segments = Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toList();
		if (segments.size() < 2) {
			throw new InvalidRepositoryAddressException(address, "expected <owner>/<name> in the path");
		}
		return new RepositoryId(segments.get(0), segments.get(1));
	}

	@Override
	public String toString() {
		return owner + "/" + name;
	}

}
