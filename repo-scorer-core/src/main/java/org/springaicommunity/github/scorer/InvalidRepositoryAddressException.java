package org.springaicommunity.github.scorer;

/**
 * Thrown when a repository address does not identify an owner and a name.
 *
 * <p>
 * Unlike transport failures this is fatal for the scoring run and is always propagated
 * to the caller.
 */
public class InvalidRepositoryAddressException extends IllegalArgumentException {

	private final String address;

	public InvalidRepositoryAddressException(String address, String reason) {
		super("Invalid repository address '" + address + "': " + reason);
		this.address = address;
	}

	public InvalidRepositoryAddressException(String address, String reason, Throwable cause) {
		super("Invalid repository address '" + address + "': " + reason, cause);
		this.address = address;
	}

	public String getAddress() {
		return address;
	}

}
