package com.github.cowwoc.accountlimiter;

import java.io.Serial;

/**
 * Thrown if an operation references an account that is not registered.
 */
public final class AccountNotFoundException extends RuntimeException
{
	@Serial
	private static final long serialVersionUID = 0L;
	/**
	 * The account identifier. Not serialized because the identifier type is unknown.
	 */
	private final transient Object accountId;

	/**
	 * Creates a new exception.
	 *
	 * @param accountId the identifier of the account that could not be found
	 */
	public AccountNotFoundException(Object accountId)
	{
		super("Account not found: " + accountId);
		this.accountId = accountId;
	}

	/**
	 * Returns the identifier of the account that could not be found.
	 *
	 * @return {@code null} if the exception was deserialized
	 */
	public Object getAccountId()
	{
		return accountId;
	}
}
