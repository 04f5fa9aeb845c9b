package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

/**
 * Uniform failure raised by every {@link IssuesClient} implementation.
 *
 * <p>
 * Carries the raw diagnostic text (HTTP response body or command output) so that
 * {@link TransientFailureClassifier} can decide whether the failure is worth retrying.
 */
public class RemoteIssueException extends RuntimeException {

	/**
	 * Status for requests that failed before any response arrived.
	 */
	public static final int NO_RESPONSE = -1;

	/**
	 * Status for external commands that could not be started or read.
	 */
	public static final int COMMAND_NOT_RUN = -2;

	private final int statusCode;

	private final String diagnostic;

	public RemoteIssueException(String message, int statusCode, @Nullable String diagnostic) {
		super(message);
		this.statusCode = statusCode;
		this.diagnostic = diagnostic != null ? diagnostic : "";
	}

	public RemoteIssueException(String message, Throwable cause) {
		this(message, NO_RESPONSE, cause);
	}

	public RemoteIssueException(String message, int statusCode, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.diagnostic = cause.getMessage() != null ? cause.getMessage() : "";
	}

	/**
	 * HTTP status code for REST failures, process exit code for CLI failures,
	 * {@link #NO_RESPONSE} when the request never completed, or
	 * {@link #COMMAND_NOT_RUN} when the CLI could not be run.
	 * @return the status or exit code
	 */
	public int getStatusCode() {
		return statusCode;
	}

	/**
	 * Raw diagnostic text as returned by the remote side.
	 * @return response body or command output, never null
	 */
	public String getDiagnostic() {
		return diagnostic;
	}

}
