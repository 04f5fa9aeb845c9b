package org.springaicommunity.github.issuesync;

import java.util.List;

/**
 * Runs an external command and captures its combined output. Abstracted so that
 * {@link GhCliIssuesClient} can be tested without a real {@code gh} binary.
 */
@FunctionalInterface
public interface CommandRunner {

	/**
	 * Run a command to completion.
	 * @param command program and arguments
	 * @return exit code and combined stdout/stderr
	 * @throws RemoteIssueException if the process cannot be started or is interrupted
	 */
	Result run(List<String> command);

	/**
	 * Outcome of a finished command.
	 *
	 * @param exitCode process exit code
	 * @param output combined stdout and stderr
	 */
	record Result(int exitCode, String output) {

		public boolean isSuccess() {
			return exitCode == 0;
		}

	}

}
