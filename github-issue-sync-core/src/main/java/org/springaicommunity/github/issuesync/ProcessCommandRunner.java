package org.springaicommunity.github.issuesync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}, with stderr merged into stdout.
 */
public class ProcessCommandRunner implements CommandRunner {

	private static final Logger logger = LoggerFactory.getLogger(ProcessCommandRunner.class);

	@Override
	public Result run(List<String> command) {
		logger.debug("exec {}", command.get(0));
		ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
		Process process;
		try {
			process = builder.start();
		}
		catch (IOException e) {
			throw new RemoteIssueException("Failed to start " + command.get(0) + ": " + e.getMessage(),
					RemoteIssueException.COMMAND_NOT_RUN, e);
		}
		try {
			String output;
			try (InputStream in = process.getInputStream()) {
				output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
			}
			int exitCode = process.waitFor();
			return new Result(exitCode, output);
		}
		catch (IOException e) {
			throw new RemoteIssueException("Failed to read output of " + command.get(0) + ": " + e.getMessage(),
					RemoteIssueException.COMMAND_NOT_RUN, e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RemoteIssueException("Interrupted while running " + command.get(0), e);
		}
	}

}
