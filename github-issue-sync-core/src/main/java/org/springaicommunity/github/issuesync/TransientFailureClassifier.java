package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies remote failures as transient or permanent by inspecting their diagnostic
 * text.
 *
 * <p>
 * A failure is transient when its text mentions a rate limit, a secondary rate limit or
 * abuse detection, when GitHub answered 429, or when the request never reached the
 * server. Explicit wait hints ({@code Retry-After: N}, {@code wait N seconds}) are
 * extracted so the retry loop can honour them.
 */
public class TransientFailureClassifier {

	private static final List<String> TRANSIENT_TOKENS = List.of("rate limit", "secondary rate", "abuse detection");

	private static final Pattern RETRY_AFTER = Pattern.compile("retry[-\\s]after:?\\s*(\\d+)",
			Pattern.CASE_INSENSITIVE);

	private static final Pattern WAIT_SECONDS = Pattern.compile("wait\\s*(\\d+)\\s*seconds", Pattern.CASE_INSENSITIVE);

	private static final int TOO_MANY_REQUESTS = 429;

	public FailureClassification classify(Throwable failure) {
		String text = diagnosticText(failure);
		if (isTransientText(text)) {
			return FailureClassification.transientFailure(extractWaitHint(text));
		}
		if (failure instanceof RemoteIssueException remote) {
			if (remote.getStatusCode() == TOO_MANY_REQUESTS) {
				return FailureClassification.transientFailure(extractWaitHint(text));
			}
			if (remote.getStatusCode() == RemoteIssueException.NO_RESPONSE && remote.getCause() instanceof IOException) {
				return FailureClassification.transientFailure(null);
			}
		}
		return FailureClassification.permanent();
	}

	static boolean isTransientText(String text) {
		String lower = text.toLowerCase(Locale.ROOT);
		return TRANSIENT_TOKENS.stream().anyMatch(lower::contains);
	}

	/**
	 * Extract an explicit positive wait from diagnostic text.
	 * @param text diagnostic text
	 * @return the requested wait, or null if none is present
	 */
	@Nullable
	static Duration extractWaitHint(String text) {
		Matcher m = RETRY_AFTER.matcher(text);
		if (m.find()) {
			return positiveSeconds(m.group(1));
		}
		Matcher m2 = WAIT_SECONDS.matcher(text);
		if (m2.find()) {
			return positiveSeconds(m2.group(1));
		}
		return null;
	}

	@Nullable
	private static Duration positiveSeconds(String digits) {
		try {
			long seconds = Long.parseLong(digits);
			return seconds > 0 ? Duration.ofSeconds(seconds) : null;
		}
		catch (NumberFormatException e) {
			return null;
		}
	}

	private static String diagnosticText(Throwable failure) {
		StringBuilder text = new StringBuilder();
		if (failure.getMessage() != null) {
			text.append(failure.getMessage());
		}
		if (failure instanceof RemoteIssueException remote && !remote.getDiagnostic().isEmpty()) {
			text.append('\n').append(remote.getDiagnostic());
		}
		return text.toString();
	}

}
