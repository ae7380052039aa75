package io.glossa;

import org.apache.maven.plugin.logging.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maven log that keeps every message for assertions.
 */
public class CapturingLog implements Log {
	private final List<String> debugs = Collections.synchronizedList(new ArrayList<>());
	private final List<String> infos = Collections.synchronizedList(new ArrayList<>());
	private final List<String> warns = Collections.synchronizedList(new ArrayList<>());
	private final List<String> errors = Collections.synchronizedList(new ArrayList<>());

	@Override public boolean isDebugEnabled() { return true; }
	@Override public void debug(CharSequence content) { debugs.add(content.toString()); }
	@Override public void debug(CharSequence content, Throwable error) { debugs.add(content.toString()); }
	@Override public void debug(Throwable error) {}
	@Override public boolean isInfoEnabled() { return true; }
	@Override public void info(CharSequence content) { infos.add(content.toString()); }
	@Override public void info(CharSequence content, Throwable error) { infos.add(content.toString()); }
	@Override public void info(Throwable error) {}
	@Override public boolean isWarnEnabled() { return true; }
	@Override public void warn(CharSequence content) { warns.add(content.toString()); }
	@Override public void warn(CharSequence content, Throwable error) { warns.add(content.toString()); }
	@Override public void warn(Throwable error) {}
	@Override public boolean isErrorEnabled() { return true; }
	@Override public void error(CharSequence content) { errors.add(content.toString()); }
	@Override public void error(CharSequence content, Throwable error) { errors.add(content.toString()); }
	@Override public void error(Throwable error) {}

	public boolean hasDebug(String substring) {
		return contains(debugs, substring);
	}

	public boolean hasInfo(String substring) {
		return contains(infos, substring);
	}

	public boolean hasWarn(String substring) {
		return contains(warns, substring);
	}

	public boolean hasError(String substring) {
		return contains(errors, substring);
	}

	public List<String> getWarns() {
		synchronized (warns) {
			return new ArrayList<>(warns);
		}
	}

	public List<String> getErrors() {
		synchronized (errors) {
			return new ArrayList<>(errors);
		}
	}

	private static boolean contains(List<String> messages, String substring) {
		synchronized (messages) {
			return messages.stream().anyMatch(s -> s.toLowerCase().contains(substring.toLowerCase()));
		}
	}
}
