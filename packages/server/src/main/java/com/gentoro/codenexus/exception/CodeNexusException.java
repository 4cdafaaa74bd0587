package com.gentoro.codenexus.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for CodeNexus with a stable {@link CodeNexusErrorCode} and optional
 * context.
 *
 * <p>The context map is copied and unmodifiable. The message is meant for humans, the code for
 * clients and logs.
 */
public class CodeNexusException extends RuntimeException {
  private final CodeNexusErrorCode code;
  private final Map<String, Object> context;

  public CodeNexusException(CodeNexusErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public CodeNexusException(CodeNexusErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public CodeNexusException(CodeNexusErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public CodeNexusException(
      CodeNexusErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public CodeNexusErrorCode getCode() {
    return code;
  }

  /** Recovery hint for the caller, derived from the error code. */
  public String getSuggestion() {
    return code.suggestion();
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach(m::put);
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", message="
        + getMessage()
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
