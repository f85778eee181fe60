package relayql.transform;

import graphql.language.SourceLocation;
import org.jspecify.annotations.Nullable;

/**
 * Raised when a definition cannot be compiled. Compilation of the definition stops at the first
 * failure; nothing is returned for it.
 *
 * <p>The message names the offending field, fragment or argument and ends with the source
 * position when one is known.
 */
public final class RelayTransformException extends RuntimeException {

  private final ErrorCode code;
  private final String reason;
  private final @Nullable SourceLocation location;

  public RelayTransformException(
      ErrorCode code, String reason, @Nullable SourceLocation location) {
    super(describe(reason, location));
    this.code = code;
    this.reason = reason;
    this.location = location;
  }

  public RelayTransformException(
      ErrorCode code, String reason, @Nullable SourceLocation location, Throwable cause) {
    super(describe(reason, location), cause);
    this.code = code;
    this.reason = reason;
    this.location = location;
  }

  public ErrorCode getCode() {
    return code;
  }

  public ErrorCode.Category getCategory() {
    return code.category();
  }

  /** The message without the trailing source position. */
  public String getReason() {
    return reason;
  }

  public @Nullable SourceLocation getLocation() {
    return location;
  }

  private static String describe(String reason, @Nullable SourceLocation location) {
    if (location == null || location.getLine() < 0) {
      return reason;
    }
    return reason + " (line " + location.getLine() + ", column " + location.getColumn() + ")";
  }
}
