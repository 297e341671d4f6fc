package se.alipsa.jcolumnar.exec;

/**
 * Unwinds a cancelled query. It never escapes {@link QueryExecutor}, which
 * turns it into an empty result with outcome {@link QueryOutcome#CANCELLED}.
 */
public final class QueryCancelledException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String stage;

  QueryCancelledException(String stage) {
    super("Query cancelled during " + stage, null, false, false);
    this.stage = stage;
  }

  public String stage() {
    return stage;
  }
}
