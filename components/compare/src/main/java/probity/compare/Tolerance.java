package probity.compare;

/** Outcome of a tolerance check: whether two numbers are close enough and how far apart. */
public final class Tolerance {

  private final boolean within;
  private final double difference;

  Tolerance(final boolean within, final double difference) {
    this.within = within;
    this.difference = difference;
  }

  public boolean isWithin() {
    return within;
  }

  /** Signed absolute difference for delta checks, relative difference for epsilon checks. */
  public double getDifference() {
    return difference;
  }

  @Override
  public String toString() {
    return "Tolerance{within=" + within + ", difference=" + difference + '}';
  }
}
