package logictools.catalog;

import logictools.catalog.MinimalityPolicy.Verdict;

/** Running tally of ingestion verdicts. */
public final class CatalogStats {
  private long firstSightings;
  private long dethronements;
  private long ties;
  private long losses;

  public CatalogStats() {}

  private CatalogStats(long firstSightings, long dethronements, long ties, long losses) {
    this.firstSightings = firstSightings;
    this.dethronements = dethronements;
    this.ties = ties;
    this.losses = losses;
  }

  void record(Verdict verdict) {
    switch (verdict) {
      case FIRST -> firstSightings++;
      case DETHRONES -> dethronements++;
      case TIES -> ties++;
      case LOSES -> losses++;
    }
  }

  public long firstSightings() {
    return firstSightings;
  }

  public long dethronements() {
    return dethronements;
  }

  public long ties() {
    return ties;
  }

  public long losses() {
    return losses;
  }

  public long ingested() {
    return firstSightings + dethronements + ties + losses;
  }

  public CatalogStats snapshot() {
    return new CatalogStats(firstSightings, dethronements, ties, losses);
  }
}
