package io.b2mash.orgguard.client;

public enum MirrorStatus {
  /** No fetch has settled yet. */
  LOADING,
  /** The most recent fetch failed. */
  ERROR,
  /** A summary is available and the most recent fetch succeeded. */
  READY
}
