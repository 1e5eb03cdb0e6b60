package io.b2mash.orgguard.client;

import io.b2mash.orgguard.api.MembershipSummary;

/**
 * Immutable view of a mirror at one instant. After a failed revalidation the previous summary is
 * kept for display but {@link #status()} is {@link MirrorStatus#ERROR}, which every decision treats
 * as unmet.
 */
public record MembershipSnapshot(MirrorStatus status, MembershipSummary summary, Throwable error) {

  private static final MembershipSnapshot LOADING =
      new MembershipSnapshot(MirrorStatus.LOADING, null, null);

  public static MembershipSnapshot loading() {
    return LOADING;
  }

  public static MembershipSnapshot ready(MembershipSummary summary) {
    return new MembershipSnapshot(MirrorStatus.READY, summary, null);
  }

  public static MembershipSnapshot failed(Throwable error, MembershipSummary previous) {
    return new MembershipSnapshot(MirrorStatus.ERROR, previous, error);
  }

  /** The summary decisions may be made against: present only when {@link MirrorStatus#READY}. */
  public MembershipSummary decisionSummary() {
    return status == MirrorStatus.READY ? summary : null;
  }
}
