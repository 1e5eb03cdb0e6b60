package io.b2mash.orgguard.client;

import com.github.benmanes.caffeine.cache.AsyncLoadingCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.orgguard.api.MembershipSummary;
import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.api.Role;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-side cache of the current subject's {@link MembershipSummary}, shared by every reader in
 * one view.
 *
 * <p>The summary lives in a single-entry Caffeine cache. Concurrent loads collapse onto the
 * in-flight future. Reads of a value older than {@link MirrorSettings#revalidateAfter()} trigger a
 * background refetch while the stale value keeps serving. {@link #revalidate()} forces one.
 * Unsubscribing never cancels a shared fetch; it still settles and updates every other reader.
 *
 * <p>Decisions are made only against a {@link MirrorStatus#READY} snapshot. While loading or after
 * a failed fetch every {@code can}/{@code hasRole} answer is {@code false}.
 */
public class MembershipMirror {

  private static final Logger log = LoggerFactory.getLogger(MembershipMirror.class);

  private static final String KEY = "membership";

  private final MembershipClient client;
  private final AsyncLoadingCache<String, MembershipSummary> cache;
  private final List<Consumer<MembershipSnapshot>> listeners = new CopyOnWriteArrayList<>();

  private volatile MembershipSnapshot snapshot = MembershipSnapshot.loading();

  public MembershipMirror(MembershipClient client, MirrorSettings settings) {
    this(client, settings, ForkJoinPool.commonPool(), Ticker.systemTicker());
  }

  MembershipMirror(
      MembershipClient client, MirrorSettings settings, Executor executor, Ticker ticker) {
    this.client = client;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(1)
            .refreshAfterWrite(settings.revalidateAfter())
            .executor(executor)
            .ticker(ticker)
            .buildAsync((key, loadExecutor) -> fetch(loadExecutor));
  }

  /**
   * Starts a fetch unless a value is cached or one is already in flight. Returns the shared future;
   * cancelling it is not supported.
   */
  public CompletableFuture<MembershipSummary> load() {
    return cache.get(KEY);
  }

  /** Forces a refetch. Joins the in-flight fetch instead when one is pending. */
  public CompletableFuture<MembershipSummary> revalidate() {
    return cache.synchronous().refresh(KEY);
  }

  /**
   * Current state. Touching a stale cached value here schedules its background revalidation but
   * never blocks.
   */
  public MembershipSnapshot snapshot() {
    cache.getIfPresent(KEY);
    return snapshot;
  }

  public MirrorStatus status() {
    return snapshot().status();
  }

  /** Role from the last good summary; {@code null} while loading or after a failed fetch. */
  public Role role() {
    var summary = snapshot().decisionSummary();
    return summary == null ? null : summary.role();
  }

  public List<Permission> permissions() {
    return PermissionChecks.listPermissions(snapshot().decisionSummary());
  }

  public boolean can(Permission permission) {
    return PermissionChecks.hasPermission(snapshot().decisionSummary(), permission);
  }

  /** Any-of by default, all-of when {@code requireAll}. */
  public boolean can(Collection<Permission> permissions, boolean requireAll) {
    return PermissionChecks.hasPermission(snapshot().decisionSummary(), permissions, requireAll);
  }

  public boolean hasRole(Role... roles) {
    return PermissionChecks.hasRole(snapshot().decisionSummary(), Arrays.asList(roles));
  }

  /**
   * Registers interest: delivers the current snapshot immediately, starts a fetch if none has
   * happened, then delivers every settled fetch until the returned handle is closed.
   */
  public Subscription subscribe(Consumer<MembershipSnapshot> listener) {
    listeners.add(listener);
    listener.accept(snapshot);
    load();
    return new Subscription(listener);
  }

  private CompletableFuture<MembershipSummary> fetch(Executor executor) {
    log.debug("Fetching membership summary");
    return CompletableFuture.supplyAsync(client::fetchMembership, executor)
        .whenComplete(this::settle);
  }

  private void settle(MembershipSummary summary, Throwable failure) {
    MembershipSnapshot next;
    if (failure != null) {
      Throwable cause = failure instanceof CompletionException ? failure.getCause() : failure;
      log.warn("Membership fetch failed: {}", cause.getMessage());
      next = MembershipSnapshot.failed(cause, snapshot.summary());
    } else {
      log.debug("Membership summary settled for role {}", summary.role());
      next = MembershipSnapshot.ready(summary);
    }
    snapshot = next;
    for (var listener : listeners) {
      listener.accept(next);
    }
  }

  /** Handle returned by {@link #subscribe}. Closing only detaches the listener. */
  public final class Subscription implements AutoCloseable {

    private final Consumer<MembershipSnapshot> listener;

    private Subscription(Consumer<MembershipSnapshot> listener) {
      this.listener = listener;
    }

    @Override
    public void close() {
      listeners.remove(listener);
    }
  }
}
