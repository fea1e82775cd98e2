package org.waabox.baker.overrides.k8s;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.baker.BakerException;
import org.waabox.baker.overrides.OverrideEntity;
import org.waabox.baker.overrides.OverrideStore;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1ConfigMap;
import io.kubernetes.client.util.Config;

/**
 * An {@link OverrideStore} reading Linux node image versions from a
 * Kubernetes ConfigMap.
 *
 * <p>Each data key of the ConfigMap names a distro, either alone, in
 * which case the version applies in every region, or prefixed with a
 * region and a slash, in which case it applies to that region only and
 * wins over the global key:
 * <pre>
 * data:
 *   aks-ubuntu-containerd-22.04-gen2: "202406.01.0"
 *   westeurope/aks-ubuntu-containerd-22.04-gen2: "202406.05.0"
 * </pre>
 *
 * <p>The ConfigMap is read by {@link #refresh()}, either on demand or
 * periodically once {@link #start()} is called. Lookups only read the last
 * successfully loaded view and never call the Kubernetes API. A failed
 * refresh keeps the previous view. A missing ConfigMap is an empty view.
 *
 * <p>Usage:
 * <pre>{@code
 * ConfigMapOverrideStore store = new ConfigMapOverrideStore(
 *     ConfigMapOverrideConfig.create("node-image-overrides"));
 * store.start();
 * Baker baker = Baker.builder().overrideStore(store) ... .build();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConfigMapOverrideStore implements OverrideStore {

  /** The logger for this class. */
  private static final Logger log =
      LoggerFactory.getLogger(ConfigMapOverrideStore.class);

  /** Separates the region from the distro in a regional key. */
  private static final char REGION_SEPARATOR = '/';

  /** The HTTP status of a missing resource. */
  private static final int NOT_FOUND = 404;

  /** The store configuration. */
  private final ConfigMapOverrideConfig config;

  /** The Kubernetes core API. */
  private final CoreV1Api coreApi;

  /** The last loaded view, swapped whole on each refresh. */
  private final AtomicReference<OverrideView> view =
      new AtomicReference<>(OverrideView.EMPTY);

  /** The refresh scheduler, null until started. */
  private volatile ScheduledExecutorService scheduler;

  /**
   * Creates a new store talking to the cluster of the default client
   * configuration (in-cluster service account or local kube config).
   *
   * @param theConfig the store configuration, never null
   *
   * @throws BakerException if the Kubernetes API client cannot be
   *                        initialized
   */
  public ConfigMapOverrideStore(final ConfigMapOverrideConfig theConfig) {
    this(theConfig, coreApi());
  }

  /**
   * Creates a new store using the given Kubernetes API.
   *
   * @param theConfig  the store configuration, never null
   * @param theCoreApi the Kubernetes core API, never null
   */
  ConfigMapOverrideStore(final ConfigMapOverrideConfig theConfig,
      final CoreV1Api theCoreApi) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    coreApi = Objects.requireNonNull(theCoreApi, "coreApi must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, String> linuxNodeImageVersions(
      final OverrideEntity entity) {
    Objects.requireNonNull(entity, "entity must not be null");
    return view.get().versionsFor(entity.region());
  }

  /**
   * Re-reads the ConfigMap and replaces the current view.
   *
   * @return true if the view was replaced, false if the ConfigMap could
   *         not be read and the previous view is kept
   */
  public boolean refresh() {
    final String name = config.configMapName();
    final String namespace = config.namespace();
    try {
      final V1ConfigMap configMap =
          coreApi.readNamespacedConfigMap(name, namespace).execute();
      final OverrideView loaded = OverrideView.parse(configMap.getData());
      view.set(loaded);
      log.debug("Loaded {} image version overrides from ConfigMap '{}/{}'",
          loaded.size(), namespace, name);
      return true;

    } catch (final ApiException e) {
      if (e.getCode() == NOT_FOUND) {
        log.info("ConfigMap '{}/{}' not found, no image version overrides",
            namespace, name);
        view.set(OverrideView.EMPTY);
        return true;
      }
      log.warn("Failed to read ConfigMap '{}/{}' (HTTP {}), keeping {}"
          + " previous overrides", namespace, name, e.getCode(),
          view.get().size(), e);
      return false;

    } catch (final RuntimeException e) {
      log.warn("Failed to read ConfigMap '{}/{}', keeping {} previous"
          + " overrides", namespace, name, view.get().size(), e);
      return false;
    }
  }

  /**
   * Loads the ConfigMap and schedules periodic refreshes on a daemon
   * thread.
   *
   * @throws IllegalStateException if the store is already started
   */
  public synchronized void start() {
    if (scheduler != null) {
      throw new IllegalStateException("ConfigMapOverrideStore is already"
          + " started");
    }
    refresh();

    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread thread = new Thread(r, "baker-override-refresh");
      thread.setDaemon(true);
      return thread;
    });

    final long intervalMillis = config.refreshInterval().toMillis();
    scheduler.scheduleAtFixedRate(this::refresh, intervalMillis,
        intervalMillis, TimeUnit.MILLISECONDS);

    log.info("ConfigMapOverrideStore started for '{}/{}', refreshing every"
        + " {} ms", config.namespace(), config.configMapName(),
        intervalMillis);
  }

  /** Stops the periodic refreshes, keeping the current view. */
  public synchronized void stop() {
    final ScheduledExecutorService current = scheduler;
    if (current == null) {
      return;
    }
    current.shutdown();
    try {
      if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
        current.shutdownNow();
      }
    } catch (final InterruptedException e) {
      current.shutdownNow();
      Thread.currentThread().interrupt();
    }
    scheduler = null;
    log.info("ConfigMapOverrideStore stopped");
  }

  /**
   * Returns whether periodic refreshes are running.
   *
   * @return true between {@link #start()} and {@link #stop()}
   */
  public boolean isStarted() {
    return scheduler != null;
  }

  /**
   * Creates the core API from the default client configuration.
   *
   * @return the API, never null
   *
   * @throws BakerException if the client cannot be initialized
   */
  private static CoreV1Api coreApi() {
    try {
      final ApiClient apiClient = Config.defaultClient();
      return new CoreV1Api(apiClient);
    } catch (final IOException e) {
      throw new BakerException(
          "Failed to initialize the Kubernetes API client", e);
    }
  }

  /**
   * An immutable parsed snapshot of the ConfigMap data.
   *
   * @param global   the versions applying in every region, keyed by
   *                 distro name
   * @param regional the versions applying to one region, keyed by lower
   *                 case region then distro name
   */
  private record OverrideView(Map<String, String> global,
      Map<String, Map<String, String>> regional) {

    /** The view of an empty or missing ConfigMap. */
    private static final OverrideView EMPTY =
        new OverrideView(Map.of(), Map.of());

    /**
     * Parses ConfigMap data.
     *
     * @param data the data, may be null
     *
     * @return the view, never null
     */
    private static OverrideView parse(final Map<String, String> data) {
      if (data == null || data.isEmpty()) {
        return EMPTY;
      }
      final Map<String, String> global = new LinkedHashMap<>();
      final Map<String, Map<String, String>> regional =
          new LinkedHashMap<>();
      data.forEach((key, value) -> {
        final String version = value == null ? "" : value.trim();
        if (version.isEmpty()) {
          log.warn("Ignoring image version override '{}' without a"
              + " version", key);
          return;
        }
        final int separator = key.indexOf(REGION_SEPARATOR);
        if (separator < 0) {
          global.put(key, version);
        } else {
          regional.computeIfAbsent(
              key.substring(0, separator).toLowerCase(Locale.ROOT),
              r -> new LinkedHashMap<>())
              .put(key.substring(separator + 1), version);
        }
      });
      return new OverrideView(Collections.unmodifiableMap(global),
          Collections.unmodifiableMap(regional));
    }

    /**
     * Returns the versions applying to a region.
     *
     * @param region the region, never null, may be empty
     *
     * @return the versions keyed by distro name, never null
     */
    private Map<String, String> versionsFor(final String region) {
      final Map<String, String> forRegion =
          regional.get(region.toLowerCase(Locale.ROOT));
      if (forRegion == null) {
        return global;
      }
      final Map<String, String> merged = new LinkedHashMap<>(global);
      merged.putAll(forRegion);
      return Collections.unmodifiableMap(merged);
    }

    /**
     * Returns the number of overrides in this view.
     *
     * @return the count of global and regional overrides
     */
    private int size() {
      int size = global.size();
      for (final Map<String, String> forRegion : regional.values()) {
        size += forRegion.size();
      }
      return size;
    }
  }
}
