package org.waabox.baker.datamodel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to bootstrap one node.
 *
 * <p>The agent pool profile, cloud spec, SIG selector and cluster location
 * drive image resolution. The Kubernetes version and kubelet configuration
 * are only consumed by the template generator.
 *
 * <p>Instances are created through {@link #builder()} and are immutable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NodeBootstrappingConfiguration {

  /** The agent pool profile. */
  private final AgentPoolProfile agentPoolProfile;

  /** The cluster the node joins. */
  private final ContainerService containerService;

  /** The cloud the cluster is deployed to. */
  private final CloudSpecConfig cloudSpecConfig;

  /** The SIG selector. */
  private final SigConfig sigConfig;

  /** The subscription owning the cluster. */
  private final String subscriptionId;

  /** The tenant owning the cluster. */
  private final String tenantId;

  /** The Kubernetes version the node runs. */
  private final String kubernetesVersion;

  /** The kubelet flags, keyed by flag name. */
  private final Map<String, String> kubeletConfig;

  /**
   * Creates a new configuration.
   *
   * @param builder the populated builder, never null
   */
  private NodeBootstrappingConfiguration(final Builder builder) {
    agentPoolProfile = builder.agentPoolProfile;
    containerService = builder.containerService;
    cloudSpecConfig = builder.cloudSpecConfig;
    sigConfig = builder.sigConfig;
    subscriptionId = builder.subscriptionId;
    tenantId = builder.tenantId;
    kubernetesVersion = builder.kubernetesVersion;
    kubeletConfig = Collections.unmodifiableMap(
        new LinkedHashMap<>(builder.kubeletConfig));
  }

  /**
   * Creates a new builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the agent pool profile.
   *
   * @return the profile, never null
   */
  public AgentPoolProfile agentPoolProfile() {
    return agentPoolProfile;
  }

  /**
   * Returns the cluster the node joins.
   *
   * @return the cluster, never null
   */
  public ContainerService containerService() {
    return containerService;
  }

  /**
   * Returns the cloud the cluster is deployed to.
   *
   * @return the cloud spec, never null
   */
  public CloudSpecConfig cloudSpecConfig() {
    return cloudSpecConfig;
  }

  /**
   * Returns the SIG selector.
   *
   * @return the selector, never null
   */
  public SigConfig sigConfig() {
    return sigConfig;
  }

  /**
   * Returns the subscription owning the cluster.
   *
   * @return the subscription id, never null, may be empty
   */
  public String subscriptionId() {
    return subscriptionId;
  }

  /**
   * Returns the tenant owning the cluster.
   *
   * @return the tenant id, never null, may be empty
   */
  public String tenantId() {
    return tenantId;
  }

  /**
   * Returns the Kubernetes version the node runs.
   *
   * @return the version, never null, may be empty
   */
  public String kubernetesVersion() {
    return kubernetesVersion;
  }

  /**
   * Returns the kubelet flags.
   *
   * @return the flags keyed by name, never null, unmodifiable
   */
  public Map<String, String> kubeletConfig() {
    return kubeletConfig;
  }

  /** Builder for {@link NodeBootstrappingConfiguration}. */
  public static final class Builder {

    /** The agent pool profile, required. */
    private AgentPoolProfile agentPoolProfile;

    /** The cluster, required. */
    private ContainerService containerService;

    /** The cloud spec, required. */
    private CloudSpecConfig cloudSpecConfig;

    /** The SIG selector, required. */
    private SigConfig sigConfig;

    /** The subscription id. */
    private String subscriptionId = "";

    /** The tenant id. */
    private String tenantId = "";

    /** The Kubernetes version. */
    private String kubernetesVersion = "";

    /** The kubelet flags. */
    private final Map<String, String> kubeletConfig = new LinkedHashMap<>();

    /** Creates a new builder. */
    private Builder() {
    }

    /**
     * Sets the agent pool profile.
     *
     * @param theProfile the profile, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder agentPoolProfile(final AgentPoolProfile theProfile) {
      agentPoolProfile = Objects.requireNonNull(theProfile,
          "agentPoolProfile must not be null");
      return this;
    }

    /**
     * Sets the cluster the node joins.
     *
     * @param theContainerService the cluster, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder containerService(
        final ContainerService theContainerService) {
      containerService = Objects.requireNonNull(theContainerService,
          "containerService must not be null");
      return this;
    }

    /**
     * Sets the cloud the cluster is deployed to.
     *
     * @param theCloudSpecConfig the cloud spec, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder cloudSpecConfig(final CloudSpecConfig theCloudSpecConfig) {
      cloudSpecConfig = Objects.requireNonNull(theCloudSpecConfig,
          "cloudSpecConfig must not be null");
      return this;
    }

    /**
     * Sets the SIG selector.
     *
     * @param theSigConfig the selector, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder sigConfig(final SigConfig theSigConfig) {
      sigConfig = Objects.requireNonNull(theSigConfig,
          "sigConfig must not be null");
      return this;
    }

    /**
     * Sets the subscription owning the cluster.
     *
     * @param theSubscriptionId the subscription id, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder subscriptionId(final String theSubscriptionId) {
      subscriptionId = Objects.requireNonNull(theSubscriptionId,
          "subscriptionId must not be null");
      return this;
    }

    /**
     * Sets the tenant owning the cluster.
     *
     * @param theTenantId the tenant id, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder tenantId(final String theTenantId) {
      tenantId = Objects.requireNonNull(theTenantId,
          "tenantId must not be null");
      return this;
    }

    /**
     * Sets the Kubernetes version the node runs.
     *
     * @param theKubernetesVersion the version, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder kubernetesVersion(final String theKubernetesVersion) {
      kubernetesVersion = Objects.requireNonNull(theKubernetesVersion,
          "kubernetesVersion must not be null");
      return this;
    }

    /**
     * Adds one kubelet flag.
     *
     * @param flag  the flag name, never null
     * @param value the flag value, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder kubeletFlag(final String flag, final String value) {
      Objects.requireNonNull(flag, "flag must not be null");
      Objects.requireNonNull(value, "value must not be null");
      kubeletConfig.put(flag, value);
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration, never null
     *
     * @throws IllegalStateException if the agent pool profile, cluster,
     *                               cloud spec or SIG selector is missing
     */
    public NodeBootstrappingConfiguration build() {
      requireSet(agentPoolProfile, "agentPoolProfile");
      requireSet(containerService, "containerService");
      requireSet(cloudSpecConfig, "cloudSpecConfig");
      requireSet(sigConfig, "sigConfig");
      return new NodeBootstrappingConfiguration(this);
    }

    /**
     * Fails if a required field was not set.
     *
     * @param value the field value
     * @param field the field name, never null
     */
    private static void requireSet(final Object value, final String field) {
      if (value == null) {
        throw new IllegalStateException(field + " must be set");
      }
    }
  }
}
