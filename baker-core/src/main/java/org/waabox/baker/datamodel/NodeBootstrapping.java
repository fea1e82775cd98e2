package org.waabox.baker.datamodel;

import java.util.Objects;
import java.util.Optional;

/**
 * The provisioning artifact of one node.
 *
 * <p>Carries the boot payload and provisioning command produced by the
 * template generator, plus the image references resolved for the node.
 * Both references may be present; customized image nodes carry neither.
 *
 * @param bootPayload         the boot payload, never null
 * @param provisioningCommand the provisioning command, never null
 * @param osImageConfig       the legacy image reference, may be null
 * @param sigImageConfig      the SIG image reference, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record NodeBootstrapping(String bootPayload,
    String provisioningCommand, OsImageConfig osImageConfig,
    SigImageConfig sigImageConfig) {

  /**
   * Creates a new artifact.
   *
   * @throws NullPointerException if the payload or command is null
   */
  public NodeBootstrapping {
    Objects.requireNonNull(bootPayload, "bootPayload must not be null");
    Objects.requireNonNull(provisioningCommand,
        "provisioningCommand must not be null");
  }

  /**
   * Creates an artifact without image references.
   *
   * @param bootPayload         the boot payload, never null
   * @param provisioningCommand the provisioning command, never null
   *
   * @return the artifact, never null
   */
  public static NodeBootstrapping withoutImage(final String bootPayload,
      final String provisioningCommand) {
    return new NodeBootstrapping(bootPayload, provisioningCommand, null,
        null);
  }

  /**
   * Returns the legacy image reference.
   *
   * @return the reference, or empty if none was resolved
   */
  public Optional<OsImageConfig> findOsImageConfig() {
    return Optional.ofNullable(osImageConfig);
  }

  /**
   * Returns the SIG image reference.
   *
   * @return the reference, or empty if none was resolved
   */
  public Optional<SigImageConfig> findSigImageConfig() {
    return Optional.ofNullable(sigImageConfig);
  }
}
