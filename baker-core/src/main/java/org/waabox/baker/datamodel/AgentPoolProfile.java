package org.waabox.baker.datamodel;

import java.util.Objects;

/**
 * The agent pool a node belongs to.
 *
 * @param name   the pool name, never null
 * @param vmSize the VM size of the pool nodes, never null
 * @param osType the OS flag of the pool, never null
 * @param distro the distro the pool nodes boot, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record AgentPoolProfile(String name, String vmSize, OsType osType,
    Distro distro) {

  /**
   * Creates a new agent pool profile.
   *
   * @throws NullPointerException if any argument is null
   */
  public AgentPoolProfile {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(vmSize, "vmSize must not be null");
    Objects.requireNonNull(osType, "osType must not be null");
    Objects.requireNonNull(distro, "distro must not be null");
  }

  /**
   * Returns whether the pool runs Windows nodes.
   *
   * @return true if the OS flag is {@link OsType#WINDOWS}
   */
  public boolean isWindows() {
    return osType == OsType.WINDOWS;
  }
}
